package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.reactive.notebook.lang.Expr;
import com.reactive.notebook.lang.Program;
import com.reactive.notebook.lang.Stmt;

/**
 * Tree-walking evaluator for one cell run.
 *
 * <p>
 * Top-level code reads and writes {@code globals} directly; function bodies,
 * lambdas and comprehensions get an {@link Environment} chain. Name lookup is
 * local scopes, then globals, then {@link Builtins}.
 *
 * <p>
 * The {@link CancellationToken} is polled at every loop iteration, function
 * call and comprehension step, so a timed-out or interrupted run unwinds with
 * {@link ExecutionCancelledException} and never reaches the namespace commit.
 * Instances are single-use and not thread-safe.
 */
public final class Interpreter {
    private final Map<String, Object> globals;
    private final StringBuilder stdout;
    private final CancellationToken token;
    private final int maxCallDepth;

    private int callDepth;
    private int currentLine;

    public Interpreter(Map<String, Object> globals, StringBuilder stdout, CancellationToken token,
            int maxCallDepth) {
        this.globals = globals;
        this.stdout = stdout;
        this.token = token;
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Runs a program against the namespace.
     *
     * @return the value of a trailing bare expression, or {@code null}
     * @throws CellRuntimeException         on any runtime fault, with the line set
     * @throws ExecutionCancelledException if the token fires
     */
    public Object execute(Program program) {
        List<Stmt> statements = program.statements();
        Object last = null;
        try {
            for (int i = 0; i < statements.size(); i++) {
                Stmt s = statements.get(i);
                if (i == statements.size() - 1 && s instanceof Stmt.ExprStmt es) {
                    currentLine = es.line();
                    last = eval(es.expr(), null);
                } else {
                    exec(s, null);
                }
            }
        } catch (CellRuntimeException e) {
            throw e.atLine(currentLine);
        } catch (StackOverflowError e) {
            throw new CellRuntimeException("RecursionError", "maximum recursion depth exceeded", currentLine);
        } catch (ArithmeticException | IndexOutOfBoundsException | ClassCastException
                | UnsupportedOperationException | IllegalArgumentException e) {
            throw new CellRuntimeException("RuntimeError", String.valueOf(e.getMessage()), currentLine);
        }
        return last;
    }

    /** Appends to the captured stdout of this run. */
    public void print(String text) {
        stdout.append(text);
    }

    public void checkpoint() {
        token.checkpoint();
    }

    /** Calls any callable value. */
    public Object call(Object callee, List<Object> args) {
        if (callee instanceof CellFunction f)
            return f.call(this, args);
        throw CellRuntimeException.typeError("'" + Values.typeName(callee) + "' object is not callable");
    }

    Object invoke(UserFunction fn, List<Object> args) {
        token.checkpoint();
        List<String> params = fn.params();
        if (args.size() != params.size())
            throw CellRuntimeException.typeError(fn.name() + "() takes " + params.size()
                    + " positional argument" + (params.size() == 1 ? "" : "s") + " but " + args.size()
                    + (args.size() == 1 ? " was" : " were") + " given");
        if (callDepth >= maxCallDepth)
            throw new CellRuntimeException("RecursionError", "maximum recursion depth exceeded");
        Environment env = new Environment(fn.closure());
        for (int i = 0; i < params.size(); i++)
            env.values.put(params.get(i), args.get(i));
        int savedLine = currentLine;
        callDepth++;
        try {
            if (fn.isLambda())
                return eval(fn.expression(), env);
            execBlock(fn.body(), env);
            return null;
        } catch (ReturnSignal r) {
            return r.value;
        } catch (CellRuntimeException e) {
            throw e.atLine(currentLine);
        } finally {
            callDepth--;
            currentLine = savedLine;
        }
    }

    // ── Statements ─────────────────────────────────────────────────

    private void execBlock(List<Stmt> block, Environment env) {
        for (Stmt s : block)
            exec(s, env);
    }

    private void exec(Stmt stmt, Environment env) {
        currentLine = stmt.line();
        if (stmt instanceof Stmt.ExprStmt s) {
            eval(s.expr(), env);
        } else if (stmt instanceof Stmt.Assign s) {
            Object value = eval(s.value(), env);
            if (s.targets().size() == 1) {
                assign(s.targets().get(0), value, env);
            } else {
                List<Object> items = Values.toList(value);
                if (items.size() != s.targets().size())
                    throw CellRuntimeException.valueError("expected " + s.targets().size()
                            + " values to unpack, got " + items.size());
                for (int i = 0; i < items.size(); i++)
                    assign(s.targets().get(i), items.get(i), env);
            }
        } else if (stmt instanceof Stmt.AugAssign s) {
            Object current = eval(s.target(), env);
            assign(s.target(), Operators.binary(s.op(), current, eval(s.value(), env)), env);
        } else if (stmt instanceof Stmt.If s) {
            execBlock(Values.truthy(eval(s.condition(), env)) ? s.then() : s.otherwise(), env);
        } else if (stmt instanceof Stmt.While s) {
            while (true) {
                token.checkpoint();
                currentLine = s.line();
                if (!Values.truthy(eval(s.condition(), env)))
                    break;
                try {
                    execBlock(s.body(), env);
                } catch (BreakSignal b) {
                    break;
                } catch (ContinueSignal c) {
                    continue;
                }
            }
        } else if (stmt instanceof Stmt.For s) {
            for (Object item : Values.iterate(eval(s.iterable(), env))) {
                token.checkpoint();
                bindTargets(s.targets(), item, env);
                try {
                    execBlock(s.body(), env);
                } catch (BreakSignal b) {
                    break;
                } catch (ContinueSignal c) {
                    continue;
                }
            }
        } else if (stmt instanceof Stmt.FunctionDef s) {
            define(s.name(), new UserFunction(s.name(), s.params(), s.body(), null, env), env);
        } else if (stmt instanceof Stmt.RecordDef s) {
            define(s.name(), new RecordType(s.name(), s.fields()), env);
        } else if (stmt instanceof Stmt.Import s) {
            define(s.alias(), Modules.load(s.module()), env);
        } else if (stmt instanceof Stmt.FromImport s) {
            ModuleValue module = Modules.load(s.module());
            if (!module.members().containsKey(s.name()))
                throw new CellRuntimeException("ImportError", "cannot import name " + Values.repr(s.name())
                        + " from " + Values.repr(s.module()));
            define(s.alias(), module.member(s.name()), env);
        } else if (stmt instanceof Stmt.Return s) {
            throw new ReturnSignal(s.value() == null ? null : eval(s.value(), env));
        } else if (stmt instanceof Stmt.Break) {
            throw BreakSignal.INSTANCE;
        } else if (stmt instanceof Stmt.Continue) {
            throw ContinueSignal.INSTANCE;
        } else if (!(stmt instanceof Stmt.Pass)) {
            throw new IllegalStateException("Unknown statement " + stmt.getClass().getSimpleName());
        }
    }

    private void bindTargets(List<String> targets, Object item, Environment env) {
        if (targets.size() == 1) {
            define(targets.get(0), item, env);
            return;
        }
        List<Object> parts = Values.toList(item);
        if (parts.size() != targets.size())
            throw CellRuntimeException.valueError("expected " + targets.size() + " values to unpack, got "
                    + parts.size());
        for (int i = 0; i < parts.size(); i++)
            define(targets.get(i), parts.get(i), env);
    }

    private void define(String name, Object value, Environment env) {
        if (env == null)
            globals.put(name, value);
        else
            env.values.put(name, value);
    }

    private void assign(Expr target, Object value, Environment env) {
        if (target instanceof Expr.Name n) {
            define(n.id(), value, env);
        } else if (target instanceof Expr.Index ix) {
            Object container = eval(ix.target(), env);
            Object key = eval(ix.index(), env);
            setItem(container, key, value);
        } else if (target instanceof Expr.Attribute at) {
            Object owner = eval(at.target(), env);
            if (!(owner instanceof RecordInstance r))
                throw new CellRuntimeException("AttributeError", "'" + Values.typeName(owner)
                        + "' object attribute '" + at.name() + "' is read-only");
            r.set(at.name(), value);
        } else {
            throw CellRuntimeException.typeError("cannot assign to expression");
        }
    }

    @SuppressWarnings("unchecked")
    private void setItem(Object container, Object key, Object value) {
        if (container instanceof List<?> l) {
            ((List<Object>) l).set(Values.position(key, l.size(), "list assignment"), value);
        } else if (container instanceof Map<?, ?> m) {
            Values.requireHashable(key);
            ((Map<Object, Object>) m).put(key, value);
        } else if (container instanceof Table t && key instanceof String name) {
            t.setColumn(name, value instanceof Column c ? new ArrayList<>(c.values()) : Values.toList(value));
        } else if (container instanceof NdArray a) {
            a.set(Values.toIndex(key, "array indices"), Values.toDouble(value));
        } else {
            throw CellRuntimeException.typeError("'" + Values.typeName(container)
                    + "' object does not support item assignment");
        }
    }

    // ── Expressions ────────────────────────────────────────────────

    private Object eval(Expr expr, Environment env) {
        if (expr instanceof Expr.Literal e)
            return e.value();
        if (expr instanceof Expr.Name e)
            return lookup(e.id(), env);
        if (expr instanceof Expr.Binary e)
            return Operators.binary(e.op(), eval(e.left(), env), eval(e.right(), env));
        if (expr instanceof Expr.Call e) {
            Object callee = eval(e.callee(), env);
            List<Object> args = new ArrayList<>(e.args().size());
            for (Expr a : e.args())
                args.add(eval(a, env));
            return call(callee, args);
        }
        if (expr instanceof Expr.Attribute e)
            return attribute(eval(e.target(), env), e.name());
        if (expr instanceof Expr.Index e)
            return Values.index(eval(e.target(), env), eval(e.index(), env));
        if (expr instanceof Expr.Logical e) {
            Object left = eval(e.left(), env);
            if (e.op().equals("and"))
                return Values.truthy(left) ? eval(e.right(), env) : left;
            return Values.truthy(left) ? left : eval(e.right(), env);
        }
        if (expr instanceof Expr.Unary e) {
            Object v = eval(e.operand(), env);
            switch (e.op()) {
                case "not":
                    return !Values.truthy(v);
                case "-":
                    return Operators.negate(v);
                default:
                    if (!Values.isNumber(v) && !(v instanceof NdArray))
                        throw CellRuntimeException.typeError("bad operand type for unary +: '"
                                + Values.typeName(v) + "'");
                    return v;
            }
        }
        if (expr instanceof Expr.ListLiteral e) {
            List<Object> items = new ArrayList<>(e.items().size());
            for (Expr item : e.items())
                items.add(eval(item, env));
            return items;
        }
        if (expr instanceof Expr.MapLiteral e) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < e.keys().size(); i++) {
                Object key = eval(e.keys().get(i), env);
                Values.requireHashable(key);
                map.put(key, eval(e.values().get(i), env));
            }
            return map;
        }
        if (expr instanceof Expr.Conditional e)
            return Values.truthy(eval(e.condition(), env)) ? eval(e.then(), env) : eval(e.otherwise(), env);
        if (expr instanceof Expr.Slice e)
            return Values.slice(eval(e.target(), env), e.from() == null ? null : eval(e.from(), env),
                    e.to() == null ? null : eval(e.to(), env));
        if (expr instanceof Expr.Lambda e)
            return new UserFunction("<lambda>", e.params(), null, e.body(), env);
        if (expr instanceof Expr.Comprehension e)
            return comprehension(e, env);
        throw new IllegalStateException("Unknown expression " + expr.getClass().getSimpleName());
    }

    private Object lookup(String name, Environment env) {
        Environment scope = env == null ? null : env.find(name);
        if (scope != null)
            return scope.values.get(name);
        if (globals.containsKey(name))
            return globals.get(name);
        Map<String, Object> builtins = Builtins.globals();
        if (builtins.containsKey(name))
            return builtins.get(name);
        throw new CellRuntimeException("NameError", "name '" + name + "' is not defined");
    }

    private Object attribute(Object target, String name) {
        if (target instanceof ModuleValue m)
            return m.member(name);
        if (target instanceof RecordInstance r)
            return r.get(name);
        return Builtins.attribute(target, name);
    }

    private List<Object> comprehension(Expr.Comprehension c, Environment env) {
        Object source = eval(c.iterable(), env);
        Environment scope = new Environment(env);
        List<Object> out = new ArrayList<>();
        for (Object item : Values.iterate(source)) {
            token.checkpoint();
            bindTargets(c.targets(), item, scope);
            if (c.condition() != null && !Values.truthy(eval(c.condition(), scope)))
                continue;
            out.add(eval(c.element(), scope));
        }
        return out;
    }

    // ── Control flow signals ───────────────────────────────────────

    private static final class ReturnSignal extends RuntimeException {
        final Object value;

        ReturnSignal(Object value) {
            super(null, null, false, false);
            this.value = value;
        }
    }

    private static final class BreakSignal extends RuntimeException {
        static final BreakSignal INSTANCE = new BreakSignal();

        private BreakSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ContinueSignal extends RuntimeException {
        static final ContinueSignal INSTANCE = new ContinueSignal();

        private ContinueSignal() {
            super(null, null, false, false);
        }
    }
}
