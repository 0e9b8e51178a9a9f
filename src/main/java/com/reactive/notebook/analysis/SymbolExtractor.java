package com.reactive.notebook.analysis;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.reactive.notebook.lang.Expr;
import com.reactive.notebook.lang.ParseException;
import com.reactive.notebook.lang.Parser;
import com.reactive.notebook.lang.Program;
import com.reactive.notebook.lang.Stmt;

/**
 * Static analysis of one cell: which names it binds at top level and which
 * names it reads from outside itself. Never executes code.
 *
 * <p>
 * Reads are resolved in textual order against the cell's own scope chain. A
 * name read before any binding of it in that chain is a use, even if the cell
 * also defines it later. Bindings made inside a top-level {@code if},
 * {@code while} or {@code for} body are definitions of the cell but do not
 * hide later reads outside that body, since the body may not run. Names
 * starting with {@code _} are private to the cell and are never reported.
 */
public final class SymbolExtractor {

    private final Set<String> defines = new LinkedHashSet<>();
    private final Set<String> uses = new LinkedHashSet<>();

    private SymbolExtractor() {
    }

    /**
     * @throws AnalysisException if the source does not parse
     */
    public static CellSymbols extract(String cellId, String source) {
        Program program;
        try {
            program = Parser.parse(source);
        } catch (ParseException e) {
            throw new AnalysisException(cellId, e.getMessage(), e.line(), e);
        }
        return extract(program);
    }

    public static CellSymbols extract(Program program) {
        SymbolExtractor extractor = new SymbolExtractor();
        extractor.block(program.statements(), new Scope(null, true));
        return new CellSymbols(extractor.defines, extractor.uses);
    }

    /** One level of name binding. Module-level block scopes share definitions but not visibility. */
    private static final class Scope {
        final Scope parent;
        final boolean module;
        final Set<String> bound = new HashSet<>();

        Scope(Scope parent, boolean module) {
            this.parent = parent;
            this.module = module;
        }

        boolean resolves(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.bound.contains(name))
                    return true;
            }
            return false;
        }
    }

    private void block(List<Stmt> statements, Scope scope) {
        for (Stmt s : statements)
            statement(s, scope);
    }

    private void statement(Stmt stmt, Scope scope) {
        if (stmt instanceof Stmt.ExprStmt s) {
            expr(s.expr(), scope);
        } else if (stmt instanceof Stmt.Assign s) {
            expr(s.value(), scope);
            for (Expr target : s.targets())
                target(target, scope);
        } else if (stmt instanceof Stmt.AugAssign s) {
            expr(s.value(), scope);
            expr(s.target(), scope);
            target(s.target(), scope);
        } else if (stmt instanceof Stmt.FunctionDef s) {
            bind(s.name(), scope);
            Scope body = new Scope(scope, false);
            body.bound.addAll(s.params());
            block(s.body(), body);
        } else if (stmt instanceof Stmt.RecordDef s) {
            bind(s.name(), scope);
        } else if (stmt instanceof Stmt.Import s) {
            bind(s.alias(), scope);
        } else if (stmt instanceof Stmt.FromImport s) {
            bind(s.alias(), scope);
        } else if (stmt instanceof Stmt.If s) {
            expr(s.condition(), scope);
            block(s.then(), branch(scope));
            block(s.otherwise(), branch(scope));
        } else if (stmt instanceof Stmt.While s) {
            expr(s.condition(), scope);
            block(s.body(), branch(scope));
        } else if (stmt instanceof Stmt.For s) {
            expr(s.iterable(), scope);
            Scope body = branch(scope);
            for (String t : s.targets())
                bind(t, body);
            block(s.body(), body);
        } else if (stmt instanceof Stmt.Return s) {
            if (s.value() != null)
                expr(s.value(), scope);
        }
    }

    // At module level a conditional body sees earlier bindings but its own do not leak.
    private Scope branch(Scope scope) {
        return scope.module ? new Scope(scope, true) : scope;
    }

    private void target(Expr target, Scope scope) {
        if (target instanceof Expr.Name n) {
            bind(n.id(), scope);
        } else if (target instanceof Expr.Index ix) {
            expr(ix.target(), scope);
            expr(ix.index(), scope);
        } else if (target instanceof Expr.Attribute at) {
            expr(at.target(), scope);
        }
    }

    private void bind(String name, Scope scope) {
        scope.bound.add(name);
        if (scope.module && !isPrivate(name))
            defines.add(name);
    }

    private void read(String name, Scope scope) {
        if (!isPrivate(name) && !scope.resolves(name))
            uses.add(name);
    }

    private static boolean isPrivate(String name) {
        return name.startsWith("_");
    }

    private void expr(Expr expr, Scope scope) {
        if (expr instanceof Expr.Name e) {
            read(e.id(), scope);
        } else if (expr instanceof Expr.ListLiteral e) {
            for (Expr item : e.items())
                expr(item, scope);
        } else if (expr instanceof Expr.MapLiteral e) {
            for (int i = 0; i < e.keys().size(); i++) {
                expr(e.keys().get(i), scope);
                expr(e.values().get(i), scope);
            }
        } else if (expr instanceof Expr.Unary e) {
            expr(e.operand(), scope);
        } else if (expr instanceof Expr.Binary e) {
            expr(e.left(), scope);
            expr(e.right(), scope);
        } else if (expr instanceof Expr.Logical e) {
            expr(e.left(), scope);
            expr(e.right(), scope);
        } else if (expr instanceof Expr.Conditional e) {
            expr(e.condition(), scope);
            expr(e.then(), scope);
            expr(e.otherwise(), scope);
        } else if (expr instanceof Expr.Call e) {
            expr(e.callee(), scope);
            for (Expr a : e.args())
                expr(a, scope);
        } else if (expr instanceof Expr.Index e) {
            expr(e.target(), scope);
            expr(e.index(), scope);
        } else if (expr instanceof Expr.Slice e) {
            expr(e.target(), scope);
            if (e.from() != null)
                expr(e.from(), scope);
            if (e.to() != null)
                expr(e.to(), scope);
        } else if (expr instanceof Expr.Attribute e) {
            expr(e.target(), scope);
        } else if (expr instanceof Expr.Lambda e) {
            Scope body = new Scope(scope, false);
            body.bound.addAll(e.params());
            expr(e.body(), body);
        } else if (expr instanceof Expr.Comprehension e) {
            expr(e.iterable(), scope);
            Scope inner = new Scope(scope, false);
            inner.bound.addAll(e.targets());
            if (e.condition() != null)
                expr(e.condition(), inner);
            expr(e.element(), inner);
        }
    }
}
