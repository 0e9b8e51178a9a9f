package com.reactive.notebook.lang;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing a {@link Program} from cell source.
 *
 * <p>
 * Precedence, lowest first: lambda, conditional, {@code or}, {@code and},
 * {@code not}, comparison/membership, additive, multiplicative, unary, power,
 * postfix (call, index, slice, attribute), primary.
 *
 * <p>
 * Misplaced {@code return}, {@code break} and {@code continue} are rejected
 * here rather than at run time, so static analysis reports them as syntax
 * errors of the cell.
 */
public final class Parser {
    private final List<Token> tokens;
    private int current;
    private int functionDepth;
    private int loopDepth;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses cell source.
     *
     * @throws ParseException on the first lexical or syntactic error
     */
    public static Program parse(String source) {
        return new Parser(Lexer.tokenize(source)).program();
    }

    private Program program() {
        List<Stmt> statements = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.EOF)) {
            if (peek().isOp("}"))
                throw error("unmatched '}'");
            statements.add(statement());
            endOfStatement();
            skipNewlines();
        }
        return new Program(List.copyOf(statements));
    }

    // ── Statements ─────────────────────────────────────────────────

    private Stmt statement() {
        Token t = peek();
        if (t.type() == TokenType.KEYWORD) {
            switch (t.text()) {
                case "def":
                    return functionDef();
                case "record":
                    return recordDef();
                case "import":
                    return importStatement();
                case "from":
                    return fromImport();
                case "if":
                    advance();
                    return ifRest(t.line());
                case "while":
                    return whileStatement();
                case "for":
                    return forStatement();
                case "return":
                    return returnStatement();
                case "break":
                    advance();
                    if (loopDepth == 0)
                        throw new ParseException("'break' outside loop", t.line());
                    return new Stmt.Break(t.line());
                case "continue":
                    advance();
                    if (loopDepth == 0)
                        throw new ParseException("'continue' outside loop", t.line());
                    return new Stmt.Continue(t.line());
                case "pass":
                    advance();
                    return new Stmt.Pass(t.line());
                default:
                    break;
            }
        }
        return simpleStatement();
    }

    private Stmt functionDef() {
        int line = advance().line();
        String name = expectName("function name");
        List<String> params = parameters();
        int savedLoops = loopDepth;
        functionDepth++;
        loopDepth = 0;
        try {
            return new Stmt.FunctionDef(name, params, block(), line);
        } finally {
            functionDepth--;
            loopDepth = savedLoops;
        }
    }

    private Stmt recordDef() {
        int line = advance().line();
        String name = expectName("record name");
        return new Stmt.RecordDef(name, parameters(), line);
    }

    private List<String> parameters() {
        expectOp("(");
        List<String> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!peek().isOp(")")) {
            do {
                if (peek().isOp(")"))
                    break;
                String p = expectName("parameter name");
                if (!seen.add(p))
                    throw error("duplicate parameter '" + p + "'");
                params.add(p);
            } while (matchOp(","));
        }
        expectOp(")");
        return List.copyOf(params);
    }

    private Stmt importStatement() {
        int line = advance().line();
        String module = expectName("module name");
        String alias = module;
        if (matchKeyword("as"))
            alias = expectName("alias");
        return new Stmt.Import(module, alias, line);
    }

    private Stmt fromImport() {
        int line = advance().line();
        String module = expectName("module name");
        expectKeyword("import");
        String name = expectName("imported name");
        String alias = name;
        if (matchKeyword("as"))
            alias = expectName("alias");
        return new Stmt.FromImport(module, name, alias, line);
    }

    private Stmt ifRest(int line) {
        Expr condition = expression();
        List<Stmt> then = block();
        int save = current;
        skipNewlines();
        if (peek().isKeyword("elif")) {
            Token elif = advance();
            return new Stmt.If(condition, then, List.of(ifRest(elif.line())), line);
        }
        if (matchKeyword("else"))
            return new Stmt.If(condition, then, block(), line);
        current = save;
        return new Stmt.If(condition, then, List.of(), line);
    }

    private Stmt whileStatement() {
        int line = advance().line();
        Expr condition = expression();
        return new Stmt.While(condition, loopBody(), line);
    }

    private Stmt forStatement() {
        int line = advance().line();
        List<String> targets = targetNames();
        expectKeyword("in");
        Expr iterable = expression();
        return new Stmt.For(targets, iterable, loopBody(), line);
    }

    private List<Stmt> loopBody() {
        loopDepth++;
        try {
            return block();
        } finally {
            loopDepth--;
        }
    }

    private Stmt returnStatement() {
        Token t = advance();
        if (functionDepth == 0)
            throw new ParseException("'return' outside function", t.line());
        Expr value = atStatementEnd() ? null : expression();
        return new Stmt.Return(value, t.line());
    }

    private Stmt simpleStatement() {
        int line = peek().line();
        List<Expr> first = expressionList();
        if (matchOp("=")) {
            for (Expr target : first)
                requireAssignable(target);
            List<Expr> rhs = expressionList();
            Expr value = rhs.size() == 1 ? rhs.get(0) : new Expr.ListLiteral(List.copyOf(rhs), line);
            return new Stmt.Assign(List.copyOf(first), value, line);
        }
        Token t = peek();
        if (t.type() == TokenType.OP && (t.text().equals("+=") || t.text().equals("-=")
                || t.text().equals("*=") || t.text().equals("/="))) {
            advance();
            if (first.size() != 1)
                throw error("augmented assignment needs a single target");
            requireAssignable(first.get(0));
            String op = t.text().substring(0, 1);
            return new Stmt.AugAssign(first.get(0), op, expression(), line);
        }
        Expr expr = first.size() == 1 ? first.get(0) : new Expr.ListLiteral(List.copyOf(first), line);
        return new Stmt.ExprStmt(expr, line);
    }

    private void requireAssignable(Expr target) {
        if (!(target instanceof Expr.Name || target instanceof Expr.Index || target instanceof Expr.Attribute))
            throw new ParseException("cannot assign to expression", target.line());
    }

    private List<Stmt> block() {
        expectOp("{");
        List<Stmt> body = new ArrayList<>();
        skipNewlines();
        while (!peek().isOp("}")) {
            if (check(TokenType.EOF))
                throw error("expected '}' to close block");
            body.add(statement());
            endOfStatement();
            skipNewlines();
        }
        advance();
        return List.copyOf(body);
    }

    private void endOfStatement() {
        if (match(TokenType.NEWLINE) || check(TokenType.EOF) || peek().isOp("}"))
            return;
        throw error("expected end of statement but found " + peek());
    }

    private boolean atStatementEnd() {
        return check(TokenType.NEWLINE) || check(TokenType.EOF) || peek().isOp("}");
    }

    private List<String> targetNames() {
        List<String> names = new ArrayList<>();
        do {
            names.add(expectName("loop variable"));
        } while (matchOp(","));
        return List.copyOf(names);
    }

    // ── Expressions ────────────────────────────────────────────────

    private List<Expr> expressionList() {
        List<Expr> items = new ArrayList<>();
        items.add(expression());
        while (matchOp(",")) {
            if (atStatementEnd() || peek().isOp("="))
                break;
            items.add(expression());
        }
        return items;
    }

    private Expr expression() {
        if (peek().isKeyword("fn"))
            return lambda();
        Expr value = or();
        if (peek().isKeyword("if")) {
            int line = advance().line();
            Expr condition = or();
            expectKeyword("else");
            Expr otherwise = expression();
            return new Expr.Conditional(condition, value, otherwise, line);
        }
        return value;
    }

    private Expr lambda() {
        int line = advance().line();
        List<String> params = parameters();
        expectOp("->");
        return new Expr.Lambda(params, expression(), line);
    }

    private Expr or() {
        Expr left = and();
        while (peek().isKeyword("or")) {
            int line = advance().line();
            left = new Expr.Logical("or", left, and(), line);
        }
        return left;
    }

    private Expr and() {
        Expr left = not();
        while (peek().isKeyword("and")) {
            int line = advance().line();
            left = new Expr.Logical("and", left, not(), line);
        }
        return left;
    }

    private Expr not() {
        if (peek().isKeyword("not")) {
            int line = advance().line();
            return new Expr.Unary("not", not(), line);
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = additive();
        while (true) {
            Token t = peek();
            String op = null;
            if (t.type() == TokenType.OP && switch (t.text()) {
                case "==", "!=", "<", "<=", ">", ">=" -> true;
                default -> false;
            }) {
                op = t.text();
                advance();
            } else if (t.isKeyword("in")) {
                op = "in";
                advance();
            } else if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
                op = "not in";
                advance();
                advance();
            }
            if (op == null)
                return left;
            left = new Expr.Binary(op, left, additive(), t.line());
        }
    }

    private Expr additive() {
        Expr left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            Token op = advance();
            left = new Expr.Binary(op.text(), left, term(), op.line());
        }
        return left;
    }

    private Expr term() {
        Expr left = unary();
        while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%")) {
            Token op = advance();
            left = new Expr.Binary(op.text(), left, unary(), op.line());
        }
        return left;
    }

    private Expr unary() {
        if (peek().isOp("-") || peek().isOp("+")) {
            Token op = advance();
            return new Expr.Unary(op.text(), unary(), op.line());
        }
        return power();
    }

    private Expr power() {
        Expr base = postfix();
        if (peek().isOp("**")) {
            Token op = advance();
            return new Expr.Binary("**", base, unary(), op.line());
        }
        return base;
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            Token t = peek();
            if (t.isOp("(")) {
                advance();
                List<Expr> args = new ArrayList<>();
                while (!peek().isOp(")")) {
                    args.add(expression());
                    if (!matchOp(","))
                        break;
                }
                expectOp(")");
                expr = new Expr.Call(expr, List.copyOf(args), t.line());
            } else if (t.isOp("[")) {
                advance();
                expr = subscript(expr, t.line());
            } else if (t.isOp(".")) {
                advance();
                expr = new Expr.Attribute(expr, expectName("attribute name"), t.line());
            } else {
                return expr;
            }
        }
    }

    private Expr subscript(Expr target, int line) {
        Expr from = null;
        if (!peek().isOp(":"))
            from = expression();
        if (matchOp(":")) {
            Expr to = peek().isOp("]") ? null : expression();
            expectOp("]");
            return new Expr.Slice(target, from, to, line);
        }
        expectOp("]");
        return new Expr.Index(target, from, line);
    }

    private Expr primary() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER, STRING -> {
                advance();
                return new Expr.Literal(t.value(), t.line());
            }
            case NAME -> {
                advance();
                return new Expr.Name(t.text(), t.line());
            }
            case KEYWORD -> {
                switch (t.text()) {
                    case "true" -> {
                        advance();
                        return new Expr.Literal(Boolean.TRUE, t.line());
                    }
                    case "false" -> {
                        advance();
                        return new Expr.Literal(Boolean.FALSE, t.line());
                    }
                    case "null" -> {
                        advance();
                        return new Expr.Literal(null, t.line());
                    }
                    case "fn" -> {
                        return lambda();
                    }
                    default -> throw error("unexpected keyword '" + t.text() + "'");
                }
            }
            case OP -> {
                if (t.isOp("("))
                    return parenthesized();
                if (t.isOp("["))
                    return listOrComprehension();
                if (t.isOp("{"))
                    return mapLiteral();
                throw error("unexpected " + t);
            }
            default -> throw error("unexpected " + t);
        }
    }

    private Expr parenthesized() {
        int line = advance().line();
        if (matchOp(")"))
            return new Expr.ListLiteral(List.of(), line);
        Expr first = expression();
        if (!peek().isOp(",")) {
            expectOp(")");
            return first;
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (matchOp(",")) {
            if (peek().isOp(")"))
                break;
            items.add(expression());
        }
        expectOp(")");
        return new Expr.ListLiteral(List.copyOf(items), line);
    }

    private Expr listOrComprehension() {
        int line = advance().line();
        if (matchOp("]"))
            return new Expr.ListLiteral(List.of(), line);
        Expr first = expression();
        if (matchKeyword("for")) {
            List<String> targets = targetNames();
            expectKeyword("in");
            Expr iterable = or();
            Expr condition = matchKeyword("if") ? or() : null;
            expectOp("]");
            return new Expr.Comprehension(first, targets, iterable, condition, line);
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (matchOp(",")) {
            if (peek().isOp("]"))
                break;
            items.add(expression());
        }
        expectOp("]");
        return new Expr.ListLiteral(List.copyOf(items), line);
    }

    private Expr mapLiteral() {
        int line = advance().line();
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        skipNewlines();
        while (!peek().isOp("}")) {
            keys.add(expression());
            skipNewlines();
            expectOp(":");
            skipNewlines();
            values.add(expression());
            skipNewlines();
            if (!matchOp(","))
                break;
            skipNewlines();
        }
        skipNewlines();
        expectOp("}");
        return new Expr.MapLiteral(List.copyOf(keys), List.copyOf(values), line);
    }

    // ── Token helpers ──────────────────────────────────────────────

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        int i = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token t = tokens.get(current);
        if (t.type() != TokenType.EOF)
            current++;
        return t;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean match(TokenType type) {
        if (!check(type))
            return false;
        advance();
        return true;
    }

    private boolean matchOp(String op) {
        if (!peek().isOp(op))
            return false;
        advance();
        return true;
    }

    private boolean matchKeyword(String keyword) {
        if (!peek().isKeyword(keyword))
            return false;
        advance();
        return true;
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // consume
        }
    }

    private void expectOp(String op) {
        if (!matchOp(op))
            throw error("expected '" + op + "' but found " + peek());
    }

    private void expectKeyword(String keyword) {
        if (!matchKeyword(keyword))
            throw error("expected '" + keyword + "' but found " + peek());
    }

    private String expectName(String what) {
        Token t = peek();
        if (t.type() != TokenType.NAME)
            throw error("expected " + what + " but found " + t);
        advance();
        return t.text();
    }

    private ParseException error(String message) {
        return new ParseException(message, peek().line());
    }
}
