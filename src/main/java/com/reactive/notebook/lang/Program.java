package com.reactive.notebook.lang;

import java.util.List;

/**
 * A parsed cell: its top-level statements in source order.
 */
public record Program(List<Stmt> statements) {

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /** The trailing bare expression whose value is auto-displayed, if any. */
    public Expr trailingExpression() {
        if (statements.isEmpty())
            return null;
        Stmt last = statements.get(statements.size() - 1);
        return last instanceof Stmt.ExprStmt es ? es.expr() : null;
    }
}
