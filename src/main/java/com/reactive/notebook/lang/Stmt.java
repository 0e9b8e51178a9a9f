package com.reactive.notebook.lang;

import java.util.List;

/**
 * Statement nodes of the cell syntax tree.
 */
public interface Stmt {

    int line();

    record ExprStmt(Expr expr, int line) implements Stmt {
    }

    /**
     * {@code target = value} or, with several targets, a destructuring
     * assignment {@code a, b = value}.
     */
    record Assign(List<Expr> targets, Expr value, int line) implements Stmt {
    }

    /** {@code target op= value}; {@code op} is the bare operator ({@code +}, {@code -}, ...). */
    record AugAssign(Expr target, String op, Expr value, int line) implements Stmt {
    }

    record FunctionDef(String name, List<String> params, List<Stmt> body, int line) implements Stmt {
    }

    record RecordDef(String name, List<String> fields, int line) implements Stmt {
    }

    /** {@code import module as alias}; alias equals the module name when omitted. */
    record Import(String module, String alias, int line) implements Stmt {
    }

    /** {@code from module import name as alias}. */
    record FromImport(String module, String name, String alias, int line) implements Stmt {
    }

    /** {@code elif} chains are nested {@code If}s in {@code otherwise}. */
    record If(Expr condition, List<Stmt> then, List<Stmt> otherwise, int line) implements Stmt {
    }

    record While(Expr condition, List<Stmt> body, int line) implements Stmt {
    }

    record For(List<String> targets, Expr iterable, List<Stmt> body, int line) implements Stmt {
    }

    record Return(Expr value, int line) implements Stmt {
    }

    record Break(int line) implements Stmt {
    }

    record Continue(int line) implements Stmt {
    }

    record Pass(int line) implements Stmt {
    }
}
