package com.reactive.notebook.lang;

import java.util.List;

/**
 * Expression nodes of the cell syntax tree. Every node remembers the source
 * line it started on so runtime faults can point back at it.
 */
public interface Expr {

    int line();

    record Literal(Object value, int line) implements Expr {
    }

    record Name(String id, int line) implements Expr {
    }

    record ListLiteral(List<Expr> items, int line) implements Expr {
    }

    record MapLiteral(List<Expr> keys, List<Expr> values, int line) implements Expr {
    }

    /** {@code -x}, {@code +x} or {@code not x}. */
    record Unary(String op, Expr operand, int line) implements Expr {
    }

    /** Arithmetic, comparison and membership operators. */
    record Binary(String op, Expr left, Expr right, int line) implements Expr {
    }

    /** Short-circuit {@code and} / {@code or}. */
    record Logical(String op, Expr left, Expr right, int line) implements Expr {
    }

    /** {@code then if condition else otherwise}. */
    record Conditional(Expr condition, Expr then, Expr otherwise, int line) implements Expr {
    }

    record Call(Expr callee, List<Expr> args, int line) implements Expr {
    }

    record Index(Expr target, Expr index, int line) implements Expr {
    }

    /** {@code target[from:to]}; either bound may be {@code null}. */
    record Slice(Expr target, Expr from, Expr to, int line) implements Expr {
    }

    record Attribute(Expr target, String name, int line) implements Expr {
    }

    record Lambda(List<String> params, Expr body, int line) implements Expr {
    }

    /** {@code [element for targets in iterable if condition]}; condition may be {@code null}. */
    record Comprehension(Expr element, List<String> targets, Expr iterable, Expr condition, int line)
            implements Expr {
    }
}
