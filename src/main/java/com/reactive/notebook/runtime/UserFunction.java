package com.reactive.notebook.runtime;

import java.util.List;

import com.reactive.notebook.lang.Expr;
import com.reactive.notebook.lang.Stmt;

/**
 * A {@code def} function or a lambda. Exactly one of {@code body} and
 * {@code expression} is set. Functions defined at cell top level have no
 * closure and resolve free names against the namespace of whichever
 * interpreter calls them.
 */
public record UserFunction(String name, List<String> params, List<Stmt> body, Expr expression,
        Environment closure) implements CellFunction {

    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
        return interpreter.invoke(this, args);
    }

    public boolean isLambda() {
        return expression != null;
    }
}
