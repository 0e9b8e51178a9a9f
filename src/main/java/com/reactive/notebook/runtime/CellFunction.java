package com.reactive.notebook.runtime;

import java.util.List;

/**
 * Anything cell code can call: user functions, lambdas, built-ins, bound
 * methods and record constructors.
 */
public interface CellFunction {

    String name();

    /**
     * Invokes the function on the given interpreter, whose namespace and
     * cancellation token apply to the call.
     */
    Object call(Interpreter interpreter, List<Object> args);
}
