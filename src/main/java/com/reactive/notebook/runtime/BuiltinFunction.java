package com.reactive.notebook.runtime;

import java.util.List;

/**
 * A function implemented in Java. {@code maxArgs < 0} means variadic.
 */
public record BuiltinFunction(String name, int minArgs, int maxArgs, Body body) implements CellFunction {

    @FunctionalInterface
    public interface Body {
        Object apply(Interpreter interpreter, List<Object> args);
    }

    public static BuiltinFunction of(String name, int arity, Body body) {
        return new BuiltinFunction(name, arity, arity, body);
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
        int n = args.size();
        if (n < minArgs || (maxArgs >= 0 && n > maxArgs)) {
            String expected;
            if (minArgs == maxArgs)
                expected = "exactly " + minArgs;
            else if (maxArgs < 0)
                expected = "at least " + minArgs;
            else
                expected = n < minArgs ? "at least " + minArgs : "at most " + maxArgs;
            throw CellRuntimeException.typeError(name + "() takes " + expected + " argument"
                    + (expected.endsWith(" 1") ? "" : "s") + " (" + n + " given)");
        }
        return body.apply(interpreter, args);
    }
}
