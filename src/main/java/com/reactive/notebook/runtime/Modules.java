package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Built-in modules reachable through {@code import}. Modules are immutable and
 * shared across namespaces.
 */
public final class Modules {
    private static final long SLEEP_SLICE_MILLIS = 20;
    private static final Map<String, ModuleValue> MODULES = Map.of(
            "math", math(),
            "time", time(),
            "text", text(),
            "data", data());

    private Modules() {
    }

    /**
     * @throws CellRuntimeException {@code ModuleNotFoundError} for unknown names
     */
    public static ModuleValue load(String name) {
        ModuleValue module = MODULES.get(name);
        if (module == null)
            throw new CellRuntimeException("ModuleNotFoundError", "No module named " + Values.repr(name));
        return module;
    }

    private static ModuleValue math() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("pi", Math.PI);
        m.put("e", Math.E);
        m.put("inf", Double.POSITIVE_INFINITY);
        m.put("nan", Double.NaN);
        unary(m, "sqrt", x -> {
            if (x < 0)
                throw CellRuntimeException.valueError("math domain error");
            return Math.sqrt(x);
        });
        unary(m, "exp", Math::exp);
        unary(m, "sin", Math::sin);
        unary(m, "cos", Math::cos);
        unary(m, "tan", Math::tan);
        unary(m, "fabs", Math::abs);
        unary(m, "log10", x -> {
            if (x <= 0)
                throw CellRuntimeException.valueError("math domain error");
            return Math.log10(x);
        });
        put(m, new BuiltinFunction("log", 1, 2, (in, a) -> {
            double x = Values.toDouble(a.get(0));
            if (x <= 0)
                throw CellRuntimeException.valueError("math domain error");
            if (a.size() == 1)
                return Math.log(x);
            return Math.log(x) / Math.log(Values.toDouble(a.get(1)));
        }));
        put(m, BuiltinFunction.of("pow", 2, (in, a) -> Math.pow(Values.toDouble(a.get(0)),
                Values.toDouble(a.get(1)))));
        put(m, BuiltinFunction.of("floor", 1, (in, a) -> Builtins.toInt(Math.floor(Values.toDouble(a.get(0))))));
        put(m, BuiltinFunction.of("ceil", 1, (in, a) -> Builtins.toInt(Math.ceil(Values.toDouble(a.get(0))))));
        put(m, BuiltinFunction.of("isnan", 1, (in, a) -> Double.isNaN(Values.toDouble(a.get(0)))));
        put(m, BuiltinFunction.of("isinf", 1, (in, a) -> Double.isInfinite(Values.toDouble(a.get(0)))));
        return new ModuleValue("math", Map.copyOf(m));
    }

    private static void unary(Map<String, Object> m, String name, DoubleUnaryOperator op) {
        put(m, BuiltinFunction.of(name, 1, (in, a) -> op.applyAsDouble(Values.toDouble(a.get(0)))));
    }

    private static ModuleValue time() {
        Map<String, Object> m = new LinkedHashMap<>();
        put(m, BuiltinFunction.of("time", 0, (in, a) -> System.currentTimeMillis() / 1000.0));
        put(m, BuiltinFunction.of("monotonic", 0, (in, a) -> System.nanoTime() / 1e9));
        put(m, BuiltinFunction.of("sleep", 1, (in, a) -> {
            double seconds = Values.toDouble(a.get(0));
            if (seconds < 0)
                throw CellRuntimeException.valueError("sleep length must be non-negative");
            sleep(in, (long) (seconds * 1000));
            return null;
        }));
        return new ModuleValue("time", Map.copyOf(m));
    }

    // Sleeps in short slices so cancellation is observed promptly.
    private static void sleep(Interpreter in, long millis) {
        long deadline = System.currentTimeMillis() + millis;
        while (true) {
            in.checkpoint();
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0)
                return;
            try {
                Thread.sleep(Math.min(remaining, SLEEP_SLICE_MILLIS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                in.checkpoint();
            }
        }
    }

    private static ModuleValue text() {
        Map<String, Object> m = new LinkedHashMap<>();
        put(m, BuiltinFunction.of("upper", 1, (in, a) -> Builtins.string(a.get(0)).toUpperCase()));
        put(m, BuiltinFunction.of("lower", 1, (in, a) -> Builtins.string(a.get(0)).toLowerCase()));
        put(m, BuiltinFunction.of("strip", 1, (in, a) -> Builtins.string(a.get(0)).strip()));
        put(m, new BuiltinFunction("split", 1, 2, (in, a) -> Builtins.split(Builtins.string(a.get(0)),
                a.size() > 1 ? a.get(1) : null)));
        put(m, BuiltinFunction.of("join", 2, (in, a) -> Builtins.join(Builtins.string(a.get(0)), a.get(1))));
        put(m, BuiltinFunction.of("replace", 3, (in, a) -> Builtins.string(a.get(0))
                .replace(Builtins.string(a.get(1)), Builtins.string(a.get(2)))));
        put(m, BuiltinFunction.of("repeat", 2, (in, a) -> Operators.binary("*",
                Builtins.string(a.get(0)), a.get(1))));
        put(m, BuiltinFunction.of("contains", 2, (in, a) -> Builtins.string(a.get(0))
                .contains(Builtins.string(a.get(1)))));
        return new ModuleValue("text", Map.copyOf(m));
    }

    private static ModuleValue data() {
        Map<String, Object> m = new LinkedHashMap<>();
        put(m, BuiltinFunction.of("table", 1, (in, a) -> table(a.get(0))));
        put(m, BuiltinFunction.of("column", 2, (in, a) -> new Column(Values.str(a.get(0)),
                Values.toList(a.get(1)))));
        put(m, BuiltinFunction.of("array", 1, (in, a) -> NdArray.fromNested(
                a.get(0) instanceof NdArray arr ? arr.toList() : Values.toList(a.get(0)))));
        put(m, BuiltinFunction.of("zeros", 1, (in, a) -> NdArray.zeros(Builtins.shapeOf(a.get(0)))));
        put(m, new BuiltinFunction("arange", 1, 3, (in, a) -> {
            List<Object> values = Values.toList(Builtins.range(a));
            double[] data = new double[values.size()];
            for (int i = 0; i < data.length; i++) {
                in.checkpoint();
                data[i] = Values.toDouble(values.get(i));
            }
            return new NdArray(data, new int[] { data.length }, true);
        }));
        return new ModuleValue("data", Map.copyOf(m));
    }

    private static Table table(Object source) {
        if (source instanceof Map<?, ?> columns) {
            LinkedHashMap<String, List<Object>> cols = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : columns.entrySet())
                cols.put(Values.str(e.getKey()), Values.toList(e.getValue()));
            return new Table(cols);
        }
        if (source instanceof List<?> rows) {
            List<Map<?, ?>> maps = new ArrayList<>();
            for (Object row : rows) {
                if (!(row instanceof Map<?, ?> r))
                    throw CellRuntimeException.typeError("table() rows must be maps, not '"
                            + Values.typeName(row) + "'");
                maps.add(r);
            }
            return Table.fromRows(maps);
        }
        throw CellRuntimeException.typeError("table() expects a map of columns or a list of rows");
    }

    private static void put(Map<String, Object> m, BuiltinFunction f) {
        m.put(f.name(), f);
    }
}
