package com.reactive.notebook.runtime;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global built-in functions and the methods of built-in types.
 */
public final class Builtins {
    private static final Map<String, Object> GLOBALS = createGlobals();

    private Builtins() {
    }

    /** The read-only built-in scope, consulted after the namespace. */
    public static Map<String, Object> globals() {
        return GLOBALS;
    }

    private static Map<String, Object> createGlobals() {
        Map<String, Object> g = new LinkedHashMap<>();
        register(g, new BuiltinFunction("print", 0, -1, (in, args) -> {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0)
                    line.append(' ');
                line.append(Values.str(args.get(i)));
            }
            in.print(line.append('\n').toString());
            return null;
        }));
        register(g, BuiltinFunction.of("len", 1, (in, a) -> Values.length(a.get(0))));
        register(g, new BuiltinFunction("range", 1, 3, (in, a) -> range(a)));
        register(g, BuiltinFunction.of("str", 1, (in, a) -> Values.str(a.get(0))));
        register(g, BuiltinFunction.of("int", 1, (in, a) -> toInt(a.get(0))));
        register(g, BuiltinFunction.of("float", 1, (in, a) -> toFloat(a.get(0))));
        register(g, BuiltinFunction.of("bool", 1, (in, a) -> Values.truthy(a.get(0))));
        register(g, new BuiltinFunction("list", 0, 1, (in, a) -> a.isEmpty() ? new ArrayList<>()
                : Values.toList(a.get(0))));
        register(g, BuiltinFunction.of("keys", 1, (in, a) -> new ArrayList<Object>(map(a.get(0), "keys").keySet())));
        register(g, BuiltinFunction.of("values", 1, (in, a) -> new ArrayList<Object>(map(a.get(0), "values").values())));
        register(g, BuiltinFunction.of("items", 1, (in, a) -> items(map(a.get(0), "items"))));
        register(g, new BuiltinFunction("sum", 1, 2, (in, a) -> {
            Object total = a.size() > 1 ? a.get(1) : (Object) 0L;
            for (Object o : Values.iterate(a.get(0))) {
                in.checkpoint();
                total = Operators.binary("+", total, o);
            }
            return total;
        }));
        register(g, new BuiltinFunction("min", 1, -1, (in, a) -> extreme(in, "min", a, -1)));
        register(g, new BuiltinFunction("max", 1, -1, (in, a) -> extreme(in, "max", a, 1)));
        register(g, BuiltinFunction.of("abs", 1, (in, a) -> {
            Object v = a.get(0);
            if (v instanceof Long l) {
                if (l == Long.MIN_VALUE)
                    throw new CellRuntimeException("OverflowError", "integer overflow");
                return Math.abs(l);
            }
            return Math.abs(Values.toDouble(v));
        }));
        register(g, new BuiltinFunction("round", 1, 2, (in, a) -> round(a)));
        register(g, new BuiltinFunction("sorted", 1, 3, (in, a) -> {
            Object key = a.size() > 1 ? a.get(1) : null;
            boolean reverse = a.size() > 2 && Values.truthy(a.get(2));
            return sorted(in, Values.toList(a.get(0)), key, reverse);
        }));
        register(g, BuiltinFunction.of("reversed", 1, (in, a) -> {
            List<Object> items = Values.toList(a.get(0));
            Collections.reverse(items);
            return items;
        }));
        register(g, new BuiltinFunction("enumerate", 1, 2, (in, a) -> {
            long i = a.size() > 1 ? Values.toLong(a.get(1), "start") : 0;
            List<Object> out = new ArrayList<>();
            for (Object o : Values.iterate(a.get(0))) {
                in.checkpoint();
                out.add(pair(i++, o));
            }
            return out;
        }));
        register(g, new BuiltinFunction("zip", 1, -1, (in, a) -> {
            List<List<Object>> lists = new ArrayList<>();
            int n = Integer.MAX_VALUE;
            for (Object o : a) {
                List<Object> l = Values.toList(o);
                lists.add(l);
                n = Math.min(n, l.size());
            }
            List<Object> out = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                in.checkpoint();
                List<Object> row = new ArrayList<>();
                for (List<Object> l : lists)
                    row.add(l.get(i));
                out.add(row);
            }
            return out;
        }));
        register(g, BuiltinFunction.of("type", 1, (in, a) -> Values.typeName(a.get(0))));
        register(g, BuiltinFunction.of("isinstance", 2, (in, a) -> {
            Object v = a.get(0);
            Object t = a.get(1);
            if (t instanceof RecordType rt)
                return v instanceof RecordInstance ri && ri.type() == rt;
            if (t instanceof String name)
                return Values.typeName(v).equals(name);
            throw CellRuntimeException.typeError("isinstance() arg 2 must be a type name or record type");
        }));
        register(g, BuiltinFunction.of("error", 1, (in, a) -> {
            throw new CellRuntimeException("Error", Values.str(a.get(0)));
        }));
        return Collections.unmodifiableMap(g);
    }

    private static void register(Map<String, Object> g, BuiltinFunction f) {
        g.put(f.name(), f);
    }

    static RangeValue range(List<Object> a) {
        long start = 0;
        long step = 1;
        long stop;
        if (a.size() == 1) {
            stop = Values.toLong(a.get(0), "range() argument");
        } else {
            start = Values.toLong(a.get(0), "range() argument");
            stop = Values.toLong(a.get(1), "range() argument");
            if (a.size() == 3)
                step = Values.toLong(a.get(2), "range() argument");
        }
        if (step == 0)
            throw CellRuntimeException.valueError("range() arg 3 must not be zero");
        return new RangeValue(start, stop, step);
    }

    static Object toInt(Object v) {
        if (v instanceof Long)
            return v;
        if (v instanceof Boolean b)
            return b ? 1L : 0L;
        if (v instanceof Double d) {
            if (d.isNaN() || d.isInfinite())
                throw CellRuntimeException.valueError("cannot convert float " + Values.formatDouble(d) + " to integer");
            return (long) d.doubleValue();
        }
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw CellRuntimeException.valueError("invalid literal for int() with base 10: " + Values.repr(s));
            }
        }
        throw CellRuntimeException.typeError("int() argument must be a string or a number, not '"
                + Values.typeName(v) + "'");
    }

    static Object toFloat(Object v) {
        if (v instanceof String s) {
            String t = s.trim().toLowerCase();
            switch (t) {
                case "nan":
                    return Double.NaN;
                case "inf":
                case "infinity":
                    return Double.POSITIVE_INFINITY;
                case "-inf":
                case "-infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
            try {
                return Double.parseDouble(t);
            } catch (NumberFormatException e) {
                throw CellRuntimeException.valueError("could not convert string to float: " + Values.repr(s));
            }
        }
        if (v instanceof Long || v instanceof Double || v instanceof Boolean)
            return Values.toDouble(v);
        throw CellRuntimeException.typeError("float() argument must be a string or a number, not '"
                + Values.typeName(v) + "'");
    }

    private static Map<?, ?> map(Object v, String fn) {
        if (v instanceof Map<?, ?> m)
            return m;
        throw CellRuntimeException.typeError(fn + "() argument must be a map, not '" + Values.typeName(v) + "'");
    }

    private static List<Object> items(Map<?, ?> m) {
        List<Object> out = new ArrayList<>();
        for (Map.Entry<?, ?> e : m.entrySet())
            out.add(pair(e.getKey(), e.getValue()));
        return out;
    }

    private static List<Object> pair(Object a, Object b) {
        List<Object> p = new ArrayList<>(2);
        p.add(a);
        p.add(b);
        return p;
    }

    private static Object extreme(Interpreter in, String fn, List<Object> args, int sign) {
        Iterable<Object> items = args.size() == 1 ? Values.iterate(args.get(0)) : args;
        Object best = null;
        boolean found = false;
        for (Object o : items) {
            in.checkpoint();
            if (!found || Values.compare(o, best, sign < 0 ? "<" : ">") * sign > 0) {
                best = o;
                found = true;
            }
        }
        if (!found)
            throw CellRuntimeException.valueError(fn + "() arg is an empty sequence");
        return best;
    }

    private static Object round(List<Object> a) {
        double v = Values.toDouble(a.get(0));
        if (a.size() == 1 || a.get(1) == null) {
            if (a.get(0) instanceof Long)
                return a.get(0);
            if (Double.isNaN(v) || Double.isInfinite(v))
                throw CellRuntimeException.valueError("cannot convert float " + Values.formatDouble(v) + " to integer");
            return (long) Math.rint(v);
        }
        long digits = Values.toLong(a.get(1), "ndigits");
        if (a.get(0) instanceof Long l && digits >= 0)
            return l;
        if (Double.isNaN(v) || Double.isInfinite(v))
            return v;
        return new BigDecimal(Double.toString(v)).setScale((int) digits, RoundingMode.HALF_EVEN).doubleValue();
    }

    static List<Object> sorted(Interpreter in, List<Object> items, Object key, boolean reverse) {
        if (key == null) {
            Operators.sort(items);
        } else {
            List<Object[]> keyed = new ArrayList<>(items.size());
            for (Object item : items) {
                in.checkpoint();
                keyed.add(new Object[] { in.call(key, Collections.singletonList(item)), item });
            }
            keyed.sort((x, y) -> Values.compare(x[0], y[0], "<"));
            items.clear();
            for (Object[] pair : keyed)
                items.add(pair[1]);
        }
        if (reverse)
            Collections.reverse(items);
        return items;
    }

    // ── Methods of built-in types ──────────────────────────────────

    /**
     * Resolves {@code target.name} for built-in types, returning a bound method or
     * a property value.
     */
    public static Object attribute(Object target, String name) {
        if (target instanceof List<?> l)
            return listMethod(castList(l), name);
        if (target instanceof Map<?, ?> m)
            return mapMethod(castMap(m), name);
        if (target instanceof String s)
            return stringMethod(s, name);
        if (target instanceof Table t)
            return tableAttribute(t, name);
        if (target instanceof Column c)
            return columnAttribute(c, name);
        if (target instanceof NdArray a)
            return arrayAttribute(a, name);
        throw noAttribute(target, name);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> castList(List<?> l) {
        return (List<Object>) l;
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> castMap(Map<?, ?> m) {
        return (Map<Object, Object>) m;
    }

    private static CellRuntimeException noAttribute(Object target, String name) {
        return new CellRuntimeException("AttributeError",
                "'" + Values.typeName(target) + "' object has no attribute '" + name + "'");
    }

    private static Object listMethod(List<Object> list, String name) {
        switch (name) {
            case "append":
                return BuiltinFunction.of("append", 1, (in, a) -> {
                    list.add(a.get(0));
                    return null;
                });
            case "extend":
                return BuiltinFunction.of("extend", 1, (in, a) -> {
                    list.addAll(Values.toList(a.get(0)));
                    return null;
                });
            case "insert":
                return BuiltinFunction.of("insert", 2, (in, a) -> {
                    long i = Values.toLong(a.get(0), "index");
                    if (i < 0)
                        i += list.size();
                    list.add((int) Math.max(0, Math.min(list.size(), i)), a.get(1));
                    return null;
                });
            case "pop":
                return new BuiltinFunction("pop", 0, 1, (in, a) -> {
                    if (list.isEmpty())
                        throw new CellRuntimeException("IndexError", "pop from empty list");
                    int i = a.isEmpty() ? list.size() - 1 : Values.position(a.get(0), list.size(), "pop");
                    return list.remove(i);
                });
            case "remove":
                return BuiltinFunction.of("remove", 1, (in, a) -> {
                    for (int i = 0; i < list.size(); i++) {
                        if (Values.equal(list.get(i), a.get(0))) {
                            list.remove(i);
                            return null;
                        }
                    }
                    throw CellRuntimeException.valueError("list.remove(x): x not in list");
                });
            case "index":
                return BuiltinFunction.of("index", 1, (in, a) -> {
                    for (int i = 0; i < list.size(); i++) {
                        if (Values.equal(list.get(i), a.get(0)))
                            return (long) i;
                    }
                    throw CellRuntimeException.valueError(Values.repr(a.get(0)) + " is not in list");
                });
            case "count":
                return BuiltinFunction.of("count", 1, (in, a) -> list.stream()
                        .filter(o -> Values.equal(o, a.get(0))).count());
            case "sort":
                return new BuiltinFunction("sort", 0, 2, (in, a) -> {
                    List<Object> sorted = sorted(in, new ArrayList<>(list), a.isEmpty() ? null : a.get(0),
                            a.size() > 1 && Values.truthy(a.get(1)));
                    list.clear();
                    list.addAll(sorted);
                    return null;
                });
            case "reverse":
                return BuiltinFunction.of("reverse", 0, (in, a) -> {
                    Collections.reverse(list);
                    return null;
                });
            case "copy":
                return BuiltinFunction.of("copy", 0, (in, a) -> new ArrayList<>(list));
            case "clear":
                return BuiltinFunction.of("clear", 0, (in, a) -> {
                    list.clear();
                    return null;
                });
            default:
                throw noAttribute(list, name);
        }
    }

    private static Object mapMethod(Map<Object, Object> map, String name) {
        switch (name) {
            case "get":
                return new BuiltinFunction("get", 1, 2, (in, a) -> {
                    Values.requireHashable(a.get(0));
                    if (map.containsKey(a.get(0)))
                        return map.get(a.get(0));
                    return a.size() > 1 ? a.get(1) : null;
                });
            case "keys":
                return BuiltinFunction.of("keys", 0, (in, a) -> new ArrayList<>(map.keySet()));
            case "values":
                return BuiltinFunction.of("values", 0, (in, a) -> new ArrayList<>(map.values()));
            case "items":
                return BuiltinFunction.of("items", 0, (in, a) -> items(map));
            case "pop":
                return new BuiltinFunction("pop", 1, 2, (in, a) -> {
                    Values.requireHashable(a.get(0));
                    if (map.containsKey(a.get(0)))
                        return map.remove(a.get(0));
                    if (a.size() > 1)
                        return a.get(1);
                    throw new CellRuntimeException("KeyError", Values.repr(a.get(0)));
                });
            case "update":
                return BuiltinFunction.of("update", 1, (in, a) -> {
                    map.putAll(map(a.get(0), "update"));
                    return null;
                });
            case "copy":
                return BuiltinFunction.of("copy", 0, (in, a) -> new LinkedHashMap<>(map));
            case "clear":
                return BuiltinFunction.of("clear", 0, (in, a) -> {
                    map.clear();
                    return null;
                });
            default:
                throw noAttribute(map, name);
        }
    }

    private static Object stringMethod(String s, String name) {
        switch (name) {
            case "upper":
                return BuiltinFunction.of("upper", 0, (in, a) -> s.toUpperCase());
            case "lower":
                return BuiltinFunction.of("lower", 0, (in, a) -> s.toLowerCase());
            case "strip":
                return BuiltinFunction.of("strip", 0, (in, a) -> s.strip());
            case "split":
                return new BuiltinFunction("split", 0, 1, (in, a) -> split(s, a.isEmpty() ? null : a.get(0)));
            case "join":
                return BuiltinFunction.of("join", 1, (in, a) -> join(s, a.get(0)));
            case "replace":
                return BuiltinFunction.of("replace", 2, (in, a) -> s.replace(string(a.get(0)), string(a.get(1))));
            case "startswith":
                return BuiltinFunction.of("startswith", 1, (in, a) -> s.startsWith(string(a.get(0))));
            case "endswith":
                return BuiltinFunction.of("endswith", 1, (in, a) -> s.endsWith(string(a.get(0))));
            case "find":
                return BuiltinFunction.of("find", 1, (in, a) -> (long) s.indexOf(string(a.get(0))));
            case "count":
                return BuiltinFunction.of("count", 1, (in, a) -> {
                    String sub = string(a.get(0));
                    if (sub.isEmpty())
                        return (long) s.length() + 1;
                    long n = 0;
                    for (int i = s.indexOf(sub); i >= 0; i = s.indexOf(sub, i + sub.length()))
                        n++;
                    return n;
                });
            default:
                throw noAttribute(s, name);
        }
    }

    static String string(Object v) {
        if (v instanceof String s)
            return s;
        throw CellRuntimeException.typeError("expected str, not '" + Values.typeName(v) + "'");
    }

    static List<Object> split(String s, Object sep) {
        List<Object> out = new ArrayList<>();
        if (sep == null) {
            for (String part : s.strip().split("\\s+")) {
                if (!part.isEmpty())
                    out.add(part);
            }
            return out;
        }
        String d = string(sep);
        if (d.isEmpty())
            throw CellRuntimeException.valueError("empty separator");
        int from = 0;
        for (int i = s.indexOf(d); i >= 0; i = s.indexOf(d, from)) {
            out.add(s.substring(from, i));
            from = i + d.length();
        }
        out.add(s.substring(from));
        return out;
    }

    static String join(String sep, Object items) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Object o : Values.iterate(items)) {
            if (!first)
                sb.append(sep);
            first = false;
            sb.append(string(o));
        }
        return sb.toString();
    }

    private static Object tableAttribute(Table t, String name) {
        switch (name) {
            case "columns":
                return new ArrayList<Object>(t.columnNames());
            case "shape":
                return new ArrayList<Object>(List.of((long) t.rowCount(), (long) t.columnCount()));
            case "head":
                return new BuiltinFunction("head", 0, 1, (in, a) -> t.head(a.isEmpty() ? 5
                        : Values.toIndex(a.get(0), "n")));
            case "row":
                return BuiltinFunction.of("row", 1, (in, a) -> t.row(Values.position(a.get(0), t.rowCount(), "row")));
            case "rows":
                return BuiltinFunction.of("rows", 0, (in, a) -> {
                    List<Object> rows = new ArrayList<>();
                    for (int i = 0; i < t.rowCount(); i++)
                        rows.add(t.row(i));
                    return rows;
                });
            default:
                if (t.hasColumn(name))
                    return t.column(name);
                throw noAttribute(t, name);
        }
    }

    private static Object columnAttribute(Column c, String name) {
        switch (name) {
            case "name":
                return c.name();
            case "tolist":
                return BuiltinFunction.of("tolist", 0, (in, a) -> new ArrayList<>(c.values()));
            case "sum":
                return BuiltinFunction.of("sum", 0, (in, a) -> {
                    Object total = 0L;
                    for (Object o : c.values())
                        total = o == null ? total : Operators.binary("+", total, o);
                    return total;
                });
            case "mean":
                return BuiltinFunction.of("mean", 0, (in, a) -> mean(c.values()));
            case "min":
                return BuiltinFunction.of("min", 0, (in, a) -> extreme(in, "min", List.of(c.values()), -1));
            case "max":
                return BuiltinFunction.of("max", 0, (in, a) -> extreme(in, "max", List.of(c.values()), 1));
            default:
                throw noAttribute(c, name);
        }
    }

    private static double mean(List<Object> values) {
        double total = 0;
        int n = 0;
        for (Object o : values) {
            if (o == null)
                continue;
            total += Values.toDouble(o);
            n++;
        }
        return n == 0 ? Double.NaN : total / n;
    }

    private static Object arrayAttribute(NdArray arr, String name) {
        switch (name) {
            case "shape":
                List<Object> shape = new ArrayList<>();
                for (int d : arr.shape())
                    shape.add((long) d);
                return shape;
            case "ndim":
                return (long) arr.ndim();
            case "size":
                return (long) arr.size();
            case "tolist":
                return BuiltinFunction.of("tolist", 0, (in, a) -> arr.toList());
            case "sum":
                return BuiltinFunction.of("sum", 0, (in, a) -> {
                    double total = 0;
                    for (double d : arr.data())
                        total += d;
                    return arr.integral() ? (Object) (long) total : (Object) total;
                });
            case "mean":
                return BuiltinFunction.of("mean", 0, (in, a) -> {
                    double total = 0;
                    for (double d : arr.data())
                        total += d;
                    return arr.size() == 0 ? Double.NaN : total / arr.size();
                });
            case "min":
            case "max":
                return BuiltinFunction.of(name, 0, (in, a) -> {
                    if (arr.size() == 0)
                        throw CellRuntimeException.valueError("zero-size array has no " + name);
                    double best = arr.data()[0];
                    for (double d : arr.data())
                        best = name.equals("min") ? Math.min(best, d) : Math.max(best, d);
                    return arr.box(best);
                });
            case "reshape":
                return BuiltinFunction.of("reshape", 1, (in, a) -> arr.reshape(shapeOf(a.get(0))));
            default:
                throw noAttribute(arr, name);
        }
    }

    static int[] shapeOf(Object v) {
        if (v instanceof Long)
            return new int[] { Values.toIndex(v, "shape") };
        List<Object> dims = Values.toList(v);
        int[] shape = new int[dims.size()];
        for (int i = 0; i < shape.length; i++)
            shape[i] = Values.toIndex(dims.get(i), "shape");
        return shape;
    }
}
