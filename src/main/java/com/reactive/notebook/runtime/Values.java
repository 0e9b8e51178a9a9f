package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Value semantics of the cell language: type names, truthiness, equality,
 * ordering, iteration, indexing and textual rendering.
 *
 * <p>
 * Runtime values are plain Java objects: {@code null}, {@link Boolean},
 * {@link Long}, {@link Double}, {@link String}, {@link List}, {@link Map},
 * plus the runtime types of this package.
 */
public final class Values {
    private static final int TEXT_ROWS = 10;

    private Values() {
    }

    public static String typeName(Object v) {
        if (v == null)
            return "null";
        if (v instanceof Boolean)
            return "bool";
        if (v instanceof Long)
            return "int";
        if (v instanceof Double)
            return "float";
        if (v instanceof String)
            return "str";
        if (v instanceof List)
            return "list";
        if (v instanceof Map)
            return "map";
        if (v instanceof UserFunction)
            return "function";
        if (v instanceof BuiltinFunction)
            return "builtin_function";
        if (v instanceof RecordType)
            return "type";
        if (v instanceof RecordInstance r)
            return r.type().name();
        if (v instanceof ModuleValue)
            return "module";
        if (v instanceof RangeValue)
            return "range";
        if (v instanceof Table)
            return "table";
        if (v instanceof Column)
            return "column";
        if (v instanceof NdArray)
            return "array";
        return v.getClass().getSimpleName();
    }

    public static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double;
    }

    public static double toDouble(Object v) {
        if (v instanceof Long l)
            return l;
        if (v instanceof Double d)
            return d;
        if (v instanceof Boolean b)
            return b ? 1 : 0;
        throw CellRuntimeException.typeError("must be a number, not '" + typeName(v) + "'");
    }

    public static long toLong(Object v, String what) {
        if (v instanceof Long l)
            return l;
        if (v instanceof Boolean b)
            return b ? 1 : 0;
        throw CellRuntimeException.typeError(what + " must be an integer, not '" + typeName(v) + "'");
    }

    public static int toIndex(Object v, String what) {
        long l = toLong(v, what);
        if (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE)
            throw new CellRuntimeException("IndexError", what + " out of range");
        return (int) l;
    }

    public static boolean truthy(Object v) {
        if (v == null)
            return false;
        if (v instanceof Boolean b)
            return b;
        if (v instanceof Long l)
            return l != 0;
        if (v instanceof Double d)
            return d != 0.0;
        if (v instanceof String s)
            return !s.isEmpty();
        if (v instanceof List<?> l)
            return !l.isEmpty();
        if (v instanceof Map<?, ?> m)
            return !m.isEmpty();
        if (v instanceof RangeValue r)
            return r.size() > 0;
        if (v instanceof NdArray a) {
            if (a.size() == 1)
                return a.data()[0] != 0.0;
            throw CellRuntimeException.valueError(
                    "the truth value of an array with more than one element is ambiguous");
        }
        if (v instanceof Table || v instanceof Column)
            throw CellRuntimeException.valueError(
                    "the truth value of a " + typeName(v) + " is ambiguous");
        return true;
    }

    // ── Equality & ordering ────────────────────────────────────────

    public static boolean equal(Object a, Object b) {
        if (a == b)
            return true;
        if (a == null || b == null)
            return false;
        if (a instanceof Long x && b instanceof Long y)
            return x.longValue() == y.longValue();
        if (isNumber(a) && isNumber(b))
            return toDouble(a) == toDouble(b);
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size())
                return false;
            for (int i = 0; i < la.size(); i++) {
                if (!equal(la.get(i), lb.get(i)))
                    return false;
            }
            return true;
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size())
                return false;
            for (Map.Entry<?, ?> e : ma.entrySet()) {
                if (!mb.containsKey(e.getKey()) || !equal(e.getValue(), mb.get(e.getKey())))
                    return false;
            }
            return true;
        }
        if (a instanceof RecordInstance ra && b instanceof RecordInstance rb)
            return ra.type() == rb.type() && equal(new ArrayList<>(ra.values().values()),
                    new ArrayList<>(rb.values().values()));
        return a.equals(b);
    }

    public static int compare(Object a, Object b, String op) {
        if (isNumber(a) && isNumber(b)) {
            if (a instanceof Long x && b instanceof Long y)
                return Long.compare(x, y);
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (a instanceof String x && b instanceof String y)
            return x.compareTo(y);
        if (a instanceof Boolean x && b instanceof Boolean y)
            return Boolean.compare(x, y);
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            int n = Math.min(la.size(), lb.size());
            for (int i = 0; i < n; i++) {
                if (!equal(la.get(i), lb.get(i)))
                    return compare(la.get(i), lb.get(i), op);
            }
            return Integer.compare(la.size(), lb.size());
        }
        throw CellRuntimeException.typeError("'" + op + "' not supported between instances of '"
                + typeName(a) + "' and '" + typeName(b) + "'");
    }

    public static void requireHashable(Object key) {
        if (key == null || key instanceof String || key instanceof Long || key instanceof Double
                || key instanceof Boolean)
            return;
        throw CellRuntimeException.typeError("unhashable type: '" + typeName(key) + "'");
    }

    // ── Sequences ──────────────────────────────────────────────────

    /** Iterates a value; lists and maps are iterated over a snapshot. */
    public static Iterable<Object> iterate(Object v) {
        if (v instanceof List<?> l)
            return new ArrayList<>(l);
        if (v instanceof RangeValue r)
            return r;
        if (v instanceof String s) {
            List<Object> chars = new ArrayList<>(s.length());
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        if (v instanceof Map<?, ?> m)
            return new ArrayList<>(m.keySet());
        if (v instanceof Column c)
            return new ArrayList<>(c.values());
        if (v instanceof Table t)
            return new ArrayList<>(t.columnNames());
        if (v instanceof NdArray a) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < a.shape()[0]; i++)
                items.add(a.get(i));
            return items;
        }
        throw CellRuntimeException.typeError("'" + typeName(v) + "' object is not iterable");
    }

    public static List<Object> toList(Object v) {
        List<Object> out = new ArrayList<>();
        for (Object o : iterate(v)) {
            CancellationToken.checkThread();
            out.add(o);
        }
        return out;
    }

    public static long length(Object v) {
        if (v instanceof String s)
            return s.codePointCount(0, s.length());
        if (v instanceof List<?> l)
            return l.size();
        if (v instanceof Map<?, ?> m)
            return m.size();
        if (v instanceof RangeValue r)
            return r.size();
        if (v instanceof Table t)
            return t.rowCount();
        if (v instanceof Column c)
            return c.size();
        if (v instanceof NdArray a)
            return a.shape()[0];
        throw CellRuntimeException.typeError("object of type '" + typeName(v) + "' has no len()");
    }

    public static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (!(item instanceof String sub))
                throw CellRuntimeException.typeError("'in <string>' requires string as left operand, not "
                        + typeName(item));
            return s.contains(sub);
        }
        if (container instanceof Map<?, ?> m)
            return m.containsKey(item);
        if (container instanceof Table t)
            return item instanceof String name && t.hasColumn(name);
        if (container instanceof RangeValue r && item instanceof Long l) {
            if (r.step() > 0 ? (l < r.start() || l >= r.stop()) : (l > r.start() || l <= r.stop()))
                return false;
            return (l - r.start()) % r.step() == 0;
        }
        for (Object o : iterate(container)) {
            if (equal(o, item))
                return true;
        }
        return false;
    }

    public static Object index(Object target, Object key) {
        if (target instanceof List<?> l)
            return l.get(position(key, l.size(), "list"));
        if (target instanceof String s) {
            int i = position(key, s.length(), "string");
            return String.valueOf(s.charAt(i));
        }
        if (target instanceof Map<?, ?> m) {
            requireHashable(key);
            if (!m.containsKey(key))
                throw new CellRuntimeException("KeyError", repr(key));
            return m.get(key);
        }
        if (target instanceof Table t) {
            if (!(key instanceof String name))
                throw CellRuntimeException.typeError("table columns are selected by name, not '"
                        + typeName(key) + "'");
            return t.column(name);
        }
        if (target instanceof Column c)
            return c.values().get(position(key, c.size(), "column"));
        if (target instanceof RangeValue r) {
            long n = r.size();
            long i = toLong(key, "range indices");
            if (i < 0)
                i += n;
            if (i < 0 || i >= n)
                throw new CellRuntimeException("IndexError", "range object index out of range");
            return r.get(i);
        }
        if (target instanceof NdArray a)
            return a.get(toIndex(key, "array indices"));
        throw CellRuntimeException.typeError("'" + typeName(target) + "' object is not subscriptable");
    }

    static int position(Object key, int size, String what) {
        if (!(key instanceof Long) && !(key instanceof Boolean))
            throw CellRuntimeException.typeError(what + " indices must be integers, not '" + typeName(key) + "'");
        long i = toLong(key, what + " indices");
        if (i < 0)
            i += size;
        if (i < 0 || i >= size)
            throw new CellRuntimeException("IndexError", what + " index out of range");
        return (int) i;
    }

    public static Object slice(Object target, Object from, Object to) {
        int size;
        if (target instanceof List<?> l)
            size = l.size();
        else if (target instanceof String s)
            size = s.length();
        else if (target instanceof Column c)
            size = c.size();
        else if (target instanceof NdArray a)
            size = a.shape()[0];
        else
            throw CellRuntimeException.typeError("'" + typeName(target) + "' object is not sliceable");
        int start = bound(from, size, 0);
        int end = Math.max(start, bound(to, size, size));
        if (target instanceof List<?> l)
            return new ArrayList<Object>(l.subList(start, end));
        if (target instanceof String s)
            return s.substring(start, end);
        if (target instanceof Column c)
            return new Column(c.name(), new ArrayList<>(c.values().subList(start, end)));
        return ((NdArray) target).slice(start, end);
    }

    private static int bound(Object v, int size, int dflt) {
        if (v == null)
            return dflt;
        long i = toLong(v, "slice indices");
        if (i < 0)
            i += size;
        return (int) Math.max(0, Math.min(size, i));
    }

    // ── Rendering ──────────────────────────────────────────────────

    /** {@code str(x)}: strings unquoted, everything else as {@link #repr}. */
    public static String str(Object v) {
        if (v instanceof String s)
            return s;
        return repr(v);
    }

    public static String repr(Object v) {
        StringBuilder sb = new StringBuilder();
        repr(v, sb, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    private static void repr(Object v, StringBuilder sb, Set<Object> active) {
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Boolean b) {
            sb.append(b ? "true" : "false");
        } else if (v instanceof Long) {
            sb.append(v);
        } else if (v instanceof Double d) {
            sb.append(formatDouble(d));
        } else if (v instanceof String s) {
            quote(s, sb);
        } else if (v instanceof List<?> l) {
            if (!active.add(l)) {
                sb.append("[...]");
                return;
            }
            sb.append('[');
            for (int i = 0; i < l.size(); i++) {
                if (i > 0)
                    sb.append(", ");
                repr(l.get(i), sb, active);
            }
            sb.append(']');
            active.remove(l);
        } else if (v instanceof Map<?, ?> m) {
            if (!active.add(m)) {
                sb.append("{...}");
                return;
            }
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!first)
                    sb.append(", ");
                first = false;
                repr(e.getKey(), sb, active);
                sb.append(": ");
                repr(e.getValue(), sb, active);
            }
            sb.append('}');
            active.remove(m);
        } else if (v instanceof UserFunction f) {
            sb.append("<function ").append(f.name()).append('>');
        } else if (v instanceof BuiltinFunction f) {
            sb.append("<built-in function ").append(f.name()).append('>');
        } else if (v instanceof RecordType t) {
            sb.append("<record ").append(t.name()).append('>');
        } else if (v instanceof RecordInstance r) {
            if (!active.add(r)) {
                sb.append(r.type().name()).append("(...)");
                return;
            }
            sb.append(r.type().name()).append('(');
            boolean first = true;
            for (Map.Entry<String, Object> e : r.values().entrySet()) {
                if (!first)
                    sb.append(", ");
                first = false;
                sb.append(e.getKey()).append('=');
                repr(e.getValue(), sb, active);
            }
            sb.append(')');
            active.remove(r);
        } else if (v instanceof ModuleValue m) {
            sb.append("<module '").append(m.name()).append("'>");
        } else if (v instanceof RangeValue r) {
            sb.append("range(").append(r.start()).append(", ").append(r.stop());
            if (r.step() != 1)
                sb.append(", ").append(r.step());
            sb.append(')');
        } else if (v instanceof NdArray a) {
            sb.append("array(");
            repr(a.toList(), sb, active);
            sb.append(')');
        } else if (v instanceof Column c) {
            renderColumn(c, sb);
        } else if (v instanceof Table t) {
            renderTable(t, sb);
        } else {
            sb.append(v);
        }
    }

    public static String formatDouble(double d) {
        if (Double.isNaN(d))
            return "nan";
        if (Double.isInfinite(d))
            return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16)
            return (long) d + ".0";
        return Double.toString(d).replace("E", "e");
    }

    private static void quote(String s, StringBuilder sb) {
        sb.append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        sb.append('\'');
    }

    private static void renderColumn(Column c, StringBuilder sb) {
        int shown = Math.min(c.size(), TEXT_ROWS);
        for (int i = 0; i < shown; i++)
            sb.append(i).append("    ").append(str(c.values().get(i))).append('\n');
        if (c.size() > shown)
            sb.append("...\n");
        sb.append("Name: ").append(c.name()).append(", Length: ").append(c.size());
    }

    private static void renderTable(Table t, StringBuilder sb) {
        List<String> names = t.columnNames();
        int shown = Math.min(t.rowCount(), TEXT_ROWS);
        List<List<String>> cells = new ArrayList<>();
        int[] widths = new int[names.size() + 1];
        List<String> header = new ArrayList<>();
        header.add("");
        header.addAll(names);
        cells.add(header);
        for (int r = 0; r < shown; r++) {
            List<String> row = new ArrayList<>();
            row.add(String.valueOf(r));
            for (String name : names)
                row.add(str(t.columnValues(name).get(r)));
            cells.add(row);
        }
        for (List<String> row : cells) {
            for (int i = 0; i < row.size(); i++)
                widths[i] = Math.max(widths[i], row.get(i).length());
        }
        Iterator<List<String>> it = cells.iterator();
        while (it.hasNext()) {
            List<String> row = it.next();
            for (int i = 0; i < row.size(); i++) {
                if (i > 0)
                    sb.append("  ");
                String cell = row.get(i);
                sb.append(" ".repeat(widths[i] - cell.length())).append(cell);
            }
            if (it.hasNext())
                sb.append('\n');
        }
        if (t.rowCount() > shown)
            sb.append("\n...");
        sb.append("\n[").append(t.rowCount()).append(" rows x ").append(names.size()).append(" columns]");
    }
}
