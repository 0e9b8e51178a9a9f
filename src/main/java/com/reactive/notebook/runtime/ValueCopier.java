package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep copy of runtime values that preserves aliasing and cycles. Immutable
 * values (numbers, strings, built-ins, modules, record types, ranges and
 * top-level functions) are shared.
 */
public final class ValueCopier {
    private final Map<Object, Object> memo = new IdentityHashMap<>();

    /** Copies every binding of a namespace with a shared memo. */
    public static Map<String, Object> copyAll(Map<String, Object> source) {
        ValueCopier copier = new ValueCopier();
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : source.entrySet())
            out.put(e.getKey(), copier.copy(e.getValue()));
        return out;
    }

    public Object copy(Object value) {
        if (value == null || value instanceof Boolean || value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof BuiltinFunction || value instanceof RecordType
                || value instanceof ModuleValue || value instanceof RangeValue)
            return value;
        Object seen = memo.get(value);
        if (seen != null)
            return seen;
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            memo.put(value, out);
            for (Object item : list)
                out.add(copy(item));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            memo.put(value, out);
            for (Map.Entry<?, ?> e : map.entrySet())
                out.put(e.getKey(), copy(e.getValue()));
            return out;
        }
        if (value instanceof RecordInstance r) {
            Map<String, Object> fields = new LinkedHashMap<>();
            RecordInstance out = new RecordInstance(r.type(), fields);
            memo.put(value, out);
            for (Map.Entry<String, Object> e : r.values().entrySet())
                fields.put(e.getKey(), copy(e.getValue()));
            return out;
        }
        if (value instanceof UserFunction f) {
            if (f.closure() == null)
                return f;
            UserFunction out = new UserFunction(f.name(), f.params(), f.body(), f.expression(),
                    copyEnvironment(f.closure()));
            memo.put(value, out);
            return out;
        }
        if (value instanceof Table t) {
            LinkedHashMap<String, List<Object>> cols = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> e : t.columns().entrySet())
                cols.put(e.getKey(), copyList(e.getValue()));
            Table out = new Table(cols);
            memo.put(value, out);
            return out;
        }
        if (value instanceof Column c) {
            Column out = new Column(c.name(), copyList(c.values()));
            memo.put(value, out);
            return out;
        }
        if (value instanceof NdArray a) {
            NdArray out = new NdArray(a.data().clone(), a.shape(), a.integral());
            memo.put(value, out);
            return out;
        }
        throw new IllegalArgumentException("Cannot copy value of type " + value.getClass().getName());
    }

    @SuppressWarnings("unchecked")
    private List<Object> copyList(List<Object> list) {
        return (List<Object>) copy(list);
    }

    private Environment copyEnvironment(Environment env) {
        if (env == null)
            return null;
        Object seen = memo.get(env);
        if (seen != null)
            return (Environment) seen;
        Map<String, Object> values = new HashMap<>();
        Environment out = new Environment(values, copyEnvironment(env.parent));
        memo.put(env, out);
        for (Map.Entry<String, Object> e : env.values.entrySet())
            values.put(e.getKey(), copy(e.getValue()));
        return out;
    }
}
