package com.reactive.notebook.runtime;

import java.util.Map;

/**
 * A value built by a {@link RecordType}. Fields are mutable but fixed in
 * number.
 */
public final class RecordInstance {
    private final RecordType type;
    private final Map<String, Object> values;

    RecordInstance(RecordType type, Map<String, Object> values) {
        this.type = type;
        this.values = values;
    }

    public RecordType type() {
        return type;
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Object get(String field) {
        if (!values.containsKey(field))
            throw new CellRuntimeException("AttributeError",
                    "'" + type.name() + "' object has no attribute '" + field + "'");
        return values.get(field);
    }

    public void set(String field, Object value) {
        get(field);
        values.put(field, value);
    }
}
