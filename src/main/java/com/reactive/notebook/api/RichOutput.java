package com.reactive.notebook.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Structured rendering of a table ({@code dataframe}), column
 * ({@code series}) or array ({@code ndarray}) result. Data is already capped
 * and JSON-safe: non-finite numbers appear as the strings {@code "NaN"},
 * {@code "Infinity"} and {@code "-Infinity"}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RichOutput {
    private String type;
    private Object data;
    private List<String> columns;
    private Map<String, String> dtypes;
    private String dtype;
    private List<Object> index;
    private String name;
    private List<Integer> shape;
    private boolean truncated;

    /** Deep copy, so that views of a cell cannot reach the engine's instance. */
    public RichOutput copy() {
        RichOutput c = new RichOutput();
        c.type = type;
        c.data = copyValue(data);
        c.columns = columns == null ? null : new ArrayList<>(columns);
        c.dtypes = dtypes == null ? null : new LinkedHashMap<>(dtypes);
        c.dtype = dtype;
        c.index = index == null ? null : new ArrayList<>(index);
        c.name = name;
        c.shape = shape == null ? null : new ArrayList<>(shape);
        c.truncated = truncated;
        return c;
    }

    private static Object copyValue(Object v) {
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l)
                out.add(copyValue(o));
            return out;
        }
        if (v instanceof Map<?, ?> m) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet())
                out.put(e.getKey(), copyValue(e.getValue()));
            return out;
        }
        return v;
    }
}
