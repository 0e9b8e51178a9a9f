package com.reactive.notebook.runtime;

import java.util.List;

/**
 * A named, positionally indexed sequence of values (one table column).
 * Rendered as a {@code series}.
 */
public final class Column {
    private final String name;
    private final List<Object> values;

    public Column(String name, List<Object> values) {
        this.name = name;
        this.values = values;
    }

    public String name() {
        return name;
    }

    public List<Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }
}
