package com.reactive.notebook.runtime;

import java.util.HashMap;
import java.util.Map;

/**
 * One local scope (function body, lambda or comprehension). The cell top
 * level has no environment: it reads and writes the namespace directly.
 */
public final class Environment {
    final Map<String, Object> values;
    final Environment parent;

    Environment(Environment parent) {
        this(new HashMap<>(), parent);
    }

    Environment(Map<String, Object> values, Environment parent) {
        this.values = values;
        this.parent = parent;
    }

    Environment find(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name))
                return e;
        }
        return null;
    }
}
