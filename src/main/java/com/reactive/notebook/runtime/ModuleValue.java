package com.reactive.notebook.runtime;

import java.util.Map;

/**
 * A built-in module bound by {@code import}.
 */
public record ModuleValue(String name, Map<String, Object> members) {

    public Object member(String attribute) {
        if (!members.containsKey(attribute))
            throw new CellRuntimeException("AttributeError",
                    "module '" + name + "' has no attribute '" + attribute + "'");
        return members.get(attribute);
    }
}
