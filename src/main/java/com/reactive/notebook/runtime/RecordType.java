package com.reactive.notebook.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Constructor produced by {@code record Name(field, ...)}.
 */
public record RecordType(String name, List<String> fields) implements CellFunction {

    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
        if (args.size() != fields.size())
            throw CellRuntimeException.typeError(name + "() takes " + fields.size()
                    + " positional arguments but " + args.size() + " were given");
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++)
            values.put(fields.get(i), args.get(i));
        return new RecordInstance(this, values);
    }
}
