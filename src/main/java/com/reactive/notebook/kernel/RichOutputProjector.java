package com.reactive.notebook.kernel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.reactive.notebook.api.RichOutput;
import com.reactive.notebook.runtime.Column;
import com.reactive.notebook.runtime.NdArray;
import com.reactive.notebook.runtime.Table;
import com.reactive.notebook.runtime.Values;

/**
 * Projects structured cell results into capped, JSON-safe {@link RichOutput}.
 *
 * <ul>
 * <li>{@code table} becomes a {@code dataframe}: row records, column names,
 * per-column dtypes, row index, full shape.</li>
 * <li>{@code column} becomes a {@code series}: index to value map, name,
 * dtype.</li>
 * <li>{@code array} becomes an {@code ndarray}: nested lists for one and two
 * dimensions, a flat prefix for more.</li>
 * </ul>
 * Anything else yields {@code null}.
 */
public final class RichOutputProjector {
    private final int maxRows;
    private final int maxElements;

    public RichOutputProjector(int maxRows, int maxElements) {
        if (maxRows <= 0 || maxElements <= 0)
            throw new IllegalArgumentException("Caps must be positive: rows=" + maxRows + ", elements=" + maxElements);
        this.maxRows = maxRows;
        this.maxElements = maxElements;
    }

    public RichOutput project(Object value) {
        if (value instanceof Table t)
            return dataframe(t);
        if (value instanceof Column c)
            return series(c);
        if (value instanceof NdArray a)
            return ndarray(a);
        return null;
    }

    private RichOutput dataframe(Table table) {
        int rows = table.rowCount();
        int shown = Math.min(rows, maxRows);
        List<String> columns = table.columnNames();

        List<Object> records = new ArrayList<>(shown);
        for (int r = 0; r < shown; r++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : table.row(r).entrySet())
                row.put(e.getKey(), safe(e.getValue()));
            records.add(row);
        }
        Map<String, String> dtypes = new LinkedHashMap<>();
        for (String name : columns)
            dtypes.put(name, dtype(table.columnValues(name)));

        RichOutput out = new RichOutput();
        out.setType("dataframe");
        out.setData(records);
        out.setColumns(columns);
        out.setDtypes(dtypes);
        out.setIndex(index(shown));
        out.setShape(List.of(rows, columns.size()));
        out.setTruncated(rows > maxRows);
        return out;
    }

    private RichOutput series(Column column) {
        int size = column.size();
        int shown = Math.min(size, maxRows);
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < shown; i++)
            data.put(String.valueOf(i), safe(column.values().get(i)));

        RichOutput out = new RichOutput();
        out.setType("series");
        out.setData(data);
        out.setName(column.name());
        out.setDtype(dtype(column.values()));
        out.setIndex(index(shown));
        out.setShape(List.of(size));
        out.setTruncated(size > maxRows);
        return out;
    }

    private RichOutput ndarray(NdArray array) {
        int[] shape = array.shape();
        Object data;
        boolean truncated;
        if (shape.length == 1) {
            int shown = Math.min(array.size(), maxElements);
            data = safe(array.slice(0, shown).toList());
            truncated = array.size() > maxElements;
        } else if (shape.length == 2) {
            int maxDim = (int) Math.sqrt(maxElements);
            int rows = Math.min(shape[0], maxDim);
            int cols = Math.min(shape[1], maxDim);
            List<Object> grid = new ArrayList<>(rows);
            for (int r = 0; r < rows; r++) {
                List<Object> line = new ArrayList<>(cols);
                for (int c = 0; c < cols; c++)
                    line.add(safe(array.element(r * shape[1] + c)));
                grid.add(line);
            }
            data = grid;
            truncated = shape[0] > rows || shape[1] > cols;
        } else {
            int shown = Math.min(array.size(), maxElements);
            List<Object> flat = new ArrayList<>(shown);
            for (int i = 0; i < shown; i++)
                flat.add(safe(array.element(i)));
            data = flat;
            truncated = array.size() > maxElements;
        }

        RichOutput out = new RichOutput();
        out.setType("ndarray");
        out.setData(data);
        out.setDtype(array.integral() ? "int64" : "float64");
        out.setShape(Arrays.stream(shape).boxed().toList());
        out.setTruncated(truncated);
        return out;
    }

    private static List<Object> index(int n) {
        List<Object> index = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            index.add(i);
        return index;
    }

    /** Column dtype by the values present, ignoring nulls. */
    static String dtype(List<Object> values) {
        boolean any = false, allLong = true, allNumber = true, allBool = true;
        for (Object v : values) {
            if (v == null)
                continue;
            any = true;
            allLong &= v instanceof Long;
            allNumber &= v instanceof Long || v instanceof Double;
            allBool &= v instanceof Boolean;
        }
        if (!any)
            return "object";
        if (allLong)
            return "int64";
        if (allNumber)
            return "float64";
        if (allBool)
            return "bool";
        return "object";
    }

    /** Converts a value to something Jackson writes as valid JSON. */
    static Object safe(Object v) {
        return safe(v, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Object safe(Object v, Set<Object> active) {
        if (v == null || v instanceof String || v instanceof Boolean || v instanceof Long)
            return v;
        if (v instanceof Double d) {
            if (d.isNaN())
                return "NaN";
            if (d.isInfinite())
                return d > 0 ? "Infinity" : "-Infinity";
            return d;
        }
        if ((v instanceof List<?> || v instanceof Map<?, ?>) && !active.add(v))
            return v instanceof List<?> ? "[...]" : "{...}";
        if (v instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list)
                out.add(safe(item, active));
            active.remove(v);
            return out;
        }
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet())
                out.put(Values.str(e.getKey()), safe(e.getValue(), active));
            active.remove(v);
            return out;
        }
        return Values.repr(v);
    }
}
