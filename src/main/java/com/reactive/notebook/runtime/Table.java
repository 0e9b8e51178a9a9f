package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented table: ordered column names, each with a value list of the
 * same length. Rendered as a {@code dataframe}.
 */
public final class Table {
    private final LinkedHashMap<String, List<Object>> columns;
    private int rowCount;

    public Table(LinkedHashMap<String, List<Object>> columns) {
        this.columns = columns;
        int rows = -1;
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
            if (rows >= 0 && e.getValue().size() != rows)
                throw CellRuntimeException.valueError("all columns must have the same length");
            rows = e.getValue().size();
        }
        this.rowCount = Math.max(rows, 0);
    }

    /** Builds a table from row maps; columns appear in first-seen order, gaps are null. */
    public static Table fromRows(List<Map<?, ?>> rows) {
        LinkedHashMap<String, List<Object>> cols = new LinkedHashMap<>();
        for (int r = 0; r < rows.size(); r++) {
            for (Object key : rows.get(r).keySet()) {
                String name = Values.str(key);
                if (!cols.containsKey(name)) {
                    List<Object> filler = new ArrayList<>();
                    for (int i = 0; i < r; i++)
                        filler.add(null);
                    cols.put(name, filler);
                }
            }
            for (Map.Entry<String, List<Object>> e : cols.entrySet())
                e.getValue().add(lookup(rows.get(r), e.getKey()));
        }
        return new Table(cols);
    }

    private static Object lookup(Map<?, ?> row, String name) {
        for (Map.Entry<?, ?> e : row.entrySet()) {
            if (Values.str(e.getKey()).equals(name))
                return e.getValue();
        }
        return null;
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Object> columnValues(String name) {
        List<Object> values = columns.get(name);
        if (values == null)
            throw new CellRuntimeException("KeyError", Values.repr(name));
        return values;
    }

    public Column column(String name) {
        return new Column(name, columnValues(name));
    }

    public void setColumn(String name, List<Object> values) {
        if (!columns.isEmpty() && values.size() != rowCount)
            throw CellRuntimeException.valueError("length of values (" + values.size()
                    + ") does not match length of table (" + rowCount + ")");
        columns.put(name, values);
        rowCount = values.size();
    }

    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> e : columns.entrySet())
            row.put(e.getKey(), e.getValue().get(index));
        return row;
    }

    public Table head(int n) {
        int limit = Math.max(0, Math.min(n, rowCount));
        LinkedHashMap<String, List<Object>> cols = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> e : columns.entrySet())
            cols.put(e.getKey(), new ArrayList<>(e.getValue().subList(0, limit)));
        return new Table(cols);
    }

    LinkedHashMap<String, List<Object>> columns() {
        return columns;
    }
}
