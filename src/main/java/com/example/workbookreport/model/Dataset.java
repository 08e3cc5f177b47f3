package com.example.workbookreport.model;

import com.example.workbookreport.util.CellValues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-ordered tabular data. Every row holds one value, possibly {@code null}, per declared column.
 */
public class Dataset {
    private final List<String> columns;
    private final List<List<Object>> rows;

    private Dataset(List<String> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static Dataset empty(List<String> columns) {
        return new Builder(columns).build();
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * @return the zero-based position of the column, or -1 when it is not declared
     */
    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public Object getValue(int rowIndex, String column) {
        int columnIndex = columns.indexOf(column);
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(rowIndex).get(columnIndex);
    }

    public static class Builder {
        private final List<String> columns;
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            if (columns == null || columns.isEmpty()) {
                throw new IllegalArgumentException("A dataset needs at least one column");
            }
            Set<String> seen = new HashSet<>();
            for (String column : columns) {
                if (column == null || column.isBlank()) {
                    throw new IllegalArgumentException("Column names must not be blank");
                }
                if (!seen.add(column)) {
                    throw new IllegalArgumentException("Duplicate column name: " + column);
                }
            }
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(Object... values) {
            return addRow(Arrays.asList(values));
        }

        public Builder addRow(List<?> values) {
            if (values.size() != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d values but the dataset declares %d columns",
                        rows.size(), values.size(), columns.size()));
            }
            List<Object> row = new ArrayList<>(values.size());
            for (int i = 0; i < values.size(); i++) {
                row.add(checkValue(columns.get(i), values.get(i)));
            }
            rows.add(Collections.unmodifiableList(row));
            return this;
        }

        /**
         * Adds a row from a column to value map. Columns missing from the map are stored as {@code null}.
         */
        public Builder addRow(Map<String, ?> values) {
            for (String key : values.keySet()) {
                if (!columns.contains(key)) {
                    throw new IllegalArgumentException("Unknown column in row: " + key);
                }
            }
            List<Object> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(values.get(column));
            }
            return addRow(row);
        }

        public Dataset build() {
            return new Dataset(columns, new ArrayList<>(rows));
        }

        private Object checkValue(String column, Object value) {
            if (!CellValues.isSupported(value)) {
                throw new IllegalArgumentException(String.format(
                        "Unsupported value type %s in column '%s'", value.getClass().getName(), column));
            }
            return value;
        }
    }
}
