package io.kiln.core.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Tabular value exchanged between nodes: named, equal-length columns.
///
/// {@link #withColumn} never modifies the receiver; it returns a copy.
///
/// @implNote Immutable and thread-safe. Column order is insertion order.
public final class Table {

    private final Map<String, Series> columns;
    private final int rowCount;

    private Table(Map<String, Series> columns) {
        int rows = -1;
        for (Map.Entry<String, Series> column : columns.entrySet()) {
            Objects.requireNonNull(column.getValue(), "column " + column.getKey() + " is null");
            if (rows >= 0 && column.getValue().size() != rows) {
                throw new IllegalArgumentException(
                        "Column '" + column.getKey() + "' has " + column.getValue().size()
                                + " rows, expected " + rows);
            }
            rows = column.getValue().size();
        }
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.rowCount = Math.max(rows, 0);
    }

    /// Creates a table from columns in iteration order.
    ///
    /// @param columns columns keyed by name, not null
    /// @return new table, never null
    /// @throws IllegalArgumentException if the columns differ in length
    public static Table of(Map<String, Series> columns) {
        return new Table(Objects.requireNonNull(columns, "columns must not be null"));
    }

    public static Table empty() {
        return new Table(Map.of());
    }

    public Optional<Series> column(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public int rowCount() {
        return rowCount;
    }

    /// Returns a copy with the column added or replaced.
    ///
    /// An empty table adopts the row count of the new column.
    ///
    /// @param name column name, not null
    /// @param series column values, not null
    /// @return new table, never null
    /// @throws IllegalArgumentException if the column length does not match
    public Table withColumn(String name, Series series) {
        Map<String, Series> copy = new LinkedHashMap<>(columns);
        copy.put(Objects.requireNonNull(name, "name must not be null"), series);
        return new Table(copy);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Table other && columns.equals(other.columns));
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "Table" + columns;
    }
}
