package com.vcinsidedigital.oci_store.schema;

import java.util.List;

public final class IndexDefinition {
    private final String name;
    private final String table;
    private final List<String> columns;
    private final boolean unique;

    private IndexDefinition(String name, String table, List<String> columns, boolean unique) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Index name must not be empty");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Index '" + name + "' has no table");
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Index '" + name + "' has no columns");
        }
        this.name = name;
        this.table = table;
        this.columns = List.copyOf(columns);
        this.unique = unique;
    }

    public static IndexDefinition on(String name, String table, String... columns) {
        return new IndexDefinition(name, table, List.of(columns), false);
    }

    public static IndexDefinition uniqueOn(String name, String table, String... columns) {
        return new IndexDefinition(name, table, List.of(columns), true);
    }

    public String getName() { return name; }
    public String getTable() { return table; }
    public List<String> getColumns() { return columns; }
    public boolean isUnique() { return unique; }

    @Override
    public String toString() {
        return (unique ? "UNIQUE " : "") + name + " ON " + table + columns;
    }
}
