package com.vcinsidedigital.oci_store.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative shape of a table: ordered columns plus foreign keys.
 * <p>
 * The column list is the single source of truth for the table. A rebuild projects exactly these
 * columns from the old table, so any column left out here is dropped.
 */
public final class TableDefinition {
    private final String name;
    private final List<ColumnDefinition> columns;
    private final List<ForeignKeyDefinition> foreignKeys;

    private TableDefinition(String name, List<ColumnDefinition> columns,
                            List<ForeignKeyDefinition> foreignKeys) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.foreignKeys = List.copyOf(foreignKeys);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    public List<ForeignKeyDefinition> getForeignKeys() {
        return foreignKeys;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::getName).toList();
    }

    public boolean hasColumn(String columnName) {
        return columns.stream().anyMatch(c -> c.getName().equals(columnName));
    }

    /**
     * Same columns and constraints under another table name.
     */
    public TableDefinition renamedTo(String newName) {
        return new TableDefinition(newName, columns, foreignKeys);
    }

    @Override
    public String toString() {
        return name + columnNames();
    }

    public static class Builder {
        private final String name;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private final List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();
        private final Set<String> columnNames = new HashSet<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Table name must not be empty");
            }
            this.name = name;
        }

        public Builder column(ColumnDefinition column) {
            if (!columnNames.add(column.getName())) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + column.getName() + "' in table '" + name + "'");
            }
            columns.add(column);
            return this;
        }

        public Builder foreignKey(String column, String referencedTable, String referencedColumn,
                                  ForeignKeyAction onDelete) {
            foreignKeys.add(new ForeignKeyDefinition(column, referencedTable, referencedColumn, onDelete));
            return this;
        }

        public TableDefinition build() {
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("Table '" + name + "' has no columns");
            }
            for (ForeignKeyDefinition fk : foreignKeys) {
                if (!columnNames.contains(fk.getColumn())) {
                    throw new IllegalArgumentException(
                            "Foreign key on unknown column '" + fk.getColumn() + "' in table '" + name + "'");
                }
            }
            long primaryKeys = columns.stream().filter(ColumnDefinition::isPrimaryKey).count();
            if (primaryKeys > 1) {
                throw new IllegalArgumentException("Table '" + name + "' declares more than one primary key column");
            }
            return new TableDefinition(name, columns, foreignKeys);
        }
    }
}
