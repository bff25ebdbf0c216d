package com.vcinsidedigital.oci_store.schema;

import java.util.Objects;

public final class ForeignKeyDefinition {
    private final String column;
    private final String referencedTable;
    private final String referencedColumn;
    private final ForeignKeyAction onDelete;

    public ForeignKeyDefinition(String column, String referencedTable, String referencedColumn,
                                ForeignKeyAction onDelete) {
        this.column = Objects.requireNonNull(column, "column");
        this.referencedTable = Objects.requireNonNull(referencedTable, "referencedTable");
        this.referencedColumn = Objects.requireNonNull(referencedColumn, "referencedColumn");
        this.onDelete = Objects.requireNonNull(onDelete, "onDelete");
    }

    public String getColumn() { return column; }
    public String getReferencedTable() { return referencedTable; }
    public String getReferencedColumn() { return referencedColumn; }
    public ForeignKeyAction getOnDelete() { return onDelete; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForeignKeyDefinition)) return false;
        ForeignKeyDefinition that = (ForeignKeyDefinition) o;
        return column.equals(that.column)
                && referencedTable.equals(that.referencedTable)
                && referencedColumn.equals(that.referencedColumn)
                && onDelete == that.onDelete;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, referencedTable, referencedColumn, onDelete);
    }

    @Override
    public String toString() {
        return column + " -> " + referencedTable + "(" + referencedColumn + ") ON DELETE " + onDelete.sql();
    }
}
