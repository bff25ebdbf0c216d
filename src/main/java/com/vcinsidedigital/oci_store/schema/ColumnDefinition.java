package com.vcinsidedigital.oci_store.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One column of a {@link TableDefinition}. Primary key columns are always not-null.
 */
public final class ColumnDefinition {
    private final String name;
    private final ColumnType type;
    private final boolean nullable;
    private final boolean primaryKey;
    private final boolean unique;
    private final String defaultExpression;

    private ColumnDefinition(String name, ColumnType type, boolean nullable, boolean primaryKey,
                             boolean unique, String defaultExpression) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.nullable = nullable && !primaryKey;
        this.primaryKey = primaryKey;
        this.unique = unique;
        this.defaultExpression = defaultExpression;
    }

    public static ColumnDefinition primaryKey(String name, ColumnType type) {
        return new ColumnDefinition(name, type, false, true, false, null);
    }

    public static ColumnDefinition required(String name, ColumnType type) {
        return new ColumnDefinition(name, type, false, false, false, null);
    }

    public static ColumnDefinition optional(String name, ColumnType type) {
        return new ColumnDefinition(name, type, true, false, false, null);
    }

    /**
     * Nullable column defaulting to the SQL expression {@code defaultExpression}, e.g. {@code CURRENT_TIMESTAMP}.
     */
    public static ColumnDefinition withDefault(String name, ColumnType type, String defaultExpression) {
        return new ColumnDefinition(name, type, true, false, false, defaultExpression);
    }

    public ColumnDefinition unique() {
        return new ColumnDefinition(name, type, nullable, primaryKey, true, defaultExpression);
    }

    public String getName() { return name; }
    public ColumnType getType() { return type; }
    public boolean isNullable() { return nullable; }
    public boolean isPrimaryKey() { return primaryKey; }
    public boolean isUnique() { return unique; }
    public String getDefaultExpression() { return defaultExpression; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnDefinition)) return false;
        ColumnDefinition that = (ColumnDefinition) o;
        return nullable == that.nullable
                && primaryKey == that.primaryKey
                && unique == that.unique
                && name.equals(that.name)
                && type == that.type
                && Objects.equals(defaultExpression, that.defaultExpression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable, primaryKey, unique, defaultExpression);
    }

    @Override
    public String toString() {
        List<String> attrs = new ArrayList<>();
        attrs.add(name);
        attrs.add(type.name());
        if (!nullable) attrs.add("NOT NULL");
        if (primaryKey) attrs.add("PK");
        if (unique) attrs.add("UNIQUE");
        if (defaultExpression != null) attrs.add("DEFAULT " + defaultExpression);
        return String.join(" ", attrs);
    }
}
