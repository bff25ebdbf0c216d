package com.vcinsidedigital.oci_store.schema;

public enum ForeignKeyAction {
    NO_ACTION("NO ACTION"),
    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    RESTRICT("RESTRICT");

    private final String sql;

    ForeignKeyAction(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /**
     * Parses the action as reported by the database catalog ({@code "CASCADE"}, {@code "NO ACTION"}, ...).
     */
    public static ForeignKeyAction fromSql(String value) {
        for (ForeignKeyAction action : values()) {
            if (action.sql.equalsIgnoreCase(value.trim())) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unsupported foreign key action: " + value);
    }
}
