package com.enterprise.clickhouse.sql.ast;

/**
 * Source of rows for FROM or JOIN: a named table or a derived table.
 * Exactly one of {@code table} and {@code subquery} is set.
 */
public record TableRef(String table, SelectNode subquery, String alias) {

    public static TableRef table(String table, String alias) {
        return new TableRef(table, null, alias);
    }

    public static TableRef subquery(SelectNode subquery, String alias) {
        return new TableRef(null, subquery, alias);
    }

    public boolean isSubquery() {
        return subquery != null;
    }
}
