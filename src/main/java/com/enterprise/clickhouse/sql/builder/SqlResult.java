package com.enterprise.clickhouse.sql.builder;

import java.util.List;

/**
 * Compiled statement. Values are inlined into {@link #sql()}, so
 * {@link #params()} is always empty; it stays for callers that expect a
 * bind list.
 */
public class SqlResult {

    private final String sql;
    private final List<Object> params;

    public SqlResult(String sql) {
        this.sql = sql;
        this.params = List.of();
    }

    public String sql() { return sql; }

    public List<Object> params() { return params; }

    @Override
    public String toString() {
        return sql;
    }
}
