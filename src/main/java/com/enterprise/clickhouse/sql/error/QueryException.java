package com.enterprise.clickhouse.sql.error;

/**
 * The server (or driver) rejected an otherwise well-formed statement.
 */
public class QueryException extends ClickHouseQueryException {

    private final String sql;

    public QueryException(String message, String sql, String queryId, Throwable cause) {
        super(message, "QUERY_ERROR", "query", queryId, cause);
        this.sql = sql;
    }

    /** Statement that failed. */
    public String sql() { return sql; }
}
