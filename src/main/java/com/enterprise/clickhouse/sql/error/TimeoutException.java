package com.enterprise.clickhouse.sql.error;

public class TimeoutException extends ClickHouseQueryException {

    private final String sql;

    public TimeoutException(String message, String sql, Throwable cause) {
        super(message, "TIMEOUT_ERROR", "timeout", null, cause);
        this.sql = sql;
    }

    public String sql() { return sql; }
}
