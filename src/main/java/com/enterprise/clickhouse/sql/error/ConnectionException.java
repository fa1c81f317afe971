package com.enterprise.clickhouse.sql.error;

public class ConnectionException extends ClickHouseQueryException {

    public ConnectionException(String message, Throwable cause) {
        super(message, "CONNECTION_ERROR", "connection", null, cause);
    }
}
