package com.enterprise.clickhouse.sql.error;

import java.time.Instant;

/**
 * Root of the query builder's exception family.
 *
 * <p>Every subclass carries a stable machine-readable {@link #code()}, a coarse
 * {@link #type()} used for grouping in logs, an optional query id and the
 * instant the failure was raised.
 */
public abstract class ClickHouseQueryException extends RuntimeException {

    private final String code;
    private final String type;
    private final String queryId;
    private final Instant timestamp;

    protected ClickHouseQueryException(String message, String code, String type,
                                       String queryId, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.type = type;
        this.queryId = queryId;
        this.timestamp = Instant.now();
    }

    public String code() { return code; }

    public String type() { return type; }

    /** Query id assigned by the server or the caller, {@code null} when unknown. */
    public String queryId() { return queryId; }

    public Instant timestamp() { return timestamp; }
}
