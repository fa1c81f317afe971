package com.enterprise.clickhouse.sql.error;

/**
 * Raised when a query cannot be compiled: invalid AST, malformed identifier,
 * unsupported operator or value, or a violated builder contract.
 */
public class ValidationException extends ClickHouseQueryException {

    public static final String CODE = "VALIDATION_ERROR";

    private final String field;
    private final Object value;

    public ValidationException(String message) {
        this(message, null, null);
    }

    public ValidationException(String message, String field, Object value) {
        this(message, field, value, null);
    }

    public ValidationException(String message, String field, Object value, Throwable cause) {
        super(message, CODE, "validation", null, cause);
        this.field = field;
        this.value = value;
    }

    /** Name of the offending field (e.g. {@code operator}, {@code identifier}), may be null. */
    public String field() { return field; }

    public Object value() { return value; }
}
