package com.enterprise.clickhouse.sql.error;

/**
 * A qualified identifier could not be quoted safely.
 */
public class IdentifierException extends ValidationException {

    public IdentifierException(String message, String identifier) {
        super(message, "identifier", identifier);
    }
}
