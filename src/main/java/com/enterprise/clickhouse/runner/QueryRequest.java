package com.enterprise.clickhouse.runner;

import java.util.Map;
import java.util.Objects;

/**
 * Compiled statement handed to a {@link QueryRunner}. {@code settings} are
 * per-request server settings on top of any SETTINGS clause in the SQL;
 * {@code format} may be null.
 */
public record QueryRequest(String sql, Map<String, Object> settings, String format) {

    public QueryRequest {
        Objects.requireNonNull(sql, "sql");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static QueryRequest of(String sql) {
        return new QueryRequest(sql, Map.of(), null);
    }
}
