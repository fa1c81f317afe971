package com.enterprise.clickhouse.sql.debug;

import com.enterprise.clickhouse.sql.builder.QueryBuilder;
import com.enterprise.clickhouse.sql.builder.SqlResult;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.validation.ValidationResult;

import java.util.List;

/**
 * Debug utility: formats compiled SQL together with validation findings.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(SqlResult result) {
        return format(result, null);
    }

    /**
     * Compiles and formats a builder. An invalid query yields its errors
     * instead of throwing.
     */
    public static String format(QueryBuilder builder) {
        ValidationResult validation = builder.validate();
        if (!validation.valid()) {
            return format(null, validation);
        }
        try {
            return format(builder.toSQL(), validation);
        } catch (ValidationException e) {
            return format(null, validation.withError(e.getMessage()));
        }
    }

    public static String format(SqlResult result, ValidationResult validation) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        if (result != null) {
            sb.append("SQL:\n  ").append(result.sql()).append("\n");
            sb.append("Parameters (").append(result.params().size()).append(")\n");
        }

        if (validation != null) {
            sb.append("Valid: ").append(validation.valid()).append("\n");
            appendList(sb, "Errors", validation.errors());
            appendList(sb, "Warnings", validation.warnings());
        }
        sb.append("======================");
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append(title).append(" (").append(items.size()).append("):\n");
        for (String item : items) {
            sb.append("  - ").append(item).append("\n");
        }
    }
}
