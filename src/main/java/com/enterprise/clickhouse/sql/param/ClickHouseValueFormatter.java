package com.enterprise.clickhouse.sql.param;

import com.enterprise.clickhouse.sql.error.ValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Converts typed Java values to ClickHouse SQL literals for inline use.
 * Values passed through this formatter appear directly in SQL text
 * (not as bind parameters).
 *
 * <ul>
 *   <li>{@code null} and {@code NaN} become {@code NULL}</li>
 *   <li>strings are single-quoted with embedded quotes doubled</li>
 *   <li>date-times become {@code 'yyyy-MM-dd HH:mm:ss'} in UTC, whole seconds</li>
 *   <li>collections, object arrays and {@code int[]}/{@code long[]}/{@code double[]}
 *       become {@code [a, b]}, maps {@code {'k': v}}</li>
 *   <li>other primitive arrays ({@code byte[]} included) are rejected</li>
 * </ul>
 */
public final class ClickHouseValueFormatter {

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ClickHouseValueFormatter() {}

    /**
     * Formats a Java value as a ClickHouse literal.
     *
     * @throws ValidationException if the type is not supported
     */
    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Character c) {
            return quote(c.toString());
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return formatFloating(((Number) value).doubleValue(), value.toString());
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof LocalDateTime ldt) {
            return quote(DATE_TIME.format(ldt.truncatedTo(ChronoUnit.SECONDS)));
        }
        if (value instanceof LocalDate ld) {
            return quote(DATE_TIME.format(ld.atStartOfDay()));
        }
        if (value instanceof Instant instant) {
            return formatInstant(instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return formatInstant(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return formatInstant(zdt.toInstant());
        }
        if (value instanceof Date date) {
            // java.sql.Date rejects toInstant()
            return formatInstant(Instant.ofEpochMilli(date.getTime()));
        }
        if (value instanceof Enum<?> e) {
            return quote(e.name());
        }
        if (value instanceof UUID uuid) {
            return quote(uuid.toString());
        }
        if (value instanceof Collection<?> items) {
            return formatArray(items);
        }
        if (value instanceof Object[] items) {
            return formatArray(Arrays.asList(items));
        }
        if (value instanceof int[] ints) {
            return formatArray(Arrays.stream(ints).boxed().toList());
        }
        if (value instanceof long[] longs) {
            return formatArray(Arrays.stream(longs).boxed().toList());
        }
        if (value instanceof double[] doubles) {
            return formatArray(Arrays.stream(doubles).boxed().toList());
        }
        if (value instanceof Map<?, ?> map) {
            return formatMap(map);
        }

        throw new ValidationException(
                "Unsupported value type: " + value.getClass().getName(), "value", value);
    }

    /** Formats {@code values} as a tuple literal {@code (a, b)}. */
    public static String formatTuple(Collection<?> values) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (Object item : values) {
            joiner.add(format(item));
        }
        return joiner.toString();
    }

    /** Single-quotes {@code text}, doubling embedded quotes. */
    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    // ==================== Internal ====================

    private static String formatFloating(double d, String text) {
        if (Double.isNaN(d)) {
            return "NULL";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "'inf'" : "'-inf'";
        }
        return text;
    }

    private static String formatInstant(Instant instant) {
        LocalDateTime utc = LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC);
        return quote(DATE_TIME.format(utc));
    }

    private static String formatArray(Collection<?> items) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Object item : items) {
            joiner.add(format(item));
        }
        return joiner.toString();
    }

    private static String formatMap(Map<?, ?> map) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            joiner.add(format(entry.getKey()) + ": " + format(entry.getValue()));
        }
        return joiner.toString();
    }
}
