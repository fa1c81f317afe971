package com.enterprise.clickhouse.sql.condition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Column-keyed conditions, in insertion order. Several entries AND together.
 *
 * <pre>{@code
 * where("status", eq("active")).with("age", gt(18))
 * }</pre>
 */
public record WhereMap(Map<String, WhereInput> entries) implements WhereInput {

    public WhereMap {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static WhereMap of(String column, WhereInput condition) {
        return new WhereMap(Map.of()).with(column, condition);
    }

    /** Returns a copy with one more entry; an existing key is replaced in place. */
    public WhereMap with(String column, WhereInput condition) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(condition, "condition");
        Map<String, WhereInput> copy = new LinkedHashMap<>(entries);
        copy.put(column, condition);
        return new WhereMap(copy);
    }
}
