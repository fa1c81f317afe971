package com.enterprise.clickhouse.sql.condition;

import java.util.Objects;

/**
 * Comparison waiting for its column. Built through {@link Conditions} and
 * turned into a predicate by {@link PredicateLowering#operatorToPredicate}.
 */
public record Operator(OperatorType type, Object value) implements WhereInput {

    public Operator {
        Objects.requireNonNull(type, "type");
    }
}
