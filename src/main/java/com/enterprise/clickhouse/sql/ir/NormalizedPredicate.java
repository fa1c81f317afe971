package com.enterprise.clickhouse.sql.ir;

import com.enterprise.clickhouse.sql.ast.PredicateOperator;

import java.util.List;

/**
 * Normalized boolean tree. {@code prewhere} marks nodes lowered from a
 * PREWHERE clause; {@link And#fromCombinator()} survives from the AST.
 */
public sealed interface NormalizedPredicate
        permits NormalizedPredicate.Comparison, NormalizedPredicate.And, NormalizedPredicate.Or,
                NormalizedPredicate.Not, NormalizedPredicate.Raw {

    boolean prewhere();

    /** {@code left} is null for EXISTS / NOT EXISTS. */
    record Comparison(String left, PredicateOperator operator, RightValue right,
                      boolean prewhere) implements NormalizedPredicate {}

    record And(List<NormalizedPredicate> children, boolean fromCombinator,
               boolean prewhere) implements NormalizedPredicate {}

    record Or(List<NormalizedPredicate> children, boolean prewhere) implements NormalizedPredicate {}

    record Not(NormalizedPredicate child, boolean prewhere) implements NormalizedPredicate {}

    record Raw(String sql, boolean prewhere) implements NormalizedPredicate {}
}
