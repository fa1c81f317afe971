package com.enterprise.clickhouse.sql.condition;

/**
 * Anything a {@code where}, {@code prewhere}, {@code having} or join
 * {@code on} clause accepts.
 */
public sealed interface WhereInput permits WhereMap, PredicateCombinator, Operator {
}
