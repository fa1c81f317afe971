package com.enterprise.clickhouse.sql.ast;

/**
 * Operator token carried by a {@link PredicateNode.Predicate}.
 */
public enum PredicateOperator {
    EQ("="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    IN("IN"),
    NOT_IN("NOT IN"),
    BETWEEN("BETWEEN"),
    LIKE("LIKE"),
    ILIKE("ILIKE"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL"),
    HAS_ANY("HAS ANY"),
    HAS_ALL("HAS ALL"),
    IN_TUPLE("IN TUPLE"),
    EXISTS("EXISTS"),
    NOT_EXISTS("NOT EXISTS");

    private final String sql;

    PredicateOperator(String sql) { this.sql = sql; }

    public String sql() { return sql; }

    /** EXISTS and NOT EXISTS have no left operand. */
    public boolean isExistential() {
        return this == EXISTS || this == NOT_EXISTS;
    }
}
