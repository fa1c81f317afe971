package com.enterprise.clickhouse.sql.condition;

public enum OperatorType {
    EQ, EQ_COL, NE, GT, GTE, LT, LTE,
    IN, NOT_IN, BETWEEN,
    LIKE, ILIKE,
    IS_NULL, IS_NOT_NULL,
    HAS_ANY, HAS_ALL, IN_TUPLE,
    EXISTS, NOT_EXISTS,
    RAW;

    /** Operators that are complete without a column: EXISTS, NOT EXISTS and raw SQL. */
    public boolean isColumnFree() {
        return this == EXISTS || this == NOT_EXISTS || this == RAW;
    }
}
