package com.enterprise.clickhouse.sql.ir;

import java.util.List;

/**
 * Normalized expression. Function calls and CASE keep their structure so the
 * renderer can special-case individual node kinds.
 */
public sealed interface ExprIR
        permits ExprIR.ColumnIR, ExprIR.ValueIR, ExprIR.TupleIR, ExprIR.SubqueryIR, ExprIR.RawIR,
                ExprIR.FunctionIR, ExprIR.CaseIR {

    String alias();

    /** {@code name} is the joined {@code table.column} reference. */
    record ColumnIR(String name, String alias) implements ExprIR {}

    /** Scalar or array value. */
    record ValueIR(Object value, String alias) implements ExprIR {}

    /** Fixed-size tuple, rendered in parentheses rather than as an array. */
    record TupleIR(List<Object> values, String alias) implements ExprIR {}

    record SubqueryIR(SelectIR query, String alias) implements ExprIR {}

    record RawIR(String sql, String alias) implements ExprIR {}

    record FunctionIR(String name, List<ExprIR> args, String alias) implements ExprIR {}

    record CaseIR(List<WhenIR> whens, ExprIR elseExpr, String alias) implements ExprIR {}

    record WhenIR(NormalizedPredicate condition, ExprIR then) {}
}
