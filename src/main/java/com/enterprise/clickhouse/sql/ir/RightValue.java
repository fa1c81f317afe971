package com.enterprise.clickhouse.sql.ir;

import java.util.List;

/** Right-hand operand of a comparison, reduced to plain data. */
public sealed interface RightValue
        permits RightValue.Scalar, RightValue.ValueList, RightValue.ColumnRef,
                RightValue.SubqueryRef, RightValue.ExprRef {

    record Scalar(Object value) implements RightValue {}

    /** Array or tuple operand; BETWEEN bounds arrive as a two-element list. */
    record ValueList(List<Object> values) implements RightValue {}

    record ColumnRef(String name) implements RightValue {}

    record SubqueryRef(SelectIR query) implements RightValue {}

    /** Function call or raw SQL on the right-hand side. */
    record ExprRef(ExprIR expr) implements RightValue {}
}
