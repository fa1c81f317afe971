package com.enterprise.clickhouse.sql.expression;

import com.enterprise.clickhouse.sql.ast.Expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * ClickHouse function calls for SELECT lists, SET values and comparisons.
 *
 * <p>String arguments name columns ({@code "u.age"} is qualified); wrap
 * literal strings with {@link #literal(Object)}. Any {@link Expr} is passed
 * through unchanged.
 */
public final class SqlFunctions {

    /** Function name the renderer prints as {@code CAST(x AS T)}. */
    public static final String CAST = "CAST";

    private SqlFunctions() {}

    // ==================== Aggregates ====================

    public static Expr.FunctionCall count() {
        return call("count", Expr.column("*"));
    }

    public static Expr.FunctionCall count(Object column) {
        return call("count", arg(column));
    }

    public static Expr.FunctionCall countDistinct(Object column) {
        return call("countDistinct", arg(column));
    }

    public static Expr.FunctionCall sum(Object column) {
        return call("sum", arg(column));
    }

    public static Expr.FunctionCall avg(Object column) {
        return call("avg", arg(column));
    }

    public static Expr.FunctionCall min(Object column) {
        return call("min", arg(column));
    }

    public static Expr.FunctionCall max(Object column) {
        return call("max", arg(column));
    }

    public static Expr.FunctionCall uniqExact(Object column) {
        return call("uniqExact", arg(column));
    }

    public static Expr.FunctionCall groupArray(Object column) {
        return call("groupArray", arg(column));
    }

    public static Expr.FunctionCall groupUniqArray(Object column) {
        return call("groupUniqArray", arg(column));
    }

    public static Expr.FunctionCall median(Object column) {
        return call("median", arg(column));
    }

    /** Parametric aggregate {@code quantile(level)(column)}. */
    public static Expr.FunctionCall quantile(double level, Object column) {
        if (level < 0 || level > 1) {
            throw new IllegalArgumentException("quantile level must be within [0, 1]: " + level);
        }
        return call("quantile(" + level + ")", arg(column));
    }

    // ==================== Strings ====================

    public static Expr.FunctionCall concat(Object... parts) {
        return call("concat", args(parts));
    }

    public static Expr.FunctionCall upper(Object column) {
        return call("upper", arg(column));
    }

    public static Expr.FunctionCall lower(Object column) {
        return call("lower", arg(column));
    }

    public static Expr.FunctionCall trim(Object column) {
        return call("trimBoth", arg(column));
    }

    public static Expr.FunctionCall substring(Object column, int offset, int length) {
        return call("substring", arg(column), literal(offset), literal(length));
    }

    // ==================== Math ====================

    public static Expr.FunctionCall round(Object column) {
        return round(column, 0);
    }

    public static Expr.FunctionCall round(Object column, int decimals) {
        return call("round", arg(column), literal(decimals));
    }

    public static Expr.FunctionCall floor(Object column) {
        return call("floor", arg(column));
    }

    public static Expr.FunctionCall ceil(Object column) {
        return call("ceil", arg(column));
    }

    public static Expr.FunctionCall abs(Object column) {
        return call("abs", arg(column));
    }

    // ==================== Conditionals ====================

    /** {@code if(condition, then, otherwise)}; values are literals, not columns. */
    public static Expr.FunctionCall ifElse(Expr condition, Object then, Object otherwise) {
        return call("if", Objects.requireNonNull(condition, "condition"),
                Expr.of(then), Expr.of(otherwise));
    }

    public static Expr.FunctionCall coalesce(Object... values) {
        return call("coalesce", args(values));
    }

    // ==================== Dates ====================

    public static Expr.FunctionCall now() {
        return call("now");
    }

    public static Expr.FunctionCall today() {
        return call("today");
    }

    public static Expr.FunctionCall toDate(Object column) {
        return call("toDate", arg(column));
    }

    public static Expr.FunctionCall toDateTime(Object column) {
        return call("toDateTime", arg(column));
    }

    public static Expr.FunctionCall formatDateTime(Object column, String pattern) {
        return call("formatDateTime", arg(column), literal(pattern));
    }

    // ==================== Arrays ====================

    public static Expr.FunctionCall arrayElement(Object column, int index) {
        return call("arrayElement", arg(column), literal(index));
    }

    public static Expr.FunctionCall arrayLength(Object column) {
        return call("length", arg(column));
    }

    public static Expr.FunctionCall arrayJoin(Object column) {
        return arrayJoin(column, ",");
    }

    /** Joins array elements into one string ({@code arrayStringConcat}). */
    public static Expr.FunctionCall arrayJoin(Object column, String separator) {
        return call("arrayStringConcat", arg(column), literal(separator));
    }

    // ==================== Conversion ====================

    /** {@code CAST(column AS type)}; {@code type} is emitted verbatim. */
    public static Expr.FunctionCall cast(Object column, String type) {
        return call(CAST, arg(column), Expr.raw(type));
    }

    public static Expr.FunctionCall toStringFn(Object column) {
        return call("toString", arg(column));
    }

    public static Expr.FunctionCall toInt(Object column) {
        return call("toInt32", arg(column));
    }

    public static Expr.FunctionCall toFloat(Object column) {
        return call("toFloat64", arg(column));
    }

    // ==================== Building blocks ====================

    /** Any function by name, for calls not covered above. */
    public static Expr.FunctionCall call(String name, Expr... args) {
        Objects.requireNonNull(name, "name");
        return new Expr.FunctionCall(name, Arrays.asList(args), null);
    }

    public static Expr.Value literal(Object value) {
        return new Expr.Value(value);
    }

    private static Expr arg(Object column) {
        Objects.requireNonNull(column, "column");
        return column instanceof String name ? Expr.column(name) : Expr.of(column);
    }

    private static Expr[] args(Object... values) {
        List<Expr> exprs = new ArrayList<>();
        for (Object value : values) {
            exprs.add(arg(value));
        }
        return exprs.toArray(new Expr[0]);
    }
}
