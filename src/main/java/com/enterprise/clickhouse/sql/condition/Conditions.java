package com.enterprise.clickhouse.sql.condition;

import com.enterprise.clickhouse.sql.builder.SelectBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Static factory for operators, column maps and combinators.
 * Designed to be imported statically for a clean DSL.
 *
 * <pre>{@code
 * import static com.enterprise.clickhouse.sql.condition.Conditions.*;
 *
 * select("id").from("users")
 *     .where(where("status", eq("active")).with("age", gt(18)));
 *
 * select("id").from("users")
 *     .where(or(where("status", eq("active")), where("status", eq("pending"))));
 *
 * // a combinator under a column applies the column to every operator inside it
 * select("id").from("users").where(where("age", and(gt(18), lt(65))));
 * }</pre>
 */
public final class Conditions {

    private Conditions() {}

    // ==================== Column maps ====================

    public static WhereMap where(String column, WhereInput condition) {
        return WhereMap.of(column, condition);
    }

    // ==================== Combinators ====================

    public static PredicateCombinator and(WhereInput... conditions) {
        return new PredicateCombinator(PredicateCombinator.Kind.AND, Arrays.asList(conditions));
    }

    public static PredicateCombinator or(WhereInput... conditions) {
        return new PredicateCombinator(PredicateCombinator.Kind.OR, Arrays.asList(conditions));
    }

    public static PredicateCombinator not(WhereInput condition) {
        return new PredicateCombinator(PredicateCombinator.Kind.NOT, List.of(condition));
    }

    // ==================== Comparison ====================

    /** A {@link SelectBuilder} value compares against a scalar subquery. */
    public static Operator eq(Object value) {
        return new Operator(OperatorType.EQ, operand(value));
    }

    /** Column-to-column equality; {@code column} may be qualified ({@code t.col}). */
    public static Operator eqCol(String column) {
        return new Operator(OperatorType.EQ_COL, Objects.requireNonNull(column, "column"));
    }

    public static Operator ne(Object value) {
        return new Operator(OperatorType.NE, operand(value));
    }

    public static Operator gt(Object value) {
        return new Operator(OperatorType.GT, operand(value));
    }

    public static Operator gte(Object value) {
        return new Operator(OperatorType.GTE, operand(value));
    }

    public static Operator lt(Object value) {
        return new Operator(OperatorType.LT, operand(value));
    }

    public static Operator lte(Object value) {
        return new Operator(OperatorType.LTE, operand(value));
    }

    public static Operator between(Object from, Object to) {
        return new Operator(OperatorType.BETWEEN, listOf(from, to));
    }

    // ==================== Membership ====================

    public static Operator in(Object... values) {
        return new Operator(OperatorType.IN, listOf(values));
    }

    public static Operator in(Collection<?> values) {
        return new Operator(OperatorType.IN, new ArrayList<Object>(values));
    }

    public static Operator in(SelectBuilder subquery) {
        return new Operator(OperatorType.IN, subquery.toSubquery());
    }

    public static Operator notIn(Object... values) {
        return new Operator(OperatorType.NOT_IN, listOf(values));
    }

    public static Operator notIn(Collection<?> values) {
        return new Operator(OperatorType.NOT_IN, new ArrayList<Object>(values));
    }

    public static Operator notIn(SelectBuilder subquery) {
        return new Operator(OperatorType.NOT_IN, subquery.toSubquery());
    }

    /** Array column shares at least one element with {@code values}. */
    public static Operator hasAny(Collection<?> values) {
        return new Operator(OperatorType.HAS_ANY, new ArrayList<Object>(values));
    }

    /** Every element of {@code values} is present in the array column. */
    public static Operator hasAll(Collection<?> values) {
        return new Operator(OperatorType.HAS_ALL, new ArrayList<Object>(values));
    }

    public static Operator inTuple(Collection<?> values) {
        return new Operator(OperatorType.IN_TUPLE, new ArrayList<Object>(values));
    }

    // ==================== Patterns ====================

    public static Operator like(String pattern) {
        return new Operator(OperatorType.LIKE, Objects.requireNonNull(pattern, "pattern"));
    }

    public static Operator ilike(String pattern) {
        return new Operator(OperatorType.ILIKE, Objects.requireNonNull(pattern, "pattern"));
    }

    public static Operator startsWith(String prefix) {
        return like(escapeLike(prefix) + "%");
    }

    public static Operator endsWith(String suffix) {
        return like("%" + escapeLike(suffix));
    }

    public static Operator contains(String text) {
        return like("%" + escapeLike(text) + "%");
    }

    // ==================== Null checks ====================

    public static Operator isNull() {
        return new Operator(OperatorType.IS_NULL, null);
    }

    public static Operator isNotNull() {
        return new Operator(OperatorType.IS_NOT_NULL, null);
    }

    // ==================== Subqueries ====================

    public static Operator exists(SelectBuilder subquery) {
        return new Operator(OperatorType.EXISTS, subquery.toSubquery());
    }

    public static Operator notExists(SelectBuilder subquery) {
        return new Operator(OperatorType.NOT_EXISTS, subquery.toSubquery());
    }

    // ==================== Raw ====================

    /**
     * Unescaped predicate SQL. Never pass user input here; validation reports
     * every use as a warning.
     */
    public static Operator raw(String sql) {
        return new Operator(OperatorType.RAW, Objects.requireNonNull(sql, "sql"));
    }

    // ==================== Internal ====================

    private static String escapeLike(String text) {
        Objects.requireNonNull(text, "text");
        StringBuilder sb = new StringBuilder(text.length() + 4);
        for (char c : text.toCharArray()) {
            if (c == '\\' || c == '%' || c == '_') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static Object operand(Object value) {
        return value instanceof SelectBuilder sb ? sb.toSubquery() : value;
    }

    private static List<Object> listOf(Object... values) {
        return new ArrayList<>(Arrays.asList(values));
    }
}
