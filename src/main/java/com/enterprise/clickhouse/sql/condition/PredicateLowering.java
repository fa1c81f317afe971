package com.enterprise.clickhouse.sql.condition;

import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.PredicateOperator;
import com.enterprise.clickhouse.sql.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns {@link WhereInput} trees into AST predicates. Shared by every builder
 * and by the CASE builder so all of them flatten and flag groups the same way.
 *
 * <ul>
 *   <li>a single-entry column map becomes one predicate, several entries an
 *       AND group that is not flagged as a combinator;</li>
 *   <li>{@code and(...)} becomes an AND group flagged as a combinator;</li>
 *   <li>a combinator under a column pushes the column down to each operator.</li>
 * </ul>
 */
public final class PredicateLowering {

    private PredicateLowering() {}

    public static PredicateNode lower(WhereInput input) {
        if (input instanceof WhereMap map) {
            return lowerMap(map);
        }
        if (input instanceof PredicateCombinator combinator) {
            List<PredicateNode> children = new ArrayList<>();
            for (WhereInput child : combinator.children()) {
                children.add(lower(child));
            }
            return combine(combinator.kind(), children);
        }
        Operator operator = (Operator) input;
        if (!operator.type().isColumnFree()) {
            throw new ValidationException(
                    "Cannot use a bare Operator without a column; wrap it as where(\"column\", "
                            + operator.type().name().toLowerCase() + "(...))",
                    "operator", operator.type());
        }
        return operatorToPredicate(null, operator);
    }

    /**
     * Lowers one operator against {@code column}. {@code column} is ignored by
     * raw SQL and must be null-tolerant only for EXISTS / NOT EXISTS.
     */
    public static PredicateNode operatorToPredicate(String column, Operator operator) {
        Object value = operator.value();
        return switch (operator.type()) {
            case EQ -> predicate(column, PredicateOperator.EQ, valueExpr(value));
            case EQ_COL -> predicate(column, PredicateOperator.EQ, Expr.column((String) value));
            case NE -> predicate(column, PredicateOperator.NE, valueExpr(value));
            case GT -> predicate(column, PredicateOperator.GT, valueExpr(value));
            case GTE -> predicate(column, PredicateOperator.GTE, valueExpr(value));
            case LT -> predicate(column, PredicateOperator.LT, valueExpr(value));
            case LTE -> predicate(column, PredicateOperator.LTE, valueExpr(value));
            case IN -> predicate(column, PredicateOperator.IN, listOrSubquery(value));
            case NOT_IN -> predicate(column, PredicateOperator.NOT_IN, listOrSubquery(value));
            case BETWEEN -> predicate(column, PredicateOperator.BETWEEN, betweenBounds(value));
            case LIKE -> predicate(column, PredicateOperator.LIKE, new Expr.Value(value));
            case ILIKE -> predicate(column, PredicateOperator.ILIKE, new Expr.Value(value));
            case IS_NULL -> predicate(column, PredicateOperator.IS_NULL, new Expr.Value(null));
            case IS_NOT_NULL -> predicate(column, PredicateOperator.IS_NOT_NULL, new Expr.Value(null));
            case HAS_ANY -> predicate(column, PredicateOperator.HAS_ANY, new Expr.ArrayValue(list(value)));
            case HAS_ALL -> predicate(column, PredicateOperator.HAS_ALL, new Expr.ArrayValue(list(value)));
            case IN_TUPLE -> predicate(column, PredicateOperator.IN_TUPLE, new Expr.ArrayValue(list(value)));
            case EXISTS -> existential(PredicateOperator.EXISTS, value);
            case NOT_EXISTS -> existential(PredicateOperator.NOT_EXISTS, value);
            case RAW -> new PredicateNode.Raw((String) value);
        };
    }

    // ==================== Column maps ====================

    private static PredicateNode lowerMap(WhereMap map) {
        if (map.entries().isEmpty()) {
            throw new ValidationException("Where condition must name at least one column",
                    "where", map);
        }
        List<PredicateNode> predicates = new ArrayList<>();
        for (Map.Entry<String, WhereInput> entry : map.entries().entrySet()) {
            predicates.add(applyColumn(entry.getKey(), entry.getValue()));
        }
        return predicates.size() == 1
                ? predicates.get(0)
                : new PredicateNode.And(predicates, false);
    }

    private static PredicateNode applyColumn(String column, WhereInput input) {
        if (input instanceof Operator operator) {
            return operatorToPredicate(column, operator);
        }
        if (input instanceof PredicateCombinator combinator) {
            List<PredicateNode> children = new ArrayList<>();
            for (WhereInput child : combinator.children()) {
                children.add(applyColumn(column, child));
            }
            return combine(combinator.kind(), children);
        }
        // nested column maps carry their own columns
        return lowerMap((WhereMap) input);
    }

    private static PredicateNode combine(PredicateCombinator.Kind kind, List<PredicateNode> children) {
        return switch (kind) {
            case AND -> new PredicateNode.And(children, true);
            case OR -> new PredicateNode.Or(children);
            case NOT -> new PredicateNode.Not(children.get(0));
        };
    }

    // ==================== Operands ====================

    private static PredicateNode predicate(String column, PredicateOperator op, Expr right) {
        if (column == null) {
            throw new ValidationException("Operator " + op.sql() + " requires a column",
                    "operator", op);
        }
        return new PredicateNode.Predicate(Expr.column(column), op, right);
    }

    private static PredicateNode existential(PredicateOperator op, Object value) {
        if (!(value instanceof Expr.Subquery subquery)) {
            throw new ValidationException(op.sql() + " operator requires a SelectBuilder subquery",
                    "operator", op);
        }
        return new PredicateNode.Predicate(null, op, subquery);
    }

    private static Expr valueExpr(Object value) {
        return Expr.of(value);
    }

    private static Expr listOrSubquery(Object value) {
        if (value instanceof Expr.Subquery subquery) {
            return subquery;
        }
        return new Expr.ArrayValue(list(value));
    }

    private static Expr betweenBounds(Object value) {
        List<Object> bounds = list(value);
        if (bounds.size() != 2) {
            throw new ValidationException("BETWEEN requires exactly two bounds, got " + bounds.size(),
                    "operator", OperatorType.BETWEEN);
        }
        return new Expr.Tuple(bounds);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Object value) {
        if (value instanceof List<?> values) {
            return (List<Object>) values;
        }
        throw new ValidationException("Operator expects a list of values, got "
                + (value == null ? "null" : value.getClass().getSimpleName()), "operator", value);
    }
}
