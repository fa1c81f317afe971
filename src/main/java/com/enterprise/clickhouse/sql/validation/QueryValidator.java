package com.enterprise.clickhouse.sql.validation;

import com.enterprise.clickhouse.sql.ast.DeleteNode;
import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.InsertNode;
import com.enterprise.clickhouse.sql.ast.JoinSpec;
import com.enterprise.clickhouse.sql.ast.OrderSpec;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.PredicateOperator;
import com.enterprise.clickhouse.sql.ast.QueryNode;
import com.enterprise.clickhouse.sql.ast.SelectNode;
import com.enterprise.clickhouse.sql.ast.SetOperation;
import com.enterprise.clickhouse.sql.ast.TableRef;
import com.enterprise.clickhouse.sql.ast.UpdateNode;
import com.enterprise.clickhouse.sql.ast.WithClause;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Structural checks over a query AST. Never throws: every violation in the
 * tree is collected, including those inside subqueries, CASE branches and
 * function arguments.
 *
 * <p>Identifier content is not restricted beyond being non-empty because the
 * renderer quotes every identifier. SETTINGS keys and function names are
 * emitted unquoted and must be plain identifiers. Raw SQL is reported as a
 * warning.
 */
public class QueryValidator {

    private static final Pattern SETTING_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // plain name, optionally with numeric parameters: quantile(0.9)
    private static final Pattern FUNCTION_NAME =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\([0-9.]+(, ?[0-9.]+)*\\))?");

    private final Logger log;

    public QueryValidator() {
        this(LoggerFactory.getLogger(QueryValidator.class));
    }

    public QueryValidator(Logger log) {
        this.log = log;
    }

    public ValidationResult validate(QueryNode query) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (query instanceof SelectNode select) {
            validateSelect(select, errors, warnings);
        } else if (query instanceof InsertNode insert) {
            validateInsert(insert, errors);
        } else if (query instanceof UpdateNode update) {
            validateUpdate(update, errors, warnings);
        } else if (query instanceof DeleteNode delete) {
            validateDelete(delete, errors, warnings);
        }
        if (!errors.isEmpty()) {
            log.debug("Query failed validation with {} error(s): {}", errors.size(), errors);
        }
        return ValidationResult.of(errors, warnings);
    }

    // ==================== Statements ====================

    private void validateSelect(SelectNode select, List<String> errors, List<String> warnings) {
        for (WithClause with : select.with()) {
            requireName(with.alias(), "CTE alias", errors);
            validateSubquery(with.query(), errors, warnings);
        }
        for (Expr column : select.columns()) {
            validateExpr(column, errors, warnings);
        }
        if (select.from() != null) {
            validateSource(select.from(), errors, warnings);
        }
        for (JoinSpec join : select.joins()) {
            validateSource(join.target(), errors, warnings);
            if (join.on() == null) {
                errors.add("JOIN requires an ON condition");
            } else {
                validatePredicate(join.on(), errors, warnings);
            }
        }
        validateOptionalPredicate(select.prewhere(), errors, warnings);
        validateOptionalPredicate(select.where(), errors, warnings);
        for (String column : select.groupBy()) {
            requireName(column, "GROUP BY column", errors);
        }
        validateOptionalPredicate(select.having(), errors, warnings);
        for (OrderSpec order : select.orderBy()) {
            requireName(order.column(), "ORDER BY column", errors);
        }
        if (select.limit() != null && select.limit() < 0) {
            errors.add("LIMIT must not be negative: " + select.limit());
        }
        if (select.offset() != null) {
            if (select.offset() < 0) {
                errors.add("OFFSET must not be negative: " + select.offset());
            }
            if (select.limit() == null) {
                warnings.add("OFFSET without LIMIT is ignored");
            }
        }
        validateSettings(select.settings(), errors);
        for (SetOperation operation : select.setOperations()) {
            validateSubquery(operation.query(), errors, warnings);
        }
    }

    private void validateInsert(InsertNode insert, List<String> errors) {
        requireName(insert.table(), "Table name", errors);
        for (String column : insert.columns()) {
            requireName(column, "Column name", errors);
        }
        if (insert.rows().isEmpty()) {
            errors.add("INSERT requires at least one row of values");
        }
        int width = insert.columns().size();
        for (int i = 0; i < insert.rows().size(); i++) {
            int size = insert.rows().get(i).size();
            if (width > 0 && size != width) {
                errors.add("Row " + i + " has " + size + " values but " + width + " columns were declared");
            }
        }
    }

    private void validateUpdate(UpdateNode update, List<String> errors, List<String> warnings) {
        requireName(update.table(), "Table name", errors);
        if (update.set().isEmpty()) {
            errors.add("UPDATE requires at least one SET column");
        }
        for (Map.Entry<String, Object> entry : update.set().entrySet()) {
            requireName(entry.getKey(), "SET column", errors);
            if (entry.getValue() instanceof Expr expr) {
                validateExpr(expr, errors, warnings);
            }
        }
        validateOptionalPredicate(update.where(), errors, warnings);
        validateSettings(update.settings(), errors);
    }

    private void validateDelete(DeleteNode delete, List<String> errors, List<String> warnings) {
        requireName(delete.table(), "Table name", errors);
        validateOptionalPredicate(delete.where(), errors, warnings);
        validateSettings(delete.settings(), errors);
    }

    // ==================== Sources ====================

    private void validateSource(TableRef source, List<String> errors, List<String> warnings) {
        if (source.isSubquery()) {
            validateSubquery(source.subquery(), errors, warnings);
            requireName(source.alias(), "Subquery alias", errors);
            return;
        }
        requireName(source.table(), "Table name", errors);
        if (source.alias() != null) {
            requireName(source.alias(), "Table alias", errors);
        }
    }

    private void validateSubquery(SelectNode subquery, List<String> errors, List<String> warnings) {
        List<String> nested = new ArrayList<>();
        validateSelect(subquery, nested, warnings);
        for (String error : nested) {
            errors.add("Subquery validation failed: " + error);
        }
    }

    // ==================== Expressions ====================

    private void validateExpr(Expr expr, List<String> errors, List<String> warnings) {
        if (expr instanceof Expr.Column column) {
            requireName(column.name(), "Column name", errors);
            if (column.table() != null) {
                requireName(column.table(), "Table qualifier", errors);
            }
        } else if (expr instanceof Expr.Subquery subquery) {
            validateSubquery(subquery.query(), errors, warnings);
        } else if (expr instanceof Expr.Raw raw) {
            if (raw.sql().isBlank()) {
                errors.add("Raw expression must not be blank");
            }
            warnRaw(raw.sql(), warnings);
        } else if (expr instanceof Expr.FunctionCall function) {
            validateFunction(function, errors, warnings);
        } else if (expr instanceof Expr.Case caseExpr) {
            validateCase(caseExpr, errors, warnings);
        }
        if (expr.alias() != null) {
            requireName(expr.alias(), "Alias", errors);
        }
    }

    private void validateFunction(Expr.FunctionCall function, List<String> errors, List<String> warnings) {
        if (function.name() == null || !FUNCTION_NAME.matcher(function.name()).matches()) {
            errors.add("Invalid function name: " + function.name());
        }
        for (int i = 0; i < function.args().size(); i++) {
            List<String> nested = new ArrayList<>();
            validateExpr(function.args().get(i), nested, warnings);
            prefixInto("Function argument " + i + ": ", nested, errors);
        }
    }

    private void validateCase(Expr.Case caseExpr, List<String> errors, List<String> warnings) {
        if (caseExpr.whens().isEmpty()) {
            errors.add("CASE requires at least one WHEN branch");
        }
        for (int i = 0; i < caseExpr.whens().size(); i++) {
            Expr.When when = caseExpr.whens().get(i);
            List<String> conditionErrors = new ArrayList<>();
            validatePredicate(when.condition(), conditionErrors, warnings);
            prefixInto("Case condition " + i + ": ", conditionErrors, errors);

            List<String> thenErrors = new ArrayList<>();
            validateExpr(when.then(), thenErrors, warnings);
            prefixInto("Case then " + i + ": ", thenErrors, errors);
        }
        if (caseExpr.elseExpr() != null) {
            List<String> elseErrors = new ArrayList<>();
            validateExpr(caseExpr.elseExpr(), elseErrors, warnings);
            prefixInto("Case else: ", elseErrors, errors);
        }
    }

    // ==================== Predicates ====================

    private void validateOptionalPredicate(PredicateNode predicate, List<String> errors, List<String> warnings) {
        if (predicate != null) {
            validatePredicate(predicate, errors, warnings);
        }
    }

    private void validatePredicate(PredicateNode predicate, List<String> errors, List<String> warnings) {
        if (predicate instanceof PredicateNode.Predicate p) {
            if (!p.operator().isExistential()) {
                if (p.left() == null) {
                    errors.add("Operator " + p.operator().sql() + " requires a left operand");
                } else {
                    validateExpr(p.left(), errors, warnings);
                }
            }
            validateOperandShape(p, errors);
            if (p.right() != null) {
                validateExpr(p.right(), errors, warnings);
            }
        } else if (predicate instanceof PredicateNode.And and) {
            if (and.children().isEmpty()) {
                errors.add("AND group must contain at least one condition");
            }
            and.children().forEach(child -> validatePredicate(child, errors, warnings));
        } else if (predicate instanceof PredicateNode.Or or) {
            if (or.children().isEmpty()) {
                errors.add("OR group must contain at least one condition");
            }
            or.children().forEach(child -> validatePredicate(child, errors, warnings));
        } else if (predicate instanceof PredicateNode.Not not) {
            validatePredicate(not.child(), errors, warnings);
        } else if (predicate instanceof PredicateNode.Raw raw) {
            if (raw.sql().isBlank()) {
                errors.add("Raw predicate must not be blank");
            }
            warnRaw(raw.sql(), warnings);
        }
    }

    private void validateOperandShape(PredicateNode.Predicate p, List<String> errors) {
        PredicateOperator op = p.operator();
        Expr right = p.right();
        String expected = switch (op) {
            case BETWEEN -> isBounds(right) ? null : "a tuple of exactly two bounds";
            case IN, NOT_IN -> right instanceof Expr.ArrayValue || right instanceof Expr.Tuple
                    || right instanceof Expr.Subquery ? null : "a value list or subquery";
            case HAS_ANY, HAS_ALL, IN_TUPLE -> right instanceof Expr.ArrayValue ? null : "an array value";
            case EXISTS, NOT_EXISTS -> right instanceof Expr.Subquery ? null : "a subquery";
            case IS_NULL, IS_NOT_NULL -> null;
            default -> right != null ? null : "a right operand";
        };
        if (expected != null) {
            errors.add("Operator " + op.sql() + " requires " + expected);
        }
    }

    private static boolean isBounds(Expr right) {
        if (right instanceof Expr.Tuple tuple) {
            return tuple.values().size() == 2;
        }
        return right instanceof Expr.ArrayValue array && array.values().size() == 2;
    }

    // ==================== Helpers ====================

    private void validateSettings(Map<String, Object> settings, List<String> errors) {
        for (String key : settings.keySet()) {
            if (key == null || !SETTING_NAME.matcher(key).matches()) {
                errors.add("Invalid setting name: " + key);
            }
        }
    }

    private static void requireName(String name, String what, List<String> errors) {
        if (name == null || name.isEmpty()) {
            errors.add(what + " must be a non-empty string");
        }
    }

    private void warnRaw(String sql, List<String> warnings) {
        log.warn("Raw SQL bypasses escaping: {}", sql);
        warnings.add("Raw SQL bypasses escaping: " + sql);
    }

    private static void prefixInto(String prefix, List<String> nested, List<String> errors) {
        for (String error : nested) {
            errors.add(prefix + error);
        }
    }
}
