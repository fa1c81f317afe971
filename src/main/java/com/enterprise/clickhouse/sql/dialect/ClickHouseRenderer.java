package com.enterprise.clickhouse.sql.dialect;

import com.enterprise.clickhouse.sql.ast.OrderSpec;
import com.enterprise.clickhouse.sql.error.IdentifierException;
import com.enterprise.clickhouse.sql.expression.SqlFunctions;
import com.enterprise.clickhouse.sql.ir.DeleteIR;
import com.enterprise.clickhouse.sql.ir.ExprIR;
import com.enterprise.clickhouse.sql.ir.InsertIR;
import com.enterprise.clickhouse.sql.ir.NormalizedPredicate;
import com.enterprise.clickhouse.sql.ir.QueryIR;
import com.enterprise.clickhouse.sql.ir.RightValue;
import com.enterprise.clickhouse.sql.ir.SelectIR;
import com.enterprise.clickhouse.sql.ir.SourceIR;
import com.enterprise.clickhouse.sql.ir.UpdateIR;
import com.enterprise.clickhouse.sql.param.ClickHouseValueFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders normalized queries as ClickHouse SQL with values inlined.
 *
 * <p>Clause order for SELECT: WITH, columns, FROM, JOIN, PREWHERE, WHERE,
 * GROUP BY, HAVING, ORDER BY, LIMIT/OFFSET, FINAL, UNION, SETTINGS.
 * UPDATE and DELETE become {@code ALTER TABLE} mutations.
 *
 * <p>Parenthesization: OR groups always, NOT as {@code NOT (...)}, an AND
 * group only when it came from an explicit {@code and(...)}, holds more than
 * one child and is not the top-level WHERE predicate.
 */
public class ClickHouseRenderer {

    private static final Pattern NUMERIC = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern IDENTIFIER_PART = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
    private static final String EMPTY_SET = "(SELECT 1 WHERE 0=1)";
    private static final String LAMBDA_VAR = "`i`";

    private final Logger log;

    public ClickHouseRenderer() {
        this(LoggerFactory.getLogger(ClickHouseRenderer.class));
    }

    public ClickHouseRenderer(Logger log) {
        this.log = log;
    }

    public String render(QueryIR query) {
        String sql;
        if (query instanceof SelectIR select) {
            sql = renderSelect(select);
        } else if (query instanceof InsertIR insert) {
            sql = renderInsert(insert);
        } else if (query instanceof UpdateIR update) {
            sql = renderUpdate(update);
        } else {
            sql = renderDelete((DeleteIR) query);
        }
        log.debug("Rendered SQL: {}", sql);
        return sql;
    }

    // ==================== SELECT ====================

    private String renderSelect(SelectIR query) {
        StringBuilder sql = new StringBuilder();

        if (!query.with().isEmpty()) {
            sql.append("WITH ")
               .append(query.with().stream()
                       .map(w -> quoteAlias(w.alias()) + " AS (" + renderSelect(w.query()) + ")")
                       .collect(Collectors.joining(", ")))
               .append(' ');
        }

        sql.append("SELECT ");
        if (query.columns().isEmpty()) {
            sql.append('*');
        } else {
            sql.append(query.columns().stream()
                    .map(this::renderAliased)
                    .collect(Collectors.joining(", ")));
        }

        if (query.from() != null) {
            sql.append(" FROM ").append(renderSource(query.from()));
        }

        for (SelectIR.Join join : query.joins()) {
            sql.append(' ').append(join.type().sql())
               .append(' ').append(renderSource(join.target()))
               .append(" ON ").append(renderPredicate(join.on(), false));
        }

        List<NormalizedPredicate> prewhere = query.predicates().stream()
                .filter(NormalizedPredicate::prewhere).collect(Collectors.toList());
        List<NormalizedPredicate> where = query.predicates().stream()
                .filter(p -> !p.prewhere()).collect(Collectors.toList());
        if (!prewhere.isEmpty()) {
            sql.append(" PREWHERE ").append(renderPredicates(prewhere, false));
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(renderPredicates(where, true));
        }

        if (!query.groupBy().isEmpty()) {
            sql.append(" GROUP BY ").append(query.groupBy().stream()
                    .map(c -> quoteIdentifier(c, IdentifierContext.SELECT))
                    .collect(Collectors.joining(", ")));
        }

        if (query.having() != null) {
            sql.append(" HAVING ").append(renderPredicate(query.having(), false));
        }

        if (!query.orderBy().isEmpty()) {
            sql.append(" ORDER BY ").append(query.orderBy().stream()
                    .map(this::renderOrder)
                    .collect(Collectors.joining(", ")));
        }

        if (query.limit() != null) {
            sql.append(" LIMIT ").append(query.limit());
            if (query.offset() != null) {
                sql.append(" OFFSET ").append(query.offset());
            }
        }

        if (query.isFinal()) {
            sql.append(" FINAL");
        }

        for (SelectIR.Union union : query.unions()) {
            sql.append(' ').append(union.type().sql())
               .append(' ').append(renderSelect(union.query()));
        }

        appendSettings(sql, query.settings());
        return sql.toString();
    }

    private String renderSource(SourceIR source) {
        String target = source.subquery() != null
                ? "(" + renderSelect(source.subquery()) + ")"
                : quoteIdentifier(source.table(), IdentifierContext.SELECT);
        return source.alias() == null ? target : target + " AS " + quoteAlias(source.alias());
    }

    private String renderOrder(OrderSpec order) {
        return quoteIdentifier(order.column(), IdentifierContext.SELECT) + " " + order.direction().name();
    }

    // ==================== INSERT / ALTER ====================

    private String renderInsert(InsertIR query) {
        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(quoteIdentifier(query.table(), IdentifierContext.SELECT));
        if (!query.columns().isEmpty()) {
            sql.append(" (").append(query.columns().stream()
                    .map(c -> quoteIdentifier(c, IdentifierContext.SELECT))
                    .collect(Collectors.joining(", "))).append(')');
        }
        sql.append(" VALUES ").append(query.rows().stream()
                .map(row -> row.stream()
                        .map(ClickHouseValueFormatter::format)
                        .collect(Collectors.joining(", ", "(", ")")))
                .collect(Collectors.joining(", ")));
        return sql.toString();
    }

    private String renderUpdate(UpdateIR query) {
        StringBuilder sql = new StringBuilder("ALTER TABLE ")
                .append(quoteIdentifier(query.table(), IdentifierContext.SELECT))
                .append(" UPDATE ");
        StringJoiner assignments = new StringJoiner(", ");
        for (Map.Entry<String, Object> entry : query.set().entrySet()) {
            Object value = entry.getValue();
            String rendered = value instanceof ExprIR expr
                    ? renderExpr(expr)
                    : ClickHouseValueFormatter.format(value);
            assignments.add(quoteIdentifier(entry.getKey(), IdentifierContext.SELECT) + " = " + rendered);
        }
        sql.append(assignments);
        appendMutationWhere(sql, query.table(), query.predicates());
        appendSettings(sql, query.settings());
        return sql.toString();
    }

    private String renderDelete(DeleteIR query) {
        StringBuilder sql = new StringBuilder("ALTER TABLE ")
                .append(quoteIdentifier(query.table(), IdentifierContext.SELECT))
                .append(" DELETE");
        appendMutationWhere(sql, query.table(), query.predicates());
        appendSettings(sql, query.settings());
        return sql.toString();
    }

    /** ClickHouse mutations need a WHERE; a full-table mutation is written as {@code WHERE 1}. */
    private void appendMutationWhere(StringBuilder sql, String table, List<NormalizedPredicate> predicates) {
        if (predicates.isEmpty()) {
            log.warn("Mutation on table {} has no WHERE clause and affects every row", table);
            sql.append(" WHERE 1");
            return;
        }
        sql.append(" WHERE ").append(renderPredicates(predicates, true));
    }

    private void appendSettings(StringBuilder sql, Map<String, Object> settings) {
        if (settings.isEmpty()) {
            return;
        }
        sql.append(" SETTINGS ").append(settings.entrySet().stream()
                .map(e -> e.getKey() + " = " + ClickHouseValueFormatter.format(e.getValue()))
                .collect(Collectors.joining(", ")));
    }

    // ==================== Expressions ====================

    private String renderAliased(ExprIR expr) {
        String rendered = renderExpr(expr);
        return expr.alias() == null ? rendered : rendered + " AS " + quoteAlias(expr.alias());
    }

    private String renderExpr(ExprIR expr) {
        if (expr instanceof ExprIR.ColumnIR column) {
            return quoteIdentifier(column.name(), IdentifierContext.SELECT);
        }
        if (expr instanceof ExprIR.ValueIR value) {
            return ClickHouseValueFormatter.format(value.value());
        }
        if (expr instanceof ExprIR.TupleIR tuple) {
            return ClickHouseValueFormatter.formatTuple(tuple.values());
        }
        if (expr instanceof ExprIR.SubqueryIR subquery) {
            return "(" + renderSelect(subquery.query()) + ")";
        }
        if (expr instanceof ExprIR.RawIR raw) {
            return raw.sql();
        }
        if (expr instanceof ExprIR.FunctionIR function) {
            return renderFunction(function);
        }
        ExprIR.CaseIR caseExpr = (ExprIR.CaseIR) expr;
        StringBuilder sql = new StringBuilder("CASE");
        for (ExprIR.WhenIR when : caseExpr.whens()) {
            sql.append(" WHEN ").append(renderPredicate(when.condition(), false))
               .append(" THEN ").append(renderExpr(when.then()));
        }
        if (caseExpr.elseExpr() != null) {
            sql.append(" ELSE ").append(renderExpr(caseExpr.elseExpr()));
        }
        return sql.append(" END").toString();
    }

    private String renderFunction(ExprIR.FunctionIR function) {
        if (SqlFunctions.CAST.equals(function.name()) && function.args().size() == 2) {
            return "CAST(" + renderExpr(function.args().get(0))
                    + " AS " + renderExpr(function.args().get(1)) + ")";
        }
        return function.name() + function.args().stream()
                .map(this::renderExpr)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    // ==================== Predicates ====================

    private String renderPredicates(List<NormalizedPredicate> predicates, boolean topLevel) {
        if (predicates.size() == 1) {
            return renderPredicate(predicates.get(0), topLevel);
        }
        return predicates.stream()
                .map(p -> renderPredicate(p, false))
                .collect(Collectors.joining(" AND "));
    }

    private String renderPredicate(NormalizedPredicate predicate, boolean topLevel) {
        if (predicate instanceof NormalizedPredicate.Comparison comparison) {
            return renderComparison(comparison);
        }
        if (predicate instanceof NormalizedPredicate.And and) {
            String rendered = and.children().stream()
                    .map(p -> renderPredicate(p, false))
                    .collect(Collectors.joining(" AND "));
            boolean wrap = !topLevel && and.fromCombinator() && and.children().size() > 1;
            return wrap ? "(" + rendered + ")" : rendered;
        }
        if (predicate instanceof NormalizedPredicate.Or or) {
            return or.children().stream()
                    .map(p -> renderPredicate(p, false))
                    .collect(Collectors.joining(" OR ", "(", ")"));
        }
        if (predicate instanceof NormalizedPredicate.Not not) {
            return "NOT (" + renderPredicate(not.child(), false) + ")";
        }
        return ((NormalizedPredicate.Raw) predicate).sql();
    }

    private String renderComparison(NormalizedPredicate.Comparison predicate) {
        String left = predicate.left() == null
                ? ""
                : quoteIdentifier(predicate.left(), IdentifierContext.PREDICATE);
        return switch (predicate.operator()) {
            case EXISTS, NOT_EXISTS -> predicate.operator().sql() + " " + renderRight(predicate.right());
            case IS_NULL, IS_NOT_NULL -> left + " " + predicate.operator().sql();
            case BETWEEN -> renderBetween(left, predicate.right());
            case HAS_ANY -> "arrayExists(" + LAMBDA_VAR + " -> (" + LAMBDA_VAR + " IN "
                    + renderRight(predicate.right()) + "), " + left + ")";
            case HAS_ALL, IN_TUPLE -> "arrayAll(" + LAMBDA_VAR + " -> (" + LAMBDA_VAR + " IN "
                    + renderRight(predicate.right()) + "), " + left + ")";
            default -> left + " " + predicate.operator().sql() + " " + renderRight(predicate.right());
        };
    }

    private String renderBetween(String left, RightValue right) {
        List<Object> bounds = ((RightValue.ValueList) right).values();
        return left + " BETWEEN " + ClickHouseValueFormatter.format(bounds.get(0))
                + " AND " + ClickHouseValueFormatter.format(bounds.get(1));
    }

    private String renderRight(RightValue right) {
        if (right instanceof RightValue.Scalar scalar) {
            return ClickHouseValueFormatter.format(scalar.value());
        }
        if (right instanceof RightValue.ValueList list) {
            if (list.values().isEmpty()) {
                return EMPTY_SET;
            }
            return list.values().stream()
                    .map(ClickHouseValueFormatter::format)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
        if (right instanceof RightValue.ColumnRef column) {
            return quoteIdentifier(column.name(), IdentifierContext.PREDICATE);
        }
        if (right instanceof RightValue.SubqueryRef subquery) {
            return "(" + renderSelect(subquery.query()) + ")";
        }
        return renderExpr(((RightValue.ExprRef) right).expr());
    }

    // ==================== Identifiers ====================

    /**
     * Backtick-quotes an identifier. {@code *}, numeric literals and, in
     * SELECT context, function-call text pass through. {@code table.column}
     * is quoted part by part and each part must be a plain identifier.
     *
     * @throws IdentifierException for a malformed qualified identifier
     */
    public static String quoteIdentifier(String identifier, IdentifierContext context) {
        if ("*".equals(identifier) || NUMERIC.matcher(identifier).matches()) {
            return identifier;
        }
        if (identifier.contains("(")) {
            return context == IdentifierContext.PREDICATE ? backtick(identifier) : identifier;
        }
        if (identifier.contains(".")) {
            String[] parts = identifier.split("\\.", -1);
            if (parts.length != 2) {
                throw new IdentifierException(
                        "Invalid identifier: '" + identifier + "' - table.column format expected", identifier);
            }
            if (!IDENTIFIER_PART.matcher(parts[0]).matches()
                    || !(IDENTIFIER_PART.matcher(parts[1]).matches() || "*".equals(parts[1]))) {
                throw new IdentifierException(
                        "Invalid identifier: '" + identifier + "' contains invalid characters", identifier);
            }
            String column = "*".equals(parts[1]) ? "*" : backtick(parts[1]);
            return backtick(parts[0]) + "." + column;
        }
        return backtick(identifier);
    }

    private static String quoteAlias(String alias) {
        return backtick(alias);
    }

    private static String backtick(String identifier) {
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }
}
