package com.enterprise.clickhouse.sql.normalize;

import com.enterprise.clickhouse.sql.ast.DeleteNode;
import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.InsertNode;
import com.enterprise.clickhouse.sql.ast.JoinSpec;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.QueryNode;
import com.enterprise.clickhouse.sql.ast.SelectNode;
import com.enterprise.clickhouse.sql.ast.SetOperation;
import com.enterprise.clickhouse.sql.ast.TableRef;
import com.enterprise.clickhouse.sql.ast.UpdateNode;
import com.enterprise.clickhouse.sql.ast.WithClause;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.ir.DeleteIR;
import com.enterprise.clickhouse.sql.ir.ExprIR;
import com.enterprise.clickhouse.sql.ir.InsertIR;
import com.enterprise.clickhouse.sql.ir.NormalizedPredicate;
import com.enterprise.clickhouse.sql.ir.QueryIR;
import com.enterprise.clickhouse.sql.ir.RightValue;
import com.enterprise.clickhouse.sql.ir.SelectIR;
import com.enterprise.clickhouse.sql.ir.SourceIR;
import com.enterprise.clickhouse.sql.ir.UpdateIR;
import com.enterprise.clickhouse.sql.validation.QueryValidator;
import com.enterprise.clickhouse.sql.validation.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a query AST and lowers it into IR.
 *
 * <p>Failures never escape: validation errors and any lowering failure end
 * up in the returned {@link ValidationResult}. PREWHERE predicates are
 * flagged and listed ahead of WHERE predicates.
 */
public class QueryNormalizer {

    private final Logger log;
    private final QueryValidator validator;

    public QueryNormalizer() {
        this(LoggerFactory.getLogger(QueryNormalizer.class), new QueryValidator());
    }

    public QueryNormalizer(Logger log, QueryValidator validator) {
        this.log = log;
        this.validator = validator;
    }

    public Normalization normalize(QueryNode query) {
        ValidationResult validation = validator.validate(query);
        if (!validation.valid()) {
            return new Normalization(null, validation);
        }
        try {
            QueryIR ir = lower(query);
            log.debug("Normalized {} query", ir.getClass().getSimpleName());
            return new Normalization(ir, validation);
        } catch (RuntimeException e) {
            log.debug("Lowering failed: {}", e.getMessage());
            return new Normalization(null, validation.withError(e.getMessage()));
        }
    }

    // ==================== Statements ====================

    private QueryIR lower(QueryNode query) {
        if (query instanceof SelectNode select) {
            return lowerSelect(select);
        }
        if (query instanceof InsertNode insert) {
            List<List<Object>> rows = new ArrayList<>();
            for (List<Object> row : insert.rows()) {
                rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
            return new InsertIR(insert.table(), List.copyOf(insert.columns()),
                    Collections.unmodifiableList(rows), insert.format());
        }
        if (query instanceof UpdateNode update) {
            Map<String, Object> set = new LinkedHashMap<>();
            update.set().forEach((column, value) ->
                    set.put(column, value instanceof Expr expr ? lowerExpr(expr) : value));
            return new UpdateIR(update.table(), Collections.unmodifiableMap(set),
                    wherePredicates(update.where()), copy(update.settings()));
        }
        DeleteNode delete = (DeleteNode) query;
        return new DeleteIR(delete.table(), wherePredicates(delete.where()), copy(delete.settings()));
    }

    private SelectIR lowerSelect(SelectNode select) {
        List<SelectIR.With> with = new ArrayList<>();
        for (WithClause clause : select.with()) {
            with.add(new SelectIR.With(clause.alias(), lowerSelect(clause.query())));
        }
        List<ExprIR> columns = new ArrayList<>();
        for (Expr column : select.columns()) {
            columns.add(lowerExpr(column));
        }
        List<SelectIR.Join> joins = new ArrayList<>();
        for (JoinSpec join : select.joins()) {
            joins.add(new SelectIR.Join(join.type(), lowerSource(join.target()),
                    lowerPredicate(join.on(), false)));
        }
        List<NormalizedPredicate> predicates = new ArrayList<>();
        if (select.prewhere() != null) {
            predicates.add(lowerPredicate(select.prewhere(), true));
        }
        if (select.where() != null) {
            predicates.add(lowerPredicate(select.where(), false));
        }
        NormalizedPredicate having = select.having() == null ? null : lowerPredicate(select.having(), false);
        List<SelectIR.Union> unions = new ArrayList<>();
        for (SetOperation operation : select.setOperations()) {
            unions.add(new SelectIR.Union(operation.type(), lowerSelect(operation.query())));
        }
        return new SelectIR(
                List.copyOf(with),
                List.copyOf(columns),
                select.from() == null ? null : lowerSource(select.from()),
                List.copyOf(joins),
                List.copyOf(predicates),
                List.copyOf(select.groupBy()),
                having,
                List.copyOf(select.orderBy()),
                select.limit(),
                select.offset(),
                select.isFinal(),
                List.copyOf(unions),
                copy(select.settings()),
                select.format());
    }

    private SourceIR lowerSource(TableRef source) {
        if (source.isSubquery()) {
            return new SourceIR(null, lowerSelect(source.subquery()), source.alias());
        }
        return new SourceIR(source.table(), null, source.alias());
    }

    private List<NormalizedPredicate> wherePredicates(PredicateNode where) {
        return where == null ? List.of() : List.of(lowerPredicate(where, false));
    }

    // ==================== Expressions ====================

    private ExprIR lowerExpr(Expr expr) {
        if (expr instanceof Expr.Column column) {
            return new ExprIR.ColumnIR(column.qualifiedName(), column.alias());
        }
        if (expr instanceof Expr.Value value) {
            return new ExprIR.ValueIR(value.value(), null);
        }
        if (expr instanceof Expr.ArrayValue array) {
            return new ExprIR.ValueIR(array.values(), null);
        }
        if (expr instanceof Expr.Tuple tuple) {
            return new ExprIR.TupleIR(tuple.values(), null);
        }
        if (expr instanceof Expr.Subquery subquery) {
            return new ExprIR.SubqueryIR(lowerSelect(subquery.query()), subquery.alias());
        }
        if (expr instanceof Expr.Raw raw) {
            return new ExprIR.RawIR(raw.sql(), raw.alias());
        }
        if (expr instanceof Expr.FunctionCall function) {
            List<ExprIR> args = new ArrayList<>();
            for (Expr arg : function.args()) {
                args.add(lowerExpr(arg));
            }
            return new ExprIR.FunctionIR(function.name(), List.copyOf(args), function.alias());
        }
        Expr.Case caseExpr = (Expr.Case) expr;
        List<ExprIR.WhenIR> whens = new ArrayList<>();
        for (Expr.When when : caseExpr.whens()) {
            whens.add(new ExprIR.WhenIR(lowerPredicate(when.condition(), false), lowerExpr(when.then())));
        }
        ExprIR elseExpr = caseExpr.elseExpr() == null ? null : lowerExpr(caseExpr.elseExpr());
        return new ExprIR.CaseIR(List.copyOf(whens), elseExpr, caseExpr.alias());
    }

    // ==================== Predicates ====================

    private NormalizedPredicate lowerPredicate(PredicateNode predicate, boolean prewhere) {
        if (predicate instanceof PredicateNode.Predicate p) {
            String left = null;
            if (!p.operator().isExistential()) {
                if (!(p.left() instanceof Expr.Column column)) {
                    throw new ValidationException("Unsupported left operand for "
                            + p.operator().sql() + ": " + p.left(), "predicate", p.left());
                }
                left = column.qualifiedName();
            }
            return new NormalizedPredicate.Comparison(left, p.operator(), extractValue(p.right()), prewhere);
        }
        if (predicate instanceof PredicateNode.And and) {
            return new NormalizedPredicate.And(lowerAll(and.children(), prewhere), and.fromCombinator(), prewhere);
        }
        if (predicate instanceof PredicateNode.Or or) {
            return new NormalizedPredicate.Or(lowerAll(or.children(), prewhere), prewhere);
        }
        if (predicate instanceof PredicateNode.Not not) {
            return new NormalizedPredicate.Not(lowerPredicate(not.child(), prewhere), prewhere);
        }
        return new NormalizedPredicate.Raw(((PredicateNode.Raw) predicate).sql(), prewhere);
    }

    private List<NormalizedPredicate> lowerAll(List<PredicateNode> children, boolean prewhere) {
        List<NormalizedPredicate> lowered = new ArrayList<>();
        for (PredicateNode child : children) {
            lowered.add(lowerPredicate(child, prewhere));
        }
        return List.copyOf(lowered);
    }

    /** Reduces a right-hand Expr to plain data for the renderer. */
    private RightValue extractValue(Expr right) {
        if (right instanceof Expr.Value value) {
            return new RightValue.Scalar(value.value());
        }
        if (right instanceof Expr.ArrayValue array) {
            return new RightValue.ValueList(array.values());
        }
        if (right instanceof Expr.Tuple tuple) {
            return new RightValue.ValueList(tuple.values());
        }
        if (right instanceof Expr.Column column) {
            return new RightValue.ColumnRef(column.qualifiedName());
        }
        if (right instanceof Expr.Subquery subquery) {
            return new RightValue.SubqueryRef(lowerSelect(subquery.query()));
        }
        return new RightValue.ExprRef(lowerExpr(right));
    }

    private static Map<String, Object> copy(Map<String, Object> settings) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }
}
