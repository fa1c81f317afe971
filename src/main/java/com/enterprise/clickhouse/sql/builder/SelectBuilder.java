package com.enterprise.clickhouse.sql.builder;

import com.enterprise.clickhouse.runner.QueryRequest;
import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.runner.StreamFormats;
import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.JoinSpec;
import com.enterprise.clickhouse.sql.ast.JoinType;
import com.enterprise.clickhouse.sql.ast.OrderSpec;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.SelectNode;
import com.enterprise.clickhouse.sql.ast.SetOperation;
import com.enterprise.clickhouse.sql.ast.SortDirection;
import com.enterprise.clickhouse.sql.ast.TableRef;
import com.enterprise.clickhouse.sql.ast.WithClause;
import com.enterprise.clickhouse.sql.condition.PredicateLowering;
import com.enterprise.clickhouse.sql.condition.WhereInput;
import com.enterprise.clickhouse.sql.error.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Fluent builder for ClickHouse SELECT statements.
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult r = QueryBuilders.select("id", "name")
 *     .from("users", "u")
 *     .leftJoin("orders", "o", where("u.id", eqCol("o.user_id")))
 *     .prewhere(where("date", gte(LocalDate.of(2024, 1, 1))))
 *     .where(where("status", eq("active")))
 *     .orderBy("id", SortDirection.DESC)
 *     .limit(100)
 *     .settings(Map.of("max_threads", 4))
 *     .toSQL();
 * }</pre>
 *
 * <p>A builder passed to {@code in(...)}, {@code exists(...)}, {@code from(...)}
 * or a column list becomes a subquery that shares this builder's tree.
 */
public class SelectBuilder extends QueryBuilder {

    private final SelectNode node = new SelectNode();
    private String alias;

    SelectBuilder(QueryCompiler compiler) {
        super(compiler);
    }

    public static SelectBuilder query() {
        return new SelectBuilder(QueryCompiler.defaults());
    }

    public static SelectBuilder query(QueryCompiler compiler) {
        return new SelectBuilder(compiler);
    }

    @Override
    public SelectNode node() {
        return node;
    }

    // ==================== Columns ====================

    /**
     * Positional columns: column names ({@code "t.col"} allowed), {@link Expr}
     * nodes, or builders that become scalar subqueries.
     */
    public SelectBuilder columns(Object... columns) {
        for (Object column : columns) {
            node.columns().add(toColumn(column));
        }
        return this;
    }

    /** Alias-keyed columns, in map iteration order. */
    public SelectBuilder columns(Map<String, ?> aliased) {
        aliased.forEach((name, column) -> node.columns().add(withAlias(toColumn(column), name)));
        return this;
    }

    /** Alias used when this builder is embedded as a subquery column. */
    public SelectBuilder as(String alias) {
        this.alias = Objects.requireNonNull(alias, "alias");
        return this;
    }

    /** Snapshot of this query as a subquery expression; later calls on this builder do not affect it. */
    public Expr.Subquery toSubquery() {
        return new Expr.Subquery(node.copy(), alias);
    }

    // ==================== FROM / JOIN / WITH ====================

    public SelectBuilder from(String table) {
        return from(table, null);
    }

    public SelectBuilder from(String table, String alias) {
        node.from(TableRef.table(Objects.requireNonNull(table, "table"), alias));
        return this;
    }

    public SelectBuilder from(SelectBuilder subquery, String alias) {
        node.from(TableRef.subquery(subquery.node().copy(), alias));
        return this;
    }

    public SelectBuilder join(JoinType type, String table, String alias, WhereInput on) {
        return addJoin(type, TableRef.table(Objects.requireNonNull(table, "table"), alias), on);
    }

    public SelectBuilder join(JoinType type, SelectBuilder subquery, String alias, WhereInput on) {
        return addJoin(type, TableRef.subquery(subquery.node().copy(), alias), on);
    }

    public SelectBuilder innerJoin(String table, WhereInput on) {
        return join(JoinType.INNER, table, null, on);
    }

    public SelectBuilder innerJoin(String table, String alias, WhereInput on) {
        return join(JoinType.INNER, table, alias, on);
    }

    public SelectBuilder leftJoin(String table, WhereInput on) {
        return join(JoinType.LEFT, table, null, on);
    }

    public SelectBuilder leftJoin(String table, String alias, WhereInput on) {
        return join(JoinType.LEFT, table, alias, on);
    }

    public SelectBuilder rightJoin(String table, WhereInput on) {
        return join(JoinType.RIGHT, table, null, on);
    }

    public SelectBuilder rightJoin(String table, String alias, WhereInput on) {
        return join(JoinType.RIGHT, table, alias, on);
    }

    public SelectBuilder fullJoin(String table, WhereInput on) {
        return join(JoinType.FULL, table, null, on);
    }

    public SelectBuilder fullJoin(String table, String alias, WhereInput on) {
        return join(JoinType.FULL, table, alias, on);
    }

    /** Common table expression: {@code WITH `alias` AS (subquery)}. */
    public SelectBuilder with(String alias, SelectBuilder query) {
        node.with().add(new WithClause(alias, query.node().copy()));
        return this;
    }

    // ==================== Filtering ====================

    /** Repeated calls AND together. */
    public SelectBuilder where(WhereInput condition) {
        node.where(merge(node.where(), condition));
        return this;
    }

    /** ClickHouse PREWHERE, evaluated before the remaining columns are read. */
    public SelectBuilder prewhere(WhereInput condition) {
        node.prewhere(merge(node.prewhere(), condition));
        return this;
    }

    public SelectBuilder having(WhereInput condition) {
        node.having(merge(node.having(), condition));
        return this;
    }

    // ==================== Grouping / ordering / paging ====================

    public SelectBuilder groupBy(String... columns) {
        node.groupBy().addAll(List.of(columns));
        return this;
    }

    public SelectBuilder orderBy(String column) {
        return orderBy(column, SortDirection.ASC);
    }

    public SelectBuilder orderBy(String column, SortDirection direction) {
        node.orderBy().add(new OrderSpec(column, direction));
        return this;
    }

    public SelectBuilder orderBy(List<OrderSpec> orders) {
        node.orderBy().addAll(orders);
        return this;
    }

    public SelectBuilder limit(int limit) {
        node.limit(limit);
        return this;
    }

    public SelectBuilder limit(int limit, int offset) {
        node.limit(limit);
        node.offset(offset);
        return this;
    }

    public SelectBuilder offset(int offset) {
        node.offset(offset);
        return this;
    }

    // ==================== ClickHouse modifiers ====================

    /** Appends {@code FINAL}. */
    public SelectBuilder withFinal() {
        node.setFinal(true);
        return this;
    }

    /** Merges into the SETTINGS clause; later keys win. */
    public SelectBuilder settings(Map<String, ?> settings) {
        node.settings().putAll(settings);
        return this;
    }

    public SelectBuilder setting(String name, Object value) {
        node.settings().put(name, value);
        return this;
    }

    /** Output format requested from the runner; gates {@link #stream}. */
    public SelectBuilder format(String format) {
        node.format(format);
        return this;
    }

    public SelectBuilder union(SelectBuilder other) {
        node.setOperations().add(new SetOperation(SetOperation.Type.UNION, other.node().copy()));
        return this;
    }

    public SelectBuilder unionAll(SelectBuilder other) {
        node.setOperations().add(new SetOperation(SetOperation.Type.UNION_ALL, other.node().copy()));
        return this;
    }

    // ==================== Execution ====================

    public List<Map<String, Object>> run(QueryRunner runner) {
        QueryRunner target = requireRunner(runner);
        return target.execute(request(toSQL(), node.format()));
    }

    public <T> List<T> run(QueryRunner runner, Class<T> rowType) {
        QueryRunner target = requireRunner(runner);
        return target.execute(request(toSQL(), node.format()), rowType);
    }

    /**
     * Streams rows. The format (default {@value StreamFormats#DEFAULT}) must be
     * streamable; otherwise this fails before the runner is touched.
     */
    public Stream<Map<String, Object>> stream(QueryRunner runner) {
        QueryRunner target = requireRunner(runner);
        String format = node.format() == null ? StreamFormats.DEFAULT : node.format();
        if (!StreamFormats.isStreamable(format)) {
            throw new ValidationException("Format " + format + " does not support streaming; use one of "
                    + StreamFormats.ALL, "format", format);
        }
        return target.stream(request(toSQL(), format));
    }

    // ==================== Internal ====================

    private SelectBuilder addJoin(JoinType type, TableRef target, WhereInput on) {
        Objects.requireNonNull(on, "JOIN requires an ON condition");
        PredicateNode condition = PredicateLowering.lower(on);
        node.joins().add(new JoinSpec(type, target, condition));
        return this;
    }

    private static QueryRequest request(SqlResult result, String format) {
        return new QueryRequest(result.sql(), Map.of(), format);
    }

    private static Expr toColumn(Object column) {
        Objects.requireNonNull(column, "column");
        if (column instanceof String name) {
            return Expr.column(name);
        }
        if (column instanceof SelectBuilder subquery) {
            return subquery.toSubquery();
        }
        if (column instanceof Expr expr) {
            return expr;
        }
        throw new IllegalArgumentException("Unsupported column type: " + column.getClass().getName());
    }

    private static Expr withAlias(Expr expr, String alias) {
        if (expr instanceof Expr.Column c) {
            return c.as(alias);
        }
        if (expr instanceof Expr.Subquery s) {
            return s.as(alias);
        }
        if (expr instanceof Expr.Raw r) {
            return r.as(alias);
        }
        if (expr instanceof Expr.FunctionCall f) {
            return f.as(alias);
        }
        if (expr instanceof Expr.Case c) {
            return c.as(alias);
        }
        throw new IllegalArgumentException(
                "Literal values cannot carry an alias; use Expr.raw(...).as(\"" + alias + "\")");
    }
}
