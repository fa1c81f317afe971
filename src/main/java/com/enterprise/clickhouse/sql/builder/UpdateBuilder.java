package com.enterprise.clickhouse.sql.builder;

import com.enterprise.clickhouse.runner.QueryRequest;
import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.sql.ast.UpdateNode;
import com.enterprise.clickhouse.sql.condition.WhereInput;

import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for {@code ALTER TABLE ... UPDATE} mutations.
 *
 * <pre>{@code
 * QueryBuilders.update("users")
 *     .set(Map.of("status", "inactive"))
 *     .where(where("age", gt(18)))
 *     .settings(Map.of("max_execution_time", 30))
 *     .toSQL();
 * }</pre>
 *
 * <p>Without a WHERE condition every row is updated.
 */
public class UpdateBuilder extends QueryBuilder {

    private final UpdateNode node;

    UpdateBuilder(QueryCompiler compiler, String table) {
        super(compiler);
        this.node = new UpdateNode(Objects.requireNonNull(table, "table"));
    }

    public static UpdateBuilder table(String table) {
        return new UpdateBuilder(QueryCompiler.defaults(), table);
    }

    public static UpdateBuilder table(QueryCompiler compiler, String table) {
        return new UpdateBuilder(compiler, table);
    }

    @Override
    public UpdateNode node() {
        return node;
    }

    /** Shallow merge into the SET map; later keys win. Values may be {@code Expr}. */
    public UpdateBuilder set(Map<String, ?> values) {
        node.set().putAll(values);
        return this;
    }

    public UpdateBuilder set(String column, Object value) {
        node.set().put(Objects.requireNonNull(column, "column"), value);
        return this;
    }

    /** Repeated calls AND together. */
    public UpdateBuilder where(WhereInput condition) {
        node.where(merge(node.where(), condition));
        return this;
    }

    public UpdateBuilder settings(Map<String, ?> settings) {
        node.settings().putAll(settings);
        return this;
    }

    public void run(QueryRunner runner) {
        QueryRunner target = requireRunner(runner);
        target.command(new QueryRequest(toSQL().sql(), Map.of(), null));
    }
}
