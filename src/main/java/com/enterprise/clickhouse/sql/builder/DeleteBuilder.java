package com.enterprise.clickhouse.sql.builder;

import com.enterprise.clickhouse.runner.QueryRequest;
import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.sql.ast.DeleteNode;
import com.enterprise.clickhouse.sql.condition.WhereInput;

import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for {@code ALTER TABLE ... DELETE} mutations.
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult r = QueryBuilders.deleteFrom("users")
 *     .where(where("id", eq(1)))
 *     .toSQL();
 * }</pre>
 *
 * <p>Without a WHERE condition every row is deleted.
 */
public class DeleteBuilder extends QueryBuilder {

    private final DeleteNode node;

    DeleteBuilder(QueryCompiler compiler, String table) {
        super(compiler);
        this.node = new DeleteNode(Objects.requireNonNull(table, "table"));
    }

    public static DeleteBuilder from(String table) {
        return new DeleteBuilder(QueryCompiler.defaults(), table);
    }

    public static DeleteBuilder from(QueryCompiler compiler, String table) {
        return new DeleteBuilder(compiler, table);
    }

    @Override
    public DeleteNode node() {
        return node;
    }

    /** Repeated calls AND together. */
    public DeleteBuilder where(WhereInput condition) {
        node.where(merge(node.where(), condition));
        return this;
    }

    public DeleteBuilder settings(Map<String, ?> settings) {
        node.settings().putAll(settings);
        return this;
    }

    public void run(QueryRunner runner) {
        QueryRunner target = requireRunner(runner);
        target.command(new QueryRequest(toSQL().sql(), Map.of(), null));
    }
}
