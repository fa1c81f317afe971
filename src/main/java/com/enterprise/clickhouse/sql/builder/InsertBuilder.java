package com.enterprise.clickhouse.sql.builder;

import com.enterprise.clickhouse.runner.InsertRequest;
import com.enterprise.clickhouse.runner.QueryRequest;
import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.sql.ast.InsertNode;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for INSERT. Three strategies, the last one chosen wins:
 * <ul>
 *   <li>{@link #values} / {@link #row}: {@code INSERT ... VALUES} SQL sent as a command</li>
 *   <li>{@link #objects}: records handed to the runner's native insert ({@code JSONEachRow})</li>
 *   <li>{@link #fromStream}: raw bytes handed to the runner's native insert ({@code JSONCompactEachRow})</li>
 * </ul>
 *
 * <pre>{@code
 * QueryBuilders.insertInto("events")
 *     .columns("id", "name")
 *     .row(1, "signup")
 *     .row(2, "login")
 *     .run(runner);
 * }</pre>
 */
public class InsertBuilder extends QueryBuilder {

    public static final String DEFAULT_OBJECT_FORMAT = "JSONEachRow";
    public static final String DEFAULT_STREAM_FORMAT = "JSONCompactEachRow";

    private enum Strategy { VALUES, OBJECTS, STREAM }

    private final InsertNode node;
    private Strategy strategy = Strategy.VALUES;
    private List<Map<String, Object>> objects = List.of();
    private InputStream stream;

    InsertBuilder(QueryCompiler compiler, String table) {
        super(compiler);
        this.node = new InsertNode(Objects.requireNonNull(table, "table"));
    }

    public static InsertBuilder into(String table) {
        return new InsertBuilder(QueryCompiler.defaults(), table);
    }

    public static InsertBuilder into(QueryCompiler compiler, String table) {
        return new InsertBuilder(compiler, table);
    }

    @Override
    public InsertNode node() {
        return node;
    }

    public InsertBuilder columns(String... columns) {
        node.columns().clear();
        node.columns().addAll(Arrays.asList(columns));
        return this;
    }

    /** Appends VALUES rows; each row must match the column list. */
    public InsertBuilder values(List<? extends List<?>> rows) {
        for (List<?> row : rows) {
            node.rows().add(new ArrayList<>(row));
        }
        strategy = Strategy.VALUES;
        return this;
    }

    public InsertBuilder row(Object... values) {
        node.rows().add(new ArrayList<>(Arrays.asList(values)));
        strategy = Strategy.VALUES;
        return this;
    }

    /** Records inserted natively, keyed by column name. */
    public InsertBuilder objects(List<? extends Map<String, ?>> records) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, ?> record : records) {
            copy.add(new LinkedHashMap<>(record));
        }
        this.objects = copy;
        strategy = Strategy.OBJECTS;
        return this;
    }

    /** Pre-encoded rows in {@link #format(String)}; the runner reads the stream. */
    public InsertBuilder fromStream(InputStream stream) {
        this.stream = Objects.requireNonNull(stream, "stream");
        strategy = Strategy.STREAM;
        return this;
    }

    public InsertBuilder format(String format) {
        node.format(format);
        return this;
    }

    public void run(QueryRunner runner) {
        QueryRunner target = requireRunner(runner);
        switch (strategy) {
            case VALUES -> target.command(new QueryRequest(toSQL().sql(), Map.of(), node.format()));
            case OBJECTS -> target.insert(InsertRequest.ofRows(node.table(), objects,
                    formatOr(DEFAULT_OBJECT_FORMAT), List.copyOf(node.columns())));
            case STREAM -> target.insert(InsertRequest.ofStream(node.table(), stream,
                    formatOr(DEFAULT_STREAM_FORMAT), List.copyOf(node.columns())));
        }
    }

    private String formatOr(String fallback) {
        return node.format() == null ? fallback : node.format();
    }
}
