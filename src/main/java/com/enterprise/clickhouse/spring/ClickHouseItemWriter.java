package com.enterprise.clickhouse.spring;

import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.sql.builder.InsertBuilder;

import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Writes each chunk as one native row insert through a {@link QueryRunner}.
 *
 * <pre>{@code
 * @Bean
 * public ClickHouseItemWriter<Event> eventWriter(QueryRunner runner) {
 *     return new ClickHouseItemWriter<>(runner, "events",
 *             e -> Map.of("id", e.id(), "name", e.name()));
 * }
 * }</pre>
 */
public class ClickHouseItemWriter<T> implements ItemWriter<T> {

    private final QueryRunner runner;
    private final String table;
    private final Function<? super T, ? extends Map<String, ?>> rowMapper;
    private String format;

    public ClickHouseItemWriter(QueryRunner runner, String table,
                                Function<? super T, ? extends Map<String, ?>> rowMapper) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.table = Objects.requireNonNull(table, "table");
        this.rowMapper = Objects.requireNonNull(rowMapper, "rowMapper");
    }

    @Override
    public void write(Chunk<? extends T> chunk) {
        if (chunk.isEmpty()) {
            return;
        }
        List<Map<String, ?>> rows = new ArrayList<>();
        for (T item : chunk) {
            rows.add(rowMapper.apply(item));
        }
        InsertBuilder insert = InsertBuilder.into(table).objects(rows);
        if (format != null) {
            insert.format(format);
        }
        insert.run(runner);
    }

    /** Native insert format. Default {@value InsertBuilder#DEFAULT_OBJECT_FORMAT}. */
    public void setFormat(String format) {
        this.format = format;
    }
}
