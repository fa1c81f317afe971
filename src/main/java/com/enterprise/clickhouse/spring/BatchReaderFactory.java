package com.enterprise.clickhouse.spring;

import com.enterprise.clickhouse.sql.builder.SelectBuilder;
import com.enterprise.clickhouse.sql.builder.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that bridges the query builder with Spring Batch readers.
 *
 * <p>The query is compiled once, when the reader is created. Values are
 * already inlined, so no statement setter is needed.
 *
 * <p>Typical usage in a {@code @Configuration} class:
 * <pre>{@code
 * @Bean
 * @StepScope
 * public JdbcCursorItemReader<User> userReader(
 *         BatchReaderFactory factory,
 *         @Value("#{jobParameters}") Map<String, Object> params) {
 *     return factory.cursorReader("userReader", activeUsers(),
 *             new DataClassRowMapper<>(User.class), params);
 * }
 * }</pre>
 */
public class BatchReaderFactory {

    private static final Logger log = LoggerFactory.getLogger(BatchReaderFactory.class);

    private final DataSource dataSource;
    private int fetchSize = 1000;
    private int queryTimeout = 0;

    public BatchReaderFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Creates a {@link JdbcCursorItemReader} for an already built query.
     *
     * @param <T>       row type
     * @param name      reader name (used for restart data and logging)
     * @param query     SELECT to run; compiled here
     * @param rowMapper maps each ResultSet row to a domain object
     * @return configured reader; Spring calls afterPropertiesSet() in managed steps
     */
    public <T> JdbcCursorItemReader<T> cursorReader(String name, SelectBuilder query, RowMapper<T> rowMapper) {
        SqlResult result = query.toSQL();
        log.debug("Reader {} query: {}", name, result.sql());

        JdbcCursorItemReader<T> reader = new JdbcCursorItemReader<>();
        reader.setName(name);
        reader.setDataSource(dataSource);
        reader.setSql(result.sql());
        reader.setRowMapper(rowMapper);
        reader.setFetchSize(fetchSize);
        if (queryTimeout > 0) {
            reader.setQueryTimeout(queryTimeout);
        }
        return reader;
    }

    /** Creates a reader for the query built by {@code provider} from job parameters. */
    public <T> JdbcCursorItemReader<T> cursorReader(String name, BatchQueryProvider provider,
                                                   RowMapper<T> rowMapper, Map<String, Object> jobParams) {
        return cursorReader(name, provider.buildQuery(jobParams), rowMapper);
    }

    /**
     * Compiles the provider's query without creating a reader.
     * Useful for logging, testing, and dry-run scenarios.
     */
    public SqlResult resolveQuery(BatchQueryProvider provider, Map<String, Object> jobParams) {
        return provider.buildQuery(jobParams).toSQL();
    }

    /** Fetch size hint. Default 1000. */
    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        this.queryTimeout = seconds;
    }
}
