package com.enterprise.clickhouse.runner;

import com.enterprise.clickhouse.sql.dialect.ClickHouseRenderer;
import com.enterprise.clickhouse.sql.dialect.IdentifierContext;
import com.enterprise.clickhouse.sql.error.ConnectionException;
import com.enterprise.clickhouse.sql.error.QueryException;
import com.enterprise.clickhouse.sql.error.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.DataClassRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link QueryRunner} over Spring JDBC.
 *
 * <p>Row inserts run as one named-parameter batch. Per-request settings and
 * pre-encoded byte streams need ClickHouse's native transport and are
 * rejected; put settings in the query's SETTINGS clause instead.
 *
 * <pre>{@code
 * JdbcQueryRunner runner = new JdbcQueryRunner(dataSource);
 * runner.setFetchSize(5000);
 * List<Map<String, Object>> rows = select("id").from("users").run(runner);
 * }</pre>
 */
public class JdbcQueryRunner implements QueryRunner {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryRunner.class);

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedTemplate;

    public JdbcQueryRunner(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.namedTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public List<Map<String, Object>> execute(QueryRequest request) {
        return translate(request.sql(), () -> jdbcTemplate.queryForList(checked(request)));
    }

    @Override
    public <T> List<T> execute(QueryRequest request, Class<T> rowType) {
        String sql = checked(request);
        if (BeanUtils.isSimpleProperty(rowType)) {
            return translate(sql, () -> jdbcTemplate.queryForList(sql, rowType));
        }
        return translate(sql, () -> jdbcTemplate.query(sql, new DataClassRowMapper<>(rowType)));
    }

    @Override
    public void command(QueryRequest request) {
        String sql = checked(request);
        translate(sql, () -> {
            jdbcTemplate.execute(sql);
            return null;
        });
    }

    @Override
    public Stream<Map<String, Object>> stream(QueryRequest request) {
        String sql = checked(request);
        return translate(sql, () -> jdbcTemplate.queryForStream(sql, new ColumnMapRowMapper()));
    }

    @Override
    public void insert(InsertRequest request) {
        if (request.isStream()) {
            throw new UnsupportedOperationException(
                    "Stream inserts in format " + request.format() + " need the native ClickHouse transport");
        }
        List<Map<String, Object>> rows = request.rows();
        if (rows.isEmpty()) {
            log.debug("Skipping insert into {}: no rows", request.table());
            return;
        }
        List<String> columns = request.columns().isEmpty()
                ? new ArrayList<>(rows.get(0).keySet())
                : request.columns();

        String sql = insertTemplate(request.table(), columns);
        SqlParameterSource[] batch = new SqlParameterSource[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            MapSqlParameterSource params = new MapSqlParameterSource();
            for (int c = 0; c < columns.size(); c++) {
                params.addValue("p" + c, rows.get(r).get(columns.get(c)));
            }
            batch[r] = params;
        }
        log.debug("Inserting {} row(s) into {} ({} requested, sent as JDBC batch)",
                rows.size(), request.table(), request.format());
        translate(sql, () -> namedTemplate.batchUpdate(sql, batch));
    }

    /** Rows fetched per round trip for queries and streams. */
    public void setFetchSize(int fetchSize) {
        jdbcTemplate.setFetchSize(fetchSize);
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        jdbcTemplate.setQueryTimeout(seconds);
    }

    // ==================== Internal ====================

    private static String insertTemplate(String table, List<String> columns) {
        String names = columns.stream()
                .map(c -> ClickHouseRenderer.quoteIdentifier(c, IdentifierContext.SELECT))
                .collect(Collectors.joining(", "));
        StringBuilder placeholders = new StringBuilder();
        for (int c = 0; c < columns.size(); c++) {
            placeholders.append(c == 0 ? "" : ", ").append(":p").append(c);
        }
        return "INSERT INTO " + ClickHouseRenderer.quoteIdentifier(table, IdentifierContext.SELECT)
                + " (" + names + ") VALUES (" + placeholders + ")";
    }

    private static String checked(QueryRequest request) {
        if (!request.settings().isEmpty()) {
            throw new IllegalArgumentException(
                    "Per-request settings are not supported over JDBC: " + request.settings().keySet());
        }
        log.debug("Executing: {}", request.sql());
        return request.sql();
    }

    private static <T> T translate(String sql, Supplier<T> call) {
        try {
            return call.get();
        } catch (CannotGetJdbcConnectionException e) {
            throw new ConnectionException("Cannot connect: " + e.getMostSpecificCause().getMessage(), e);
        } catch (QueryTimeoutException e) {
            throw new TimeoutException("Query timed out: " + sql, sql, e);
        } catch (DataAccessException e) {
            throw new QueryException("Query failed: " + e.getMostSpecificCause().getMessage(), sql, null, e);
        }
    }
}
