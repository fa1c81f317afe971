package com.enterprise.clickhouse.sql.builder;

import com.enterprise.clickhouse.sql.ast.QueryNode;
import com.enterprise.clickhouse.sql.dialect.ClickHouseRenderer;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.normalize.Normalization;
import com.enterprise.clickhouse.sql.normalize.QueryNormalizer;
import com.enterprise.clickhouse.sql.validation.QueryValidator;
import com.enterprise.clickhouse.sql.validation.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Normalize, validate and render pipeline shared by all builders.
 * Stateless apart from its collaborators, so one instance may serve any
 * number of threads.
 */
public class QueryCompiler {

    private static final QueryCompiler DEFAULT = new QueryCompiler(
            LoggerFactory.getLogger(QueryCompiler.class), new QueryNormalizer(), new ClickHouseRenderer());

    private final Logger log;
    private final QueryNormalizer normalizer;
    private final ClickHouseRenderer renderer;

    public QueryCompiler(Logger log, QueryNormalizer normalizer, ClickHouseRenderer renderer) {
        this.log = Objects.requireNonNull(log, "log");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /** Compiler with default loggers for every stage. */
    public static QueryCompiler defaults() {
        return DEFAULT;
    }

    /** Compiler whose stages all log through {@code log}. */
    public static QueryCompiler withLogger(Logger log) {
        return new QueryCompiler(log,
                new QueryNormalizer(log, new QueryValidator(log)),
                new ClickHouseRenderer(log));
    }

    /**
     * @throws ValidationException carrying every validation error when the
     *                             query cannot be compiled
     */
    public SqlResult compile(QueryNode query) {
        Normalization normalization = normalizer.normalize(query);
        ValidationResult validation = normalization.validation();
        if (!validation.valid()) {
            log.error("Query validation failed: {}", validation.errors());
            throw new ValidationException(
                    "Query validation failed: " + String.join(", ", validation.errors()),
                    "query", validation.errors());
        }
        return new SqlResult(renderer.render(normalization.ir()));
    }

    /** Advisory check; never throws. */
    public ValidationResult validate(QueryNode query) {
        return normalizer.normalize(query).validation();
    }
}
