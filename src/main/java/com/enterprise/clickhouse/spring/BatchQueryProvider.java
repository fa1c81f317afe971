package com.enterprise.clickhouse.spring;

import com.enterprise.clickhouse.sql.builder.SelectBuilder;

import java.util.Map;

/**
 * Builds the reader query for a Spring Batch step from job parameters.
 *
 * <p>Each call MUST create a fresh {@link SelectBuilder}; builders are
 * single-owner and must not be shared across calls.
 * <pre>{@code
 * @Bean
 * public BatchQueryProvider activeUsers() {
 *     return params -> select("id", "name")
 *         .from("users")
 *         .where(where("status", eq(params.get("status"))));
 * }
 * }</pre>
 */
@FunctionalInterface
public interface BatchQueryProvider {

    SelectBuilder buildQuery(Map<String, Object> jobParams);
}
