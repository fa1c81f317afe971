package com.enterprise.clickhouse.spring;

import com.enterprise.clickhouse.runner.JdbcQueryRunner;
import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.sql.builder.QueryCompiler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wiring for the query builder's Spring integration.
 *
 * <p>Provides a {@link QueryCompiler}, a JDBC-backed {@link QueryRunner} and a
 * {@link BatchReaderFactory}, tuned through {@code clickhouse.query.*}:
 * <pre>{@code
 * @Import(ClickHouseQueryConfig.class)
 * @Configuration
 * public class MyBatchConfig { ... }
 * }</pre>
 *
 * <p>Override individual beans to customize them.
 */
@Configuration
@EnableConfigurationProperties(ClickHouseQueryProperties.class)
public class ClickHouseQueryConfig {

    @Bean
    @ConditionalOnMissingBean
    public QueryCompiler queryCompiler() {
        return QueryCompiler.defaults();
    }

    @Bean
    @ConditionalOnMissingBean(QueryRunner.class)
    public JdbcQueryRunner queryRunner(DataSource dataSource, ClickHouseQueryProperties properties) {
        JdbcQueryRunner runner = new JdbcQueryRunner(dataSource);
        runner.setFetchSize(properties.getFetchSize());
        runner.setQueryTimeout(properties.getQueryTimeoutSeconds());
        return runner;
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchReaderFactory batchReaderFactory(DataSource dataSource, ClickHouseQueryProperties properties) {
        BatchReaderFactory factory = new BatchReaderFactory(dataSource);
        factory.setFetchSize(properties.getFetchSize());
        factory.setQueryTimeout(properties.getQueryTimeoutSeconds());
        return factory;
    }
}
