package com.enterprise.clickhouse.runner;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Transport port: executes compiled statements. The builders only produce
 * SQL text and hand it over through this interface.
 */
public interface QueryRunner {

    List<Map<String, Object>> execute(QueryRequest request);

    <T> List<T> execute(QueryRequest request, Class<T> rowType);

    /** Statement without a result set (DDL, mutations, VALUES inserts). */
    void command(QueryRequest request);

    /** Lazily fetched rows; the caller must close the stream. */
    Stream<Map<String, Object>> stream(QueryRequest request);

    void insert(InsertRequest request);
}
