package com.enterprise.clickhouse.sql.ir;

/** FROM / JOIN target: exactly one of {@code table} and {@code subquery} is set. */
public record SourceIR(String table, SelectIR subquery, String alias) {}
