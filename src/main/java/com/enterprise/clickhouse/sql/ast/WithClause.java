package com.enterprise.clickhouse.sql.ast;

/** Named subquery rendered as {@code WITH `alias` AS (...)}. */
public record WithClause(String alias, SelectNode query) {}
