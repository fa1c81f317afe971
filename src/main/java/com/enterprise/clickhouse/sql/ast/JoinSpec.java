package com.enterprise.clickhouse.sql.ast;

public record JoinSpec(JoinType type, TableRef target, PredicateNode on) {}
