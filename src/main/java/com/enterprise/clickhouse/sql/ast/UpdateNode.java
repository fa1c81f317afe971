package com.enterprise.clickhouse.sql.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code ALTER TABLE ... UPDATE} mutation. SET values are plain values or
 * {@link Expr} nodes.
 */
public final class UpdateNode implements QueryNode {

    private final String table;
    private final Map<String, Object> set = new LinkedHashMap<>();
    private final Map<String, Object> settings = new LinkedHashMap<>();
    private PredicateNode where;

    public UpdateNode(String table) {
        this.table = table;
    }

    public String table() { return table; }

    public Map<String, Object> set() { return set; }

    public Map<String, Object> settings() { return settings; }

    public PredicateNode where() { return where; }

    public void where(PredicateNode where) { this.where = where; }
}
