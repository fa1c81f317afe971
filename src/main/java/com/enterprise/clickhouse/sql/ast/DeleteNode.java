package com.enterprise.clickhouse.sql.ast;

import java.util.LinkedHashMap;
import java.util.Map;

public final class DeleteNode implements QueryNode {

    private final String table;
    private final Map<String, Object> settings = new LinkedHashMap<>();
    private PredicateNode where;

    public DeleteNode(String table) {
        this.table = table;
    }

    public String table() { return table; }

    public Map<String, Object> settings() { return settings; }

    public PredicateNode where() { return where; }

    public void where(PredicateNode where) { this.where = where; }
}
