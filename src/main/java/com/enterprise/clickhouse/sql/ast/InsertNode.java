package com.enterprise.clickhouse.sql.ast;

import java.util.ArrayList;
import java.util.List;

public final class InsertNode implements QueryNode {

    private final String table;
    private final List<String> columns = new ArrayList<>();
    private final List<List<Object>> rows = new ArrayList<>();
    private String format;

    public InsertNode(String table) {
        this.table = table;
    }

    public String table() { return table; }

    public List<String> columns() { return columns; }

    /** VALUES rows in insertion order. */
    public List<List<Object>> rows() { return rows; }

    public String format() { return format; }

    public void format(String format) { this.format = format; }
}
