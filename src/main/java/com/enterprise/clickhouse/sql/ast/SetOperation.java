package com.enterprise.clickhouse.sql.ast;

public record SetOperation(Type type, SelectNode query) {

    public enum Type {
        UNION("UNION DISTINCT"),
        UNION_ALL("UNION ALL");

        private final String sql;

        Type(String sql) { this.sql = sql; }

        public String sql() { return sql; }
    }
}
