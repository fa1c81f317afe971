package com.enterprise.clickhouse.sql.ast;

import java.util.Objects;

public record OrderSpec(String column, SortDirection direction) {

    public OrderSpec {
        Objects.requireNonNull(column, "column");
        direction = direction == null ? SortDirection.ASC : direction;
    }

    public static OrderSpec asc(String column) {
        return new OrderSpec(column, SortDirection.ASC);
    }

    public static OrderSpec desc(String column) {
        return new OrderSpec(column, SortDirection.DESC);
    }
}
