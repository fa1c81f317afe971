package com.enterprise.clickhouse.sql.ast;

public enum SortDirection {
    ASC, DESC
}
