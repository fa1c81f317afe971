package com.enterprise.clickhouse.sql.ir;

import java.util.List;

public record InsertIR(String table, List<String> columns, List<List<Object>> rows,
                       String format) implements QueryIR {}
