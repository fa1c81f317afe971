package com.enterprise.clickhouse.sql.ir;

import java.util.List;
import java.util.Map;

public record DeleteIR(String table, List<NormalizedPredicate> predicates,
                       Map<String, Object> settings) implements QueryIR {}
