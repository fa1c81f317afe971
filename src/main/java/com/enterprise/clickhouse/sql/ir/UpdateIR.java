package com.enterprise.clickhouse.sql.ir;

import java.util.List;
import java.util.Map;

/** SET values are plain values or {@link ExprIR}. */
public record UpdateIR(String table, Map<String, Object> set, List<NormalizedPredicate> predicates,
                       Map<String, Object> settings) implements QueryIR {}
