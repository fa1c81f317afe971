package com.enterprise.clickhouse.sql.ir;

import com.enterprise.clickhouse.sql.ast.JoinType;
import com.enterprise.clickhouse.sql.ast.OrderSpec;
import com.enterprise.clickhouse.sql.ast.SetOperation;

import java.util.List;
import java.util.Map;

/**
 * Normalized SELECT. {@code predicates} lists PREWHERE predicates first,
 * then WHERE predicates; {@code having} is null when absent.
 */
public record SelectIR(
        List<With> with,
        List<ExprIR> columns,
        SourceIR from,
        List<Join> joins,
        List<NormalizedPredicate> predicates,
        List<String> groupBy,
        NormalizedPredicate having,
        List<OrderSpec> orderBy,
        Integer limit,
        Integer offset,
        boolean isFinal,
        List<Union> unions,
        Map<String, Object> settings,
        String format) implements QueryIR {

    public record With(String alias, SelectIR query) {}

    public record Join(JoinType type, SourceIR target, NormalizedPredicate on) {}

    public record Union(SetOperation.Type type, SelectIR query) {}
}
