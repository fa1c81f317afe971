package com.enterprise.clickhouse.sql.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable SELECT statement tree. List and map accessors return the live
 * collections so the owning builder can append to them. A node embedded in
 * another query is always a {@link #copy()}, never the builder's own node.
 */
public final class SelectNode implements QueryNode {

    private final List<Expr> columns = new ArrayList<>();
    private final List<WithClause> with = new ArrayList<>();
    private final List<JoinSpec> joins = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<OrderSpec> orderBy = new ArrayList<>();
    private final Map<String, Object> settings = new LinkedHashMap<>();
    private final List<SetOperation> setOperations = new ArrayList<>();
    private TableRef from;
    private PredicateNode prewhere;
    private PredicateNode where;
    private PredicateNode having;
    private Integer limit;
    private Integer offset;
    private boolean finalModifier;
    private String format;

    public SelectNode() {
    }

    private SelectNode(SelectNode other) {
        columns.addAll(other.columns);
        with.addAll(other.with);
        joins.addAll(other.joins);
        groupBy.addAll(other.groupBy);
        orderBy.addAll(other.orderBy);
        settings.putAll(other.settings);
        setOperations.addAll(other.setOperations);
        from = other.from;
        prewhere = other.prewhere;
        where = other.where;
        having = other.having;
        limit = other.limit;
        offset = other.offset;
        finalModifier = other.finalModifier;
        format = other.format;
    }

    /**
     * Detached copy of this statement. Elements are immutable records, and any
     * nested SELECT they reference was itself copied when it was embedded, so
     * copying the collections is enough to isolate the result.
     */
    public SelectNode copy() {
        return new SelectNode(this);
    }

    public List<Expr> columns() { return columns; }

    public List<WithClause> with() { return with; }

    public List<JoinSpec> joins() { return joins; }

    public List<String> groupBy() { return groupBy; }

    public List<OrderSpec> orderBy() { return orderBy; }

    public Map<String, Object> settings() { return settings; }

    public List<SetOperation> setOperations() { return setOperations; }

    public TableRef from() { return from; }

    public void from(TableRef from) { this.from = from; }

    public PredicateNode prewhere() { return prewhere; }

    public void prewhere(PredicateNode prewhere) { this.prewhere = prewhere; }

    public PredicateNode where() { return where; }

    public void where(PredicateNode where) { this.where = where; }

    public PredicateNode having() { return having; }

    public void having(PredicateNode having) { this.having = having; }

    public Integer limit() { return limit; }

    public void limit(Integer limit) { this.limit = limit; }

    public Integer offset() { return offset; }

    public void offset(Integer offset) { this.offset = offset; }

    public boolean isFinal() { return finalModifier; }

    public void setFinal(boolean finalModifier) { this.finalModifier = finalModifier; }

    public String format() { return format; }

    public void format(String format) { this.format = format; }
}
