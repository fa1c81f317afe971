package com.enterprise.clickhouse.sql.condition;

import java.util.List;
import java.util.Objects;

/**
 * Explicit {@code and(...)}, {@code or(...)} or {@code not(...)} grouping.
 * NOT always holds exactly one child.
 */
public record PredicateCombinator(Kind kind, List<WhereInput> children) implements WhereInput {

    public enum Kind { AND, OR, NOT }

    public PredicateCombinator {
        Objects.requireNonNull(kind, "kind");
        children = List.copyOf(children);
        if (kind == Kind.NOT && children.size() != 1) {
            throw new IllegalArgumentException("NOT takes exactly one condition");
        }
    }
}
