package com.enterprise.clickhouse.sql.ast;

import java.util.List;

/**
 * Boolean-logic tree of the query AST.
 *
 * <p>{@link And#fromCombinator()} records whether the group was written as an
 * explicit {@code and(...)} combinator or produced by merging conditions. The
 * renderer parenthesizes on that flag alone, so it is carried unchanged into
 * the IR.
 */
public sealed interface PredicateNode
        permits PredicateNode.Predicate, PredicateNode.And, PredicateNode.Or,
                PredicateNode.Not, PredicateNode.Raw {

    /** {@code left} is null for EXISTS / NOT EXISTS. */
    record Predicate(Expr left, PredicateOperator operator, Expr right) implements PredicateNode {}

    record And(List<PredicateNode> children, boolean fromCombinator) implements PredicateNode {
        public And {
            children = List.copyOf(children);
        }
    }

    record Or(List<PredicateNode> children) implements PredicateNode {
        public Or {
            children = List.copyOf(children);
        }
    }

    record Not(PredicateNode child) implements PredicateNode {}

    /** Opaque predicate SQL, emitted as-is. */
    record Raw(String sql) implements PredicateNode {}
}
