package com.enterprise.clickhouse.sql.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression node of the query AST.
 *
 * <p>{@link Raw} and {@link FunctionCall} are emitted verbatim (function
 * arguments are still rendered as expressions). Everything else is quoted or
 * formatted by the renderer.
 */
public sealed interface Expr
        permits Expr.Column, Expr.Value, Expr.ArrayValue, Expr.Tuple,
                Expr.Subquery, Expr.Raw, Expr.FunctionCall, Expr.Case {

    /** Alias used in a SELECT list, {@code null} when the node carries none. */
    default String alias() { return null; }

    /**
     * Column reference. {@code table} is the qualifier of a {@code table.column}
     * reference or {@code null}.
     */
    record Column(String name, String table, String alias) implements Expr {

        public Column as(String alias) {
            return new Column(name, table, alias);
        }

        /** Joined {@code table.name} form used by the IR. */
        public String qualifiedName() {
            return table == null ? name : table + "." + name;
        }
    }

    record Value(Object value) implements Expr {}

    record ArrayValue(List<Object> values) implements Expr {
        public ArrayValue {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    /** Fixed-size value group; BETWEEN endpoints travel as a tuple. */
    record Tuple(List<Object> values) implements Expr {
        public Tuple {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    record Subquery(SelectNode query, String alias) implements Expr {

        public Subquery as(String alias) {
            return new Subquery(query, alias);
        }
    }

    /** Unsafe SQL fragment, never escaped. */
    record Raw(String sql, String alias) implements Expr {

        public Raw as(String alias) {
            return new Raw(sql, alias);
        }
    }

    record FunctionCall(String name, List<Expr> args, String alias) implements Expr {

        public FunctionCall {
            args = List.copyOf(args);
        }

        public FunctionCall as(String alias) {
            return new FunctionCall(name, args, alias);
        }
    }

    record Case(List<When> whens, Expr elseExpr, String alias) implements Expr {

        public Case {
            whens = List.copyOf(whens);
        }

        public Case as(String alias) {
            return new Case(whens, elseExpr, alias);
        }
    }

    record When(PredicateNode condition, Expr then) {}

    // ==================== Factories ====================

    /**
     * Parses a column reference. {@code "t.c"} splits on the first dot into
     * qualifier and name; function-call text is kept whole.
     */
    static Column column(String ref) {
        Objects.requireNonNull(ref, "column");
        int dot = ref.indexOf('.');
        if (dot < 0 || ref.contains("(")) {
            return new Column(ref, null, null);
        }
        return new Column(ref.substring(dot + 1), ref.substring(0, dot), null);
    }

    /** Wraps a plain value; an {@link Expr} is returned unchanged. */
    static Expr of(Object value) {
        return value instanceof Expr e ? e : new Value(value);
    }

    static Raw raw(String sql) {
        return new Raw(Objects.requireNonNull(sql, "sql"), null);
    }

    static ArrayValue array(Object... values) {
        return new ArrayValue(Arrays.asList(values));
    }
}
