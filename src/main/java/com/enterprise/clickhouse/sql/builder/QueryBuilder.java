package com.enterprise.clickhouse.sql.builder;

import com.enterprise.clickhouse.runner.QueryRunner;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.QueryNode;
import com.enterprise.clickhouse.sql.condition.PredicateLowering;
import com.enterprise.clickhouse.sql.condition.WhereInput;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Common base of the statement builders: compilation, validation and the
 * WHERE merge rule.
 */
public abstract class QueryBuilder {

    protected final QueryCompiler compiler;

    protected QueryBuilder(QueryCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    /** The statement tree being built. Live, not a copy. */
    public abstract QueryNode node();

    /**
     * Compiles the statement.
     *
     * @throws ValidationException when the statement is invalid
     */
    public SqlResult toSQL() {
        return compiler.compile(node());
    }

    /** Reports errors and warnings without throwing. */
    public ValidationResult validate() {
        return compiler.validate(node());
    }

    /**
     * AND-merges a new condition into an existing clause. Merged groups are
     * not combinator groups, and merging into an earlier merge appends to it.
     */
    protected static PredicateNode merge(PredicateNode existing, WhereInput input) {
        PredicateNode lowered = PredicateLowering.lower(Objects.requireNonNull(input, "condition"));
        if (existing == null) {
            return lowered;
        }
        List<PredicateNode> children = new ArrayList<>();
        if (existing instanceof PredicateNode.And and && !and.fromCombinator()) {
            children.addAll(and.children());
        } else {
            children.add(existing);
        }
        children.add(lowered);
        return new PredicateNode.And(children, false);
    }

    protected static QueryRunner requireRunner(QueryRunner runner) {
        if (runner == null) {
            throw new ValidationException("A QueryRunner is required to execute the query", "runner", null);
        }
        return runner;
    }
}
