package com.enterprise.clickhouse.sql.expression;

import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.condition.PredicateLowering;
import com.enterprise.clickhouse.sql.condition.WhereInput;
import com.enterprise.clickhouse.sql.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static factory for searched CASE expressions.
 *
 * <pre>{@code
 * Cases.when(where("amount", gt(1000)), "High")
 *      .when(where("amount", gt(100)), "Medium")
 *      .orElse("Low")
 *      .as("tier")
 * }</pre>
 *
 * <p>Branches may themselves be CASE expressions, up to {@value #MAX_DEPTH}
 * levels deep. Deeper nesting fails when the branch is added.
 */
public final class Cases {

    public static final int MAX_DEPTH = 10;

    private Cases() {}

    public static CaseBuilder when(WhereInput condition, Object then) {
        return new CaseBuilder().when(condition, then);
    }

    public static CaseBuilder when(PredicateNode condition, Object then) {
        return new CaseBuilder().when(condition, then);
    }

    /**
     * Nesting depth of a CASE expression: each CASE-valued branch counts one
     * level plus its own depth.
     */
    public static int depth(Expr.Case expr) {
        int depth = 0;
        for (Expr.When when : expr.whens()) {
            depth += branchDepth(when.then());
        }
        return depth + branchDepth(expr.elseExpr());
    }

    private static int branchDepth(Expr branch) {
        return branch instanceof Expr.Case nested ? 1 + depth(nested) : 0;
    }

    // ==================== Builder ====================

    public static final class CaseBuilder {

        private final List<Expr.When> whens = new ArrayList<>();
        private int depth;

        private CaseBuilder() {}

        public CaseBuilder when(WhereInput condition, Object then) {
            return when(PredicateLowering.lower(Objects.requireNonNull(condition, "condition")), then);
        }

        public CaseBuilder when(PredicateNode condition, Object then) {
            Objects.requireNonNull(condition, "condition");
            Expr thenExpr = Expr.of(then);
            track(thenExpr);
            whens.add(new Expr.When(condition, thenExpr));
            return this;
        }

        public Expr.Case orElse(Object otherwise) {
            Expr elseExpr = Expr.of(otherwise);
            track(elseExpr);
            return new Expr.Case(whens, elseExpr, null);
        }

        /** Finishes without ELSE; unmatched rows yield NULL. */
        public Expr.Case end() {
            return new Expr.Case(whens, null, null);
        }

        private void track(Expr branch) {
            depth += branchDepth(branch);
            if (depth > MAX_DEPTH) {
                throw new ValidationException(
                        "CASE expression nesting exceeds maximum depth of " + MAX_DEPTH,
                        "case", "nesting");
            }
        }
    }
}
