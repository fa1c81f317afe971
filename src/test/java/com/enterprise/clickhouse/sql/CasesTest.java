package com.enterprise.clickhouse.sql;

import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.expression.Cases;
import org.junit.jupiter.api.Test;

import static com.enterprise.clickhouse.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CasesTest {

    @Test
    void buildsBranchesInOrder() {
        Expr.Case expr = Cases.when(where("a", eq(1)), "one")
                .when(where("a", eq(2)), "two")
                .orElse("other");

        assertThat(expr.whens()).hasSize(2);
        assertThat(expr.whens().get(1).then()).isEqualTo(new Expr.Value("two"));
        assertThat(expr.elseExpr()).isEqualTo(new Expr.Value("other"));
        assertThat(expr.alias()).isNull();
    }

    @Test
    void endLeavesElseEmpty() {
        assertThat(Cases.when(where("a", eq(1)), 1).end().elseExpr()).isNull();
    }

    @Test
    void tenLevelsOfNestingAreAllowed() {
        Expr.Case expr = nested(10);
        assertThat(Cases.depth(expr)).isEqualTo(10);
    }

    @Test
    void elevenLevelsOfNestingFail() {
        assertThatThrownBy(() -> nested(11))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maximum depth of 10")
                .hasFieldOrPropertyWithValue("field", "case")
                .hasFieldOrPropertyWithValue("value", "nesting");
    }

    @Test
    void depthAddsUpAcrossBranches() {
        Expr.Case inner = Cases.when(where("b", eq(1)), "x").orElse("y");
        Expr.Case outer = Cases.when(where("a", eq(1)), inner).orElse(inner);
        assertThat(Cases.depth(outer)).isEqualTo(2);
    }

    private static Expr.Case nested(int levels) {
        Expr.Case current = Cases.when(where("x", eq(0)), "leaf").orElse("none");
        for (int i = 0; i < levels; i++) {
            current = Cases.when(where("x", eq(i)), current).orElse("none");
        }
        return current;
    }
}
