package com.enterprise.clickhouse.sql;

import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.PredicateOperator;
import com.enterprise.clickhouse.sql.ast.SelectNode;
import com.enterprise.clickhouse.sql.expression.SqlFunctions;
import com.enterprise.clickhouse.sql.ir.ExprIR;
import com.enterprise.clickhouse.sql.ir.NormalizedPredicate;
import com.enterprise.clickhouse.sql.ir.RightValue;
import com.enterprise.clickhouse.sql.ir.SelectIR;
import com.enterprise.clickhouse.sql.normalize.Normalization;
import com.enterprise.clickhouse.sql.normalize.QueryNormalizer;
import org.junit.jupiter.api.Test;

import static com.enterprise.clickhouse.sql.builder.QueryBuilders.select;
import static com.enterprise.clickhouse.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.assertThat;

class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();

    @Test
    void prewhereIsListedFirstAndFlagged() {
        SelectNode node = select().from("events")
                .where(where("type", eq("click")))
                .prewhere(where("date", eq("2024-01-01")))
                .node();

        SelectIR ir = (SelectIR) normalizer.normalize(node).ir();

        assertThat(ir.predicates()).hasSize(2);
        assertThat(ir.predicates().get(0).prewhere()).isTrue();
        assertThat(((NormalizedPredicate.Comparison) ir.predicates().get(0)).left()).isEqualTo("date");
        assertThat(ir.predicates().get(1).prewhere()).isFalse();
    }

    @Test
    void combinatorFlagSurvives() {
        SelectNode node = select().from("t").where(and(where("a", eq(1)), where("b", eq(2)))).node();

        SelectIR ir = (SelectIR) normalizer.normalize(node).ir();

        assertThat(((NormalizedPredicate.And) ir.predicates().get(0)).fromCombinator()).isTrue();
    }

    @Test
    void columnsUseQualifiedNames() {
        SelectNode node = select("u.id").from("users", "u").where(where("u.id", eqCol("o.user_id"))).node();

        SelectIR ir = (SelectIR) normalizer.normalize(node).ir();

        assertThat(ir.columns()).containsExactly(new ExprIR.ColumnIR("u.id", null));
        NormalizedPredicate.Comparison comparison = (NormalizedPredicate.Comparison) ir.predicates().get(0);
        assertThat(comparison.left()).isEqualTo("u.id");
        assertThat(comparison.right()).isEqualTo(new RightValue.ColumnRef("o.user_id"));
    }

    @Test
    void functionsLowerRecursively() {
        SelectNode node = select(SqlFunctions.cast("id", "String").as("s")).from("t").node();

        ExprIR column = ((SelectIR) normalizer.normalize(node).ir()).columns().get(0);

        assertThat(column).isInstanceOf(ExprIR.FunctionIR.class);
        ExprIR.FunctionIR function = (ExprIR.FunctionIR) column;
        assertThat(function.name()).isEqualTo(SqlFunctions.CAST);
        assertThat(function.alias()).isEqualTo("s");
        assertThat(function.args()).containsExactly(
                new ExprIR.ColumnIR("id", null), new ExprIR.RawIR("String", null));
    }

    @Test
    void invalidQueryYieldsNoIr() {
        Normalization result = normalizer.normalize(select("").from("t").node());

        assertThat(result.ir()).isNull();
        assertThat(result.validation().valid()).isFalse();
    }

    @Test
    void loweringFailureIsReportedNotThrown() {
        SelectNode node = select().from("t").node();
        node.where(new PredicateNode.Predicate(new Expr.Value(1), PredicateOperator.EQ, new Expr.Value(1)));

        Normalization result = normalizer.normalize(node);

        assertThat(result.ir()).isNull();
        assertThat(result.validation().errors()).singleElement()
                .asString().startsWith("Unsupported left operand for =");
    }
}
