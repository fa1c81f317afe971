package com.enterprise.clickhouse.sql;

import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.PredicateNode;
import com.enterprise.clickhouse.sql.ast.PredicateOperator;
import com.enterprise.clickhouse.sql.ast.SelectNode;
import com.enterprise.clickhouse.sql.ast.TableRef;
import com.enterprise.clickhouse.sql.builder.SelectBuilder;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.expression.Cases;
import com.enterprise.clickhouse.sql.expression.SqlFunctions;
import com.enterprise.clickhouse.sql.validation.QueryValidator;
import com.enterprise.clickhouse.sql.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.enterprise.clickhouse.sql.builder.QueryBuilders.*;
import static com.enterprise.clickhouse.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryValidatorTest {

    private final QueryValidator validator = new QueryValidator();

    @Test
    void validQueryHasNoFindings() {
        ValidationResult result = validator.validate(select("id").from("users").where(where("id", eq(1))).node());

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void collectsEveryErrorInsteadOfStoppingAtFirst() {
        SelectBuilder query = select("").from("").groupBy("").orderBy("");
        query.node().limit(-1);

        assertThat(validator.validate(query.node()).errors()).containsExactly(
                "Column name must be a non-empty string",
                "Table name must be a non-empty string",
                "GROUP BY column must be a non-empty string",
                "ORDER BY column must be a non-empty string",
                "LIMIT must not be negative: -1");
    }

    @Test
    void subqueryErrorsArePrefixed() {
        SelectBuilder query = select("id").from("users").where(where("id", in(select("").from("orders"))));

        assertThat(validator.validate(query.node()).errors())
                .containsExactly("Subquery validation failed: Column name must be a non-empty string");
    }

    @Test
    void fromSubqueryNeedsAlias() {
        SelectNode node = select("x").node();
        node.from(TableRef.subquery(select("x").from("t").node(), null));

        assertThat(validator.validate(node).errors()).containsExactly("Subquery alias must be a non-empty string");
    }

    @Test
    void functionAndCaseErrorsArePrefixed() {
        SelectBuilder query = select(
                SqlFunctions.sum(""),
                Cases.when(where("", eq(1)), Expr.column("")).orElse(Expr.column("")))
                .from("t");

        assertThat(validator.validate(query.node()).errors()).containsExactly(
                "Function argument 0: Column name must be a non-empty string",
                "Case condition 0: Column name must be a non-empty string",
                "Case then 0: Column name must be a non-empty string",
                "Case else: Column name must be a non-empty string");
    }

    @Test
    void invalidFunctionName() {
        SelectBuilder query = select(SqlFunctions.call("drop table")).from("t");
        assertThat(validator.validate(query.node()).errors()).containsExactly("Invalid function name: drop table");
    }

    @Test
    void existsNeedsNoLeftOperand() {
        SelectBuilder query = select().from("users").where(exists(select("1").from("orders")));
        assertThat(validator.validate(query.node()).valid()).isTrue();
    }

    @Test
    void comparisonWithoutLeftOperandIsAnError() {
        SelectNode node = select().from("t").node();
        node.where(new PredicateNode.Predicate(null, PredicateOperator.EQ, new Expr.Value(1)));

        assertThat(validator.validate(node).errors()).containsExactly("Operator = requires a left operand");
    }

    @Test
    void operandShapeMustMatchOperator() {
        SelectNode node = select().from("t").node();
        node.where(new PredicateNode.And(List.of(
                new PredicateNode.Predicate(Expr.column("age"), PredicateOperator.BETWEEN, new Expr.Value(5)),
                new PredicateNode.Predicate(Expr.column("id"), PredicateOperator.IN, new Expr.Value(1)),
                new PredicateNode.Predicate(Expr.column("tags"), PredicateOperator.HAS_ANY, new Expr.Tuple(List.of("a"))),
                new PredicateNode.Predicate(null, PredicateOperator.EXISTS, new Expr.Value(1)),
                new PredicateNode.Predicate(Expr.column("x"), PredicateOperator.GT, null)), false));

        assertThat(validator.validate(node).errors()).containsExactly(
                "Operator BETWEEN requires a tuple of exactly two bounds",
                "Operator IN requires a value list or subquery",
                "Operator HAS ANY requires an array value",
                "Operator EXISTS requires a subquery",
                "Operator > requires a right operand");
    }

    @Test
    void misshapenPredicateFailsCompilation() {
        SelectBuilder query = select().from("users");
        query.node().where(new PredicateNode.Predicate(
                Expr.column("age"), PredicateOperator.BETWEEN, new Expr.Value(5)));

        assertThatThrownBy(query::toSQL)
                .isInstanceOf(ValidationException.class)
                .hasMessage("Query validation failed: Operator BETWEEN requires a tuple of exactly two bounds");
    }

    @Test
    void emptyGroupsAreErrors() {
        SelectNode node = select().from("t").node();
        node.where(new PredicateNode.Or(List.of()));

        assertThat(validator.validate(node).errors()).containsExactly("OR group must contain at least one condition");
    }

    @Test
    void rawSqlIsAWarning() {
        SelectBuilder query = select(Expr.raw("toStartOfHour(ts)")).from("t").where(raw("x > 1"));
        ValidationResult result = validator.validate(query.node());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "Raw SQL bypasses escaping: toStartOfHour(ts)",
                "Raw SQL bypasses escaping: x > 1");
    }

    @Test
    void offsetWithoutLimitWarns() {
        ValidationResult result = validator.validate(select().from("t").offset(5).node());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly("OFFSET without LIMIT is ignored");
    }

    @Test
    void settingNamesMustBeIdentifiers() {
        ValidationResult result = validator.validate(
                select().from("t").setting("max_threads", 4).setting("x; DROP", 1).node());

        assertThat(result.errors()).containsExactly("Invalid setting name: x; DROP");
    }

    @Test
    void mutationChecks() {
        assertThat(validator.validate(update("t").node()).errors())
                .containsExactly("UPDATE requires at least one SET column");
        assertThat(validator.validate(deleteFrom("").node()).errors())
                .containsExactly("Table name must be a non-empty string");
    }
}
