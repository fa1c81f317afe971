package com.enterprise.clickhouse.sql;

import com.enterprise.clickhouse.sql.ast.Expr;
import com.enterprise.clickhouse.sql.ast.JoinType;
import com.enterprise.clickhouse.sql.ast.SortDirection;
import com.enterprise.clickhouse.sql.builder.SelectBuilder;
import com.enterprise.clickhouse.sql.builder.SqlResult;
import com.enterprise.clickhouse.sql.error.IdentifierException;
import com.enterprise.clickhouse.sql.error.ValidationException;
import com.enterprise.clickhouse.sql.expression.Cases;
import com.enterprise.clickhouse.sql.expression.SqlFunctions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.enterprise.clickhouse.sql.builder.QueryBuilders.select;
import static com.enterprise.clickhouse.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectBuilderTest {

    // ==================== Columns / FROM ====================

    @Test
    void selectsQuotedColumns() {
        assertThat(select("id", "name", "email").from("users").toSQL().sql())
                .isEqualTo("SELECT `id`, `name`, `email` FROM `users`");
    }

    @Test
    void emptyColumnListSelectsStar() {
        assertThat(select().from("users").toSQL().sql()).isEqualTo("SELECT * FROM `users`");
    }

    @Test
    void paramsAreAlwaysEmpty() {
        SqlResult result = select("id").from("users").where(where("id", eq(1))).toSQL();
        assertThat(result.params()).isEmpty();
    }

    @Test
    void aliasMapWithScalarSubquery() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", "id");
        columns.put("avgAge", select("avg(age)").from("users"));

        assertThat(select(columns).from("users").toSQL().sql())
                .isEqualTo("SELECT `id` AS `id`, (SELECT avg(age) FROM `users`) AS `avgAge` FROM `users`");
    }

    @Test
    void fromSubqueryWithAlias() {
        assertThat(select("x").from(select("x").from("t"), "sub").toSQL().sql())
                .isEqualTo("SELECT `x` FROM (SELECT `x` FROM `t`) AS `sub`");
    }

    @Test
    void tupleAndArrayColumnsKeepTheirBrackets() {
        assertThat(select(new Expr.Tuple(List.of(1, "a")), new Expr.ArrayValue(List.of(1, 2))).from("t").toSQL().sql())
                .isEqualTo("SELECT (1, 'a'), [1, 2] FROM `t`");
    }

    // ==================== WHERE combinations ====================

    @Test
    void repeatedWhereCallsAndTogetherWithoutParens() {
        String sql = select().from("users")
                .where(where("status", eq("active")))
                .where(where("age", gt(18)))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `users` WHERE `status` = 'active' AND `age` > 18");
    }

    @Test
    void orIsAlwaysParenthesized() {
        String sql = select().from("users")
                .where(or(where("status", eq("active")), where("status", eq("pending"))))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `users` WHERE (`status` = 'active' OR `status` = 'pending')");
    }

    @Test
    void notWrapsItsChild() {
        String sql = select().from("users").where(not(where("status", eq("inactive")))).toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `users` WHERE NOT (`status` = 'inactive')");
    }

    @Test
    void topLevelAndCombinatorWithNestedOr() {
        String sql = select().from("users")
                .where(and(
                        where("status", eq("active")),
                        or(where("age", gt(18)), where("age", lt(65)))))
                .toSQL().sql();
        assertThat(sql).isEqualTo(
                "SELECT * FROM `users` WHERE `status` = 'active' AND (`age` > 18 OR `age` < 65)");
    }

    @Test
    void topLevelAndCombinatorOfSimplePredicates() {
        String sql = select().from("t").where(and(where("a", eq(1)), where("b", eq(2)))).toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `t` WHERE `a` = 1 AND `b` = 2");
    }

    @Test
    void combinatorsUnderColumnsDistributeTheColumn() {
        String sql = select().from("users")
                .where(where("age", and(gt(18), lt(65)))
                        .with("status", or(eq("active"), eq("pending"))))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `users` WHERE (`age` > 18 AND `age` < 65)"
                + " AND (`status` = 'active' OR `status` = 'pending')");
    }

    @Test
    void combinatorAndInsideOrIsParenthesized() {
        String sql = select().from("t")
                .where(or(and(where("a", eq(1)), where("b", eq(2))), where("c", eq(3))))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `t` WHERE ((`a` = 1 AND `b` = 2) OR `c` = 3)");
    }

    @Test
    void bareComparisonOperatorIsRejected() {
        assertThatThrownBy(() -> select().from("t").where(eq(1)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("bare Operator");
    }

    // ==================== Operators ====================

    @Test
    void inList() {
        assertThat(select("id").from("users").where(where("id", in(1, 2, 3))).toSQL().sql())
                .isEqualTo("SELECT `id` FROM `users` WHERE `id` IN (1, 2, 3)");
    }

    @Test
    void emptyInListMatchesNothing() {
        assertThat(select("id").from("users").where(where("id", in(List.of()))).toSQL().sql())
                .isEqualTo("SELECT `id` FROM `users` WHERE `id` IN (SELECT 1 WHERE 0=1)");
    }

    @Test
    void inSubquery() {
        String sql = select("id").from("users")
                .where(where("id", in(select("user_id").from("orders").where(where("status", eq("completed"))))))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT `id` FROM `users` WHERE `id` IN "
                + "(SELECT `user_id` FROM `orders` WHERE `status` = 'completed')");
    }

    @Test
    void existsHasNoLeftOperand() {
        String sql = select().from("users")
                .where(exists(select("1").from("orders").where(where("orders.user_id", eqCol("users.id")))))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `users` WHERE EXISTS "
                + "(SELECT 1 FROM `orders` WHERE `orders`.`user_id` = `users`.`id`)");
    }

    @Test
    void betweenAndNullChecks() {
        String sql = select().from("users")
                .where(where("age", between(18, 65)).with("deleted_at", isNull()).with("email", isNotNull()))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT * FROM `users` WHERE `age` BETWEEN 18 AND 65"
                + " AND `deleted_at` IS NULL AND `email` IS NOT NULL");
    }

    @Test
    void arrayMembershipUsesLambdas() {
        assertThat(select().from("posts").where(where("tags", hasAny(List.of("a", "b")))).toSQL().sql())
                .isEqualTo("SELECT * FROM `posts` WHERE arrayExists(`i` -> (`i` IN ('a', 'b')), `tags`)");
        assertThat(select().from("posts").where(where("tags", hasAll(List.of("a", "b")))).toSQL().sql())
                .isEqualTo("SELECT * FROM `posts` WHERE arrayAll(`i` -> (`i` IN ('a', 'b')), `tags`)");
    }

    @Test
    void startsWithEscapesWildcards() {
        assertThat(select().from("deals").where(where("name", startsWith("50%_off"))).toSQL().sql())
                .isEqualTo("SELECT * FROM `deals` WHERE `name` LIKE '50\\%\\_off%'");
    }

    @Test
    void rawPredicateIsEmittedVerbatimWithWarning() {
        SelectBuilder query = select().from("events").where(raw("toYear(created) = 2024"));

        assertThat(query.toSQL().sql()).isEqualTo("SELECT * FROM `events` WHERE toYear(created) = 2024");
        assertThat(query.validate().warnings()).hasSize(1);
        assertThat(query.validate().valid()).isTrue();
    }

    // ==================== Joins / CTE / UNION ====================

    @Test
    void innerJoinWithQualifiedColumns() {
        String sql = select("u.id", "u.name", "p.title")
                .from("users", "u")
                .innerJoin("posts", where("u.id", eqCol("p.user_id")))
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT `u`.`id`, `u`.`name`, `p`.`title` FROM `users` AS `u`"
                + " INNER JOIN `posts` ON `u`.`id` = `p`.`user_id`");
    }

    @Test
    void leftJoinWithAlias() {
        String sql = select("u.id").from("users", "u")
                .leftJoin("orders", "o", where("u.id", eqCol("o.user_id")))
                .toSQL().sql();
        assertThat(sql).isEqualTo(
                "SELECT `u`.`id` FROM `users` AS `u` LEFT JOIN `orders` AS `o` ON `u`.`id` = `o`.`user_id`");
    }

    @Test
    void withClauseComesFirst() {
        String sql = select("id")
                .with("active", select("id").from("users").where(where("status", eq("active"))))
                .from("active")
                .toSQL().sql();
        assertThat(sql).isEqualTo("WITH `active` AS (SELECT `id` FROM `users` WHERE `status` = 'active')"
                + " SELECT `id` FROM `active`");
    }

    @Test
    void unionAllAppendsQuery() {
        assertThat(select("id").from("a").unionAll(select("id").from("b")).toSQL().sql())
                .isEqualTo("SELECT `id` FROM `a` UNION ALL SELECT `id` FROM `b`");
    }

    @Test
    void unionWithItselfEmbedsTheQueryAsItWas() {
        SelectBuilder query = select("id").from("a");
        query.unionAll(query);

        assertThat(query.validate().valid()).isTrue();
        assertThat(query.toSQL().sql()).isEqualTo("SELECT `id` FROM `a` UNION ALL SELECT `id` FROM `a`");
    }

    // ==================== Embedded builders ====================

    @Test
    void subqueryIsFixedWhenEmbedded() {
        SelectBuilder orders = select("user_id").from("orders");
        SelectBuilder users = select("id").from("users").where(where("id", in(orders)));

        orders.where(where("status", eq("cancelled")));

        assertThat(users.toSQL().sql())
                .isEqualTo("SELECT `id` FROM `users` WHERE `id` IN (SELECT `user_id` FROM `orders`)");
        assertThat(orders.toSQL().sql())
                .isEqualTo("SELECT `user_id` FROM `orders` WHERE `status` = 'cancelled'");
    }

    @Test
    void fromJoinAndWithSourcesAreFixedWhenEmbedded() {
        SelectBuilder recent = select("id").from("events");
        SelectBuilder query = select("r.id")
                .with("cte", recent)
                .from(recent, "r")
                .join(JoinType.INNER, recent, "j", where("r.id", eqCol("j.id")));

        recent.limit(1);

        assertThat(query.toSQL().sql()).doesNotContain("LIMIT");
    }

    // ==================== Clause order ====================

    @Test
    void fullClauseOrder() {
        String sql = select("user_id", "count(*)")
                .from("events")
                .prewhere(where("date", gte(LocalDate.of(2024, 1, 1))))
                .where(where("type", eq("click")))
                .groupBy("user_id")
                .having(where("count(*)", gt(10)))
                .orderBy("user_id", SortDirection.DESC)
                .limit(10, 20)
                .withFinal()
                .settings(Map.of("max_threads", 4))
                .toSQL().sql();

        assertThat(sql).isEqualTo("SELECT `user_id`, count(*) FROM `events`"
                + " PREWHERE `date` >= '2024-01-01 00:00:00'"
                + " WHERE `type` = 'click'"
                + " GROUP BY `user_id`"
                + " HAVING `count(*)` > 10"
                + " ORDER BY `user_id` DESC"
                + " LIMIT 10 OFFSET 20"
                + " FINAL"
                + " SETTINGS max_threads = 4");
    }

    @Test
    void compilationIsDeterministic() {
        SelectBuilder query = select("id").from("users").where(where("id", in(1, 2)));
        assertThat(query.toSQL().sql()).isEqualTo(query.toSQL().sql());
    }

    // ==================== Expressions ====================

    @Test
    void caseExpressionInSelectList() {
        String sql = select(Cases.when(where("amount", gt(1000)), "High")
                        .when(where("amount", gt(100)), "Medium")
                        .orElse("Low")
                        .as("tier"))
                .from("orders")
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT CASE WHEN `amount` > 1000 THEN 'High'"
                + " WHEN `amount` > 100 THEN 'Medium' ELSE 'Low' END AS `tier` FROM `orders`");
    }

    @Test
    void functionsAndCast() {
        String sql = select(SqlFunctions.count().as("total"),
                        SqlFunctions.cast("price", "Decimal(10, 2)").as("p"))
                .from("orders")
                .toSQL().sql();
        assertThat(sql).isEqualTo("SELECT count(*) AS `total`, CAST(`price` AS Decimal(10, 2)) AS `p` FROM `orders`");
    }

    // ==================== Failures ====================

    @Test
    void invalidQueryThrowsWithAllErrors() {
        assertThatThrownBy(() -> select("").from("").toSQL())
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Query validation failed: ")
                .hasMessageContaining("Column name must be a non-empty string")
                .hasMessageContaining("Table name must be a non-empty string");
    }

    @Test
    void malformedQualifiedIdentifierIsRejected() {
        assertThatThrownBy(() -> select("a.b.c").from("t").toSQL())
                .isInstanceOf(IdentifierException.class)
                .hasMessageContaining("table.column format expected");
    }
}
