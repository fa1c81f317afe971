package com.enterprise.clickhouse.sql.builder;

import java.util.Map;

/**
 * Entry points for every statement kind.
 * Designed to be imported statically alongside
 * {@link com.enterprise.clickhouse.sql.condition.Conditions}.
 *
 * <pre>{@code
 * import static com.enterprise.clickhouse.sql.builder.QueryBuilders.*;
 * import static com.enterprise.clickhouse.sql.condition.Conditions.*;
 *
 * select("id").from("users").where(where("id", in(1, 2, 3))).toSQL();
 * }</pre>
 */
public final class QueryBuilders {

    private QueryBuilders() {}

    public static SelectBuilder select(Object... columns) {
        return SelectBuilder.query().columns(columns);
    }

    public static SelectBuilder select(Map<String, ?> aliasedColumns) {
        return SelectBuilder.query().columns(aliasedColumns);
    }

    public static InsertBuilder insertInto(String table) {
        return InsertBuilder.into(table);
    }

    public static UpdateBuilder update(String table) {
        return UpdateBuilder.table(table);
    }

    public static DeleteBuilder deleteFrom(String table) {
        return DeleteBuilder.from(table);
    }
}
