package com.enterprise.clickhouse.sql.dialect;

/**
 * Clause position of an identifier. Function-call text stays unquoted in a
 * SELECT list but is quoted inside predicates.
 */
public enum IdentifierContext {
    SELECT, PREDICATE
}
