package com.enterprise.clickhouse.sql.ir;

/**
 * Normalized, immutable statement ready for rendering. Holds no references
 * to AST objects; built per compilation and then discarded.
 */
public sealed interface QueryIR permits SelectIR, InsertIR, UpdateIR, DeleteIR {
}
