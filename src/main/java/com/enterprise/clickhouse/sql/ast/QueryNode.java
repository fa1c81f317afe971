package com.enterprise.clickhouse.sql.ast;

/**
 * Root of a statement AST. Nodes are mutable and owned by a single builder.
 */
public sealed interface QueryNode permits SelectNode, InsertNode, UpdateNode, DeleteNode {
}
