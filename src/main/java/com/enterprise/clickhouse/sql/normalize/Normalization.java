package com.enterprise.clickhouse.sql.normalize;

import com.enterprise.clickhouse.sql.ir.QueryIR;
import com.enterprise.clickhouse.sql.validation.ValidationResult;

/**
 * Result of {@link QueryNormalizer#normalize}. {@code ir} is null whenever
 * {@code validation} is invalid.
 */
public record Normalization(QueryIR ir, ValidationResult validation) {}
