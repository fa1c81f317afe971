package com.enterprise.clickhouse.sql.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating a query. Errors make the query uncompilable;
 * warnings are advisory only.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /** Copy with one more error, always invalid. */
    public ValidationResult withError(String error) {
        List<String> merged = new ArrayList<>(errors);
        merged.add(error);
        return of(merged, warnings);
    }
}
