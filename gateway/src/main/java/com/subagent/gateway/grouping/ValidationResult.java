package com.subagent.gateway.grouping;

import java.util.List;

/**
 * Outcome of {@link ConstraintValidator#validate}. {@code valid} is true iff
 * {@code errors} is empty.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
