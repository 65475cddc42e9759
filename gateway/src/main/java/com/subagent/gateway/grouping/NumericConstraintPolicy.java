package com.subagent.gateway.grouping;

/**
 * How the validator treats group-count and tools-per-group bounds.
 *
 * STRICT:   a bound violation is a validation error and triggers an outer retry.
 * ADVISORY: a bound violation is logged as a warning; the bounds only steer
 *            the prompts. Coverage and id/name uniqueness stay hard rules.
 */
public enum NumericConstraintPolicy {
    STRICT,
    ADVISORY
}
