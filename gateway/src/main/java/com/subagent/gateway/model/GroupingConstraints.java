package com.subagent.gateway.model;

/**
 * Numeric shape requested for a partition.
 *
 * Supplied once per build run. Whether the bounds are hard errors or only
 * advisory is decided by the validator's
 * {@link com.subagent.gateway.grouping.NumericConstraintPolicy}.
 */
public record GroupingConstraints(
        int minToolsPerGroup,
        int maxToolsPerGroup,
        int minGroups,
        int maxGroups) {

    public static final GroupingConstraints DEFAULTS = new GroupingConstraints(5, 20, 3, 10);
}
