package com.subagent.gateway.grouping;

import com.subagent.gateway.model.GroupingConstraints;
import com.subagent.gateway.model.ToolGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a proposed partition against structural and numeric rules.
 *
 * Checks run in a fixed order and accumulate:
 * <ol>
 *   <li>each group is well-formed (id, name, description, ≥1 tool, score in [0,1])</li>
 *   <li>group ids and group names are pairwise unique</li>
 *   <li>the constraints themselves are well-formed; if not, stop here</li>
 *   <li>group count and tools-per-group bounds, subject to {@link NumericConstraintPolicy}</li>
 * </ol>
 * Deterministic and free of side effects apart from advisory warnings in the log.
 */
@Component
public class ConstraintValidator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintValidator.class);

    private final NumericConstraintPolicy policy;

    public ConstraintValidator(
            @Value("${subagents.grouping.numeric-policy:STRICT}") NumericConstraintPolicy policy) {
        this.policy = policy;
    }

    public NumericConstraintPolicy policy() {
        return policy;
    }

    public ValidationResult validate(List<ToolGroup> groups, GroupingConstraints constraints) {
        List<String> errors = new ArrayList<>();

        // 1. Per-group shape
        for (int i = 0; i < groups.size(); i++) {
            checkGroup(i, groups.get(i), errors);
        }

        // 2. Uniqueness
        Set<String> duplicateIds   = duplicates(groups.stream().filter(g -> g != null).map(ToolGroup::id).toList());
        Set<String> duplicateNames = duplicates(groups.stream().filter(g -> g != null).map(ToolGroup::name).toList());
        if (!duplicateIds.isEmpty()) {
            errors.add("Group IDs are not unique: " + String.join(", ", duplicateIds));
        }
        if (!duplicateNames.isEmpty()) {
            errors.add("Group names are not unique: " + String.join(", ", duplicateNames));
        }

        // 3. The policy itself; numeric checks are meaningless against a broken one
        List<String> constraintErrors = checkConstraints(constraints);
        if (!constraintErrors.isEmpty()) {
            errors.addAll(constraintErrors);
            return ValidationResult.of(errors);
        }

        // 4. Numeric bounds
        List<String> numeric = numericViolations(groups, constraints);
        if (policy == NumericConstraintPolicy.STRICT) {
            errors.addAll(numeric);
        } else {
            numeric.forEach(v -> log.warn("Advisory constraint not met: {}", v));
        }

        return ValidationResult.of(errors);
    }

    /**
     * Errors describing a malformed constraint object; empty when it is usable.
     */
    public List<String> checkConstraints(GroupingConstraints c) {
        List<String> errors = new ArrayList<>();
        if (c == null) {
            errors.add("Constraints: constraints are required");
            return errors;
        }
        if (c.minToolsPerGroup() < 1) {
            errors.add("Constraints.minToolsPerGroup: must be at least 1 (was " + c.minToolsPerGroup() + ")");
        }
        if (c.maxToolsPerGroup() < c.minToolsPerGroup()) {
            errors.add("Constraints.maxToolsPerGroup: must be >= minToolsPerGroup (%d < %d)"
                    .formatted(c.maxToolsPerGroup(), c.minToolsPerGroup()));
        }
        if (c.minGroups() < 1) {
            errors.add("Constraints.minGroups: must be at least 1 (was " + c.minGroups() + ")");
        }
        if (c.maxGroups() < c.minGroups()) {
            errors.add("Constraints.maxGroups: must be >= minGroups (%d < %d)"
                    .formatted(c.maxGroups(), c.minGroups()));
        }
        return errors;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void checkGroup(int index, ToolGroup group, List<String> errors) {
        String at = "Group[" + index + "]";
        if (group == null) {
            errors.add(at + ": group is missing");
            return;
        }
        if (isBlank(group.id())) {
            errors.add(at + ".id: Group ID is required and must be non-empty");
        }
        if (isBlank(group.name())) {
            errors.add(at + ".name: Group name is required and must be non-empty");
        }
        if (isBlank(group.description())) {
            errors.add(at + ".description: Group description is required and must be non-empty");
        }
        if (group.tools().isEmpty()) {
            errors.add(at + ".tools: Tool group must contain at least one tool");
        }
        Double score = group.complementarityScore();
        if (score != null && (score.isNaN() || score < 0.0 || score > 1.0)) {
            errors.add(at + ".complementarityScore: Complementarity score must be between 0 and 1 (was " + score + ")");
        }
    }

    private static List<String> numericViolations(List<ToolGroup> groups, GroupingConstraints c) {
        List<String> violations = new ArrayList<>();
        if (groups.size() < c.minGroups()) {
            violations.add("Too few groups: %d (minimum constraint: %d)".formatted(groups.size(), c.minGroups()));
        }
        if (groups.size() > c.maxGroups()) {
            violations.add("Too many groups: %d (maximum constraint: %d)".formatted(groups.size(), c.maxGroups()));
        }
        for (ToolGroup g : groups) {
            if (g == null) continue;
            int n = g.tools().size();
            if (n < c.minToolsPerGroup()) {
                violations.add("Group \"%s\" has too few tools: %d (minimum constraint: %d)"
                        .formatted(g.name(), n, c.minToolsPerGroup()));
            }
            if (n > c.maxToolsPerGroup()) {
                violations.add("Group \"%s\" has too many tools: %d (maximum constraint: %d)"
                        .formatted(g.name(), n, c.maxToolsPerGroup()));
            }
        }
        return violations;
    }

    private static Set<String> duplicates(List<String> values) {
        Set<String> seen = new HashSet<>();
        Set<String> dups = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !seen.add(v)) dups.add(v);
        }
        return dups;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
