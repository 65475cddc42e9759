package com.subagent.gateway.model;

import java.util.List;

/**
 * Optional project knowledge fed into the analysis phase of grouping.
 *
 * @param domain      one-line description of the project domain; may be null
 * @param customHints operator-supplied or extracted hints, in order
 * @param fullContent merged project documentation; may be null
 */
public record ProjectContext(String domain, List<String> customHints, String fullContent) {

    public ProjectContext {
        customHints = customHints == null ? List.of() : List.copyOf(customHints);
    }
}
