package com.subagent.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named subset of tools that becomes one sub-agent.
 *
 * The same tool may legitimately appear in more than one group. Uniqueness
 * of {@code id} and {@code name} is a partition-level rule enforced by
 * {@link com.subagent.gateway.grouping.ConstraintValidator}, not here.
 *
 * @param complementarityScore how well the tools work together, in [0,1]; may be null
 * @param metadata             free-form extra data carried through persistence; may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolGroup(
        String              id,
        String              name,
        String              description,
        List<Tool>          tools,
        String              systemPrompt,
        Double              complementarityScore,
        Map<String, Object> metadata) {

    public ToolGroup {
        tools    = tools == null ? List.of() : List.copyOf(tools);
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ToolGroup withDescription(String newDescription) {
        return new ToolGroup(id, name, newDescription, tools, systemPrompt, complementarityScore, metadata);
    }

    public ToolGroup withSystemPrompt(String newPrompt) {
        return new ToolGroup(id, name, description, tools, newPrompt, complementarityScore, metadata);
    }

    /** Tool keys in group order. */
    public List<String> toolKeys() {
        return tools.stream().map(Tool::key).toList();
    }
}
