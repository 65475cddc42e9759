package com.subagent.gateway.grouping;

import java.util.List;
import java.util.Map;

/**
 * JSON schema of the final-assignment reply, attached to the phase-3
 * completion call for providers that support structured output.
 */
public final class GroupingResponseSchema {

    private GroupingResponseSchema() {}

    public static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "required", List.of("groups"),
            "additionalProperties", false,
            "properties", Map.of(
                    "groups", Map.of(
                            "type", "array",
                            "items", Map.of(
                                    "type", "object",
                                    "required", List.of("id", "name", "description", "toolKeys",
                                                        "systemPrompt", "complementarityScore"),
                                    "additionalProperties", false,
                                    "properties", Map.of(
                                            "id", field("string", "Unique kebab-case identifier of the group"),
                                            "name", field("string", "Human-readable group name"),
                                            "description", field("string",
                                                    "When and how to use this agent, and why its tools belong together"),
                                            "toolKeys", Map.of(
                                                    "type", "array",
                                                    "items", Map.of("type", "string"),
                                                    "description", "Tool keys, each exactly \"serverName:toolName\""),
                                            "systemPrompt", field("string",
                                                    "System prompt for the agent that runs this group's tools"),
                                            "complementarityScore", Map.of(
                                                    "type", "number",
                                                    "minimum", 0,
                                                    "maximum", 1,
                                                    "description", "0.0-1.0, how well the tools complement each other"))))));

    private static Map<String, Object> field(String type, String description) {
        return Map.of("type", type, "description", description);
    }
}
