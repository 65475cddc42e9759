package com.subagent.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool discovered on an upstream MCP server.
 *
 * Tool names are only unique per server, so the identity used everywhere
 * (prompts, toolKeys in the grouping reply, coverage checks) is
 * {@code serverName:name}; see {@link #key()}.
 *
 * @param serverName  the upstream server that exposes this tool
 * @param name        tool name as reported by that server
 * @param description free-text description shown to the LLM
 * @param inputSchema JSON schema of the tool's arguments, kept opaque
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Tool(
        String              serverName,
        String              name,
        String              description,
        Map<String, Object> inputSchema) {

    public Tool {
        // Schemas are opaque JSON and may carry null values
        inputSchema = inputSchema == null
                ? Map.of("type", "object")
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
    }

    /** The {@code serverName:name} identity key. */
    public String key() {
        return serverName + ":" + name;
    }
}
