package com.subagent.gateway.mcp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a {@code tools/call}. Agent failures are reported here with
 * {@code isError=true}, never as a JSON-RPC error.
 */
public record McpToolCallResult(List<McpContent> content,
                                @JsonProperty("isError") boolean error) {

    public static McpToolCallResult success(String text) {
        return new McpToolCallResult(List.of(McpContent.text(text)), false);
    }

    public static McpToolCallResult error(String text) {
        return new McpToolCallResult(List.of(McpContent.text(text)), true);
    }

    /** Text of the first content block, or empty. */
    public String text() {
        return content.isEmpty() ? "" : content.get(0).text();
    }
}
