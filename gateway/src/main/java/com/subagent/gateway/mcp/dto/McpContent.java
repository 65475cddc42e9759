package com.subagent.gateway.mcp.dto;

public record McpContent(String type, String text) {

    public static McpContent text(String text) {
        return new McpContent("text", text);
    }
}
