package com.subagent.gateway.mcp.dto;

import java.util.Map;

/** One entry of a {@code tools/list} result. */
public record McpTool(String name, String description, Map<String, Object> inputSchema) {}
