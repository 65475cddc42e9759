package com.subagent.gateway.mcp.dto;

import java.util.List;

public record McpToolsListResult(List<McpTool> tools) {}
