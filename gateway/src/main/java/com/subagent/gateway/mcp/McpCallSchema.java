package com.subagent.gateway.mcp;

/**
 * How a {@code tools/call} identifies the sub-agent it targets.
 *
 * Older MCP clients of this gateway send an explicit {@code agentId}
 * argument; newer ones rely on the tool name alone.
 */
public enum McpCallSchema {
    /** Agent id is the tool name without its {@code agent_} prefix. Only {@code prompt} is required. */
    PROMPT_ONLY,
    /** Agent id comes from the {@code agentId} argument; both it and {@code prompt} are required. */
    PROMPT_AND_AGENT_ID
}
