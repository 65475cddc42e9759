package com.subagent.gateway.model;

import java.time.Instant;
import java.util.Map;

/**
 * A single task addressed to one sub-agent.
 *
 * @param context optional caller data, passed through unexamined; may be null
 */
public record AgentRequest(
        String              requestId,
        String              agentId,
        String              prompt,
        Map<String, Object> context,
        Instant             timestamp) {}
