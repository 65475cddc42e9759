package com.subagent.gateway.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of running a sub-agent. Exactly one of {@code result} and
 * {@code error} is set; the constructor rejects anything else.
 */
public record AgentResponse(
        String       requestId,
        String       agentId,
        String       result,
        List<String> toolsUsed,
        String       error,
        Instant      timestamp) {

    public AgentResponse {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("AgentResponse needs exactly one of result or error");
        }
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
    }

    public static AgentResponse success(AgentRequest request, String result, List<String> toolsUsed) {
        return new AgentResponse(request.requestId(), request.agentId(),
                result, toolsUsed, null, Instant.now());
    }

    public static AgentResponse failure(AgentRequest request, String error) {
        return new AgentResponse(request.requestId(), request.agentId(),
                null, List.of(), error, Instant.now());
    }

    public boolean isError() { return error != null; }
}
