package com.subagent.gateway.agent;

import com.subagent.gateway.model.AgentRequest;
import com.subagent.gateway.model.SubAgent;

import java.util.Optional;

/**
 * Maps a request to the sub-agent it names. Lookup is exact; there is no
 * fuzzy matching or fallback agent. Neither method throws.
 */
public class SubAgentRouter {

    private final SubAgentRegistry registry;

    public SubAgentRouter(SubAgentRegistry registry) {
        this.registry = registry;
    }

    public Optional<SubAgent> route(AgentRequest request) {
        if (request == null) return Optional.empty();
        return registry.get(request.agentId());
    }

    /** True when requestId, agentId and prompt are all present and non-blank. */
    public boolean validateRequest(AgentRequest request) {
        return request != null
                && hasText(request.requestId())
                && hasText(request.agentId())
                && hasText(request.prompt());
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
