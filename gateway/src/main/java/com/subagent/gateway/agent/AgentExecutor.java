package com.subagent.gateway.agent;

import com.subagent.gateway.model.AgentRequest;
import com.subagent.gateway.model.AgentResponse;
import com.subagent.gateway.model.SubAgent;

/**
 * Runs one request on one sub-agent. Implementations report failures through
 * {@link AgentResponse#failure} rather than by throwing.
 */
public interface AgentExecutor {

    AgentResponse execute(SubAgent agent, AgentRequest request);
}
