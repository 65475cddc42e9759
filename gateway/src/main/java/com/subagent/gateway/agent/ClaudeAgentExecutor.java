package com.subagent.gateway.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagent.gateway.claude.ClaudeClient;
import com.subagent.gateway.model.AgentRequest;
import com.subagent.gateway.model.AgentResponse;
import com.subagent.gateway.model.SubAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single-shot execution on the Anthropic Messages API: the sub-agent's
 * system prompt plus the caller's prompt, with any request context appended
 * as JSON. The model answers from its prompt; tools are described to it but
 * not invoked on its behalf.
 */
@Component
public class ClaudeAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(ClaudeAgentExecutor.class);

    private final ClaudeClient claude;
    private final ObjectMapper objectMapper;

    public ClaudeAgentExecutor(ClaudeClient claude, ObjectMapper objectMapper) {
        this.claude       = claude;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentResponse execute(SubAgent agent, AgentRequest request) {
        if (agent.toolGroup().tools().isEmpty()) {
            return AgentResponse.failure(request, "No tools available in this group");
        }
        try {
            String reply = claude.complete(
                    agent.llmProvider().model(),
                    agent.systemPrompt(),
                    List.of(new ClaudeClient.Message("user", userMessage(request))),
                    null);
            return AgentResponse.success(request, reply, List.of());
        } catch (RuntimeException e) {
            log.warn("Sub-agent '{}' failed on request {}: {}", agent.id(), request.requestId(), e.getMessage());
            return AgentResponse.failure(request, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    String userMessage(AgentRequest request) {
        if (request.context() == null || request.context().isEmpty()) {
            return request.prompt();
        }
        try {
            return request.prompt() + "\n\nContext:\n"
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.context());
        } catch (JsonProcessingException e) {
            // Unserialisable context is dropped rather than failing the call.
            log.warn("Could not serialise context for request {}: {}", request.requestId(), e.getMessage());
            return request.prompt();
        }
    }
}
