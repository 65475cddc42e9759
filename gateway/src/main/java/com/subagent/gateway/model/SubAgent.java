package com.subagent.gateway.model;

/**
 * A tool group bound to an LLM provider and an execution prompt.
 * Created once when the registry is built and never mutated afterwards.
 */
public record SubAgent(
        String            id,
        String            name,
        String            description,
        ToolGroup         toolGroup,
        LlmProviderConfig llmProvider,
        String            systemPrompt) {}
