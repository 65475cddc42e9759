package com.subagent.gateway.model;

/**
 * Which LLM a sub-agent runs on. Only the Anthropic provider ships with
 * this gateway; the type is carried so persisted agents stay self-describing.
 */
public record LlmProviderConfig(String type, String model) {}
