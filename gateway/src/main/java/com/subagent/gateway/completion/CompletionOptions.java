package com.subagent.gateway.completion;

import java.util.List;
import java.util.Map;

/**
 * Per-call options for a {@link CompletionProvider}.
 *
 * @param messages       the full conversation to send; empty means "prompt only"
 * @param temperature    sampling temperature, or null for the provider default
 * @param responseSchema JSON schema the reply should follow, or null
 */
public record CompletionOptions(
        List<ConversationTurn> messages,
        Double                 temperature,
        Map<String, Object>    responseSchema) {

    public CompletionOptions {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static CompletionOptions of(Conversation conversation, double temperature) {
        return new CompletionOptions(conversation.turns(), temperature, null);
    }

    public CompletionOptions withResponseSchema(Map<String, Object> schema) {
        return new CompletionOptions(messages, temperature, schema);
    }
}
