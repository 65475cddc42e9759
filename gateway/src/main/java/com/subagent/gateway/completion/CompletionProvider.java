package com.subagent.gateway.completion;

/**
 * Minimal text-completion contract consumed by the grouping orchestrator.
 *
 * Implementations must not cache replies: a retry asks the same question
 * again on purpose.
 */
public interface CompletionProvider {

    /**
     * @param prompt  the latest user prompt; used on its own when
     *                {@code options.messages()} is empty
     * @param options conversation, temperature and optional response schema
     * @return the assistant's reply text
     */
    String complete(String prompt, CompletionOptions options);
}
