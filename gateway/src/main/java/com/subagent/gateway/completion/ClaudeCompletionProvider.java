package com.subagent.gateway.completion;

import com.subagent.gateway.claude.ClaudeClient;
import com.subagent.gateway.claude.ClaudeClient.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link CompletionProvider} backed by the Anthropic Messages API.
 *
 * The Messages API has no "system" role inside {@code messages}, so system
 * turns are joined into the top-level system field. The response schema is
 * not forwarded; the prompts already demand a bare JSON object.
 */
@Component
public class ClaudeCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCompletionProvider.class);

    private final ClaudeClient claude;
    private final String       model;

    public ClaudeCompletionProvider(ClaudeClient claude,
                                    @Value("${subagents.llm.model:claude-sonnet-4-5}") String model) {
        this.claude = claude;
        this.model  = model;
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        StringBuilder system = new StringBuilder();
        List<Message> messages = new ArrayList<>();

        for (ConversationTurn turn : options.messages()) {
            switch (turn.role()) {
                case SYSTEM -> {
                    if (!system.isEmpty()) system.append("\n\n");
                    system.append(turn.content());
                }
                case USER      -> messages.add(new Message("user", turn.content()));
                case ASSISTANT -> messages.add(new Message("assistant", turn.content()));
            }
        }
        if (messages.isEmpty()) {
            messages.add(new Message("user", prompt));
        }
        if (options.responseSchema() != null) {
            log.debug("Response schema requested; relying on prompt instructions for JSON output");
        }

        return claude.complete(model, system.isEmpty() ? null : system.toString(),
                messages, options.temperature());
    }
}
