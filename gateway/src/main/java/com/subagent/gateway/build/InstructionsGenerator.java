package com.subagent.gateway.build;

import com.subagent.gateway.completion.CompletionOptions;
import com.subagent.gateway.completion.CompletionProvider;
import com.subagent.gateway.completion.Conversation;
import com.subagent.gateway.completion.ConversationTurn;
import com.subagent.gateway.model.ProjectContext;
import com.subagent.gateway.model.ToolGroup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Writes the server-level usage text that MCP clients receive on initialize:
 * which agent to pick for which kind of task, and common mistakes to avoid.
 */
@Component
public class InstructionsGenerator {

    static final int    MAX_CONTEXT_CHARS = 2000;
    static final double TEMPERATURE       = 0.4;

    static final String SYSTEM = """
            You are an expert at writing clear, actionable instructions for AI agents. \
            Write professional documentation that helps LLMs use MCP servers effectively.""";

    /**
     * @return trimmed instruction text
     * @throws RuntimeException whatever the completion provider throws
     */
    public String generate(List<ToolGroup> groups, CompletionProvider completion, ProjectContext context) {
        String prompt = prompt(groups, context);
        Conversation conversation = Conversation.empty()
                .append(ConversationTurn.system(SYSTEM))
                .append(ConversationTurn.user(prompt));
        String reply = completion.complete(prompt, CompletionOptions.of(conversation, TEMPERATURE));
        return reply == null ? "" : reply.strip();
    }

    static String prompt(List<ToolGroup> groups, ProjectContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                Write usage instructions for an MCP server whose tools are specialised sub-agents.
                Each sub-agent owns one group of upstream tools and is called as agent_<id>.

                AVAILABLE AGENT GROUPS:
                """);
        sb.append(groupsSummary(groups)).append("\n");

        if (context != null && context.fullContent() != null) {
            String content = context.fullContent();
            sb.append("\nPROJECT CONTEXT:\n")
              .append(content, 0, Math.min(content.length(), MAX_CONTEXT_CHARS))
              .append("\n");
        }

        sb.append("""

                The instructions should:
                1. Explain what this server is for and what its agents can do
                2. Say which agent to call for which kind of task
                3. Give best practices for delegating work to the agents
                4. Warn about common mistakes, such as calling an agent for work outside its group
                5. Keep a professional, instructional tone

                Aim for 300-500 words. Reply with the instructions only.""");
        return sb.toString();
    }

    static String groupsSummary(List<ToolGroup> groups) {
        return IntStream.range(0, groups.size())
                .mapToObj(i -> {
                    ToolGroup g = groups.get(i);
                    return "%d. %s (agent_%s, %d tools)\n   Purpose: %s\n   Tools: %s".formatted(
                            i + 1, g.name(), g.id(), g.tools().size(), g.description(),
                            String.join(", ", g.toolKeys()));
                })
                .collect(Collectors.joining("\n\n"));
    }
}
