package com.subagent.gateway.grouping;

import com.subagent.gateway.model.GroupingConstraints;
import com.subagent.gateway.model.ProjectContext;
import com.subagent.gateway.model.Tool;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Prompt text for the three grouping phases and for corrective feedback.
 *
 * Phase 1 (analysis) and phase 2 (strategy) ask for free text that is only
 * ever read back by the LLM. Phase 3 asks for the strict JSON object that
 * {@link GroupingReplyParser} decodes.
 */
public final class GroupingPrompts {

    /** Project documentation beyond this many characters is cut off. */
    static final int MAX_DOC_CHARS = 4000;

    private GroupingPrompts() {}

    /**
     * Group-count window handed to the LLM: the configured bounds narrowed
     * by what the tool count allows at the configured group sizes.
     */
    record GroupCountRange(int min, int max) {

        static GroupCountRange of(int toolCount, GroupingConstraints c) {
            int needed  = (int) Math.ceil((double) toolCount / c.maxToolsPerGroup());
            int min     = Math.min(Math.max(c.minGroups(), needed), c.maxGroups());
            int fitting = toolCount / c.minToolsPerGroup();
            int max     = Math.max(min, Math.min(c.maxGroups(), fitting));
            return new GroupCountRange(min, max);
        }
    }

    // ------------------------------------------------------------------
    // Phase 1: analysis
    // ------------------------------------------------------------------

    static final String ANALYSIS_SYSTEM = """
            You are a software architect studying a development project and the tools
            available to it. Work out what kind of project this is, which workflows its
            developers follow, and which tools naturally belong together. Your analysis
            will be used to split the tools into specialised agents.""";

    static String analysisPrompt(List<Tool> tools, ProjectContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analyse this project and its ").append(tools.size()).append(" available tools.\n\n");
        sb.append("AVAILABLE TOOLS:\n");
        for (int i = 0; i < tools.size(); i++) {
            Tool t = tools.get(i);
            sb.append(i + 1).append(". \"").append(t.key()).append("\"\n")
              .append("   Description: ").append(nullToEmpty(t.description())).append("\n\n");
        }

        if (context != null) {
            if (context.fullContent() != null && !context.fullContent().isBlank()) {
                String docs = context.fullContent();
                if (docs.length() > MAX_DOC_CHARS) {
                    docs = docs.substring(0, MAX_DOC_CHARS) + "\n\n[... content truncated ...]";
                }
                sb.append("PROJECT DOCUMENTATION:\n").append(docs).append("\n\n");
            }
            if (context.domain() != null && !context.domain().isBlank()) {
                sb.append("PROJECT DOMAIN: ").append(context.domain()).append("\n\n");
            }
            if (!context.customHints().isEmpty()) {
                sb.append("PROJECT HINTS:\n");
                context.customHints().forEach(h -> sb.append("- ").append(h).append("\n"));
                sb.append("\n");
            }
        }

        sb.append("""
                Cover the following in your analysis:
                1. Project characteristics: project type, languages and frameworks, visible conventions.
                2. Workflows: the main development tasks and the order they usually happen in.
                3. Tool relationships: which tools are used together, which are foundational,
                   which are specialised, and what clusters they form.
                4. Domain specifics: terminology or constraints that should shape the grouping.

                Be concrete. Refer to tools by their exact "server:tool" key.""");
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Phase 2: strategy
    // ------------------------------------------------------------------

    static String strategyPrompt(List<Tool> tools, GroupingConstraints c) {
        GroupCountRange range = GroupCountRange.of(tools.size(), c);
        return """
                Based on your analysis, propose a grouping strategy.

                CONSTRAINTS:
                - Total tools: %d
                - Number of groups: %d-%d
                - Tools per group: %d-%d

                Describe:
                1. The theme of each group and the workflow it serves.
                2. How the tools are distributed, keeping group sizes inside the limits.
                3. When a developer should call each agent, and which agents are used in sequence.

                Do not produce the final JSON yet; describe the plan in prose."""
                .formatted(tools.size(), range.min(), range.max(),
                           c.minToolsPerGroup(), c.maxToolsPerGroup());
    }

    // ------------------------------------------------------------------
    // Phase 3: final assignment
    // ------------------------------------------------------------------

    static String finalSystemPrompt(List<Tool> tools, GroupingConstraints c) {
        GroupCountRange range = GroupCountRange.of(tools.size(), c);
        return """
                You organise tools into specialised agent groups under strict numeric rules.

                REQUIREMENTS:
                1. Produce between %d and %d groups.
                2. Every group holds between %d and %d tools.
                3. Every one of the %d tools appears in at least one group. A tool may sit in a
                   second group only when it clearly serves that group's workflow too.
                4. A tool key appears at most once inside the same group.
                5. Group ids and group names are unique.

                OUTPUT FORMAT (a single JSON object, nothing before or after it):
                {
                  "groups": [
                    {
                      "id": "kebab-case-identifier",
                      "name": "Descriptive Name",
                      "description": "When and how to use this agent",
                      "toolKeys": ["server:tool1", "server:tool2"],
                      "systemPrompt": "Instructions for the agent that runs these tools",
                      "complementarityScore": 0.85
                    }
                  ]
                }

                DESCRIPTIONS must tell another LLM when to call the agent ("Use this agent when..."),
                where it fits in a larger workflow, and how its tools work together.

                SYSTEM PROMPTS must tell the agent to use its tools to gather what it needs, to
                always finish with a plain-text answer, and to summarise its findings for the user."""
                .formatted(range.min(), range.max(),
                           c.minToolsPerGroup(), c.maxToolsPerGroup(), tools.size());
    }

    static String finalPrompt(List<Tool> tools, GroupingConstraints c, int attempt) {
        GroupCountRange range = GroupCountRange.of(tools.size(), c);

        String toolList = IntStream.range(0, tools.size())
                .mapToObj(i -> "%d. \"%s\": %s".formatted(i + 1, tools.get(i).key(),
                        nullToEmpty(tools.get(i).description())))
                .collect(Collectors.joining("\n"));

        StringBuilder sb = new StringBuilder();
        sb.append("Now create the final tool groups following the strategy you developed.\n\n");
        sb.append("EXAMPLE DISTRIBUTIONS:\n");
        distributions(tools.size(), range).forEach(d -> sb.append("- ").append(d).append("\n"));
        sb.append("\nTOOLS TO ORGANISE (").append(tools.size()).append(" total):\n")
          .append(toolList).append("\n\n");
        sb.append("""
                INSTRUCTIONS:
                1. Follow your strategy.
                2. Assign every tool to at least one group.
                3. Keep to %d-%d groups of %d-%d tools each.
                4. Copy tool keys exactly as listed above (case-sensitive).
                5. Give every group a systemPrompt.

                Reply with the JSON object only.""".formatted(range.min(), range.max(),
                        c.minToolsPerGroup(), c.maxToolsPerGroup()));

        if (attempt > 1) {
            sb.append("\n\nRETRY #").append(attempt).append(": earlier attempts failed validation. Check that:\n")
              .append("- there are ").append(range.min()).append('-').append(range.max()).append(" groups\n")
              .append("- each group has ").append(c.minToolsPerGroup()).append('-')
              .append(c.maxToolsPerGroup()).append(" tools\n")
              .append("- all ").append(tools.size()).append(" tools are assigned\n")
              .append("- group ids and names are unique\n")
              .append("- tool keys match exactly");
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Corrective feedback (inner retry)
    // ------------------------------------------------------------------

    static String correctionPrompt(String error) {
        return """
                Your previous reply could not be accepted:
                %s

                Fix the problem and send the complete corrected JSON object. Remember:
                - copy every tool key exactly (case-sensitive) from the tool list
                - every tool must appear in at least one group
                - a tool key must not repeat inside one group
                - every group needs id, name, description, toolKeys and systemPrompt

                Reply with the JSON object only.""".formatted(error);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Even splits of the tool count, one line per allowed group count. */
    static List<String> distributions(int toolCount, GroupCountRange range) {
        List<String> lines = new ArrayList<>();
        for (int groups = range.min(); groups <= range.max(); groups++) {
            final int n = groups;
            String split = IntStream.range(0, n)
                    .mapToObj(i -> String.valueOf(toolCount / n + (i < toolCount % n ? 1 : 0)))
                    .collect(Collectors.joining(" + "));
            lines.add(n + " groups = [" + split + "] tools");
        }
        return lines;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
