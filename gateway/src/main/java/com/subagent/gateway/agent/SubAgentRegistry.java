package com.subagent.gateway.agent;

import com.subagent.gateway.model.LlmProviderConfig;
import com.subagent.gateway.model.SubAgent;
import com.subagent.gateway.model.ToolGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable id-to-agent map built once from persisted tool groups.
 *
 * Iteration follows the order the groups were given in, which is the order
 * agents are advertised over MCP. Nothing is added or removed after
 * construction, so concurrent readers need no locking.
 */
public final class SubAgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubAgentRegistry.class);

    private final Map<String, SubAgent> agents;

    private SubAgentRegistry(Map<String, SubAgent> agents) {
        this.agents = Collections.unmodifiableMap(agents);
    }

    /**
     * @throws RegistryException if {@code groups} is empty or two groups share an id
     */
    public static SubAgentRegistry fromGroups(List<ToolGroup> groups, LlmProviderConfig llmProvider) {
        if (groups == null || groups.isEmpty()) {
            throw new RegistryException("No tool groups to build sub-agents from");
        }
        Map<String, SubAgent> agents = new LinkedHashMap<>();
        for (ToolGroup group : groups) {
            if (agents.containsKey(group.id())) {
                throw new RegistryException("Duplicate sub-agent id: " + group.id());
            }
            SubAgent agent = createSubAgent(group, llmProvider);
            agents.put(agent.id(), agent);
            log.info("Registered sub-agent '{}' ({} tools) on {}/{}",
                    agent.id(), group.tools().size(), llmProvider.type(), llmProvider.model());
        }
        SubAgentRegistry registry = new SubAgentRegistry(agents);
        log.info("Sub-agent registry ready: {} agents {} covering {} tool slots",
                registry.size(), registry.agentIds(), registry.toolCount());
        return registry;
    }

    static SubAgent createSubAgent(ToolGroup group, LlmProviderConfig llmProvider) {
        String prompt = group.systemPrompt() != null && !group.systemPrompt().isBlank()
                ? group.systemPrompt()
                : defaultSystemPrompt(group);
        return new SubAgent(group.id(), group.name(), group.description(), group, llmProvider, prompt);
    }

    /** Used for groups persisted without a prompt of their own. */
    static String defaultSystemPrompt(ToolGroup group) {
        String toolList = group.tools().stream()
                .map(t -> "- " + t.name() + ": " + t.description())
                .collect(Collectors.joining("\n"));
        return """
                You are %s.

                Description: %s

                Available tools:
                %s

                Your role is to help users by using these tools effectively. When given a task, \
                analyze which tools are needed and execute them to provide accurate results."""
                .formatted(group.name(), group.description(), toolList);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<SubAgent> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(agents.get(id));
    }

    /** All agents in registration order. */
    public List<SubAgent> agents() {
        return List.copyOf(agents.values());
    }

    public List<String> agentIds() {
        return List.copyOf(agents.keySet());
    }

    public int size() {
        return agents.size();
    }

    /** Total tool slots across agents; a tool shared by two groups counts twice. */
    public int toolCount() {
        return agents.values().stream().mapToInt(a -> a.toolGroup().tools().size()).sum();
    }
}
