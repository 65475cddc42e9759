package com.subagent.gateway.config;

import com.subagent.gateway.agent.AgentExecutor;
import com.subagent.gateway.agent.SubAgentRegistry;
import com.subagent.gateway.agent.SubAgentRouter;
import com.subagent.gateway.mcp.McpAdapter;
import com.subagent.gateway.mcp.McpCallSchema;
import com.subagent.gateway.model.GroupingConstraints;
import com.subagent.gateway.model.LlmProviderConfig;
import com.subagent.gateway.store.GroupStore;
import com.subagent.gateway.store.PersistedGroups;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.nio.file.Path;

/**
 * Wiring for both run modes. Everything under {@code !build} needs persisted
 * groups, so serving fails at startup when the build has not run yet or its
 * output cannot form a registry.
 */
@Configuration
public class GatewayConfig {

    @Bean
    GroupingConstraints groupingConstraints(
            @Value("${subagents.grouping.min-tools-per-group:5}") int minToolsPerGroup,
            @Value("${subagents.grouping.max-tools-per-group:20}") int maxToolsPerGroup,
            @Value("${subagents.grouping.min-groups:3}") int minGroups,
            @Value("${subagents.grouping.max-groups:10}") int maxGroups) {
        return new GroupingConstraints(minToolsPerGroup, maxToolsPerGroup, minGroups, maxGroups);
    }

    @Bean
    LlmProviderConfig llmProviderConfig(
            @Value("${subagents.llm.provider:anthropic}") String provider,
            @Value("${subagents.llm.model:claude-sonnet-4-5}") String model) {
        return new LlmProviderConfig(provider, model);
    }

    // ------------------------------------------------------------------
    // Serving
    // ------------------------------------------------------------------

    @Bean
    @Profile("!build")
    PersistedGroups persistedGroups(GroupStore store,
                                    @Value("${subagents.groups-path:.subagents/groups.json}") Path groupsPath) {
        return store.load(groupsPath);
    }

    @Bean
    @Profile("!build")
    SubAgentRegistry subAgentRegistry(PersistedGroups groups, LlmProviderConfig llmProvider) {
        return SubAgentRegistry.fromGroups(groups.groups(), llmProvider);
    }

    @Bean
    @Profile("!build")
    SubAgentRouter subAgentRouter(SubAgentRegistry registry) {
        return new SubAgentRouter(registry);
    }

    @Bean
    @Profile("!build")
    McpAdapter mcpAdapter(SubAgentRegistry registry,
                          SubAgentRouter router,
                          AgentExecutor executor,
                          MeterRegistry meterRegistry,
                          PersistedGroups groups,
                          @Value("${subagents.mcp.call-schema:PROMPT_ONLY}") McpCallSchema callSchema) {
        return new McpAdapter(registry, router, executor, meterRegistry, callSchema, groups.instructions());
    }
}
