package com.subagent.gateway.agent;

import com.subagent.gateway.Fixtures;
import com.subagent.gateway.model.LlmProviderConfig;
import com.subagent.gateway.model.SubAgent;
import com.subagent.gateway.model.Tool;
import com.subagent.gateway.model.ToolGroup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubAgentRegistryTest {

    static final LlmProviderConfig LLM = new LlmProviderConfig("anthropic", "claude-sonnet-4-5");

    final List<Tool> tools = Fixtures.tools(4);

    @Test
    void fromGroups_keepsGivenOrderAndBindsProvider() {
        SubAgentRegistry registry = SubAgentRegistry.fromGroups(List.of(
                Fixtures.group("zeta", tools.subList(0, 2)),
                Fixtures.group("alpha", tools.subList(2, 4))), LLM);

        assertThat(registry.agentIds()).containsExactly("zeta", "alpha");
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.toolCount()).isEqualTo(4);
        assertThat(registry.get("alpha")).get()
                .extracting(SubAgent::llmProvider).isEqualTo(LLM);
        assertThat(registry.get("zeta").orElseThrow().toolGroup().toolKeys())
                .containsExactly("server-0:tool_0", "server-1:tool_1");
    }

    @Test
    void fromGroups_usesGroupPromptWhenPresent() {
        SubAgentRegistry registry = SubAgentRegistry.fromGroups(List.of(Fixtures.group("a", tools)), LLM);

        assertThat(registry.get("a").orElseThrow().systemPrompt()).isEqualTo("You are the a agent.");
    }

    @Test
    void fromGroups_generatesPromptWhenMissing() {
        ToolGroup bare = new ToolGroup("files", "File Ops", "Read and write files", tools.subList(0, 1), null, null, null);

        SubAgent agent = SubAgentRegistry.fromGroups(List.of(bare), LLM).get("files").orElseThrow();

        assertThat(agent.systemPrompt())
                .startsWith("You are File Ops.")
                .contains("Description: Read and write files")
                .contains("- tool_0: Does task number 0");
    }

    @Test
    void fromGroups_emptyOrDuplicate_throws() {
        assertThatThrownBy(() -> SubAgentRegistry.fromGroups(List.of(), LLM))
                .isInstanceOf(RegistryException.class);
        assertThatThrownBy(() -> SubAgentRegistry.fromGroups(List.of(
                        Fixtures.group("dup", tools.subList(0, 1)),
                        Fixtures.group("dup", tools.subList(1, 2))), LLM))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("dup");
    }

    @Test
    void agents_isReadOnlySnapshot() {
        SubAgentRegistry registry = SubAgentRegistry.fromGroups(List.of(Fixtures.group("a", tools)), LLM);

        assertThatThrownBy(() -> registry.agents().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(registry.get(null)).isEmpty();
    }
}
