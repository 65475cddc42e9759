package com.subagent.gateway.mcp;

import com.subagent.gateway.Fixtures;
import com.subagent.gateway.agent.AgentExecutor;
import com.subagent.gateway.agent.SubAgentRegistry;
import com.subagent.gateway.agent.SubAgentRouter;
import com.subagent.gateway.mcp.dto.McpTool;
import com.subagent.gateway.mcp.dto.McpToolCallResult;
import com.subagent.gateway.model.AgentRequest;
import com.subagent.gateway.model.AgentResponse;
import com.subagent.gateway.model.LlmProviderConfig;
import com.subagent.gateway.model.SubAgent;
import com.subagent.gateway.model.Tool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class McpAdapterTest {

    @Mock AgentExecutor executor;

    final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    final List<Tool> tools = Fixtures.tools(4);
    final SubAgentRegistry registry = SubAgentRegistry.fromGroups(List.of(
            Fixtures.group("files", tools.subList(0, 2)),
            Fixtures.group("git", tools.subList(2, 4))),
            new LlmProviderConfig("anthropic", "m"));

    McpAdapter adapter(McpCallSchema schema) {
        return new McpAdapter(registry, new SubAgentRouter(registry), executor, meters, schema, "Use agents wisely.");
    }

    // ------------------------------------------------------------------
    // tools/list
    // ------------------------------------------------------------------

    @Test
    void listTools_oneToolPerAgentInRegistryOrder() {
        List<McpTool> listed = adapter(McpCallSchema.PROMPT_ONLY).listTools();

        assertThat(listed).extracting(McpTool::name).containsExactly("agent_files", "agent_git");
        assertThat(listed.get(0).description()).isEqualTo("Sub-agent for Group files: Handles files work");
        assertThat(listed.get(0).inputSchema()).containsEntry("required", List.of("prompt"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void listTools_agentIdSchema_requiresAgentId() {
        McpTool tool = adapter(McpCallSchema.PROMPT_AND_AGENT_ID).listTools().get(0);

        assertThat(tool.inputSchema()).containsEntry("required", List.of("agentId", "prompt"));
        Map<String, Object> properties = (Map<String, Object>) tool.inputSchema().get("properties");
        assertThat(properties).containsKeys("agentId", "prompt", "context");
    }

    // ------------------------------------------------------------------
    // tools/call
    // ------------------------------------------------------------------

    @Test
    void callTool_promptOnly_routesByToolName() {
        when(executor.execute(any(), any())).thenAnswer(inv ->
                AgentResponse.success(inv.getArgument(1), "listed", List.of()));

        McpToolCallResult result = adapter(McpCallSchema.PROMPT_ONLY)
                .callTool("agent_git", Map.of("prompt", "show log", "context", Map.of("branch", "main")));

        assertThat(result.error()).isFalse();
        assertThat(result.text()).isEqualTo("listed");

        ArgumentCaptor<SubAgent> agent = ArgumentCaptor.forClass(SubAgent.class);
        ArgumentCaptor<AgentRequest> request = ArgumentCaptor.forClass(AgentRequest.class);
        verify(executor).execute(agent.capture(), request.capture());
        assertThat(agent.getValue().id()).isEqualTo("git");
        assertThat(request.getValue().prompt()).isEqualTo("show log");
        assertThat(request.getValue().context()).containsEntry("branch", "main");
        assertThat(request.getValue().requestId()).isNotBlank();
        assertThat(meters.counter("subagents.mcp.calls", "agent", "git", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void callTool_agentIdSchema_readsIdFromArguments() {
        when(executor.execute(any(), any())).thenAnswer(inv ->
                AgentResponse.success(inv.getArgument(1), "ok", List.of()));

        McpToolCallResult result = adapter(McpCallSchema.PROMPT_AND_AGENT_ID)
                .callTool("agent_git", Map.of("agentId", "agent_files", "prompt", "read"));

        assertThat(result.error()).isFalse();
        ArgumentCaptor<SubAgent> agent = ArgumentCaptor.forClass(SubAgent.class);
        verify(executor).execute(agent.capture(), any());
        assertThat(agent.getValue().id()).isEqualTo("files");
    }

    @Test
    void callTool_unknownAgent_isErrorMentioningNotFound() {
        McpToolCallResult result = adapter(McpCallSchema.PROMPT_ONLY)
                .callTool("unknown_agent", Map.of("prompt", "hello"));

        assertThat(result.error()).isTrue();
        assertThat(result.content()).hasSize(1);
        assertThat(result.content().get(0).type()).isEqualTo("text");
        assertThat(result.text()).contains("not found");
        verifyNoInteractions(executor);
        assertThat(meters.counter("subagents.mcp.calls", "agent", "unknown", "status", "not_found").count())
                .isEqualTo(1.0);
    }

    @Test
    void callTool_missingPrompt_isError() {
        McpToolCallResult result = adapter(McpCallSchema.PROMPT_ONLY).callTool("agent_git", Map.of());

        assertThat(result.error()).isTrue();
        assertThat(result.text()).contains("prompt");
        verifyNoInteractions(executor);
    }

    @Test
    void callTool_agentIdSchemaWithoutAgentId_isError() {
        McpToolCallResult result = adapter(McpCallSchema.PROMPT_AND_AGENT_ID)
                .callTool("agent_git", Map.of("prompt", "p"));

        assertThat(result.error()).isTrue();
        assertThat(result.text()).contains("agentId");
    }

    @Test
    void callTool_agentError_isPassedThrough() {
        when(executor.execute(any(), any())).thenAnswer(inv ->
                AgentResponse.failure(inv.getArgument(1), "upstream down"));

        McpToolCallResult result = adapter(McpCallSchema.PROMPT_ONLY).callTool("agent_files", Map.of("prompt", "p"));

        assertThat(result.error()).isTrue();
        assertThat(result.text()).isEqualTo("upstream down");
    }

    @Test
    void callTool_executorThrows_becomesErrorEnvelope() {
        when(executor.execute(any(), any())).thenThrow(new IllegalStateException("kaboom"));

        McpToolCallResult result = adapter(McpCallSchema.PROMPT_ONLY).callTool("agent_files", Map.of("prompt", "p"));

        assertThat(result.error()).isTrue();
        assertThat(result.text()).isEqualTo("kaboom");
        assertThat(meters.counter("subagents.mcp.calls", "agent", "files", "status", "error").count()).isEqualTo(1.0);
    }

    @Test
    void stripPrefix_onlyRemovesLeadingPrefix() {
        assertThat(McpAdapter.stripPrefix("agent_files")).isEqualTo("files");
        assertThat(McpAdapter.stripPrefix("files")).isEqualTo("files");
        assertThat(McpAdapter.stripPrefix("my_agent_x")).isEqualTo("my_agent_x");
        assertThat(McpAdapter.stripPrefix(" ")).isNull();
    }
}
