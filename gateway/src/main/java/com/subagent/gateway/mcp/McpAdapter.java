package com.subagent.gateway.mcp;

import com.subagent.gateway.agent.AgentExecutor;
import com.subagent.gateway.agent.SubAgentRegistry;
import com.subagent.gateway.agent.SubAgentRouter;
import com.subagent.gateway.mcp.dto.McpTool;
import com.subagent.gateway.mcp.dto.McpToolCallResult;
import com.subagent.gateway.model.AgentRequest;
import com.subagent.gateway.model.AgentResponse;
import com.subagent.gateway.model.SubAgent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Presents each sub-agent as one MCP tool named {@code agent_<id>} and turns
 * {@code tools/call} invocations into {@link AgentRequest}s.
 *
 * Every call is timed and counted:
 * <pre>
 *   subagents.mcp.calls{agent, status="success|error|not_found|invalid"}
 *   subagents.mcp.call.duration{agent}
 * </pre>
 * Nothing here throws to the caller; all failures come back as an error
 * envelope.
 */
public class McpAdapter {

    private static final Logger log = LoggerFactory.getLogger(McpAdapter.class);

    public static final String TOOL_PREFIX = "agent_";
    private static final String UNKNOWN_AGENT_TAG = "unknown";

    private final SubAgentRegistry registry;
    private final SubAgentRouter   router;
    private final AgentExecutor    executor;
    private final MeterRegistry    meterRegistry;
    private final McpCallSchema    callSchema;
    private final String           instructions;

    public McpAdapter(SubAgentRegistry registry,
                      SubAgentRouter router,
                      AgentExecutor executor,
                      MeterRegistry meterRegistry,
                      McpCallSchema callSchema,
                      String instructions) {
        this.registry      = registry;
        this.router        = router;
        this.executor      = executor;
        this.meterRegistry = meterRegistry;
        this.callSchema    = callSchema;
        this.instructions  = instructions;
    }

    /** Usage text sent with the initialize reply; may be null. */
    public String instructions() {
        return instructions;
    }

    // ------------------------------------------------------------------
    // tools/list
    // ------------------------------------------------------------------

    public List<McpTool> listTools() {
        return registry.agents().stream().map(this::toTool).toList();
    }

    McpTool toTool(SubAgent agent) {
        return new McpTool(
                TOOL_PREFIX + agent.id(),
                "Sub-agent for " + agent.name() + ": " + agent.description(),
                inputSchema());
    }

    private Map<String, Object> inputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (callSchema == McpCallSchema.PROMPT_AND_AGENT_ID) {
            properties.put("agentId", Map.of("type", "string", "description", "The ID of the sub-agent to invoke"));
        }
        properties.put("prompt",  Map.of("type", "string", "description", "The task prompt for the agent"));
        properties.put("context", Map.of("type", "object", "description", "Optional context for the agent"));

        List<String> required = callSchema == McpCallSchema.PROMPT_AND_AGENT_ID
                ? List.of("agentId", "prompt")
                : List.of("prompt");

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    // ------------------------------------------------------------------
    // tools/call
    // ------------------------------------------------------------------

    public McpToolCallResult callTool(String toolName, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;

        String prompt = stringArg(args, "prompt");
        String agentId = callSchema == McpCallSchema.PROMPT_AND_AGENT_ID
                ? stripPrefix(stringArg(args, "agentId"))
                : stripPrefix(toolName);

        AgentRequest request = new AgentRequest(
                UUID.randomUUID().toString(), agentId, prompt, contextArg(args), Instant.now());

        if (!router.validateRequest(request)) {
            count(UNKNOWN_AGENT_TAG, "invalid");
            return McpToolCallResult.error(callSchema == McpCallSchema.PROMPT_AND_AGENT_ID
                    ? "Missing required arguments: agentId and prompt are required"
                    : "Missing required argument: prompt");
        }

        Optional<SubAgent> agent = router.route(request);
        if (agent.isEmpty()) {
            count(UNKNOWN_AGENT_TAG, "not_found");
            log.warn("tools/call for unknown agent '{}' (tool {})", agentId, toolName);
            return McpToolCallResult.error("Agent " + toolName + " not found");
        }
        return execute(agent.get(), request);
    }

    private McpToolCallResult execute(SubAgent agent, AgentRequest request) {
        MDC.put("requestId", request.requestId());
        MDC.put("agentId", agent.id());
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            log.info("Executing sub-agent '{}'", agent.id());
            AgentResponse response = executor.execute(agent, request);
            if (response.isError()) {
                status = "error";
                return McpToolCallResult.error(response.error());
            }
            return McpToolCallResult.success(response.result().isEmpty() ? "No result" : response.result());
        } catch (RuntimeException e) {
            status = "error";
            log.error("Sub-agent '{}' threw during execution", agent.id(), e);
            return McpToolCallResult.error(e.getMessage() == null ? "Unknown error" : e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("subagents.mcp.call.duration", "agent", agent.id()));
            count(agent.id(), status);
            MDC.remove("requestId");
            MDC.remove("agentId");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void count(String agent, String status) {
        meterRegistry.counter("subagents.mcp.calls", "agent", agent, "status", status).increment();
    }

    static String stripPrefix(String name) {
        if (name == null || name.isBlank()) return null;
        return name.startsWith(TOOL_PREFIX) ? name.substring(TOOL_PREFIX.length()) : name;
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (!(value instanceof String)) return null;
        String s = (String) value;
        return s.isBlank() ? null : s;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> contextArg(Map<String, Object> args) {
        Object value = args.get("context");
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
