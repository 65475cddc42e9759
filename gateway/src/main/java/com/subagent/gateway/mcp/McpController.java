package com.subagent.gateway.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagent.gateway.mcp.dto.JsonRpcError;
import com.subagent.gateway.mcp.dto.JsonRpcRequest;
import com.subagent.gateway.mcp.dto.JsonRpcResponse;
import com.subagent.gateway.mcp.dto.McpToolCallResult;
import com.subagent.gateway.mcp.dto.McpToolsListResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MCP over HTTP: one JSON-RPC 2.0 endpoint.
 *
 * POST /mcp  initialize | ping | tools/list | tools/call | notifications/*
 *
 * Example:
 *   curl -X POST http://localhost:8080/mcp \
 *     -H "Content-Type: application/json" \
 *     -d '{"jsonrpc":"2.0","id":1,"method":"tools/list"}'
 */
@RestController
@RequestMapping("/mcp")
@Profile("!build")
public class McpController {

    private static final Logger log = LoggerFactory.getLogger(McpController.class);

    static final String PROTOCOL_VERSION = "2025-03-26";
    static final int    PARSE_ERROR      = -32700;

    private final McpAdapter   adapter;
    private final ObjectMapper objectMapper;
    private final String       serverName;
    private final String       serverVersion;

    public McpController(McpAdapter adapter,
                         ObjectMapper objectMapper,
                         @Value("${subagents.mcp.server-name:subagent-gateway}") String serverName,
                         @Value("${subagents.mcp.server-version:0.1.0}") String serverVersion) {
        this.adapter       = adapter;
        this.objectMapper  = objectMapper;
        this.serverName    = serverName;
        this.serverVersion = serverVersion;
    }

    @PostMapping
    public ResponseEntity<JsonRpcResponse> handle(@RequestBody JsonNode body) {
        JsonRpcRequest request;
        try {
            request = objectMapper.treeToValue(body, JsonRpcRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return ResponseEntity.ok(JsonRpcResponse.error(null, JsonRpcError.INVALID_REQUEST,
                    "Invalid request: " + e.getMessage()));
        }
        if (request == null || !"2.0".equals(request.jsonrpc())
                || request.method() == null || request.method().isBlank()) {
            return ResponseEntity.ok(JsonRpcResponse.error(request == null ? null : request.id(),
                    JsonRpcError.INVALID_REQUEST, "Invalid request: jsonrpc must be \"2.0\" and method is required"));
        }

        // Notifications (no id) are acknowledged without a body.
        if (request.isNotification()) {
            log.debug("Notification {}", request.method());
            return ResponseEntity.accepted().build();
        }

        log.debug("JSON-RPC {} id={}", request.method(), request.id());
        JsonRpcResponse response = switch (request.method()) {
            case "initialize" -> JsonRpcResponse.result(request.id(), initialize(request.params()));
            case "ping"       -> JsonRpcResponse.result(request.id(), Map.of());
            case "tools/list" -> JsonRpcResponse.result(request.id(), new McpToolsListResult(adapter.listTools()));
            case "tools/call" -> toolsCall(request);
            default           -> JsonRpcResponse.error(request.id(), JsonRpcError.METHOD_NOT_FOUND,
                    "Method not found: " + request.method());
        };
        return ResponseEntity.ok(response);
    }

    /** A body that is not JSON at all. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<JsonRpcResponse> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.ok(JsonRpcResponse.error(null, PARSE_ERROR, "Parse error"));
    }

    // ------------------------------------------------------------------
    // Methods
    // ------------------------------------------------------------------

    private Map<String, Object> initialize(JsonNode params) {
        String requested = params == null ? null : params.path("protocolVersion").asText(null);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", requested != null ? requested : PROTOCOL_VERSION);
        result.put("capabilities",    Map.of("tools", Map.of()));
        result.put("serverInfo",      Map.of("name", serverName, "version", serverVersion));
        if (adapter.instructions() != null) {
            result.put("instructions", adapter.instructions());
        }
        return result;
    }

    private JsonRpcResponse toolsCall(JsonRpcRequest request) {
        JsonNode params = request.params();
        if (params == null || !params.path("name").isTextual()) {
            return JsonRpcResponse.error(request.id(), JsonRpcError.INVALID_PARAMS,
                    "Invalid params: tools/call requires a string 'name'");
        }
        JsonNode argsNode = params.path("arguments");
        if (!argsNode.isMissingNode() && !argsNode.isNull() && !argsNode.isObject()) {
            return JsonRpcResponse.error(request.id(), JsonRpcError.INVALID_PARAMS,
                    "Invalid params: 'arguments' must be an object");
        }
        Map<String, Object> arguments = argsNode.isObject()
                ? objectMapper.convertValue(argsNode, new TypeReference<Map<String, Object>>() {})
                : Map.of();

        McpToolCallResult result = adapter.callTool(params.get("name").asText(), arguments);
        return JsonRpcResponse.result(request.id(), result);
    }
}
