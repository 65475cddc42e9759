package com.subagent.gateway.mcp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /mcp.
 *
 * {@code id} is kept as a raw node because JSON-RPC allows numbers and
 * strings and the reply must echo it unchanged. A request without an id is
 * a notification and gets no reply body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, JsonNode id, String method, JsonNode params) {

    public boolean isNotification() {
        return id == null || id.isNull() || id.isMissingNode();
    }
}
