package com.subagent.gateway.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.subagent.gateway.model.ToolGroup;

import java.util.List;

/**
 * What a build writes and the server reads back.
 *
 * @param instructions server-level usage text announced on MCP initialize; may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedGroups(String instructions, List<ToolGroup> groups) {

    public PersistedGroups {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
