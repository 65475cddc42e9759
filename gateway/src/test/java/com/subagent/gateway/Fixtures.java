package com.subagent.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagent.gateway.model.Tool;
import com.subagent.gateway.model.ToolGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/** Shared builders for tools, groups and LLM replies used across tests. */
public final class Fixtures {

    private Fixtures() {}

    /** {@code n} tools spread round-robin over three servers. */
    public static List<Tool> tools(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new Tool("server-" + (i % 3), "tool_" + i, "Does task number " + i, null))
                .toList();
    }

    public static ToolGroup group(String id, List<Tool> tools) {
        return new ToolGroup(id, "Group " + id, "Handles " + id + " work", tools,
                "You are the " + id + " agent.", 0.8, null);
    }

    /** Splits {@code tools} into consecutive chunks of {@code size}. */
    public static List<List<Tool>> chunks(List<Tool> tools, int size) {
        List<List<Tool>> out = new ArrayList<>();
        for (int i = 0; i < tools.size(); i += size) {
            out.add(tools.subList(i, Math.min(i + size, tools.size())));
        }
        return out;
    }

    /** A well-formed final-assignment reply, one group per chunk, ids "group-1", "group-2", ... */
    public static String reply(List<List<Tool>> partition) {
        List<Map<String, Object>> groups = new ArrayList<>();
        for (int i = 0; i < partition.size(); i++) {
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("id", "group-" + (i + 1));
            g.put("name", "Group " + (i + 1));
            g.put("description", "Tools for area " + (i + 1));
            g.put("toolKeys", partition.get(i).stream().map(Tool::key).toList());
            g.put("complementarityScore", 0.9);
            g.put("systemPrompt", "You are specialist " + (i + 1) + ".");
            groups.add(g);
        }
        try {
            return new ObjectMapper().writeValueAsString(Map.of("groups", groups));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
