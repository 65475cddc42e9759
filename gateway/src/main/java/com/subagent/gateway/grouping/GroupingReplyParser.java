package com.subagent.gateway.grouping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.subagent.gateway.model.Tool;
import com.subagent.gateway.model.ToolGroup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the LLM's final-assignment reply into tool groups.
 *
 * Decode-then-validate: the reply is either turned into a complete list of
 * {@link ToolGroup}s or rejected with one human-readable reason, which the
 * orchestrator sends back to the LLM. A partially decoded structure never
 * leaves this class.
 */
@Component
public class GroupingReplyParser {

    static final double DEFAULT_SCORE = 0.5;

    // Models sometimes wrap the object in a ```json fence despite instructions
    private static final Pattern FENCED = Pattern.compile(
            "^```(?:json)?\\s*\\n(.*?)\\n?```$", Pattern.DOTALL);

    private static final List<String> REQUIRED_FIELDS = List.of("id", "name", "description", "toolKeys");

    // A second JSON value after the object is a malformed reply, not noise
    private final ObjectReader reader;

    public GroupingReplyParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ReplyDecodeResult decode(String reply, List<Tool> tools) {
        if (reply == null || reply.isBlank()) {
            return ReplyDecodeResult.failure("Reply is not valid JSON: the reply was empty");
        }

        JsonNode root;
        try {
            root = reader.readTree(unwrapFence(reply.strip()));
        } catch (JsonProcessingException e) {
            return ReplyDecodeResult.failure("Reply is not valid JSON: " + e.getOriginalMessage());
        }

        JsonNode groupsNode = root == null ? null : root.get("groups");
        if (groupsNode == null || !groupsNode.isArray()) {
            return ReplyDecodeResult.failure("Reply does not contain a 'groups' array");
        }

        Map<String, Tool> toolsByKey = new LinkedHashMap<>();
        tools.forEach(t -> toolsByKey.putIfAbsent(t.key(), t));

        List<ToolGroup> groups  = new ArrayList<>();
        Set<String>     covered = new LinkedHashSet<>();

        for (int i = 0; i < groupsNode.size(); i++) {
            JsonNode node = groupsNode.get(i);

            List<String> missing = missingFields(node);
            if (!missing.isEmpty()) {
                return ReplyDecodeResult.failure("Group[%d] is missing required field(s): %s"
                        .formatted(i, String.join(", ", missing)));
            }
            String name = node.get("name").asText();

            List<Tool>  groupTools = new ArrayList<>();
            Set<String> seenInGroup = new LinkedHashSet<>();
            for (JsonNode keyNode : node.get("toolKeys")) {
                String key = keyNode.isTextual() ? keyNode.asText() : keyNode.toString();
                Tool tool = toolsByKey.get(key);
                if (tool == null) {
                    return ReplyDecodeResult.failure(
                            "Unknown or misspelled tool key \"%s\" in group \"%s\"".formatted(key, name));
                }
                if (!seenInGroup.add(key)) {
                    return ReplyDecodeResult.failure(
                            "Tool key \"%s\" is listed more than once in group \"%s\"".formatted(key, name));
                }
                groupTools.add(tool);
            }
            if (groupTools.isEmpty()) {
                return ReplyDecodeResult.failure("Group \"%s\" has no tools".formatted(name));
            }

            JsonNode prompt = node.get("systemPrompt");
            if (prompt == null || !prompt.isTextual() || prompt.asText().isBlank()) {
                return ReplyDecodeResult.failure("Group \"%s\" is missing its systemPrompt".formatted(name));
            }

            JsonNode score = node.get("complementarityScore");
            covered.addAll(seenInGroup);
            groups.add(new ToolGroup(
                    sanitizeId(node.get("id").asText()),
                    name,
                    node.get("description").asText(),
                    groupTools,
                    prompt.asText(),
                    score != null && score.isNumber() ? score.asDouble() : DEFAULT_SCORE,
                    null));
        }

        List<String> uncovered = toolsByKey.keySet().stream()
                .filter(k -> !covered.contains(k))
                .toList();
        if (!uncovered.isEmpty()) {
            String sample = String.join(", ", uncovered.subList(0, Math.min(5, uncovered.size())));
            return ReplyDecodeResult.failure("Not every tool was assigned to a group. Missing %d tools: %s%s"
                    .formatted(uncovered.size(), sample, uncovered.size() > 5 ? "..." : ""));
        }

        return ReplyDecodeResult.ok(groups);
    }

    /**
     * Lowercase kebab-case: anything outside [a-z0-9-] becomes a dash,
     * runs of dashes collapse, leading and trailing dashes are trimmed.
     */
    public static String sanitizeId(String id) {
        return id.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String unwrapFence(String reply) {
        Matcher m = FENCED.matcher(reply);
        return m.matches() ? m.group(1) : reply;
    }

    private static List<String> missingFields(JsonNode node) {
        if (node == null || !node.isObject()) {
            return REQUIRED_FIELDS;
        }
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = node.get(field);
            boolean present = "toolKeys".equals(field)
                    ? value != null && value.isArray()
                    : value != null && value.isTextual() && !value.asText().isBlank();
            if (!present) missing.add(field);
        }
        return missing;
    }
}
