package com.subagent.gateway.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagent.gateway.model.ToolGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads and writes the grouping result shared between the build and the server.
 *
 * Two layouts are understood:
 * <pre>
 *   JSON_FILE   groups.json                 array of groups, or {"instructions", "groups"}
 *   DIRECTORY   groups/instructions.md      optional
 *               groups/&lt;id&gt;/group.json     the group record
 *               groups/&lt;id&gt;/description.md optional, overrides "description"
 *               groups/&lt;id&gt;/prompt.md      optional, overrides "systemPrompt"
 * </pre>
 * {@link #load} picks the layout from what is on disk; {@link #save} is told
 * which one to write. Loaded groups are always sorted by id so the tool list
 * the server advertises is stable between restarts.
 */
@Component
public class GroupStore {

    private static final Logger log = LoggerFactory.getLogger(GroupStore.class);

    static final String GROUP_FILE        = "group.json";
    static final String DESCRIPTION_FILE  = "description.md";
    static final String PROMPT_FILE       = "prompt.md";
    static final String INSTRUCTIONS_FILE = "instructions.md";

    private final ObjectMapper objectMapper;

    public GroupStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Load
    // ------------------------------------------------------------------

    public PersistedGroups load(Path path) {
        if (!Files.exists(path)) {
            throw new GroupStoreException(
                    "No tool groups found at " + path + ". Run the build first (--spring.profiles.active=build).");
        }
        PersistedGroups loaded = Files.isDirectory(path) ? loadDirectory(path) : loadFile(path);

        List<ToolGroup> sorted = loaded.groups().stream()
                .sorted(Comparator.comparing(ToolGroup::id, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        log.info("Loaded {} tool groups from {}", sorted.size(), path);
        return new PersistedGroups(loaded.instructions(), sorted);
    }

    private PersistedGroups loadFile(Path file) {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || root.isMissingNode()) {
                throw new GroupStoreException("Groups file is empty: " + file);
            }
            // Older builds wrote a bare array without instructions.
            if (root.isArray()) {
                return new PersistedGroups(null, readGroups(root, file));
            }
            if (root.isObject() && root.path("groups").isArray()) {
                String instructions = root.hasNonNull("instructions") ? root.get("instructions").asText() : null;
                return new PersistedGroups(instructions, readGroups(root.get("groups"), file));
            }
            throw new GroupStoreException("Groups file must hold an array or an object with a 'groups' array: " + file);
        } catch (IOException e) {
            throw new GroupStoreException("Cannot read groups file " + file + ": " + e.getMessage(), e);
        }
    }

    private List<ToolGroup> readGroups(JsonNode array, Path source) throws IOException {
        List<ToolGroup> groups = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isObject()) {
                throw new GroupStoreException("Non-object entry in groups array of " + source);
            }
            groups.add(objectMapper.treeToValue(node, ToolGroup.class));
        }
        return groups;
    }

    private PersistedGroups loadDirectory(Path dir) {
        List<ToolGroup> groups = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.sorted().toList()) {
                Path groupFile = child.resolve(GROUP_FILE);
                if (!Files.isDirectory(child) || !Files.isRegularFile(groupFile)) {
                    continue;
                }
                ToolGroup group = objectMapper.readValue(groupFile.toFile(), ToolGroup.class);

                String description = readOptional(child.resolve(DESCRIPTION_FILE));
                if (description != null) group = group.withDescription(description);
                String prompt = readOptional(child.resolve(PROMPT_FILE));
                if (prompt != null) group = group.withSystemPrompt(prompt);

                groups.add(group);
            }
            return new PersistedGroups(readOptional(dir.resolve(INSTRUCTIONS_FILE)), groups);
        } catch (IOException e) {
            throw new GroupStoreException("Cannot read groups directory " + dir + ": " + e.getMessage(), e);
        }
    }

    private static String readOptional(Path file) throws IOException {
        if (!Files.isRegularFile(file)) return null;
        String text = Files.readString(file, StandardCharsets.UTF_8).strip();
        return text.isEmpty() ? null : text;
    }

    // ------------------------------------------------------------------
    // Save
    // ------------------------------------------------------------------

    public void save(PersistedGroups groups, Path path, GroupLayout layout) {
        try {
            switch (layout) {
                case JSON_FILE -> saveFile(groups, path);
                case DIRECTORY -> saveDirectory(groups, path);
            }
        } catch (IOException e) {
            throw new GroupStoreException("Cannot write groups to " + path + ": " + e.getMessage(), e);
        }
        log.info("Saved {} tool groups to {} ({})", groups.groups().size(), path, layout);
    }

    private void saveFile(PersistedGroups groups, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, toJson(groups), StandardCharsets.UTF_8);
    }

    private void saveDirectory(PersistedGroups groups, Path dir) throws IOException {
        Files.createDirectories(dir);

        Set<String> written = new HashSet<>();
        for (ToolGroup group : groups.groups()) {
            Path groupDir = dir.resolve(group.id());
            Files.createDirectories(groupDir);
            // The prompt lives in prompt.md so it can be edited as plain markdown.
            Files.writeString(groupDir.resolve(GROUP_FILE), toJson(group.withSystemPrompt(null)), StandardCharsets.UTF_8);
            writeOrDelete(groupDir.resolve(DESCRIPTION_FILE), group.description());
            writeOrDelete(groupDir.resolve(PROMPT_FILE), group.systemPrompt());
            written.add(group.id());
        }
        writeOrDelete(dir.resolve(INSTRUCTIONS_FILE), groups.instructions());
        removeStaleGroups(dir, written);
    }

    /** Groups from an earlier build that are no longer produced would otherwise be served again. */
    private void removeStaleGroups(Path dir, Set<String> keep) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.toList()) {
                String name = child.getFileName().toString();
                if (Files.isDirectory(child) && !keep.contains(name) && Files.isRegularFile(child.resolve(GROUP_FILE))) {
                    Files.deleteIfExists(child.resolve(GROUP_FILE));
                    Files.deleteIfExists(child.resolve(DESCRIPTION_FILE));
                    Files.deleteIfExists(child.resolve(PROMPT_FILE));
                    log.info("Removed stale group files under {}", child);
                }
            }
        }
    }

    private static void writeOrDelete(Path file, String content) throws IOException {
        if (content == null || content.isBlank()) {
            Files.deleteIfExists(file);
        } else {
            Files.writeString(file, content.strip() + "\n", StandardCharsets.UTF_8);
        }
    }

    private String toJson(Object value) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value) + "\n";
    }
}
