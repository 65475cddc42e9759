package com.subagent.gateway.build;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagent.gateway.model.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the tool catalog produced by upstream discovery: a JSON array of
 * {@code {serverName, name, description, inputSchema}} objects.
 */
@Component
public class ToolCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public ToolCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws CatalogException if the file is missing or unreadable, the catalog
     *                          is empty, or a tool lacks its server or name, or
     *                          two tools share a key
     */
    public List<Tool> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CatalogException("Tool catalog not found: " + path);
        }
        List<Tool> tools;
        try {
            tools = objectMapper.readValue(path.toFile(), new TypeReference<List<Tool>>() {});
        } catch (IOException e) {
            throw new CatalogException("Cannot read tool catalog " + path + ": " + e.getMessage(), e);
        }
        if (tools == null || tools.isEmpty()) {
            throw new CatalogException("No tools in catalog " + path + "; nothing to group");
        }

        Set<String> keys = new HashSet<>();
        for (int i = 0; i < tools.size(); i++) {
            Tool tool = tools.get(i);
            if (isBlank(tool.serverName()) || isBlank(tool.name())) {
                throw new CatalogException("Tool[" + i + "] in " + path + " needs both serverName and name");
            }
            if (!keys.add(tool.key())) {
                throw new CatalogException("Tool " + tool.key() + " appears more than once in " + path);
            }
        }

        long servers = tools.stream().map(Tool::serverName).distinct().count();
        log.info("Loaded {} tools from {} servers ({})", tools.size(), servers, path);
        return tools;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
