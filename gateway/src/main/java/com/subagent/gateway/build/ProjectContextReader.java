package com.subagent.gateway.build;

import com.subagent.gateway.model.ProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects project knowledge for the grouping analysis.
 *
 * Configured domain and hints come first. Then every readable agent
 * instruction file is merged in: its text is appended to
 * {@code fullContent}, the first {@code Project:} or {@code Domain:} line
 * fills in a missing domain, and markdown bullets become hints.
 */
@Component
public class ProjectContextReader {

    private static final Logger log = LoggerFactory.getLogger(ProjectContextReader.class);

    static final List<String> DEFAULT_FILES  = List.of("Agent.md", "CLAUDE.md", "agent.md", "claude.md");
    static final int          MAX_HINTS      = 10;
    static final String       DEFAULT_DOMAIN = "General purpose development";

    private static final Pattern DOMAIN_LINE = Pattern.compile("(?i)(?:Project|Domain):\\s*(.+)");
    private static final Pattern BULLET      = Pattern.compile("(?m)^[-*]\\s+(.+)$");

    private final String       configuredDomain;
    private final List<String> configuredHints;
    private final List<String> extraFiles;

    @Autowired
    public ProjectContextReader(@Value("${subagents.project.domain:}") String configuredDomain,
                                @Value("${subagents.project.hints:}") List<String> configuredHints,
                                @Value("${subagents.project.context-files:}") List<String> extraFiles) {
        this.configuredDomain = configuredDomain == null || configuredDomain.isBlank() ? null : configuredDomain.strip();
        this.configuredHints  = clean(configuredHints);
        this.extraFiles       = clean(extraFiles);
    }

    /**
     * @param baseDir directory the relative file names are resolved against
     * @return empty when there is no configured context and no file was found
     */
    public Optional<ProjectContext> read(Path baseDir) {
        String domain = configuredDomain;
        Set<String> hints = new LinkedHashSet<>(configuredHints);
        List<String> sections = new ArrayList<>();

        for (ContextFile file : candidateFiles(baseDir)) {
            String content;
            try {
                content = Files.readString(file.path(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("Skipping unreadable context file {}: {}", file.path(), e.getMessage());
                continue;
            }
            sections.add("=== " + file.name() + " ===\n" + content);

            if (domain == null) {
                Matcher m = DOMAIN_LINE.matcher(content);
                if (m.find()) domain = m.group(1).strip();
            }
            Matcher bullets = BULLET.matcher(content);
            while (bullets.find()) {
                hints.add(bullets.group(1).strip());
            }
        }

        if (domain == null && hints.isEmpty() && sections.isEmpty()) {
            log.info("No project context found under {}", baseDir.toAbsolutePath());
            return Optional.empty();
        }

        List<String> kept = hints.stream().limit(MAX_HINTS).toList();
        log.info("Project context: domain='{}', {} hints, {} files",
                domain == null ? DEFAULT_DOMAIN : domain, kept.size(), sections.size());
        return Optional.of(new ProjectContext(
                domain == null ? DEFAULT_DOMAIN : domain,
                kept,
                sections.isEmpty() ? null : String.join("\n\n", sections)));
    }

    /**
     * Configured files first, then the defaults. On case-insensitive file
     * systems Agent.md and agent.md are the same file, so existing files are
     * deduplicated by real path.
     */
    private List<ContextFile> candidateFiles(Path baseDir) {
        List<String> names = new ArrayList<>(extraFiles);
        names.addAll(DEFAULT_FILES);

        Set<Path> seen = new HashSet<>();
        List<ContextFile> files = new ArrayList<>();
        for (String name : names) {
            Path file = baseDir.resolve(name).normalize();
            if (!Files.isRegularFile(file)) continue;
            try {
                if (seen.add(file.toRealPath())) files.add(new ContextFile(name, file));
            } catch (IOException e) {
                log.debug("Cannot resolve {}: {}", file, e.getMessage());
            }
        }
        return files;
    }

    private record ContextFile(String name, Path path) {}

    private static List<String> clean(List<String> values) {
        if (values == null) return List.of();
        return values.stream().map(String::strip).filter(s -> !s.isEmpty()).toList();
    }
}
