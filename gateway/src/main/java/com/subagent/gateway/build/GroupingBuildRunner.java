package com.subagent.gateway.build;

import com.subagent.gateway.completion.CompletionProvider;
import com.subagent.gateway.grouping.ToolGroupingOrchestrator;
import com.subagent.gateway.model.GroupingConstraints;
import com.subagent.gateway.model.ProjectContext;
import com.subagent.gateway.model.Tool;
import com.subagent.gateway.model.ToolGroup;
import com.subagent.gateway.store.GroupLayout;
import com.subagent.gateway.store.GroupStore;
import com.subagent.gateway.store.PersistedGroups;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * The offline build: catalog, project context, grouping, instructions, save.
 *
 * Runs once at startup under the {@code build} profile; the web server is
 * disabled in that profile so the process exits when this returns. Any
 * exception other than an instructions failure aborts the build and leaves
 * the previous groups on disk untouched.
 */
@Component
@Profile("build")
public class GroupingBuildRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(GroupingBuildRunner.class);

    private final ToolCatalogLoader        catalogLoader;
    private final ProjectContextReader     contextReader;
    private final ToolGroupingOrchestrator orchestrator;
    private final InstructionsGenerator    instructionsGenerator;
    private final CompletionProvider       completion;
    private final GroupStore               groupStore;
    private final GroupingConstraints      constraints;
    private final Path                     toolsPath;
    private final Path                     groupsPath;
    private final GroupLayout              layout;
    private final Path                     projectRoot;

    public GroupingBuildRunner(ToolCatalogLoader catalogLoader,
                               ProjectContextReader contextReader,
                               ToolGroupingOrchestrator orchestrator,
                               InstructionsGenerator instructionsGenerator,
                               CompletionProvider completion,
                               GroupStore groupStore,
                               GroupingConstraints constraints,
                               @Value("${subagents.tools-path:.subagents/tools.json}") Path toolsPath,
                               @Value("${subagents.groups-path:.subagents/groups.json}") Path groupsPath,
                               @Value("${subagents.groups-layout:JSON_FILE}") GroupLayout layout,
                               @Value("${subagents.project.root:.}") Path projectRoot) {
        this.catalogLoader         = catalogLoader;
        this.contextReader         = contextReader;
        this.orchestrator          = orchestrator;
        this.instructionsGenerator = instructionsGenerator;
        this.completion            = completion;
        this.groupStore            = groupStore;
        this.constraints           = constraints;
        this.toolsPath             = toolsPath;
        this.groupsPath            = groupsPath;
        this.layout                = layout;
        this.projectRoot           = projectRoot;
    }

    @Override
    public void run(String... args) {
        long start = System.currentTimeMillis();

        List<Tool> tools = catalogLoader.load(toolsPath);
        ProjectContext context = contextReader.read(projectRoot).orElse(null);

        List<ToolGroup> groups = orchestrator.groupTools(tools, completion, constraints, context);

        String instructions = null;
        try {
            instructions = instructionsGenerator.generate(groups, completion, context);
        } catch (RuntimeException e) {
            log.warn("Could not generate usage instructions, continuing without them: {}", e.getMessage());
        }

        groupStore.save(new PersistedGroups(instructions, groups), groupsPath, layout);

        log.info("Build complete in {}s: {} tools -> {} groups", (System.currentTimeMillis() - start) / 1000,
                tools.size(), groups.size());
        for (ToolGroup g : groups) {
            log.info("  {} ({} tools): {}", g.id(), g.tools().size(), g.name());
        }
    }
}
