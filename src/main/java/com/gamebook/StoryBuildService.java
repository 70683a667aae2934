package com.gamebook;

import com.gamebook.PipelineConfigStore.PipelineConfig;
import com.gamebook.ingest.PageTextSource;
import com.gamebook.lint.GraphSummary;
import com.gamebook.models.StoryNode;
import com.gamebook.pipeline.GraphAssembler;
import com.gamebook.pipeline.GraphRepairer;
import com.gamebook.pipeline.RepairResult;
import com.gamebook.pipeline.StoryGraph;
import com.gamebook.storage.StoryDiffWriter;
import com.gamebook.storage.StoryStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs assemble, repair and persist for one build. The previous store, when present, seeds
 * the assembler and is diffed against the new one.
 */
public class StoryBuildService {

    private final StoryStore store;
    private final PipelineConfig config;
    private final GraphAssembler assembler;
    private final GraphRepairer repairer;
    private final StoryDiffWriter diffWriter;
    private final AppLogger logger = AppLogger.get();

    public StoryBuildService(StoryStore store, PipelineConfig config) {
        this.store = store;
        this.config = config != null ? config : new PipelineConfig();
        this.assembler = new GraphAssembler(this.config);
        this.repairer = new GraphRepairer();
        this.diffWriter = new StoryDiffWriter();
    }

    /**
     * @param diffPath where to write the store diff, or null to skip it
     */
    public BuildResult build(PageTextSource source, Path storyPath, Path reportPath, Path diffPath) throws IOException {
        List<StoryNode> priorNodes = store.readIfExists(storyPath);
        String priorJson = Files.exists(storyPath) ? Files.readString(storyPath, StandardCharsets.UTF_8) : null;

        List<StoryNode> seedNodes = new ArrayList<>();
        for (StoryNode node : priorNodes) {
            if (node.getSectionNumber() > 0) {
                seedNodes.add(node);
            } else {
                logWarn("Ignoring prior node without a section number: " + node.getId());
            }
        }
        StoryGraph prior = StoryGraph.of(seedNodes, config.getEntrySection());

        StoryGraph assembled = assembler.assemble(source, prior);
        RepairResult repaired = repairer.repair(assembled);
        List<StoryNode> nodes = repaired.graph().inPersistedOrder();

        store.write(storyPath, nodes);
        List<String> changes = repaired.changeLogLines();
        if (reportPath != null) {
            store.writeChangeLog(reportPath, changes);
        }

        int diffHunks = 0;
        if (priorJson != null && diffPath != null) {
            String name = storyPath.getFileName().toString();
            diffHunks = diffWriter.write(diffPath, name, priorJson, Files.readString(storyPath, StandardCharsets.UTF_8));
        }

        log("Rebuilt story with " + nodes.size() + " nodes, " + changes.size() + " link changes");
        return new BuildResult(nodes, changes, GraphSummary.of(nodes, config.getEntrySection()), diffHunks);
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[StoryBuildService] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[StoryBuildService] " + message);
        }
    }

    public record BuildResult(List<StoryNode> nodes, List<String> changeLog, GraphSummary summary, int diffHunks) {}
}
