package com.gamebook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamebook.PipelineConfigStore.PipelineConfig;
import com.gamebook.StoryBuildService.BuildResult;
import com.gamebook.ingest.PagedTextFileSource;
import com.gamebook.models.NodeType;
import com.gamebook.models.StoryNode;
import com.gamebook.storage.StoryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StoryBuildServiceTest {

    static final String FILLER = "The corridor is quiet and the lamps flicker softly while you wait in silence. "
        + "Dust drifts through the pale light of the old stone hall.";

    static String pageDump() {
        return String.join("\n",
            "--- PAGE 11 ---",
            "1",
            "You stand at the gate. Turn to 2. Turn to 5.",
            FILLER,
            "--- PAGE 12 ---",
            "2",
            "The floor gives way and you die in the dark.",
            FILLER,
            "");
    }

    @TempDir
    Path tempDir;

    private final StoryStore store = new StoryStore(new ObjectMapper());

    @Test
    void buildsRepairsAndPersistsTheStory() throws Exception {
        Path pages = tempDir.resolve("raw_text.txt");
        Files.writeString(pages, pageDump(), StandardCharsets.UTF_8);
        Path story = tempDir.resolve("story.json");
        Path report = tempDir.resolve("link_report.txt");
        Path diff = tempDir.resolve("story.diff");
        StoryBuildService service = new StoryBuildService(store, new PipelineConfig());

        BuildResult result = service.build(PagedTextFileSource.load(pages, 10), story, report, diff);

        List<String> ids = result.nodes().stream().map(StoryNode::getId).collect(Collectors.toList());
        assertEquals(List.of("section_1", "section_2", "section_5"), ids);
        assertEquals(NodeType.NORMAL, result.nodes().get(0).getType());
        assertEquals(NodeType.ENDING_DEATH, result.nodes().get(1).getType());
        // the stub is the only neutral ending, so it becomes the win
        assertEquals(NodeType.ENDING_WIN, result.nodes().get(2).getType());
        assertEquals(List.of("Created stub section 5 (referenced by section 1)."), result.changeLog());
        assertEquals("Created stub section 5 (referenced by section 1).\n",
            Files.readString(report, StandardCharsets.UTF_8));
        assertEquals(0, result.diffHunks());
        assertFalse(Files.exists(diff));
        assertEquals(3, store.read(story).size());
        assertTrue(result.summary().getUnreachableIds().isEmpty());
    }

    @Test
    void rebuildIsStableAndDiffsAgainstPriorStore() throws Exception {
        Path pages = tempDir.resolve("raw_text.txt");
        Files.writeString(pages, pageDump(), StandardCharsets.UTF_8);
        Path story = tempDir.resolve("story.json");
        Path report = tempDir.resolve("link_report.txt");
        Path diff = tempDir.resolve("story.diff");
        StoryBuildService service = new StoryBuildService(store, new PipelineConfig());

        service.build(PagedTextFileSource.load(pages, 10), story, report, diff);
        String firstJson = Files.readString(story, StandardCharsets.UTF_8);
        BuildResult second = service.build(PagedTextFileSource.load(pages, 10), story, report, diff);

        assertEquals(firstJson, Files.readString(story, StandardCharsets.UTF_8));
        assertEquals(0, second.diffHunks());
        assertEquals("", Files.readString(diff, StandardCharsets.UTF_8));
        assertEquals("No broken links found.\n", Files.readString(report, StandardCharsets.UTF_8));
    }

    @Test
    void priorNodesSurviveWhenTheirPagesAreGone() throws Exception {
        Path story = tempDir.resolve("story.json");
        StoryNode remembered = new StoryNode(1, "Forest Road", "The woods are dark and full of wolves.",
            NodeType.ENDING_NEUTRAL);
        store.write(story, List.of(remembered));
        Path diff = tempDir.resolve("story.diff");

        BuildResult result = new StoryBuildService(store, new PipelineConfig())
            .build(new PagedTextFileSource(Map.of(), 10), story, null, diff);

        assertEquals(1, result.nodes().size());
        StoryNode node = result.nodes().get(0);
        assertEquals("The woods are dark and full of wolves.", node.getText());
        assertEquals("Forest Road", node.getTitle());
        assertEquals(NodeType.ENDING_WIN, node.getType());
        assertTrue(result.diffHunks() > 0);
        String diffText = Files.readString(diff, StandardCharsets.UTF_8);
        assertTrue(diffText.contains("-  \"node_type\" : \"ending_neutral\""));
        assertTrue(diffText.contains("+  \"node_type\" : \"ending_win\""));
    }
}
