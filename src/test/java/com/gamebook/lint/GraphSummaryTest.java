package com.gamebook.lint;

import com.gamebook.models.NodeType;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphSummaryTest {

    private static StoryNode node(int section, NodeType type, int... destinations) {
        StoryNode node = new StoryNode(section, "Section " + section, "Text.", type);
        for (int destination : destinations) {
            node.getChoices().add(new StoryChoice("Go", StoryNode.sectionId(destination)));
        }
        return node;
    }

    @Test
    void countsEndingsDepthAndUnreachable() {
        List<StoryNode> nodes = List.of(
            node(1, NodeType.NORMAL, 2, 3),
            node(2, NodeType.NORMAL, 4),
            node(3, NodeType.ENDING_DEATH),
            node(4, NodeType.ENDING_WIN),
            node(9, NodeType.ENDING_NEUTRAL));

        GraphSummary summary = GraphSummary.of(nodes, 1);

        assertEquals(5, summary.getTotalNodes());
        assertEquals(3, summary.getTotalChoices());
        assertEquals(1.5, summary.getAverageChoicesPerNormalNode(), 1e-9);
        assertEquals(2, summary.getMaxDepth());
        assertEquals("section_1", summary.getEntryId());
        assertEquals(List.of("section_9"), summary.getUnreachableIds());
        assertEquals(Map.of("ending_win", 1, "ending_death", 1, "ending_neutral", 1), summary.getEndingCounts());
        assertEquals(List.of(
            "Nodes: 5, choices: 3",
            "Endings: win=1, death=1, neutral=1",
            "Average choices per normal node: 1.50",
            "Deepest path from entry: 2",
            "Unreachable nodes: section_9"), summary.formatLines());
    }

    @Test
    void depthsIgnoreDanglingChoices() {
        List<StoryNode> nodes = List.of(node(1, NodeType.NORMAL, 2, 77), node(2, NodeType.ENDING_WIN));

        Map<String, Integer> depths = GraphSummary.breadthFirstDepths(nodes, 1);

        assertEquals(Map.of("section_1", 0, "section_2", 1), depths);
    }

    @Test
    void emptyStoreHasNoEntry() {
        GraphSummary summary = GraphSummary.of(List.of(), 1);

        assertEquals(0, summary.getTotalNodes());
        assertNull(summary.getEntryId());
        assertEquals(0, summary.getMaxDepth());
        assertTrue(summary.formatLines().contains("Unreachable nodes: none"));
    }
}
