package com.gamebook.pipeline;

import com.gamebook.models.NodeType;
import com.gamebook.models.StoryNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class StoryGraphTest {

    @Test
    void copiesNodesOnConstruction() {
        StoryNode original = new StoryNode(2, "Title", "Text.", NodeType.ENDING_WIN);
        StoryGraph graph = StoryGraph.of(List.of(original));

        original.setText("Changed.");

        assertEquals("Text.", graph.get(2).getText());
    }

    @Test
    void laterDuplicateSectionReplacesEarlier() {
        StoryGraph graph = StoryGraph.of(List.of(
            new StoryNode(4, "First", "A.", NodeType.ENDING_NEUTRAL),
            new StoryNode(4, "Second", "B.", NodeType.ENDING_NEUTRAL)));

        assertEquals(1, graph.size());
        assertEquals("Second", graph.get(4).getTitle());
    }

    @Test
    void entryFallsBackToLowestSection() {
        StoryGraph graph = StoryGraph.of(List.of(
            new StoryNode(9, "Nine", "A.", NodeType.ENDING_NEUTRAL),
            new StoryNode(3, "Three", "B.", NodeType.ENDING_NEUTRAL)));

        assertEquals(3, graph.entry().getSectionNumber());
        assertNull(StoryGraph.empty().entry());
        assertTrue(StoryGraph.empty().isEmpty());
    }

    @Test
    void copyNodesIsIndependentOfSnapshot() {
        StoryGraph graph = StoryGraph.of(List.of(new StoryNode(1, "One", "A.", NodeType.ENDING_NEUTRAL)));

        TreeMap<Integer, StoryNode> working = graph.copyNodes();
        working.get(1).setTitle("Edited");
        working.remove(1);

        assertEquals("One", graph.get(1).getTitle());
        assertThrows(UnsupportedOperationException.class, () -> graph.sectionNumbers().add(5));
    }
}
