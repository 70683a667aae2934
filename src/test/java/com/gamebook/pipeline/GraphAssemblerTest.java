package com.gamebook.pipeline;

import com.gamebook.PipelineConfigStore.PipelineConfig;
import com.gamebook.ingest.PageTextSource;
import com.gamebook.models.NodeType;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphAssemblerTest {

    private static final String FILLER = "The corridor is quiet and the lamps flicker softly while you wait in silence. "
        + "Dust drifts through the pale light of the old stone hall.";

    private static PageTextSource pages(Map<Integer, String> pages) {
        return section -> pages.getOrDefault(section, "");
    }

    private static String page(int section, String prose) {
        return section + "\n" + prose + "\n" + FILLER;
    }

    @Test
    void expandsFromEntryThroughExtractedChoices() {
        Map<Integer, String> source = new HashMap<>();
        source.put(1, page(1, "You stand at the gate. Turn to 2. Turn to 3."));
        source.put(2, page(2, "The floor gives way and you die in the dark."));
        source.put(3, page(3, "Victory is yours at last."));
        source.put(4, page(4, "Nobody ever comes here."));

        StoryGraph graph = new GraphAssembler(new PipelineConfig()).assemble(pages(source), StoryGraph.empty());

        assertEquals(List.of(1, 2, 3), List.copyOf(graph.sectionNumbers()));
        StoryNode entry = graph.get(1);
        assertEquals(NodeType.NORMAL, entry.getType());
        assertEquals(List.of("section_2", "section_3"), entry.getChoices().stream().map(StoryChoice::getNext).toList());
        assertFalse(entry.getText().contains("Turn to"));
        assertTrue(entry.getText().startsWith("You stand at the gate."));
        assertEquals(NodeType.ENDING_DEATH, graph.get(2).getType());
        assertEquals(NodeType.ENDING_WIN, graph.get(3).getType());
    }

    @Test
    void secondPassAddsDestinationsRejectedDuringTheMainLoop() {
        Map<Integer, String> text = new HashMap<>();
        text.put(1, page(1, "You stand at the gate. Turn to 2. Turn to 7."));
        text.put(2, page(2, "A stair leads down. Turn to 3."));
        text.put(3, page(3, "Victory is yours at last."));
        Map<Integer, Integer> usableChecks = new HashMap<>();
        PageTextSource source = new PageTextSource() {
            @Override
            public String textFor(int sectionNumber) {
                return text.getOrDefault(sectionNumber, "");
            }

            @Override
            public boolean looksUsable(int sectionNumber) {
                int checks = usableChecks.merge(sectionNumber, 1, Integer::sum);
                // page 2 is still being scanned the first time it is asked for
                if (sectionNumber == 2 && checks == 1) {
                    return false;
                }
                return PageTextSource.super.looksUsable(sectionNumber);
            }
        };

        StoryGraph graph = new GraphAssembler(new PipelineConfig()).assemble(source, StoryGraph.empty());

        assertEquals(List.of(1, 2, 3), List.copyOf(graph.sectionNumbers()));
        assertEquals(List.of("section_3"), graph.get(2).getChoices().stream().map(StoryChoice::getNext).toList());
        assertFalse(graph.contains(7));
        assertEquals(2, usableChecks.get(2));
        // main loop, then one scan per pass: adds 2, adds 3, adds nothing
        assertEquals(4, usableChecks.get(7));
    }

    @Test
    void stopsAtSafetyCap() {
        Map<Integer, String> source = new HashMap<>();
        source.put(1, page(1, "Turn to 2. Turn to 3."));
        source.put(2, page(2, "You rest."));
        source.put(3, page(3, "You rest again."));
        PipelineConfig config = new PipelineConfig();
        config.setMaxNodes(2);

        StoryGraph graph = new GraphAssembler(config).assemble(pages(source), StoryGraph.empty());

        assertEquals(2, graph.size());
        assertFalse(graph.contains(3));
    }

    @Test
    void absorbsContinuationPageWhenNoChoiceFound() {
        Map<Integer, String> source = new HashMap<>();
        source.put(1, page(1, "Start here. Turn to 5."));
        source.put(5, page(5, "The passage bends to the left."));
        source.put(6, "The tunnel opens onto a narrow ledge. Turn to 9.");
        source.put(9, page(9, "You are free at last."));

        StoryGraph graph = new GraphAssembler(new PipelineConfig()).assemble(pages(source), StoryGraph.empty());

        StoryNode five = graph.get(5);
        assertEquals(List.of("section_9"), five.getChoices().stream().map(StoryChoice::getNext).toList());
        assertTrue(five.getText().contains("narrow ledge"));
        assertTrue(graph.contains(9));
        assertFalse(graph.contains(6));
    }

    @Test
    void continuationStopsAtNewSectionHeader() {
        Map<Integer, String> source = new HashMap<>();
        source.put(1, page(1, "You sit down by the fire."));
        source.put(2, page(2, "Turn to 4."));

        StoryGraph graph = new GraphAssembler(new PipelineConfig()).assemble(pages(source), StoryGraph.empty());

        assertEquals(1, graph.size());
        assertFalse(graph.get(1).hasChoices());
        assertEquals(NodeType.ENDING_NEUTRAL, graph.get(1).getType());
    }

    @Test
    void reusesPriorNodeWhenPageYieldsNoChoices() {
        StoryNode prior = new StoryNode(1, "Old", "Old text.", NodeType.NORMAL);
        StoryChoice choice = new StoryChoice("Open the chest", "section_4");
        choice.setRequires(Map.of("gold", 5));
        prior.setChoices(List.of(choice));
        prior.setEffects(Map.of("morale", 1));

        Map<Integer, String> source = new HashMap<>();
        source.put(1, page(1, "The map is smudged."));

        StoryGraph graph = new GraphAssembler(new PipelineConfig())
            .assemble(pages(source), StoryGraph.of(List.of(prior)));

        StoryNode node = graph.get(1);
        assertEquals(1, node.getChoices().size());
        StoryChoice reused = node.getChoices().get(0);
        assertEquals("Go to section 4.", reused.getText());
        assertEquals("section_4", reused.getNext());
        assertEquals(5, reused.getRequires().get("gold"));
        assertEquals(1, node.getEffects().get("morale"));
        assertEquals(NodeType.NORMAL, node.getType());
    }

    @Test
    void priorSectionsSeedTheFrontier() {
        StoryNode prior = new StoryNode(7, "Old", "Remembered text.", NodeType.ENDING_NEUTRAL);
        Map<Integer, String> source = new HashMap<>();
        source.put(1, page(1, "Nothing happens."));

        StoryGraph graph = new GraphAssembler(new PipelineConfig())
            .assemble(pages(source), StoryGraph.of(List.of(prior)));

        assertTrue(graph.contains(7));
        assertEquals("Remembered text.", graph.get(7).getText());
    }
}
