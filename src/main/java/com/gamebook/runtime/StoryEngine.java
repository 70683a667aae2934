package com.gamebook.runtime;

import com.gamebook.AppLogger;
import com.gamebook.models.NodeType;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;
import com.gamebook.pipeline.StoryGraph;
import com.gamebook.storage.StoryStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read API over a validated story for the gameplay layer.
 */
public class StoryEngine {

    static final String DEFAULT_TITLE = "Cold Start";
    static final String DEFAULT_TEXT = "No story file was found. Add story.json to continue.";

    private final List<StoryNode> nodes;
    private final Map<String, StoryNode> nodesById;
    private final RequirementEvaluator evaluator;

    public StoryEngine(List<StoryNode> source) {
        this(source, new RequirementEvaluator());
    }

    public StoryEngine(List<StoryNode> source, RequirementEvaluator evaluator) {
        List<StoryNode> prepared = new ArrayList<>();
        if (source != null) {
            for (StoryNode node : source) {
                if (node != null) {
                    prepared.add(prepare(node));
                }
            }
        }
        if (prepared.isEmpty()) {
            prepared = defaultStory();
        }
        prepared.sort(Comparator.comparingInt(StoryNode::getSectionNumber).thenComparing(StoryNode::getId));

        Map<String, StoryNode> byId = new LinkedHashMap<>();
        for (StoryNode node : prepared) {
            byId.putIfAbsent(node.getId(), node);
        }
        this.nodes = Collections.unmodifiableList(prepared);
        this.nodesById = byId;
        this.evaluator = evaluator != null ? evaluator : new RequirementEvaluator();
    }

    /**
     * Load the store at {@code path}. A missing store yields the single-node placeholder story.
     *
     * @throws com.gamebook.storage.StoryStoreException when the store is malformed
     */
    public static StoryEngine load(StoryStore store, Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("[StoryEngine] Story file not found, using placeholder story: " + path);
            }
            return new StoryEngine(Collections.emptyList());
        }
        return new StoryEngine(store.read(path));
    }

    public StoryNode getEntryNode() {
        return StoryGraph.findEntry(nodes, StoryGraph.DEFAULT_ENTRY_SECTION);
    }

    public Optional<StoryNode> getNode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodesById.get(id.trim()));
    }

    public boolean nodeExists(String id) {
        return getNode(id).isPresent();
    }

    public List<StoryNode> getNodes() {
        return nodes;
    }

    public List<StoryChoice> getAvailableChoices(StoryNode node, Map<String, ?> stats) {
        return getAvailableChoices(node, stats, false);
    }

    /**
     * Choices whose requirements the stats satisfy, or all of them when {@code includeLocked} is set.
     */
    public List<StoryChoice> getAvailableChoices(StoryNode node, Map<String, ?> stats, boolean includeLocked) {
        if (node == null) {
            return Collections.emptyList();
        }
        List<StoryChoice> available = new ArrayList<>();
        for (StoryChoice choice : node.getChoices()) {
            if (includeLocked || evaluator.requirementsMet(choice.getRequires(), stats)) {
                available.add(choice.copy());
            }
        }
        return available;
    }

    /**
     * Node reached by the {@code index}-th available choice, if that choice exists and leads somewhere real.
     */
    public Optional<StoryNode> resolveChoice(StoryNode node, int index, Map<String, ?> stats) {
        List<StoryChoice> available = getAvailableChoices(node, stats);
        if (index < 0 || index >= available.size()) {
            return Optional.empty();
        }
        return getNode(available.get(index).getNext());
    }

    private static StoryNode prepare(StoryNode source) {
        StoryNode node = source.copy();
        if (node.getSectionNumber() <= 0) {
            Integer fromId = StoryNode.parseSectionId(node.getId());
            node.setSectionNumber(fromId != null ? fromId : 0);
        }
        if (node.getId() == null || node.getId().isBlank()) {
            node.setId(StoryNode.sectionId(Math.max(node.getSectionNumber(), 0)));
        }
        if (node.getTitle() == null || node.getTitle().isBlank()) {
            node.setTitle("Untitled Scene");
        }
        if (node.getText() == null) {
            node.setText("");
        }

        List<StoryChoice> choices = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (StoryChoice choice : node.getChoices()) {
            if (choices.size() >= StoryNode.MAX_CHOICES) {
                break;
            }
            if (choice == null || choice.getNext() == null || choice.getNext().isBlank()) {
                continue;
            }
            if (choice.getText() == null || choice.getText().isBlank()) {
                choice.setText("Continue");
            }
            if (seen.add(choice.getDuplicateKey())) {
                choices.add(choice);
            }
        }
        node.setChoices(choices);

        // A normal node without exits would strand the player.
        NodeType type = node.getType();
        if (type == null) {
            node.setType(choices.isEmpty() ? NodeType.ENDING_NEUTRAL : NodeType.NORMAL);
        } else if (type == NodeType.NORMAL && choices.isEmpty()) {
            node.setType(NodeType.ENDING_NEUTRAL);
        }
        return node;
    }

    private static List<StoryNode> defaultStory() {
        List<StoryNode> story = new ArrayList<>();
        story.add(new StoryNode(1, DEFAULT_TITLE, DEFAULT_TEXT, NodeType.ENDING_NEUTRAL));
        return story;
    }
}
