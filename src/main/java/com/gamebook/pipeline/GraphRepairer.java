package com.gamebook.pipeline;

import com.gamebook.AppLogger;
import com.gamebook.ingest.ChoiceExtractor;
import com.gamebook.ingest.NodeClassifier;
import com.gamebook.ingest.ProseCleaner;
import com.gamebook.ingest.TitleInferrer;
import com.gamebook.models.ChangeLogEntry;
import com.gamebook.models.NodeType;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Closes every dangling destination of an assembled graph and enforces the terminal invariants.
 *
 * <p>Nodes are processed in ascending section order so remaps are reproducible. A missing
 * destination is remapped to the closest existing section within {@link #REMAP_DISTANCE}, the
 * smaller number winning a tie; otherwise a neutral stub is created at exactly that number.
 * The input snapshot is left untouched.
 */
public class GraphRepairer {

    public static final int REMAP_DISTANCE = 2;
    public static final int WIN_SECTION = 999;
    static final String WIN_TITLE = "Final Triumphant Escape";
    static final String WIN_TEXT = "You survive and escape. Victory is yours.";
    private static final List<String> AFFIRMATIVE_CUES = List.of("return", "survive", "find", "worth");

    private final NodeClassifier classifier;
    private final AppLogger logger = AppLogger.get();

    public GraphRepairer() {
        this(new NodeClassifier());
    }

    public GraphRepairer(NodeClassifier classifier) {
        this.classifier = classifier;
    }

    public RepairResult repair(StoryGraph graph) {
        TreeMap<Integer, StoryNode> working = graph.copyNodes();
        List<ChangeLogEntry> changeLog = new ArrayList<>();

        for (StoryNode node : working.values()) {
            node.setId(StoryNode.sectionId(node.getSectionNumber()));
        }

        TreeSet<Integer> existing = new TreeSet<>(working.keySet());
        for (Integer sectionNumber : new ArrayList<>(working.keySet())) {
            StoryNode node = working.get(sectionNumber);
            for (StoryChoice choice : node.getChoices()) {
                ChangeLogEntry entry = closeDanglingEdge(sectionNumber, choice, existing, working);
                if (entry != null) {
                    changeLog.add(entry);
                    log(entry.getMessage());
                }
            }
        }

        for (StoryNode node : working.values()) {
            normalizeNode(node);
        }
        ensureWinEnding(working);

        return new RepairResult(StoryGraph.of(working.values(), graph.getEntrySection()), changeLog);
    }

    private ChangeLogEntry closeDanglingEdge(int source, StoryChoice choice, TreeSet<Integer> existing,
                                             TreeMap<Integer, StoryNode> working) {
        Integer destination = choice.getDestination();
        if (destination != null && existing.contains(destination)) {
            return null;
        }

        if (destination != null) {
            Integer remap = nearestExisting(destination, existing);
            if (remap != null) {
                choice.setNext(StoryNode.sectionId(remap));
                return ChangeLogEntry.remap(source, destination, remap);
            }
        }

        int stubSection = destination != null && destination > 0
            ? destination
            : (existing.isEmpty() ? 1 : existing.last() + 1);
        working.put(stubSection, createStub(stubSection));
        existing.add(stubSection);
        choice.setNext(StoryNode.sectionId(stubSection));
        return ChangeLogEntry.stub(source, stubSection);
    }

    /**
     * Closest existing section within {@link #REMAP_DISTANCE}; on equal distance the smaller number.
     */
    static Integer nearestExisting(int destination, NavigableSet<Integer> existing) {
        for (int distance = 1; distance <= REMAP_DISTANCE; distance++) {
            if (existing.contains(destination - distance)) {
                return destination - distance;
            }
            if (existing.contains(destination + distance)) {
                return destination + distance;
            }
        }
        return null;
    }

    static StoryNode createStub(int sectionNumber) {
        return new StoryNode(sectionNumber, TitleInferrer.defaultTitle(sectionNumber),
            ProseCleaner.missingSectionText(sectionNumber), NodeType.ENDING_NEUTRAL);
    }

    private void normalizeNode(StoryNode node) {
        int sectionNumber = node.getSectionNumber();
        if (node.getTitle() == null || node.getTitle().isBlank()) {
            node.setTitle(TitleInferrer.defaultTitle(sectionNumber));
        }
        if (node.getText() == null || node.getText().isBlank()) {
            node.setText(ProseCleaner.missingSectionText(sectionNumber));
        }

        // Parallel duplicates are dropped silently here; the linter is the one that reports them.
        List<StoryChoice> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (StoryChoice choice : node.getChoices()) {
            if (!seen.add(choice.getDuplicateKey())) {
                continue;
            }
            String label = choice.getText() != null ? choice.getText().trim() : "";
            if (label.isEmpty()) {
                Integer destination = choice.getDestination();
                label = ChoiceExtractor.defaultLabel(destination != null ? destination : sectionNumber);
            }
            if (label.length() > StoryChoice.MAX_LABEL_LENGTH) {
                label = label.substring(0, StoryChoice.MAX_LABEL_LENGTH);
            }
            choice.setText(label);
            kept.add(choice);
            if (kept.size() >= StoryNode.MAX_CHOICES) {
                break;
            }
        }
        node.setChoices(kept);

        if (node.hasChoices()) {
            node.setType(NodeType.NORMAL);
        } else if (node.getType() == null || node.getType() == NodeType.NORMAL) {
            node.setType(classifier.classify(node.getText(), false));
        }
    }

    private void ensureWinEnding(TreeMap<Integer, StoryNode> working) {
        for (StoryNode node : working.values()) {
            if (node.getType() == NodeType.ENDING_WIN) {
                return;
            }
        }

        StoryNode firstNeutral = null;
        for (StoryNode node : working.values()) {
            if (node.getType() != NodeType.ENDING_NEUTRAL) {
                continue;
            }
            if (firstNeutral == null) {
                firstNeutral = node;
            }
            if (hasAffirmativeCue(node.getText())) {
                promote(node, "affirmative ending");
                return;
            }
        }
        if (firstNeutral != null) {
            promote(firstNeutral, "first neutral ending");
            return;
        }

        int winSection = working.isEmpty() || working.lastKey() < WIN_SECTION ? WIN_SECTION : working.lastKey() + 1;
        StoryNode win = new StoryNode(winSection, WIN_TITLE, WIN_TEXT, NodeType.ENDING_WIN);
        working.put(winSection, win);
        log("No ending could be promoted, created win ending " + win.getId());
    }

    private void promote(StoryNode node, String reason) {
        node.setType(NodeType.ENDING_WIN);
        log("Promoted " + node.getId() + " to ending_win (" + reason + ")");
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[GraphRepairer] " + message);
        }
    }

    static boolean hasAffirmativeCue(String text) {
        String lower = text != null ? text.toLowerCase(Locale.ROOT) : "";
        for (String cue : AFFIRMATIVE_CUES) {
            if (lower.contains(cue)) {
                return true;
            }
        }
        return false;
    }
}
