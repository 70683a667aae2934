package com.gamebook.pipeline;

import com.gamebook.models.StoryNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * Read-only snapshot of a node set keyed by section number.
 *
 * <p>Every pipeline stage takes a snapshot and returns a new one. Nodes handed out by
 * {@link #get(int)} and {@link #nodes()} belong to the snapshot and must not be changed;
 * use {@link #copyNodes()} to obtain a working set.
 */
public final class StoryGraph {

    public static final int DEFAULT_ENTRY_SECTION = 1;

    private final TreeMap<Integer, StoryNode> nodes;
    private final int entrySection;

    private StoryGraph(TreeMap<Integer, StoryNode> nodes, int entrySection) {
        this.nodes = nodes;
        this.entrySection = entrySection;
    }

    public static StoryGraph empty() {
        return new StoryGraph(new TreeMap<>(), DEFAULT_ENTRY_SECTION);
    }

    /**
     * Snapshot of copies of the given nodes. A later node with the same section number replaces an earlier one.
     */
    public static StoryGraph of(Collection<StoryNode> source, int entrySection) {
        TreeMap<Integer, StoryNode> map = new TreeMap<>();
        if (source != null) {
            for (StoryNode node : source) {
                if (node != null) {
                    map.put(node.getSectionNumber(), node.copy());
                }
            }
        }
        return new StoryGraph(map, entrySection);
    }

    public static StoryGraph of(Collection<StoryNode> source) {
        return of(source, DEFAULT_ENTRY_SECTION);
    }

    /**
     * Entry node of an arbitrary node collection: the one numbered {@code entrySection}, else the lowest numbered.
     */
    public static StoryNode findEntry(Collection<StoryNode> source, int entrySection) {
        if (source == null) {
            return null;
        }
        StoryNode lowest = null;
        for (StoryNode node : source) {
            if (node == null) {
                continue;
            }
            if (node.getSectionNumber() == entrySection) {
                return node;
            }
            if (lowest == null || node.getSectionNumber() < lowest.getSectionNumber()) {
                lowest = node;
            }
        }
        return lowest;
    }

    public StoryNode get(int sectionNumber) {
        return nodes.get(sectionNumber);
    }

    public boolean contains(int sectionNumber) {
        return nodes.containsKey(sectionNumber);
    }

    public NavigableSet<Integer> sectionNumbers() {
        return Collections.unmodifiableNavigableSet(nodes.navigableKeySet());
    }

    /**
     * Nodes ascending by section number.
     */
    public List<StoryNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int getEntrySection() {
        return entrySection;
    }

    public StoryNode entry() {
        return findEntry(nodes.values(), entrySection);
    }

    /**
     * Entry node first, every other node ascending by section number.
     */
    public List<StoryNode> inPersistedOrder() {
        List<StoryNode> ordered = new ArrayList<>(nodes.size());
        StoryNode entry = entry();
        if (entry != null) {
            ordered.add(entry);
        }
        for (StoryNode node : nodes.values()) {
            if (node != entry) {
                ordered.add(node);
            }
        }
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Deep copies of every node, keyed and sorted by section number.
     */
    public TreeMap<Integer, StoryNode> copyNodes() {
        TreeMap<Integer, StoryNode> copies = new TreeMap<>();
        for (Map.Entry<Integer, StoryNode> entry : nodes.entrySet()) {
            copies.put(entry.getKey(), entry.getValue().copy());
        }
        return copies;
    }
}
