package com.gamebook.lint;

import com.gamebook.models.NodeType;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;
import com.gamebook.pipeline.StoryGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shape statistics of a node list: sizes, ending counts and breadth-first depth from the entry.
 */
public class GraphSummary {

    private final int totalNodes;
    private final int totalChoices;
    private final Map<String, Integer> endingCounts;
    private final double averageChoicesPerNormalNode;
    private final int maxDepth;
    private final String entryId;
    private final List<String> unreachableIds;

    private GraphSummary(int totalNodes, int totalChoices, Map<String, Integer> endingCounts,
                         double averageChoicesPerNormalNode, int maxDepth, String entryId,
                         List<String> unreachableIds) {
        this.totalNodes = totalNodes;
        this.totalChoices = totalChoices;
        this.endingCounts = endingCounts;
        this.averageChoicesPerNormalNode = averageChoicesPerNormalNode;
        this.maxDepth = maxDepth;
        this.entryId = entryId;
        this.unreachableIds = unreachableIds;
    }

    public static GraphSummary of(List<StoryNode> nodes, int entrySection) {
        List<StoryNode> safe = nodes != null ? nodes : List.of();
        Map<String, Integer> endings = new LinkedHashMap<>();
        endings.put(NodeType.ENDING_WIN.getValue(), 0);
        endings.put(NodeType.ENDING_DEATH.getValue(), 0);
        endings.put(NodeType.ENDING_NEUTRAL.getValue(), 0);

        int totalChoices = 0;
        int normalNodes = 0;
        int normalChoices = 0;
        for (StoryNode node : safe) {
            int count = node.getChoices().size();
            totalChoices += count;
            NodeType type = node.getType();
            if (type == NodeType.NORMAL) {
                normalNodes++;
                normalChoices += count;
            } else if (type != null) {
                endings.merge(type.getValue(), 1, Integer::sum);
            }
        }

        StoryNode entry = StoryGraph.findEntry(safe, entrySection);
        Map<String, Integer> depths = breadthFirstDepths(safe, entrySection);
        int maxDepth = depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<String> unreachable = new ArrayList<>();
        for (StoryNode node : safe) {
            if (!depths.containsKey(node.getId())) {
                unreachable.add(node.getId());
            }
        }

        double average = normalNodes == 0 ? 0.0 : (double) normalChoices / normalNodes;
        return new GraphSummary(safe.size(), totalChoices, endings, average, maxDepth,
            entry != null ? entry.getId() : null, unreachable);
    }

    /**
     * Breadth-first distance from the entry node to every reachable node id.
     * Choices pointing outside the node list are ignored.
     */
    public static Map<String, Integer> breadthFirstDepths(List<StoryNode> nodes, int entrySection) {
        Map<String, StoryNode> byId = new HashMap<>();
        for (StoryNode node : nodes) {
            byId.putIfAbsent(node.getId(), node);
        }
        Map<String, Integer> depths = new LinkedHashMap<>();
        StoryNode entry = StoryGraph.findEntry(nodes, entrySection);
        if (entry == null) {
            return depths;
        }

        Deque<String> queue = new ArrayDeque<>();
        queue.add(entry.getId());
        depths.put(entry.getId(), 0);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            StoryNode node = byId.get(current);
            if (node == null) {
                continue;
            }
            for (StoryChoice choice : node.getChoices()) {
                String next = choice.getNext();
                if (next != null && byId.containsKey(next) && !depths.containsKey(next)) {
                    depths.put(next, depths.get(current) + 1);
                    queue.add(next);
                }
            }
        }
        return depths;
    }

    public List<String> formatLines() {
        List<String> lines = new ArrayList<>();
        lines.add("Nodes: " + totalNodes + ", choices: " + totalChoices);
        lines.add(String.format(Locale.ROOT, "Endings: win=%d, death=%d, neutral=%d",
            endingCounts.get(NodeType.ENDING_WIN.getValue()),
            endingCounts.get(NodeType.ENDING_DEATH.getValue()),
            endingCounts.get(NodeType.ENDING_NEUTRAL.getValue())));
        lines.add(String.format(Locale.ROOT, "Average choices per normal node: %.2f", averageChoicesPerNormalNode));
        lines.add("Deepest path from entry: " + maxDepth);
        lines.add("Unreachable nodes: " + (unreachableIds.isEmpty() ? "none" : String.join(", ", unreachableIds)));
        return lines;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public int getTotalChoices() {
        return totalChoices;
    }

    public Map<String, Integer> getEndingCounts() {
        return endingCounts;
    }

    public double getAverageChoicesPerNormalNode() {
        return averageChoicesPerNormalNode;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public String getEntryId() {
        return entryId;
    }

    public List<String> getUnreachableIds() {
        return unreachableIds;
    }
}
