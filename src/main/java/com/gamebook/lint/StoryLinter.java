package com.gamebook.lint;

import com.gamebook.AppLogger;
import com.gamebook.PipelineConfigStore.PipelineConfig;
import com.gamebook.lint.LintReport.CheckResult;
import com.gamebook.lint.LintReport.DuplicateChoice;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Quality gate over a persisted node list: duplicate choices, reachability from the entry and OCR noise.
 * Never changes the nodes except through {@link #fixDuplicateChoices(List)}.
 */
public class StoryLinter {

    static final String ALLOWED_CHARACTERS =
        "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789"
            + " \t\n\r.,!?;:'\"()-[]{}_/\\@#$%^&*+=<>|`~\u20AC\u00A3";

    private final double minReachableRatio;
    private final double maxNoiseRatio;
    private final int entrySection;
    private final AppLogger logger = AppLogger.get();

    public StoryLinter(PipelineConfig config) {
        PipelineConfig safe = config != null ? config : new PipelineConfig();
        this.minReachableRatio = safe.getMinReachableRatio();
        this.maxNoiseRatio = safe.getMaxNoiseRatio();
        this.entrySection = safe.getEntrySection();
    }

    public LintReport lint(List<StoryNode> nodes) {
        List<CheckResult> checks = new ArrayList<>();

        List<DuplicateChoice> duplicates = findDuplicateChoices(nodes);
        if (duplicates.isEmpty()) {
            checks.add(new CheckResult("duplicates", true, "no duplicate choices"));
        } else {
            checks.add(new CheckResult("duplicates", false,
                "duplicate choices detected (" + duplicates.size() + " total)"));
        }

        int reachable = GraphSummary.breadthFirstDepths(nodes, entrySection).size();
        int total = nodes.size();
        double ratio = reachableRatio(nodes);
        if (ratio < minReachableRatio) {
            checks.add(new CheckResult("reachability", false, String.format(Locale.ROOT,
                "reachable ratio %.3f is below threshold %.3f (%d/%d)", ratio, minReachableRatio, reachable, total)));
        } else {
            checks.add(new CheckResult("reachability", true, String.format(Locale.ROOT,
                "reachable ratio %.3f meets threshold %.3f (%d/%d)", ratio, minReachableRatio, reachable, total)));
        }

        double noise = 0.0;
        String noisiest = null;
        for (StoryNode node : nodes) {
            double nodeNoise = noiseRatio(node.getText());
            if (nodeNoise > noise) {
                noise = nodeNoise;
                noisiest = node.getId();
            }
        }
        if (noise > maxNoiseRatio) {
            checks.add(new CheckResult("noise", false, String.format(Locale.ROOT,
                "max noise ratio %.3f exceeds threshold %.3f (node %s)", noise, maxNoiseRatio, noisiest)));
        } else {
            checks.add(new CheckResult("noise", true, String.format(Locale.ROOT,
                "max noise ratio %.3f within threshold %.3f", noise, maxNoiseRatio)));
        }

        LintReport report = new LintReport(checks, duplicates, ratio, noise, noisiest);
        log("Lint " + (report.isPassed() ? "passed" : "failed") + " for " + total + " nodes");
        return report;
    }

    /**
     * Every choice whose (normalized label, next) pair already appeared earlier in the same node.
     */
    public List<DuplicateChoice> findDuplicateChoices(List<StoryNode> nodes) {
        List<DuplicateChoice> duplicates = new ArrayList<>();
        for (StoryNode node : nodes) {
            Set<String> seen = new HashSet<>();
            for (StoryChoice choice : node.getChoices()) {
                if (!seen.add(choice.getDuplicateKey())) {
                    duplicates.add(new DuplicateChoice(node.getId(), choice.getText(), choice.getNext()));
                }
            }
        }
        return duplicates;
    }

    /**
     * Drop later duplicates and cap every node at {@link StoryNode#MAX_CHOICES}, in place.
     */
    public FixResult fixDuplicateChoices(List<StoryNode> nodes) {
        int removed = 0;
        int trimmed = 0;
        for (StoryNode node : nodes) {
            List<StoryChoice> unique = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (StoryChoice choice : node.getChoices()) {
                if (!seen.add(choice.getDuplicateKey())) {
                    removed++;
                    continue;
                }
                unique.add(choice);
            }
            if (unique.size() > StoryNode.MAX_CHOICES) {
                trimmed += unique.size() - StoryNode.MAX_CHOICES;
                unique = new ArrayList<>(unique.subList(0, StoryNode.MAX_CHOICES));
            }
            if (unique.size() != node.getChoices().size()) {
                node.setChoices(unique);
            }
        }
        if (removed > 0 || trimmed > 0) {
            log("Removed " + removed + " duplicate choices, trimmed " + trimmed + " over the cap");
        }
        return new FixResult(removed, trimmed);
    }

    public double reachableRatio(List<StoryNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return 0.0;
        }
        return (double) GraphSummary.breadthFirstDepths(nodes, entrySection).size() / nodes.size();
    }

    /**
     * Share of characters outside {@link #ALLOWED_CHARACTERS}. Empty text counts as clean.
     */
    public static double noiseRatio(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        long bad = text.chars().filter(c -> ALLOWED_CHARACTERS.indexOf(c) < 0).count();
        return (double) bad / text.length();
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[StoryLinter] " + message);
        }
    }

    public record FixResult(int removedDuplicates, int trimmedOverCap) {
        public boolean changed() {
            return removedDuplicates > 0 || trimmedOverCap > 0;
        }
    }
}
