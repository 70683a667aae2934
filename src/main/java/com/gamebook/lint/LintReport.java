package com.gamebook.lint;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one linter run. Passes only when every check passed.
 */
public class LintReport {

    private final List<CheckResult> checks;
    private final List<DuplicateChoice> duplicates;
    private final double reachableRatio;
    private final double maxNoiseRatio;
    private final String noisiestNodeId;

    public LintReport(List<CheckResult> checks, List<DuplicateChoice> duplicates, double reachableRatio,
                      double maxNoiseRatio, String noisiestNodeId) {
        this.checks = checks != null ? checks : new ArrayList<>();
        this.duplicates = duplicates != null ? duplicates : new ArrayList<>();
        this.reachableRatio = reachableRatio;
        this.maxNoiseRatio = maxNoiseRatio;
        this.noisiestNodeId = noisiestNodeId;
    }

    public boolean isPassed() {
        return checks.stream().allMatch(CheckResult::passed);
    }

    public List<String> formatLines() {
        List<String> lines = new ArrayList<>();
        for (CheckResult check : checks) {
            lines.add((check.passed() ? "PASS: " : "FAIL: ") + check.message());
        }
        return lines;
    }

    public List<CheckResult> getChecks() {
        return checks;
    }

    public List<DuplicateChoice> getDuplicates() {
        return duplicates;
    }

    public double getReachableRatio() {
        return reachableRatio;
    }

    public double getMaxNoiseRatio() {
        return maxNoiseRatio;
    }

    public String getNoisiestNodeId() {
        return noisiestNodeId;
    }

    public record CheckResult(String name, boolean passed, String message) {}

    public record DuplicateChoice(String nodeId, String label, String next) {}
}
