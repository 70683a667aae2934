package com.gamebook.pipeline;

import com.gamebook.models.ChangeLogEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Repaired graph plus the ordered audit trail of remaps and stubs.
 */
public record RepairResult(StoryGraph graph, List<ChangeLogEntry> changeLog) {

    public RepairResult {
        changeLog = changeLog != null ? List.copyOf(changeLog) : List.of();
    }

    public List<String> changeLogLines() {
        return changeLog.stream().map(ChangeLogEntry::getMessage).collect(Collectors.toList());
    }
}
