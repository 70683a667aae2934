package com.gamebook.storage;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.gamebook.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Unified diff between the previous and the rebuilt story store.
 */
public class StoryDiffWriter {

    private static final int CONTEXT_LINES = 3;

    private final AppLogger logger = AppLogger.get();

    public String unifiedDiff(String fileName, String before, String after) {
        List<String> original = lines(before);
        return render(fileName, original, DiffUtils.diff(original, lines(after)));
    }

    /**
     * Write the diff and return the number of changed hunks.
     */
    public int write(Path target, String fileName, String before, String after) throws IOException {
        List<String> original = lines(before);
        Patch<String> patch = DiffUtils.diff(original, lines(after));
        String diff = render(fileName, original, patch);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, diff.isEmpty() ? "" : diff + "\n", StandardCharsets.UTF_8);
        int hunks = patch.getDeltas().size();
        if (logger != null) {
            logger.info("[StoryDiffWriter] Wrote " + hunks + " changed hunks to " + target);
        }
        return hunks;
    }

    private String render(String fileName, List<String> original, Patch<String> patch) {
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
            fileName,
            fileName,
            original,
            patch,
            CONTEXT_LINES
        );
        return String.join("\n", unified);
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\\R", -1));
    }
}
