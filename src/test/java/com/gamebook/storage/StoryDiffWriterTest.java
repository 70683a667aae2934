package com.gamebook.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoryDiffWriterTest {

    @TempDir
    Path tempDir;

    private final StoryDiffWriter writer = new StoryDiffWriter();

    @Test
    void identicalTextHasNoDiff() throws Exception {
        String text = "[\n  1,\n  2\n]\n";
        assertEquals("", writer.unifiedDiff("story.json", text, text));

        Path target = tempDir.resolve("story.diff");
        assertEquals(0, writer.write(target, "story.json", text, text));
        assertEquals("", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void changedLineProducesUnifiedHunk() throws Exception {
        String before = "a\nb\nc\n";
        String after = "a\nB\nc\n";

        String diff = writer.unifiedDiff("story.json", before, after);

        assertTrue(diff.startsWith("--- story.json\n+++ story.json\n@@ "));
        assertTrue(diff.contains("\n-b\n+B"));

        Path target = tempDir.resolve("out/story.diff");
        assertEquals(1, writer.write(target, "story.json", before, after));
        assertEquals(diff + "\n", Files.readString(target, StandardCharsets.UTF_8));
    }
}
