package com.gamebook.ingest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PagedTextFileSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void mapsSectionsToPagesWithOffset() throws Exception {
        Path dump = tempDir.resolve("raw_text.txt");
        Files.writeString(dump, "--- PAGE 1 ---\nCover page\n\n--- PAGE 11 ---\n1\nYou wake up.\n\n--- PAGE 12 ---\n\n");

        PagedTextFileSource source = PagedTextFileSource.load(dump, 10);
        assertEquals("1\nYou wake up.", source.textFor(1));
        assertEquals("", source.textFor(2));
        assertEquals("", source.textFor(3));
        assertEquals(3, source.getPages().size());
    }

    @Test
    void ignoresTextBeforeFirstMarker() {
        Map<Integer, String> pages = PagedTextFileSource.parse("preamble\n--- PAGE 2 ---\nbody");
        assertEquals(Map.of(2, "body"), pages);
    }

    @Test
    void missingFileIsReported() {
        assertThrows(FileNotFoundException.class,
            () -> PagedTextFileSource.load(tempDir.resolve("absent.txt"), 10));
    }

    @Test
    void usabilityNeedsEnoughLetters() {
        PageTextSource source = section -> section == 1 ? "a".repeat(80) : "a".repeat(79) + " 1234";
        assertTrue(source.looksUsable(1));
        assertFalse(source.looksUsable(2));
    }

    @Test
    void recognizesSectionHeaders() {
        PageTextSource source = section -> "";
        assertTrue(source.looksLikeNewSection("12\nThe road bends."));
        assertTrue(source.looksLikeNewSection("\n- 12 13 -\nThe road bends."));
        assertTrue(source.looksLikeNewSection("7 The Gate\nYou stand."));
        assertFalse(source.looksLikeNewSection("The road bends.\nYou walk on."));
        assertFalse(source.looksLikeNewSection("40 paces further along the road you find a well."));
        assertFalse(source.looksLikeNewSection(""));
    }
}
