package com.gamebook.ingest;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void replacesTypographicGlyphs() {
        String raw = "A\u2014B \u201Cquoted\u201D it\u2019s \u00ABfine\u00BB";
        assertEquals("A-B \"quoted\" it's \"fine\"", normalizer.normalize(raw));
    }

    @Test
    void unifiesLineEndings() {
        assertEquals("a\nb\nc", normalizer.normalize("a\r\nb\rc"));
    }

    @Test
    void stripsSoftHyphens() {
        assertEquals("paragraph", normalizer.normalize("para\u00ADgraph"));
    }

    @Test
    void rejoinsWordsWrappedAcrossLines() {
        assertEquals("a wonderful day", normalizer.normalize("a won-\nderful day"));
        assertEquals("a wonderful day", normalizer.normalize("a won- \n  derful day"));
    }

    @Test
    void leavesHyphenWithoutLineBreak() {
        assertEquals("well - known", normalizer.normalize("well - known"));
    }

    @Test
    void repairsSplitPageReferences() {
        assertEquals("turn to page 18.", normalizer.normalize("turn to page 1 8."));
        assertEquals("see section 123 now", normalizer.normalize("see section 1 2 3 now"));
        assertEquals("Page 45", normalizer.normalize("Page 4 5"));
    }

    @Test
    void collapsesWhitespace() {
        assertEquals("one two three", normalizer.collapseWhitespace("  one\n\ttwo   three \n"));
        assertEquals("", normalizer.collapseWhitespace(null));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", normalizer.normalize(null));
    }
}
