package com.gamebook.ingest;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TitleInferrerTest {

    private final TitleInferrer inferrer = new TitleInferrer();

    @Test
    void picksFirstMatchingKeywordGroup() {
        assertEquals("Dragon Trail", inferrer.inferTitle(4, "A dragon blocks the trail."));
        assertEquals("Dragon Encounter", inferrer.inferTitle(4, "A dragon sleeps."));
        assertEquals("Toward Forbidden Castle", inferrer.inferTitle(4, "You find the Forbidden Castle."));
        assertEquals("Forest Road", inferrer.inferTitle(4, "Wolves howl in the woods."));
        assertEquals("Cave Passage", inferrer.inferTitle(4, "A narrow tunnel."));
        assertEquals("Journey's End", inferrer.inferTitle(4, "THE END"));
    }

    @Test
    void defaultsToSectionNumber() {
        assertEquals("Section 42", inferrer.inferTitle(42, "Nothing of note."));
        assertEquals("Section 42", inferrer.inferTitle(42, null));
    }
}
