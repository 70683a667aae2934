package com.gamebook.ingest;

import java.util.regex.Pattern;

/**
 * Supplies raw extracted page text by section number.
 */
@FunctionalInterface
public interface PageTextSource {

    int MIN_USABLE_LETTERS = 80;

    Pattern EDGE_PUNCTUATION = Pattern.compile("^[^0-9A-Za-z]+|[^0-9A-Za-z]+$");
    Pattern BARE_NUMBER = Pattern.compile("\\d{1,3}");
    Pattern NUMBER_PAIR = Pattern.compile("\\d{1,3}\\s+\\d{1,3}");
    Pattern LEADING_NUMBER = Pattern.compile("^\\d{1,3}\\b.*");

    /**
     * Raw text for the page holding this section, or an empty string when unavailable.
     */
    String textFor(int sectionNumber);

    /**
     * A page is usable when it carries enough letters to be real prose.
     */
    default boolean looksUsable(int sectionNumber) {
        String text = textFor(sectionNumber);
        if (text == null || text.isBlank()) {
            return false;
        }
        long letters = text.chars().filter(Character::isLetter).count();
        return letters >= MIN_USABLE_LETTERS;
    }

    /**
     * True when one of the first four non-blank lines looks like a bare section header.
     */
    default boolean looksLikeNewSection(String pageText) {
        if (pageText == null || pageText.isBlank()) {
            return false;
        }
        int inspected = 0;
        for (String line : pageText.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (inspected++ >= 4) {
                break;
            }
            String stripped = EDGE_PUNCTUATION.matcher(trimmed).replaceAll("");
            if (stripped.isEmpty()) {
                continue;
            }
            if (BARE_NUMBER.matcher(stripped).matches() || NUMBER_PAIR.matcher(stripped).matches()) {
                return true;
            }
            if (LEADING_NUMBER.matcher(stripped).matches() && stripped.split("\\s+").length <= 3) {
                return true;
            }
        }
        return false;
    }
}
