package com.gamebook.ingest;

import java.util.regex.Pattern;

/**
 * Canonicalizes raw OCR page text. Stateless.
 */
public class TextNormalizer {

    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");
    private static final Pattern WRAPPED_WORD = Pattern.compile("([A-Za-z])-[ \\t]*\\n[ \\t]*([A-Za-z])");
    private static final Pattern SPLIT_THREE_DIGITS =
        Pattern.compile("(?i)\\b(page|section)\\s+(\\d)\\s+(\\d)\\s+(\\d)\\b");
    private static final Pattern SPLIT_TWO_DIGITS =
        Pattern.compile("(?i)\\b(page|section)\\s+(\\d)\\s+(\\d)\\b");

    public String normalize(String raw) {
        if (raw == null) return "";
        String t = raw.replace("\r\n", "\n").replace('\r', '\n');

        // dashes and hyphen variants
        t = t.replace('\u2014', '-').replace('\u2013', '-')
            .replace('\u2010', '-').replace('\u2011', '-').replace('\u2012', '-').replace('\u2212', '-');
        // typographic quotes
        t = t.replace('\u201C', '"').replace('\u201D', '"').replace('\u201E', '"')
            .replace('\u00AB', '"').replace('\u00BB', '"');
        t = t.replace('\u2019', '\'').replace('\u2018', '\'').replace('\u201A', '\'');
        // soft hyphen
        t = t.replace("\u00AD", "");
        t = t.replace('_', ' ');

        t = WRAPPED_WORD.matcher(t).replaceAll("$1$2");

        // "page 1 2 3" before "page 1 2" so the longer form is not cut short
        t = SPLIT_THREE_DIGITS.matcher(t).replaceAll("$1 $2$3$4");
        t = SPLIT_TWO_DIGITS.matcher(t).replaceAll("$1 $2$3");
        return t;
    }

    /**
     * Collapse every whitespace run, newlines included, to one space.
     */
    public String collapseWhitespace(String s) {
        if (s == null) return "";
        return MULTI_SPACE.matcher(s).replaceAll(" ").trim();
    }
}
