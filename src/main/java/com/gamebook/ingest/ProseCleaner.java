package com.gamebook.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns normalized page text into display prose: drops OCR noise lines, removes the clauses the
 * {@link ChoiceExtractor} consumed and reflows what is left into blank-line separated paragraphs.
 */
public class ProseCleaner {

    private static final Pattern NOISE_SYMBOLS = Pattern.compile("[\\\\/_=~|<>]{3,}");
    private static final Pattern PAGE_NUMBER_LINE = Pattern.compile("^[^A-Za-z0-9]*\\d{1,3}[^A-Za-z0-9]*$");
    private static final Pattern PAGE_NUMBER_PREFIX = Pattern.compile("^[^A-Za-z]*\\d{1,3}\\b[^A-Za-z]*");
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("\\s+([,.!?;:])");
    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^[\\s\\-]+|[\\s\\-]+$");

    private static final double MIN_ALPHA_RATIO = 0.28;
    private static final double MAX_SINGLE_LETTER_WORDS = 0.55;
    private static final double MIN_AVG_WORD_LENGTH = 3.2;
    private static final double MIN_VOWEL_WORDS = 0.65;
    private static final double MAX_CAPS_WORDS = 0.7;
    private static final double MIN_VOWEL_WORDS_FOR_CAPS = 0.7;
    private static final double MAX_PUNCTUATION_DENSITY = 0.25;
    private static final double MIN_ALPHA_RATIO_WITH_PUNCTUATION = 0.55;

    private final ChoiceExtractor choiceExtractor;

    public ProseCleaner(ChoiceExtractor choiceExtractor) {
        this.choiceExtractor = choiceExtractor;
    }

    public static String missingSectionText(int sectionNumber) {
        return "[Section " + sectionNumber + " - not found in source]";
    }

    /**
     * Clean a section's normalized text.
     *
     * @param normalizedText output of {@link TextNormalizer#normalize(String)}
     * @param sectionNumber used for the placeholder when nothing survives
     * @param fallback previous text for this section, used when cleaning yields nothing
     */
    public String clean(String normalizedText, int sectionNumber, String fallback) {
        // Choice clauses go first; a destination wrapped onto its own line would otherwise read as noise.
        String text = choiceExtractor.removeChoiceClauses(normalizedText != null ? normalizedText : "");

        List<String> paragraphs = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            String stripped = line.trim();
            if (stripped.isEmpty()) {
                flushParagraph(current, paragraphs);
                continue;
            }
            stripped = PAGE_NUMBER_PREFIX.matcher(stripped).replaceFirst("").trim();
            if (stripped.isEmpty() || isNoiseLine(stripped)) {
                continue;
            }
            current.add(stripped);
        }
        flushParagraph(current, paragraphs);

        List<String> cleaned = new ArrayList<>();
        for (String paragraph : paragraphs) {
            String prose = tidy(paragraph);
            if (!prose.isEmpty()) {
                cleaned.add(prose);
            }
        }

        String result = String.join("\n\n", cleaned).trim();
        if (!result.isEmpty()) {
            return result;
        }
        String backup = fallback != null ? fallback.trim() : "";
        return backup.isEmpty() ? missingSectionText(sectionNumber) : backup;
    }

    private void flushParagraph(List<String> current, List<String> paragraphs) {
        if (!current.isEmpty()) {
            paragraphs.add(String.join(" ", current));
            current.clear();
        }
    }

    private String tidy(String paragraph) {
        String p = MULTI_SPACE.matcher(paragraph).replaceAll(" ").trim();
        p = SPACE_BEFORE_PUNCT.matcher(p).replaceAll("$1");
        return EDGE_DASHES.matcher(p).replaceAll("");
    }

    /**
     * Heuristic OCR-garbage detector for a single trimmed line.
     */
    public boolean isNoiseLine(String line) {
        String stripped = line != null ? line.trim() : "";
        if (stripped.isEmpty()) {
            return false;
        }
        if (PAGE_NUMBER_LINE.matcher(stripped).matches()) {
            return true;
        }
        if (NOISE_SYMBOLS.matcher(stripped).find()) {
            return true;
        }

        int nonSpace = stripped.replace(" ", "").length();
        if (nonSpace == 0) {
            return true;
        }
        long alpha = stripped.chars().filter(Character::isLetter).count();
        double alphaRatio = (double) alpha / nonSpace;
        if (stripped.length() >= 10 && alphaRatio < MIN_ALPHA_RATIO) {
            return true;
        }

        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(stripped);
        while (m.find()) {
            words.add(m.group());
        }
        if (words.size() >= 6) {
            int singles = 0;
            int totalLength = 0;
            int withVowel = 0;
            int allCaps = 0;
            for (String word : words) {
                if (word.length() == 1) singles++;
                totalLength += word.length();
                if (containsVowel(word)) withVowel++;
                if (word.equals(word.toUpperCase())) allCaps++;
            }
            double n = words.size();
            if (singles / n > MAX_SINGLE_LETTER_WORDS) {
                return true;
            }
            if (totalLength / n < MIN_AVG_WORD_LENGTH && withVowel / n < MIN_VOWEL_WORDS) {
                return true;
            }
            if (allCaps / n > MAX_CAPS_WORDS && withVowel / n < MIN_VOWEL_WORDS_FOR_CAPS) {
                return true;
            }
        }

        long punctuation = stripped.chars()
            .filter(c -> !Character.isLetterOrDigit(c) && !Character.isWhitespace(c))
            .count();
        return (double) punctuation / Math.max(1, stripped.length()) > MAX_PUNCTUATION_DENSITY
            && alphaRatio < MIN_ALPHA_RATIO_WITH_PUNCTUATION;
    }

    private boolean containsVowel(String word) {
        for (int i = 0; i < word.length(); i++) {
            if ("aeiouAEIOU".indexOf(word.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
