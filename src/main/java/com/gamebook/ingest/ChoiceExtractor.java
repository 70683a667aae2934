package com.gamebook.ingest;

import com.gamebook.models.ExtractedChoice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds "turn to N" style clauses in section text and turns them into choices.
 *
 * <p>A clause is a run of text ending in {@code . ! ? ;} or a line break. Within a clause the
 * destination is either a cue verb followed, within a short window that does not cross a comma,
 * by a short token, or a page/section marker followed by a short token. Tokens go through
 * {@link #CONFUSABLE_DIGITS} before being parsed; a token without a real digit must not read as an
 * ordinary word.
 */
public class ChoiceExtractor {

    public static final int MIN_DESTINATION = 1;
    public static final int MAX_DESTINATION = 500;
    public static final int MAX_CHOICES = 4;

    private static final int MIN_LABEL_LENGTH = 8;
    private static final int MIN_LABEL_LETTERS = 6;
    private static final int MAX_LABEL_LENGTH = 60;

    /**
     * Characters OCR commonly produces in place of digits.
     */
    public static final Map<Character, Character> CONFUSABLE_DIGITS = Map.ofEntries(
        Map.entry('O', '0'),
        Map.entry('o', '0'),
        Map.entry('I', '1'),
        Map.entry('l', '1'),
        Map.entry('S', '5'),
        Map.entry('s', '5'),
        Map.entry('B', '8'),
        Map.entry('g', '9'),
        Map.entry('q', '9'),
        Map.entry('H', '7'),
        Map.entry('h', '7')
    );

    private static final Pattern CLAUSE = Pattern.compile("[^.!?;\\n]+[.!?;]*");
    // Same as CLAUSE but a single line break does not end the clause; a blank line does.
    private static final Pattern WRAPPED_CLAUSE = Pattern.compile("(?:[^.!?;\\n]|\\n(?![ \\t]*\\n))+[.!?;]*");
    private static final Pattern ABBREVIATED_MARKER = Pattern.compile("(?i)\\bpg?\\.\\s*(?=[A-Za-z]{0,2}\\d)");
    private static final Pattern CUE_VERB = Pattern.compile("(?i)\\b(?:turn|go|proceed|continue|head)\\b");
    private static final Pattern DESTINATION = Pattern.compile(
        "(?i)\\b(?:"
            + "(?:turn|go|proceed|continue|head)\\b[^0-9.!?;,\\n]{0,40}?\\b([A-Za-z]{0,2}\\d[0-9A-Za-z]{0,3})"
            + "|(?:pages?|sections?)\\s+([0-9A-Za-z]{1,4})"
            + "|(?:turn|go|proceed|continue|head)\\b[^0-9.!?;,\\n]{0,40}?\\b([OoIlSsBgqHh]{1,4})"
            + ")(?![0-9A-Za-z])");

    private static final int CUE_WINDOW = 40;
    private static final Pattern WINDOW_BREAK = Pattern.compile("[0-9.!?;,]");

    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("\\s+([,.!?;:])");
    private static final Pattern COMMA_BEFORE_STOP = Pattern.compile("[,;:]\\s*([.!?])");
    private static final Pattern BETWEEN_BREAK = Pattern.compile("(?i),|\\b(?:or|but)\\b");
    private static final Pattern LEADING_CONNECTIVE = Pattern.compile("(?i)^[\\s,;:-]*(?:(?:and|or|but|then)\\b[\\s,;:-]*)+");
    private static final Pattern TRAILING_CONNECTIVE = Pattern.compile("(?i)(?:[\\s,;:-]+(?:and|or|then|so))+[\\s,;:-]*$");
    private static final Pattern PAGE_WORD = Pattern.compile("(?i)\\bpage\\b");
    private static final Pattern EDGE_JUNK_START = Pattern.compile("^[\\s\\-~,;:]+");
    private static final Pattern EDGE_JUNK_END = Pattern.compile("[\\s\\-~,;:]+$");

    private final TextNormalizer normalizer;

    public ChoiceExtractor(TextNormalizer normalizer) {
        this.normalizer = normalizer != null ? normalizer : new TextNormalizer();
    }

    /**
     * Extract up to four choices in order of appearance; the first clause naming a destination wins.
     */
    public List<ExtractedChoice> extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return Collections.emptyList();
        }
        String text = expandAbbreviations(normalizer.collapseWhitespace(normalizedText));

        List<ExtractedChoice> found = new ArrayList<>();
        Set<Integer> seenDestinations = new HashSet<>();
        Matcher clauses = CLAUSE.matcher(text);
        while (clauses.find() && found.size() < MAX_CHOICES) {
            String clause = clauses.group();
            Matcher m = DESTINATION.matcher(clause);
            int segmentStart = 0;
            while (m.find()) {
                Integer destination = validDestination(m);
                if (destination == null) {
                    continue;
                }
                int start = segmentStart;
                int end = segmentEnd(clause, m.end());
                segmentStart = end;
                if (seenDestinations.contains(destination)) {
                    continue;
                }
                seenDestinations.add(destination);
                String label = cleanLabel(clause.substring(0, end), start, cueStart(clause, m), m.end(), destination);
                found.add(new ExtractedChoice(label, destination));
                if (found.size() >= MAX_CHOICES) {
                    break;
                }
            }
        }
        return found;
    }

    /**
     * Drop every clause that names a valid destination. Clauses may wrap over single line breaks
     * ("turn to\n45."); a dropped clause that spanned lines leaves one line break behind.
     * Other clauses and paragraph breaks are kept.
     */
    public String removeChoiceClauses(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return "";
        }
        String text = expandAbbreviations(normalizedText);
        StringBuilder out = new StringBuilder(text.length());
        Matcher clauses = WRAPPED_CLAUSE.matcher(text);
        int last = 0;
        while (clauses.find()) {
            out.append(text, last, clauses.start());
            String clause = clauses.group();
            if (!namesDestination(normalizer.collapseWhitespace(clause))) {
                out.append(clause);
            } else {
                out.append(clause.indexOf('\n') >= 0 ? '\n' : ' ');
            }
            last = clauses.end();
        }
        out.append(text.substring(last));
        return out.toString();
    }

    /**
     * Map an OCR token to a section number. Returns null when any character is neither a digit
     * nor a known confusable.
     */
    public static Integer parseDestinationToken(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        StringBuilder digits = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
                continue;
            }
            Character mapped = CONFUSABLE_DIGITS.get(c);
            if (mapped == null) {
                return null;
            }
            digits.append(mapped);
        }
        if (digits.length() > 9) {
            return null;
        }
        return Integer.parseInt(digits.toString());
    }

    public static boolean inRange(int destination) {
        return destination >= MIN_DESTINATION && destination <= MAX_DESTINATION;
    }

    public static String defaultLabel(int destination) {
        return "Go to section " + destination + ".";
    }

    private boolean namesDestination(String clause) {
        Matcher m = DESTINATION.matcher(clause);
        while (m.find()) {
            if (validDestination(m) != null) {
                return true;
            }
        }
        return false;
    }

    private Integer validDestination(Matcher m) {
        String token = m.group(1) != null ? m.group(1) : (m.group(2) != null ? m.group(2) : m.group(3));
        if (m.group(1) == null && !plausibleToken(token)) {
            return null;
        }
        Integer destination = parseDestinationToken(token);
        if (destination == null || !inRange(destination)) {
            return null;
        }
        return destination;
    }

    // A token without digits must not read as an ordinary word ("page so", "turn and go").
    private boolean plausibleToken(String token) {
        if (token.chars().anyMatch(Character::isDigit)) {
            return true;
        }
        if (token.length() < 2) {
            return false;
        }
        return token.chars().noneMatch(c -> Character.isLowerCase(c) && c != 'l' && c != 'o');
    }

    // Several cue verbs can sit in one window ("go north and turn to 7"); the label keeps all but the last.
    private int cueStart(String clause, Matcher m) {
        int start = m.start();
        if (m.group(2) == null) {
            Matcher cue = CUE_VERB.matcher(clause).useTransparentBounds(true).region(m.start(), m.end());
            while (cue.find()) {
                start = cue.start();
            }
            return start;
        }
        // "turn to page lO": the verb before a marker belongs to the same cue
        Matcher cue = CUE_VERB.matcher(clause).useTransparentBounds(true)
            .region(Math.max(0, m.start() - CUE_WINDOW), m.start());
        while (cue.find()) {
            if (!WINDOW_BREAK.matcher(clause.substring(cue.end(), m.start())).find()) {
                start = cue.start();
            }
        }
        return start;
    }

    private String expandAbbreviations(String text) {
        return ABBREVIATED_MARKER.matcher(text).replaceAll("page ");
    }

    /*
     * Where the text after one destination stops belonging to it. With a second destination later in
     * the clause, the words in between are split at the first comma, "or" or "but":
     * "turn to 12 to fight or turn to 15 to run".
     */
    private int segmentEnd(String clause, int destinationEnd) {
        Matcher next = DESTINATION.matcher(clause).useTransparentBounds(true)
            .region(destinationEnd, clause.length());
        while (next.find()) {
            if (validDestination(next) == null) {
                continue;
            }
            int nextCue = Math.max(destinationEnd, cueStart(clause, next));
            Matcher split = BETWEEN_BREAK.matcher(clause).useTransparentBounds(true).region(destinationEnd, nextCue);
            return split.find() ? split.start() : nextCue;
        }
        return clause.length();
    }

    /**
     * Label from the clause text around one cue. The clause is already cut where the next choice
     * begins; {@code segmentStart} is where this choice's share of it begins.
     */
    String cleanLabel(String clause, int segmentStart, int cueStart, int cueEnd, int destination) {
        String before = clause.substring(Math.min(segmentStart, cueStart), cueStart);
        String after = TRAILING_CONNECTIVE.matcher(clause.substring(cueEnd)).replaceAll("");
        if (segmentStart > 0) {
            before = LEADING_CONNECTIVE.matcher(before).replaceFirst("");
        }

        before = EDGE_JUNK_END.matcher(before).replaceAll("");
        before = TRAILING_CONNECTIVE.matcher(before).replaceAll("");
        String text = normalizer.collapseWhitespace(before + " " + after);

        text = EDGE_JUNK_START.matcher(text).replaceAll("");
        text = COMMA_BEFORE_STOP.matcher(text).replaceAll("$1");
        text = SPACE_BEFORE_PUNCT.matcher(text).replaceAll("$1");
        text = EDGE_JUNK_END.matcher(text).replaceAll("");
        text = PAGE_WORD.matcher(text).replaceAll("section");

        if (!text.isEmpty() && Character.isLowerCase(text.charAt(0))) {
            text = Character.toUpperCase(text.charAt(0)) + text.substring(1);
        }

        long letters = text.chars().filter(Character::isLetter).count();
        if (text.length() < MIN_LABEL_LENGTH || letters < MIN_LABEL_LETTERS) {
            text = defaultLabel(destination);
        }
        if (text.length() > MAX_LABEL_LENGTH) {
            text = text.substring(0, MAX_LABEL_LENGTH - 3).trim() + "...";
        }
        return text;
    }
}
