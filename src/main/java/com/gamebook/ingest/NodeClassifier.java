package com.gamebook.ingest;

import com.gamebook.models.NodeType;

import java.util.List;
import java.util.Locale;

/**
 * Assigns a node type from choice presence and fixed, case-insensitive keyword tables.
 * Death terms are checked before win terms.
 */
public class NodeClassifier {

    public static final List<String> DEATH_TERMS = List.of(
        "death",
        "die",
        "dead",
        "killed",
        "execution",
        "burn",
        "collapse",
        "you don't",
        "too late",
        "never seen again",
        "won't be"
    );

    public static final List<String> WIN_TERMS = List.of(
        "victory",
        "escape",
        "survive",
        "triumph",
        "you return",
        "back in your own time",
        "you are free",
        "you find the forbidden castle",
        "worth the trip"
    );

    public NodeType classify(String cleanedText, boolean hasChoices) {
        if (hasChoices) {
            return NodeType.NORMAL;
        }
        String lower = cleanedText != null ? cleanedText.toLowerCase(Locale.ROOT) : "";
        if (containsAny(lower, DEATH_TERMS)) {
            return NodeType.ENDING_DEATH;
        }
        if (containsAny(lower, WIN_TERMS)) {
            return NodeType.ENDING_WIN;
        }
        return NodeType.ENDING_NEUTRAL;
    }

    static boolean containsAny(String lower, List<String> terms) {
        for (String term : terms) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
