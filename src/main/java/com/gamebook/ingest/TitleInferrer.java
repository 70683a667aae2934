package com.gamebook.ingest;

import java.util.List;
import java.util.Locale;

/**
 * Picks a display title from the first matching keyword group, falling back to "Section N".
 */
public class TitleInferrer {

    private record TitleRule(String title, List<String> keywords) {}

    private static final List<TitleRule> RULES = List.of(
        new TitleRule("Toward Forbidden Castle", List.of("forbidden castle")),
        new TitleRule("Forest Road", List.of("forest", "woods", "tree", "wolves")),
        new TitleRule("Cave Passage", List.of("cave", "cavern", "tunnel")),
        new TitleRule("Court And Castle", List.of("king", "court", "castle", "dungeon", "guard")),
        new TitleRule("Crossing The Water", List.of("stream", "river", "waterfall", "lake", "water")),
        new TitleRule("Mountain Ascent", List.of("mountain", "trail", "ridge", "climb")),
        new TitleRule("Journey's End", List.of("the end"))
    );

    public String inferTitle(int sectionNumber, String cleanedText) {
        String lower = cleanedText != null ? cleanedText.toLowerCase(Locale.ROOT) : "";
        if (lower.contains("dragon")) {
            return lower.contains("trail") ? "Dragon Trail" : "Dragon Encounter";
        }
        for (TitleRule rule : RULES) {
            if (NodeClassifier.containsAny(lower, rule.keywords())) {
                return rule.title();
            }
        }
        return defaultTitle(sectionNumber);
    }

    public static String defaultTitle(int sectionNumber) {
        return "Section " + sectionNumber;
    }
}
