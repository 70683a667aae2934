package com.gamebook.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A directed edge between two story nodes.
 * {@code requires} and {@code effects} are opaque to the pipeline and passed through untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"text", "next", "requires", "effects"})
public class StoryChoice {

    public static final int MAX_LABEL_LENGTH = 60;

    private String text;
    private String next;
    private Map<String, Object> requires = new LinkedHashMap<>();
    private Map<String, Object> effects = new LinkedHashMap<>();

    public StoryChoice() {
    }

    public StoryChoice(String text, String next) {
        this.text = text;
        this.next = next;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getNext() {
        return next;
    }

    public void setNext(String next) {
        this.next = next;
    }

    public Map<String, Object> getRequires() {
        return requires;
    }

    public void setRequires(Map<String, Object> requires) {
        this.requires = requires != null ? new LinkedHashMap<>(requires) : new LinkedHashMap<>();
    }

    public Map<String, Object> getEffects() {
        return effects;
    }

    public void setEffects(Map<String, Object> effects) {
        this.effects = effects != null ? new LinkedHashMap<>(effects) : new LinkedHashMap<>();
    }

    /**
     * Section number this choice points at, or null when {@code next} is not a section id.
     */
    @JsonIgnore
    public Integer getDestination() {
        return StoryNode.parseSectionId(next);
    }

    /**
     * Lowercased label with every run of non-alphanumerics collapsed to a single space.
     */
    public static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        return label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    /**
     * Identity used for parallel-duplicate detection: normalized label plus destination id.
     */
    @JsonIgnore
    public String getDuplicateKey() {
        return normalizeLabel(text) + "\u0000" + (next != null ? next.trim() : "");
    }

    public StoryChoice copy() {
        StoryChoice copy = new StoryChoice(text, next);
        copy.setRequires(requires);
        copy.setEffects(effects);
        return copy;
    }

    @Override
    public String toString() {
        return "StoryChoice{" +
            "text='" + text + '\'' +
            ", next='" + next + '\'' +
            '}';
    }
}
