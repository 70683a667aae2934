package com.gamebook.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One narrative section of the gamebook.
 *
 * <p>{@code nodeType} is kept as the raw persisted string so that unknown values
 * coming from an older store survive loading and can be reclassified during repair.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "section_number", "title", "text", "node_type", "choices", "effects", "random_event_pool"})
public class StoryNode {

    public static final String ID_PREFIX = "section_";
    public static final int MAX_CHOICES = 4;

    private String id;
    @JsonProperty("section_number")
    private int sectionNumber;
    private String title;
    private String text;
    @JsonProperty("node_type")
    private String nodeType;
    private List<StoryChoice> choices = new ArrayList<>();
    private Map<String, Object> effects = new LinkedHashMap<>();
    @JsonProperty("random_event_pool")
    private List<Object> randomEventPool = new ArrayList<>();

    public StoryNode() {
    }

    public StoryNode(int sectionNumber, String title, String text, NodeType nodeType) {
        this.id = sectionId(sectionNumber);
        this.sectionNumber = sectionNumber;
        this.title = title;
        this.text = text;
        this.nodeType = nodeType != null ? nodeType.getValue() : null;
    }

    public static String sectionId(int sectionNumber) {
        return ID_PREFIX + sectionNumber;
    }

    /**
     * Parse a {@code section_<n>} id. Returns null for anything else.
     */
    public static Integer parseSectionId(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        if (!trimmed.startsWith(ID_PREFIX)) {
            return null;
        }
        String digits = trimmed.substring(ID_PREFIX.length());
        if (digits.isEmpty() || digits.length() > 9 || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return Integer.parseInt(digits);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getSectionNumber() {
        return sectionNumber;
    }

    public void setSectionNumber(int sectionNumber) {
        this.sectionNumber = sectionNumber;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getNodeType() {
        return nodeType;
    }

    public void setNodeType(String nodeType) {
        this.nodeType = nodeType;
    }

    @JsonIgnore
    public NodeType getType() {
        return NodeType.fromString(nodeType);
    }

    @JsonIgnore
    public void setType(NodeType type) {
        this.nodeType = type != null ? type.getValue() : null;
    }

    public List<StoryChoice> getChoices() {
        return choices;
    }

    public void setChoices(List<StoryChoice> choices) {
        this.choices = new ArrayList<>();
        if (choices != null) {
            for (StoryChoice choice : choices) {
                if (choice != null) {
                    this.choices.add(choice);
                }
            }
        }
    }

    public Map<String, Object> getEffects() {
        return effects;
    }

    public void setEffects(Map<String, Object> effects) {
        this.effects = effects != null ? new LinkedHashMap<>(effects) : new LinkedHashMap<>();
    }

    public List<Object> getRandomEventPool() {
        return randomEventPool;
    }

    public void setRandomEventPool(List<Object> randomEventPool) {
        this.randomEventPool = randomEventPool != null ? new ArrayList<>(randomEventPool) : new ArrayList<>();
    }

    @JsonIgnore
    public boolean hasChoices() {
        return choices != null && !choices.isEmpty();
    }

    public StoryNode copy() {
        StoryNode copy = new StoryNode();
        copy.id = id;
        copy.sectionNumber = sectionNumber;
        copy.title = title;
        copy.text = text;
        copy.nodeType = nodeType;
        List<StoryChoice> copiedChoices = new ArrayList<>();
        if (choices != null) {
            for (StoryChoice choice : choices) {
                copiedChoices.add(choice.copy());
            }
        }
        copy.choices = copiedChoices;
        copy.setEffects(effects);
        copy.setRandomEventPool(randomEventPool);
        return copy;
    }

    @Override
    public String toString() {
        return "StoryNode{" +
            "id='" + id + '\'' +
            ", sectionNumber=" + sectionNumber +
            ", nodeType='" + nodeType + '\'' +
            ", choices=" + (choices != null ? choices.size() : 0) +
            '}';
    }
}
