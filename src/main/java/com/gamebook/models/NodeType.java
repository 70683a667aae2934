package com.gamebook.models;

/**
 * Node classification tags as persisted in the story store.
 */
public enum NodeType {
    NORMAL("normal"),
    ENDING_WIN("ending_win"),
    ENDING_DEATH("ending_death"),
    ENDING_NEUTRAL("ending_neutral");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isEnding() {
        return this != NORMAL;
    }

    /**
     * Resolve a persisted tag. Returns null for unknown or blank values.
     */
    public static NodeType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
