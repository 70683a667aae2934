package com.gamebook.models;

/**
 * Audit record for one repair action on a dangling destination.
 */
public class ChangeLogEntry {

    public enum Kind { REMAP, STUB }

    private final Kind kind;
    private final int sourceSection;
    private final int missingDestination;
    private final int resolvedSection;

    private ChangeLogEntry(Kind kind, int sourceSection, int missingDestination, int resolvedSection) {
        this.kind = kind;
        this.sourceSection = sourceSection;
        this.missingDestination = missingDestination;
        this.resolvedSection = resolvedSection;
    }

    public static ChangeLogEntry remap(int sourceSection, int missingDestination, int resolvedSection) {
        return new ChangeLogEntry(Kind.REMAP, sourceSection, missingDestination, resolvedSection);
    }

    public static ChangeLogEntry stub(int sourceSection, int stubSection) {
        return new ChangeLogEntry(Kind.STUB, sourceSection, stubSection, stubSection);
    }

    public Kind getKind() {
        return kind;
    }

    public int getSourceSection() {
        return sourceSection;
    }

    public int getMissingDestination() {
        return missingDestination;
    }

    public int getResolvedSection() {
        return resolvedSection;
    }

    public String getMessage() {
        if (kind == Kind.REMAP) {
            return "Remapped missing destination " + missingDestination + " -> " + resolvedSection
                + " (source section " + sourceSection + ").";
        }
        return "Created stub section " + resolvedSection + " (referenced by section " + sourceSection + ").";
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
