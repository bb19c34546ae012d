package com.erbformat.parser.ast;

import java.util.Objects;

/** Source span of a token or node: character offsets (end exclusive) and 1-based lines. */
public final class Location implements Comparable<Location> {
    private final int startOffset;
    private final int endOffset;
    private final int startLine;
    private final int endLine;

    public Location(int startOffset, int endOffset, int startLine, int endLine) {
        if (endOffset < startOffset) {
            throw new IllegalArgumentException(
                    "endOffset " + endOffset + " precedes startOffset " + startOffset);
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    /** Spans from the start of this location to the end of {@code other}. */
    public Location to(Location other) {
        Objects.requireNonNull(other, "other");
        return new Location(startOffset, other.endOffset, startLine, other.endLine);
    }

    public boolean contains(Location other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    @Override
    public int compareTo(Location other) {
        return Integer.compare(startOffset, other.startOffset);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Location)) {
            return false;
        }
        Location other = (Location) obj;
        return startOffset == other.startOffset
                && endOffset == other.endOffset
                && startLine == other.startLine
                && endLine == other.endLine;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startOffset, endOffset, startLine, endLine);
    }

    @Override
    public String toString() {
        if (startLine == endLine) {
            return "line " + startLine + ", char " + startOffset + ".." + endOffset;
        }
        return "line " + startLine + ", char " + startOffset + " to line " + endLine + ", char " + endOffset;
    }
}
