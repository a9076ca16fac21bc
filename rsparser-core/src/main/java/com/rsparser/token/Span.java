package com.rsparser.token;

/**
 * A copied source position: 1-based lines, 0-based columns.
 *
 * <p>Spans never take part in equality. Two spans always compare equal so that tokens and
 * syntax trees compare structurally, regardless of where they were parsed from.</p>
 */
public record Span(int line, int column, int endLine, int endColumn) {

    /** Span attached to synthesized tokens that have no source position. */
    public static final Span CALL_SITE = new Span(0, 0, 0, 0);

    public static Span of(int line, int column, int length) {
        return new Span(line, column, line, column + length);
    }

    /**
     * Span covering this span and {@code other}.
     */
    public Span join(Span other) {
        if (other == null || other == CALL_SITE) return this;
        if (this == CALL_SITE) return other;
        return new Span(line, column, other.endLine, other.endColumn);
    }

    /**
     * Zero-width span at the end of this span (the closing delimiter of a group).
     */
    public Span close() {
        return new Span(endLine, Math.max(0, endColumn - 1), endLine, endColumn);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Span;
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
