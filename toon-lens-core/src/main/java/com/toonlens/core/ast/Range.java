package com.toonlens.core.ast;

import java.util.Objects;

/**
 * A source interval in a Toon document.
 *
 * <p>The start position is inclusive and the end position is exclusive. Containment is
 * therefore half-open: a position on the end line is inside the range only while its
 * character offset is strictly below {@code end.character()}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Range key = Range.ofLine(0, 0, 4);              // "name" in "name: Ada"
 * key.contains(new Position(0, 3));               // true
 * key.contains(new Position(0, 4));               // false, end is exclusive
 * }</pre>
 *
 * @param start inclusive start position
 * @param end exclusive end position
 */
public record Range(Position start, Position end) {

    /**
     * Compact constructor with validation.
     */
    public Range {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    /**
     * Creates a range from raw line/character coordinates.
     *
     * @param startLine zero-based start line
     * @param startCharacter zero-based start character
     * @param endLine zero-based end line
     * @param endCharacter zero-based, exclusive end character
     * @return the range
     */
    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Creates a range that lies on a single line.
     *
     * @param line zero-based line
     * @param startCharacter inclusive start character
     * @param endCharacter exclusive end character
     * @return the range
     */
    public static Range ofLine(int line, int startCharacter, int endCharacter) {
        return of(line, startCharacter, line, endCharacter);
    }

    /**
     * Tests whether a position lies inside this range.
     *
     * @param position position to test
     * @return true if {@code start <= position < end}
     */
    public boolean contains(Position position) {
        Objects.requireNonNull(position, "position must not be null");
        return !position.isBefore(start) && position.isBefore(end);
    }

    /**
     * Returns true if this range spans more than one line.
     *
     * @return true for multi-line ranges
     */
    public boolean spansLines() {
        return start.line() != end.line();
    }
}
