package com.toonlens.core.ast;

/**
 * A zero-based line/character location in a Toon document.
 *
 * @param line zero-based line number
 * @param character zero-based character offset within the line
 */
public record Position(int line, int character) implements Comparable<Position> {

    /**
     * Compact constructor with validation.
     */
    public Position {
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative: " + line);
        }
        if (character < 0) {
            throw new IllegalArgumentException("character must not be negative: " + character);
        }
    }

    /**
     * Returns true if this position comes strictly before {@code other}.
     *
     * @param other position to compare against
     * @return true if this position precedes {@code other}
     */
    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(character, other.character);
    }
}
