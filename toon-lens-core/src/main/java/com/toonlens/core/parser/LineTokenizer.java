package com.toonlens.core.parser;

import com.toonlens.core.ast.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits line segments into trimmed tokens whose offsets come from the scan position.
 *
 * <p>Offsets are recorded while each token is consumed, never by searching the line for the
 * token text again, so a value that also appears earlier on the line (a value equal to its
 * key, a repeated field name) still gets its own position.
 */
public final class LineTokenizer {

    /**
     * A trimmed token and its {@code [start, end)} character offsets within its line.
     *
     * @param text trimmed token text
     * @param start inclusive start offset
     * @param end exclusive end offset
     */
    public record Token(String text, int start, int end) {

        /**
         * Returns this token's range on the given line.
         *
         * @param line zero-based line number
         * @return single-line range
         */
        public Range range(int line) {
            return Range.ofLine(line, start, end);
        }
    }

    private LineTokenizer() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Trims the segment {@code [from, to)} of a line.
     *
     * <p>An all-whitespace segment yields an empty token positioned at {@code to}.
     *
     * @param line source line
     * @param from inclusive segment start
     * @param to exclusive segment end
     * @return trimmed token
     */
    public static Token trim(String line, int from, int to) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(line.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return new Token(line.substring(start, end), start, end);
    }

    /**
     * Splits the segment {@code [from, to)} on commas and trims every cell.
     *
     * <p>A segment without commas yields exactly one token. Empty cells (for example the
     * trailing cell of {@code "a,"}) are kept as empty tokens.
     *
     * @param line source line
     * @param from inclusive segment start
     * @param to exclusive segment end
     * @return tokens in source order
     */
    public static List<Token> splitOnComma(String line, int from, int to) {
        List<Token> tokens = new ArrayList<>();
        int cellStart = from;
        for (int i = from; i <= to; i++) {
            if (i == to || line.charAt(i) == ',') {
                tokens.add(trim(line, cellStart, i));
                cellStart = i + 1;
            }
        }
        return tokens;
    }
}
