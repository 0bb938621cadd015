package com.toonlens.core.parser;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Pre-compiled line patterns and indentation helpers shared by the parser and the
 * line-level validators.
 *
 * <p>Structured and simple array headers share the {@code name[size]} prefix, so callers
 * must try {@link #STRUCTURED_ARRAY_HEADER} first and reject simple-array matches on lines
 * that carry a {@code {...}} field list (see {@link #hasFieldList(String)}).
 *
 * @since 1.0.0
 */
public final class LinePatterns {

    /** {@code name[size]{field,...}:} with nothing after the colon. */
    public static final Pattern STRUCTURED_ARRAY_HEADER =
        Pattern.compile("^(\\s*)([A-Za-z_][A-Za-z0-9_]*)\\[(\\d+)\\]\\{([^}]+)\\}:\\s*$");

    /** {@code name[size]: values}. Group 4 is the raw value list. */
    public static final Pattern SIMPLE_ARRAY_HEADER =
        Pattern.compile("^(\\s*)([A-Za-z_][A-Za-z0-9_]*)\\[(\\d+)\\]:\\s*(.*)$");

    /** Digits of an array size declaration. */
    public static final Pattern ARRAY_SIZE = Pattern.compile("\\d+");

    private LinePatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits document text into lines.
     *
     * <p>Lines are separated by {@code \n}; a trailing {@code \r} is dropped so that CRLF
     * text yields the same character offsets as LF text. The result always has at least
     * one element, and a trailing separator yields a final empty line.
     *
     * @param text document text
     * @return lines without terminators
     */
    public static String[] splitLines(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.endsWith("\r")) {
                lines[i] = line.substring(0, line.length() - 1);
            }
        }
        return lines;
    }

    /**
     * Returns true if the line is empty or consists only of whitespace.
     *
     * @param line line without its terminator
     * @return true for blank lines
     */
    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    /**
     * Counts the leading whitespace characters of a line.
     *
     * @param line line without its terminator
     * @return indentation width in characters
     */
    public static int indentation(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        return indent;
    }

    /**
     * Returns true if the line contains both an opening and a closing brace.
     *
     * @param line line to test
     * @return true when the line looks like it carries a field list
     */
    public static boolean hasFieldList(String line) {
        return line.indexOf('{') >= 0 && line.indexOf('}') >= 0;
    }

    /**
     * Returns true if a {@code [} occurs before the given colon offset.
     *
     * <p>Such lines are array declarations, well-formed or not, and never key-value pairs.
     *
     * @param line line to test
     * @param colonIndex offset of the first colon
     * @return true if an opening bracket precedes the colon
     */
    public static boolean hasBracketBefore(String line, int colonIndex) {
        int bracket = line.indexOf('[');
        return bracket >= 0 && bracket < colonIndex;
    }

    /**
     * Parses the digits of an array size declaration.
     *
     * @param digits text between the brackets
     * @return the size, or empty when the text is not a non-negative int
     */
    public static OptionalInt parseSize(String digits) {
        if (!ARRAY_SIZE.matcher(digits).matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
