package com.toonlens.core.parser;

/**
 * Options for {@link ToonParser}.
 *
 * @param maxNestingDepth maximum number of nested blocks, between 1 and
 *                        {@link #MAX_NESTING_DEPTH_LIMIT}; deeper input fails with a
 *                        {@link ToonParseException} instead of exhausting the stack
 */
public record ParserOptions(int maxNestingDepth) {

    /** Default maximum block nesting depth. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    /** Largest accepted nesting limit; block parsing recurses once per level. */
    public static final int MAX_NESTING_DEPTH_LIMIT = 1024;

    /**
     * Compact constructor with validation.
     */
    public ParserOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1: " + maxNestingDepth);
        }
        if (maxNestingDepth > MAX_NESTING_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                "maxNestingDepth must be at most " + MAX_NESTING_DEPTH_LIMIT + ": " + maxNestingDepth);
        }
    }

    /**
     * Creates the default options.
     *
     * @return default parser options
     */
    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH);
    }
}
