package com.toonlens.core.parser;

import com.toonlens.core.ast.Range;

import java.util.Objects;

/**
 * Structured description of a failed parse.
 *
 * @param message human-readable failure message
 * @param range source range the failure is anchored to; degenerate ({@code 0:0-0:0}) for
 *              internal failures that have no meaningful location
 */
public record ParseError(String message, Range range) {

    /**
     * Compact constructor with validation.
     */
    public ParseError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }

    /**
     * Creates an error anchored at the start of the document.
     *
     * @param message failure message
     * @return parse error with a degenerate range
     */
    public static ParseError atDocumentStart(String message) {
        return new ParseError(message, Range.of(0, 0, 0, 0));
    }
}
