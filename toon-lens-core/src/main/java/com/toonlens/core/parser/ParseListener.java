package com.toonlens.core.parser;

import com.toonlens.core.ast.DocumentNode;

import java.time.Duration;

/**
 * Optional observer of a parser's lifecycle. All methods default to no-ops.
 *
 * <p>A listener is passed to a {@link ToonParser} explicitly; there is no global
 * registry. Exceptions thrown by a listener propagate to the caller of
 * {@link ToonParser#parse(String)}.
 */
public interface ParseListener {

    /** Listener that ignores every event. */
    ParseListener NONE = new ParseListener() {
    };

    /**
     * Called before any line is read.
     *
     * @param source full source text
     */
    default void onParseStart(String source) {
    }

    /**
     * Called once the tree is complete.
     *
     * @param document parsed tree
     * @param elapsed time spent parsing
     */
    default void onParseComplete(DocumentNode document, Duration elapsed) {
    }

    /**
     * Called once when the parse is abandoned, before the failure propagates.
     *
     * @param error failure description
     */
    default void onParseError(ParseError error) {
    }
}
