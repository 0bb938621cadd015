package com.toonlens.core.query;

import com.toonlens.core.ast.Range;

import java.util.Objects;

/**
 * Hover answer for a position.
 *
 * @param contents markdown text
 * @param range range of the hovered token
 */
public record Hover(String contents, Range range) {

    public Hover {
        Objects.requireNonNull(contents, "contents must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }
}
