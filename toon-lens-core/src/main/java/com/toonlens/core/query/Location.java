package com.toonlens.core.query;

import com.toonlens.core.ast.Range;

import java.util.Objects;

/**
 * A range inside a document identified by URI.
 *
 * @param uri document URI
 * @param range target range
 */
public record Location(String uri, Range range) {

    public Location {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }
}
