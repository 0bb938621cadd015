package com.toonlens.core.serializer;

import java.util.Objects;

/**
 * Output settings for {@link ToonSerializer}.
 *
 * @param indent indentation unit, one per nesting level; non-empty whitespace
 * @param lineEnding {@code "\n"} or {@code "\r\n"}
 */
public record SerializerOptions(String indent, String lineEnding) {

    public static final String DEFAULT_INDENT = "  ";
    public static final String DEFAULT_LINE_ENDING = "\n";

    public SerializerOptions {
        Objects.requireNonNull(indent, "indent must not be null");
        Objects.requireNonNull(lineEnding, "lineEnding must not be null");
        if (indent.isEmpty() || !indent.isBlank()) {
            throw new IllegalArgumentException("indent must be non-empty whitespace, got '" + indent + "'");
        }
        if (!lineEnding.equals("\n") && !lineEnding.equals("\r\n")) {
            throw new IllegalArgumentException("lineEnding must be \\n or \\r\\n");
        }
    }

    public static SerializerOptions defaults() {
        return new SerializerOptions(DEFAULT_INDENT, DEFAULT_LINE_ENDING);
    }
}
