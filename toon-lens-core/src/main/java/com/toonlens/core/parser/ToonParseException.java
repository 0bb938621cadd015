package com.toonlens.core.parser;

import java.util.Objects;

/**
 * Thrown when a parse has to be abandoned. Ordinary malformed lines never cause this; they
 * degrade to empty nodes instead.
 */
public class ToonParseException extends RuntimeException {

    private final ParseError error;

    public ToonParseException(ParseError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    public ToonParseException(ParseError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error must not be null").message(), cause);
        this.error = error;
    }

    /**
     * Returns the structured error.
     *
     * @return parse error
     */
    public ParseError getError() {
        return error;
    }
}
