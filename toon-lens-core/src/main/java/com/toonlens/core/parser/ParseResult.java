package com.toonlens.core.parser;

import com.toonlens.core.ast.DocumentNode;

import java.util.Optional;

/**
 * Outcome of {@link ToonParser#tryParse(String)}: either a document or an error, never both.
 *
 * @param document parsed tree, null on failure
 * @param error failure description, null on success
 */
public record ParseResult(DocumentNode document, ParseError error) {

    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        if ((document == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of document and error must be set");
        }
    }

    public static ParseResult success(DocumentNode document) {
        return new ParseResult(document, null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean succeeded() {
        return document != null;
    }

    public Optional<DocumentNode> documentIfPresent() {
        return Optional.ofNullable(document);
    }

    /**
     * Returns the document or rethrows the failure.
     *
     * @return parsed document
     * @throws ToonParseException if the parse failed
     */
    public DocumentNode orElseThrow() {
        if (error != null) {
            throw new ToonParseException(error);
        }
        return document;
    }
}
