package com.toonlens.core.parser;

import com.toonlens.core.ast.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Parses Toon text into a {@link DocumentNode} tree.
 *
 * <p>The parser is line oriented. Every call reads the full text and returns a brand-new
 * tree; nothing is shared between calls, so a single instance may be used from several
 * threads at once for different documents.
 *
 * <p><b>Recognized constructs</b> (first match wins, in this order):
 * <ol>
 *   <li>structured array header {@code name[size]{f1,f2}:} plus the indented data rows that
 *       immediately follow it</li>
 *   <li>simple array {@code name[size]: v1,v2}</li>
 *   <li>block header {@code key:} followed by strictly more indented lines</li>
 *   <li>key-value pair {@code key: value}, unless a {@code [} appears before the colon</li>
 * </ol>
 * Anything else, including blank lines, becomes an {@code EmptyNode}. Malformed input
 * never throws.
 *
 * <p><b>Failures:</b> a parse is abandoned only for internal errors and for block nesting
 * deeper than {@link ParserOptions#maxNestingDepth()}. The failure is reported once to the
 * {@link ParseListener} and then thrown as a {@link ToonParseException};
 * {@link #tryParse(String)} returns it as a {@link ParseResult} instead. Exceptions thrown
 * by the listener are logged and do not affect the parse.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ToonParser parser = new ToonParser();
 * DocumentNode document = parser.parse("""
 *     user:
 *       name: Ada
 *     tags[2]: math,code
 *     """);
 * }</pre>
 *
 * @since 1.0.0
 */
public class ToonParser {

    private static final Logger log = LoggerFactory.getLogger(ToonParser.class);

    private final ParserOptions options;
    private final ParseListener listener;

    public ToonParser() {
        this(ParserOptions.defaults(), ParseListener.NONE);
    }

    public ToonParser(ParserOptions options) {
        this(options, ParseListener.NONE);
    }

    public ToonParser(ParserOptions options, ParseListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Parses the given text.
     *
     * @param text full document text; {@code \n} separates lines and a trailing {@code \r}
     *             on a line is dropped
     * @return the document tree
     * @throws ToonParseException if the parse had to be abandoned
     */
    public DocumentNode parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        long started = System.nanoTime();
        notifyListener("start", () -> listener.onParseStart(text));
        log.debug("Parse started ({} characters)", text.length());

        DocumentNode document;
        try {
            document = new LineClassifier(LinePatterns.splitLines(text), options.maxNestingDepth()).readDocument();
        } catch (ToonParseException e) {
            reportFailure(e.getError(), e);
            throw e;
        } catch (RuntimeException e) {
            ParseError error = ParseError.atDocumentStart(
                e.getMessage() != null ? e.getMessage() : "Unknown parse error");
            reportFailure(error, e);
            throw new ToonParseException(error, e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        DocumentNode parsed = document;
        notifyListener("complete", () -> listener.onParseComplete(parsed, elapsed));
        log.debug("Parse complete: {} top-level nodes in {} ms",
            document.children().size(), elapsed.toMillis());
        return document;
    }

    /**
     * Parses the given text, returning failures as a value instead of throwing.
     *
     * @param text full document text
     * @return a successful result with the tree, or a failed result with the error
     */
    public ParseResult tryParse(String text) {
        try {
            return ParseResult.success(parse(text));
        } catch (ToonParseException e) {
            return ParseResult.failure(e.getError());
        }
    }

    /**
     * Returns the options this parser was created with.
     *
     * @return parser options
     */
    public ParserOptions getOptions() {
        return options;
    }

    private void reportFailure(ParseError error, Exception cause) {
        log.error("Parse error at {}: {}", error.range().start(), error.message(), cause);
        notifyListener("error", () -> listener.onParseError(error));
    }

    private void notifyListener(String event, Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Parse listener failed on {} event: {}", event, e.getMessage(), e);
        }
    }
}
