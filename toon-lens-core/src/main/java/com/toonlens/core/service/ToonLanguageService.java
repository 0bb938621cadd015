package com.toonlens.core.service;

import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.Position;
import com.toonlens.core.config.ToonConfig;
import com.toonlens.core.diagnostic.Diagnostic;
import com.toonlens.core.diagnostic.DiagnosticEngine;
import com.toonlens.core.parser.ParseError;
import com.toonlens.core.parser.ParseResult;
import com.toonlens.core.parser.ToonParser;
import com.toonlens.core.query.DefinitionProvider;
import com.toonlens.core.query.Hover;
import com.toonlens.core.query.HoverProvider;
import com.toonlens.core.query.Location;
import com.toonlens.core.serializer.ToonSerializer;
import com.toonlens.core.visitor.AstWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-document entry point for editor integrations.
 *
 * <p>The service keeps the latest tree of every open document, keyed by URI. Each
 * {@link #update(String, String)} parses the full text and replaces the cached tree in one
 * step; readers see either the old or the new tree, never a mix. Documents are independent
 * and may be updated concurrently.
 *
 * <p>Queries never throw. Unknown documents and provider failures yield an empty result,
 * and failures are logged.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ToonLanguageService service = ToonLanguageService.fromConfig(config);
 * List<Diagnostic> diagnostics = service.update(uri, text);
 * Optional<Hover> hover = service.hover(uri, new Position(2, 5));
 * }</pre>
 */
public class ToonLanguageService {

    private static final Logger log = LoggerFactory.getLogger(ToonLanguageService.class);

    private final ToonParser parser;
    private final DiagnosticEngine engine;
    private final ToonSerializer serializer;
    private final AstWalker walker;
    private final Map<String, DocumentNode> documents = new ConcurrentHashMap<>();

    public ToonLanguageService(ToonParser parser, DiagnosticEngine engine, ToonSerializer serializer) {
        this(parser, engine, serializer, new AstWalker());
    }

    /**
     * Creates a service whose hover and definition queries run on the given walker.
     *
     * @param parser document parser
     * @param engine diagnostic engine
     * @param serializer formatter
     * @param walker walker for position queries, for example one with a {@code NodeVisitListener}
     */
    public ToonLanguageService(ToonParser parser, DiagnosticEngine engine, ToonSerializer serializer,
                               AstWalker walker) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.walker = Objects.requireNonNull(walker, "walker must not be null");
    }

    /**
     * Creates a service wired from configuration, with validators discovered through SPI.
     *
     * @param config loaded configuration
     * @return configured service
     */
    public static ToonLanguageService fromConfig(ToonConfig config) {
        return new ToonLanguageService(
            new ToonParser(config.parser().toOptions()),
            DiagnosticEngine.withDiscoveredValidators(config.validators().disabled()),
            new ToonSerializer(config.format().toOptions()));
    }

    /**
     * Parses new document text, caches the tree and validates it.
     *
     * <p>If the parse is abandoned, the previous tree is evicted and the parse error is
     * returned as a single error diagnostic.
     *
     * @param uri document URI
     * @param text full document text
     * @return diagnostics for the new text
     */
    public List<Diagnostic> update(String uri, String text) {
        Objects.requireNonNull(uri, "uri must not be null");
        ParseResult result = parser.tryParse(text);
        if (!result.succeeded()) {
            documents.remove(uri);
            ParseError error = result.error();
            log.warn("Could not parse {}: {}", uri, error.message());
            return List.of(Diagnostic.error(error.range(), error.message()));
        }

        DocumentNode document = result.orElseThrow();
        documents.put(uri, document);
        return safeExecute("diagnostics for " + uri, () -> engine.validate(document, text), List.of());
    }

    /**
     * Forgets a document.
     *
     * @param uri document URI
     */
    public void close(String uri) {
        documents.remove(uri);
    }

    /**
     * Returns the cached tree of a document.
     *
     * @param uri document URI
     * @return tree of the last successful update, or empty
     */
    public Optional<DocumentNode> document(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public Optional<Hover> hover(String uri, Position position) {
        return document(uri).flatMap(document -> safeExecute("hover at " + position, () -> {
            HoverProvider provider = new HoverProvider(position, uri);
            walker.walk(document, provider);
            return provider.getHover();
        }, Optional.empty()));
    }

    public Optional<Location> definition(String uri, Position position) {
        return document(uri).flatMap(document -> safeExecute("definition at " + position, () -> {
            DefinitionProvider provider = new DefinitionProvider(position, uri);
            walker.walk(document, provider);
            return provider.getDefinition();
        }, Optional.empty()));
    }

    /**
     * Renders the cached tree of a document as canonical text.
     *
     * @param uri document URI
     * @return canonical text, or empty for unknown documents
     */
    public Optional<String> format(String uri) {
        return document(uri).map(serializer::serialize);
    }

    private static <T> T safeExecute(String operation, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.error("Failed to compute {}: {}", operation, e.getMessage(), e);
            return fallback;
        }
    }
}
