package com.toonlens.core.service;

import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.Position;
import com.toonlens.core.ast.Range;
import com.toonlens.core.config.ToonConfig;
import com.toonlens.core.diagnostic.AstDiagnosticValidator;
import com.toonlens.core.diagnostic.Diagnostic;
import com.toonlens.core.diagnostic.DiagnosticEngine;
import com.toonlens.core.diagnostic.DocumentValidator;
import com.toonlens.core.diagnostic.LineSyntaxValidator;
import com.toonlens.core.parser.ParserOptions;
import com.toonlens.core.parser.ToonParser;
import com.toonlens.core.query.Location;
import com.toonlens.core.serializer.ToonSerializer;
import com.toonlens.core.visitor.AstWalker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ToonLanguageService}.
 */
class ToonLanguageServiceTest {

    private static final String URI = "file:///tmp/data.toon";
    private static final String TEXT = "hikes[1]{id,name}:\n  1,Trail\nbroken";

    private final ToonLanguageService service = new ToonLanguageService(
        new ToonParser(),
        new DiagnosticEngine(List.of(new AstDiagnosticValidator(), new LineSyntaxValidator())),
        new ToonSerializer());

    @Test
    void update_returnsDiagnosticsAndCachesDocument() {
        List<Diagnostic> diagnostics = service.update(URI, TEXT);

        assertThat(diagnostics).hasSize(1);
        assertThat(service.document(URI)).isPresent();
    }

    @Test
    void update_sameUri_replacesCachedTree() {
        service.update(URI, "a: 1");
        DocumentNode first = service.document(URI).orElseThrow();

        service.update(URI, "a: 2");

        assertThat(service.document(URI)).get().isNotSameAs(first);
    }

    @Test
    void close_evictsDocument() {
        service.update(URI, TEXT);

        service.close(URI);

        assertThat(service.document(URI)).isEmpty();
        assertThat(service.hover(URI, new Position(0, 1))).isEmpty();
        assertThat(service.format(URI)).isEmpty();
    }

    @Test
    void hoverAndDefinition_onCachedDocument_areAnswered() {
        service.update(URI, TEXT);

        assertThat(service.hover(URI, new Position(1, 4))).isPresent();
        assertThat(service.definition(URI, new Position(1, 4)))
            .contains(new Location(URI, Range.ofLine(0, 12, 16)));
    }

    @Test
    void queries_unknownDocument_returnEmpty() {
        assertThat(service.hover("file:///unknown", new Position(0, 0))).isEmpty();
        assertThat(service.definition("file:///unknown", new Position(0, 0))).isEmpty();
    }

    @Test
    void hoverAndDefinition_walkFails_returnEmpty() {
        AstWalker failingWalker = new AstWalker((node, depth) -> {
            throw new IllegalStateException("walk failed");
        });
        ToonLanguageService failing = new ToonLanguageService(
            new ToonParser(), new DiagnosticEngine(List.of(new AstDiagnosticValidator())),
            new ToonSerializer(), failingWalker);

        List<Diagnostic> diagnostics = failing.update(URI, TEXT);

        assertThat(diagnostics).isEmpty();
        assertThat(failing.document(URI)).isPresent();
        assertThat(failing.hover(URI, new Position(1, 4))).isEmpty();
        assertThat(failing.definition(URI, new Position(1, 4))).isEmpty();
    }

    @Test
    void update_abandonedParse_returnsParseErrorAndEvicts() {
        ToonLanguageService shallow = new ToonLanguageService(
            new ToonParser(new ParserOptions(1)), new DiagnosticEngine(List.of()), new ToonSerializer());
        shallow.update(URI, "a: 1");

        List<Diagnostic> diagnostics = shallow.update(URI, "a:\n  b:\n    c: 1");

        assertThat(diagnostics).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.isError()).isTrue();
            assertThat(diagnostic.message()).contains("nesting depth");
        });
        assertThat(shallow.document(URI)).isEmpty();
    }

    @Test
    void update_validatorThrows_returnsRemainingDiagnostics() {
        DocumentValidator failing = new DocumentValidator() {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public String getDisplayName() {
                return "Failing";
            }

            @Override
            public List<Diagnostic> validate(DocumentNode document, String text) {
                throw new IllegalStateException("boom");
            }
        };
        ToonLanguageService withFailure = new ToonLanguageService(new ToonParser(),
            new DiagnosticEngine(List.of(failing, new LineSyntaxValidator())), new ToonSerializer());

        assertThat(withFailure.update(URI, TEXT)).hasSize(1);
    }

    @Test
    void format_returnsCanonicalText() {
        service.update(URI, "user:\n    name:   Ada");

        assertThat(service.format(URI)).contains("user:\n  name: Ada");
    }

    @Test
    void fromConfig_disabledValidator_isNotRun() {
        ToonConfig config = new ToonConfig(null, null,
            new ToonConfig.ValidatorSettings(List.of(LineSyntaxValidator.ID)));
        ToonLanguageService configured = ToonLanguageService.fromConfig(config);

        assertThat(configured.update(URI, TEXT)).isEmpty();
    }

    @Test
    void update_differentDocumentsConcurrently_areIndependent() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Diagnostic>>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String uri = "file:///tmp/doc" + i + ".toon";
                String text = "items[" + i + "]: a";
                futures.add(executor.submit(() -> service.update(uri, text)));
            }
            for (int i = 0; i < 16; i++) {
                assertThat(futures.get(i).get(10, TimeUnit.SECONDS)).hasSize(i == 1 ? 0 : 1);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
