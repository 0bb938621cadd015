package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Runs a fixed list of {@link DocumentValidator}s over a document.
 *
 * <p>Validators run in list order and their diagnostics are concatenated. A validator that
 * throws is logged and skipped; the others still run and their diagnostics are kept.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DiagnosticEngine engine = DiagnosticEngine.withDiscoveredValidators();
 * List<Diagnostic> diagnostics = engine.validate(parser.parse(text), text);
 * }</pre>
 */
public class DiagnosticEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticEngine.class);

    private final List<DocumentValidator> validators;

    public DiagnosticEngine(List<? extends DocumentValidator> validators) {
        this.validators = List.copyOf(Objects.requireNonNull(validators, "validators must not be null"));
    }

    /**
     * Creates an engine with every validator registered through SPI.
     *
     * @return engine over all discovered validators
     */
    public static DiagnosticEngine withDiscoveredValidators() {
        return withDiscoveredValidators(List.of());
    }

    /**
     * Creates an engine with the validators registered through SPI, minus the disabled ones.
     *
     * @param disabledIds validator ids to leave out; unknown ids are logged and ignored
     * @return engine over the enabled validators
     */
    public static DiagnosticEngine withDiscoveredValidators(Collection<String> disabledIds) {
        log.debug("Discovering validators via ServiceLoader");
        List<DocumentValidator> discovered = new ArrayList<>();
        ServiceLoader.load(DocumentValidator.class).forEach(discovered::add);

        for (String id : disabledIds) {
            if (discovered.stream().noneMatch(v -> v.getId().equals(id))) {
                log.warn("Unknown validator id in configuration: {}", id);
            }
        }

        List<DocumentValidator> enabled = new ArrayList<>();
        for (DocumentValidator validator : discovered) {
            if (disabledIds.contains(validator.getId())) {
                log.debug("  - {} disabled by configuration", validator.getId());
            } else {
                enabled.add(validator);
                log.debug("  - {} ({})", validator.getId(), validator.getDisplayName());
            }
        }
        log.debug("Discovered {} validators, {} enabled", discovered.size(), enabled.size());
        return new DiagnosticEngine(enabled);
    }

    /**
     * Validates a document with every validator.
     *
     * @param document parsed tree
     * @param text source text of the tree
     * @return diagnostics of all validators that completed, in validator order
     */
    public List<Diagnostic> validate(DocumentNode document, String text) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(text, "text must not be null");

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (DocumentValidator validator : validators) {
            try {
                diagnostics.addAll(validator.validate(document, text));
            } catch (RuntimeException e) {
                log.error("Validator {} failed: {}", validator.getId(), e.getMessage(), e);
            }
        }
        return diagnostics;
    }

    public List<DocumentValidator> getValidators() {
        return validators;
    }
}
