package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.DocumentNode;

import java.util.List;

/**
 * A pass that inspects a parsed document and reports problems.
 *
 * <p>Validators are discovered via Java Service Provider Interface (SPI) and run by
 * {@link DiagnosticEngine}. Each validator is independent: it sees the whole tree and the
 * source text, and its output is concatenated with the others in discovery order.
 *
 * <p>Implementations must be stateless between calls so that one instance can validate
 * any number of documents, possibly from several threads.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.toonlens.core.diagnostic.DocumentValidator}
 *
 * @see DiagnosticEngine
 */
public interface DocumentValidator {

    /**
     * Returns unique identifier for this validator.
     *
     * <p>Used to disable validators from configuration. Should be kebab-case
     * (e.g., "ast", "line-syntax").
     *
     * @return unique validator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this validator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Validates a document.
     *
     * <p>Problems in the document are reported as diagnostics, never as exceptions. An
     * exception thrown from here is treated as a bug in the validator: the engine logs it
     * and carries on with the next validator.
     *
     * @param document parsed tree
     * @param text source text the tree was parsed from
     * @return diagnostics in document order, never {@code null}
     */
    List<Diagnostic> validate(DocumentNode document, String text);
}
