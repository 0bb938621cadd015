package com.toonlens.core.diagnostic;

/**
 * Severity of a {@link Diagnostic}.
 */
public enum DiagnosticSeverity {
    /** The document is malformed. */
    ERROR("error"),

    /** The document is well-formed but suspicious. */
    WARNING("warning");

    private final String id;

    DiagnosticSeverity(String id) {
        this.id = id;
    }

    /**
     * Returns the lower-case identifier used in output, e.g. {@code "error"}.
     *
     * @return severity identifier
     */
    public String id() {
        return id;
    }
}
