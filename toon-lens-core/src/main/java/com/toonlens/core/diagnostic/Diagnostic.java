package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.Range;

import java.util.Objects;

/**
 * A problem found in a document, anchored at the narrowest meaningful range.
 *
 * @param severity error or warning
 * @param range source range the problem applies to
 * @param message human-readable message from {@link DiagnosticMessages}
 * @param source producer of the diagnostic, always {@value #SOURCE} for built-in validators
 */
public record Diagnostic(
    DiagnosticSeverity severity,
    Range range,
    String message,
    String source
) {
    /** Source tag attached to every built-in diagnostic. */
    public static final String SOURCE = "toon";

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    public static Diagnostic error(Range range, String message) {
        return new Diagnostic(DiagnosticSeverity.ERROR, range, message, SOURCE);
    }

    public static Diagnostic warning(Range range, String message) {
        return new Diagnostic(DiagnosticSeverity.WARNING, range, message, SOURCE);
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }
}
