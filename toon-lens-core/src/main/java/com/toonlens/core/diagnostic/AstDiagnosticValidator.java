package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.visitor.AstWalker;

import java.util.List;

/**
 * Structural validator that walks the syntax tree with an {@link AstDiagnosticVisitor}.
 *
 * @see AstDiagnosticVisitor
 */
public class AstDiagnosticValidator extends AbstractDocumentValidator {

    public static final String ID = "ast";

    private final AstWalker walker = new AstWalker();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Structure Validator";
    }

    @Override
    public List<Diagnostic> validate(DocumentNode document, String text) {
        AstDiagnosticVisitor visitor = new AstDiagnosticVisitor();
        walker.walk(document, visitor);
        List<Diagnostic> diagnostics = visitor.getDiagnostics();
        log.debug("Structure validation produced {} diagnostics", diagnostics.size());
        return diagnostics;
    }
}
