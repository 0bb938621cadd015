package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.EmptyNode;
import com.toonlens.core.ast.Range;
import com.toonlens.core.parser.LinePatterns;
import com.toonlens.core.visitor.AstVisitor;
import com.toonlens.core.visitor.AstWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Explains why a non-blank line was not recognized.
 *
 * <p>The parser turns unrecognized lines into {@link EmptyNode}s without complaint. This
 * validator revisits those lines in the source text and reports the first syntax problem
 * it finds on each:
 * <ol>
 *   <li>{@code [} with no {@code ]} after it: {@link DiagnosticMessages#MISSING_CLOSING_BRACKET}</li>
 *   <li>nothing between the brackets: {@link DiagnosticMessages#MISSING_ARRAY_SIZE}</li>
 *   <li>a size that is not a non-negative int: {@link DiagnosticMessages#INVALID_ARRAY_SIZE}</li>
 *   <li>an opening brace after {@code ]} that is never closed:
 *       {@link DiagnosticMessages#MISSING_CLOSING_BRACE}</li>
 *   <li>no colon at all: {@link DiagnosticMessages#MISSING_COLON}</li>
 * </ol>
 * Blank lines and lines the parser recognized are never reported here; their checks
 * belong to {@link AstDiagnosticValidator}.
 *
 * <p>Bracket checks apply only when the bracket comes before the first colon (or there is
 * no colon), so values such as {@code note: see [1} are left alone.
 */
public class LineSyntaxValidator extends AbstractDocumentValidator {

    public static final String ID = "line-syntax";

    private final AstWalker walker = new AstWalker();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Line Syntax Validator";
    }

    @Override
    public List<Diagnostic> validate(DocumentNode document, String text) {
        String[] lines = lines(text);
        List<Diagnostic> diagnostics = new ArrayList<>();
        walker.walk(document, new AstVisitor() {
            @Override
            public void visitEmpty(EmptyNode node) {
                int index = node.range().start().line();
                if (index < lines.length && !LinePatterns.isBlank(lines[index])) {
                    checkLine(index, lines[index]).ifPresent(diagnostics::add);
                }
            }
        });
        log.debug("Line syntax validation produced {} diagnostics", diagnostics.size());
        return diagnostics;
    }

    /**
     * Checks one unrecognized line.
     *
     * @param index line index
     * @param line line text
     * @return the first problem found, if any
     */
    Optional<Diagnostic> checkLine(int index, String line) {
        int colon = line.indexOf(':');
        int bracket = line.indexOf('[');
        if (bracket >= 0 && (colon < 0 || bracket < colon)) {
            Optional<Diagnostic> arrayProblem = checkArrayDeclaration(index, line, bracket);
            if (arrayProblem.isPresent()) {
                return arrayProblem;
            }
        }
        if (colon < 0) {
            return Optional.of(Diagnostic.error(
                Range.ofLine(index, 0, line.length()), DiagnosticMessages.MISSING_COLON));
        }
        return Optional.empty();
    }

    private Optional<Diagnostic> checkArrayDeclaration(int index, String line, int bracket) {
        int close = line.indexOf(']', bracket);
        if (close < 0) {
            return Optional.of(Diagnostic.error(
                Range.ofLine(index, bracket, line.length()), DiagnosticMessages.MISSING_CLOSING_BRACKET));
        }

        Range sizeRange = Range.ofLine(index, bracket, close + 1);
        String size = line.substring(bracket + 1, close).trim();
        if (size.isEmpty()) {
            return Optional.of(Diagnostic.error(sizeRange, DiagnosticMessages.MISSING_ARRAY_SIZE));
        }
        if (LinePatterns.parseSize(size).isEmpty()) {
            return Optional.of(Diagnostic.error(sizeRange, DiagnosticMessages.INVALID_ARRAY_SIZE));
        }

        int brace = line.indexOf('{', close);
        if (brace >= 0 && line.indexOf('}', brace) < 0) {
            return Optional.of(Diagnostic.error(
                Range.ofLine(index, brace, line.length()), DiagnosticMessages.MISSING_CLOSING_BRACE));
        }
        return Optional.empty();
    }
}
