package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DataRowNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Visitor that checks declared sizes, field counts and missing keys or values.
 *
 * <p>Diagnostics accumulate in traversal order. Each rule is anchored at the narrowest
 * range that explains it:
 * <ul>
 *   <li>missing key or value: the key or value range of the pair</li>
 *   <li>simple array size mismatch: the whole array line</li>
 *   <li>structured array row count mismatch: the size literal</li>
 *   <li>row cell count mismatch: the offending row, one diagnostic per row</li>
 *   <li>block without children: the block, as a warning</li>
 * </ul>
 *
 * <p>Instances are single use per walk; call {@link #clear()} before reusing one.
 */
public class AstDiagnosticVisitor implements AstVisitor {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void visitBlock(BlockNode node) {
        // The parser never builds a childless block; trees built by hand can.
        if (node.children().isEmpty()) {
            diagnostics.add(Diagnostic.warning(node.range(), DiagnosticMessages.EMPTY_BLOCK));
        }
    }

    @Override
    public void visitKeyValuePair(KeyValuePairNode node) {
        if (node.key().isBlank()) {
            diagnostics.add(Diagnostic.error(node.keyRange(), DiagnosticMessages.MISSING_KEY));
        }
        if (node.value().isBlank()) {
            diagnostics.add(Diagnostic.error(node.valueRange(), DiagnosticMessages.MISSING_VALUE));
        }
    }

    @Override
    public void visitSimpleArray(SimpleArrayNode node) {
        int actual = node.values().size();
        if (actual != node.declaredSize()) {
            diagnostics.add(Diagnostic.error(node.range(),
                DiagnosticMessages.arraySize(node.declaredSize(), actual)));
        }
    }

    @Override
    public void visitStructuredArray(StructuredArrayNode node) {
        int actual = node.dataRows().size();
        if (actual != node.declaredSize()) {
            diagnostics.add(Diagnostic.error(node.sizeRange(),
                DiagnosticMessages.arrayRows(node.declaredSize(), actual)));
        }
    }

    @Override
    public void visitDataRow(DataRowNode node) {
        node.array().ifPresent(array -> {
            int expected = array.fields().size();
            int actual = node.values().size();
            if (actual != expected) {
                diagnostics.add(Diagnostic.error(node.range(),
                    DiagnosticMessages.fieldCount(expected, actual)));
            }
        });
    }

    /**
     * Returns the diagnostics collected so far.
     *
     * @return unmodifiable snapshot in traversal order
     */
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public void clear() {
        diagnostics.clear();
    }
}
