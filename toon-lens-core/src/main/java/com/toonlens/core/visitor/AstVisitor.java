package com.toonlens.core.visitor;

import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DataRowNode;
import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.EmptyNode;
import com.toonlens.core.ast.FieldNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;

/**
 * Callbacks invoked by {@link AstWalker}, one per node type.
 *
 * <p>Every method is optional. A visitor overrides only the node types it cares about;
 * the walker still traverses the whole tree.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * List<String> keys = new ArrayList<>();
 * new AstWalker().walk(document, new AstVisitor() {
 *     @Override
 *     public void visitKeyValuePair(KeyValuePairNode node) {
 *         keys.add(node.key());
 *     }
 * });
 * }</pre>
 */
public interface AstVisitor {

    default void visitDocument(DocumentNode node) {
    }

    default void visitKeyValuePair(KeyValuePairNode node) {
    }

    default void visitBlock(BlockNode node) {
    }

    default void visitSimpleArray(SimpleArrayNode node) {
    }

    default void visitStructuredArray(StructuredArrayNode node) {
    }

    default void visitField(FieldNode node) {
    }

    default void visitDataRow(DataRowNode node) {
    }

    default void visitValue(ValueNode node) {
    }

    default void visitEmpty(EmptyNode node) {
    }
}
