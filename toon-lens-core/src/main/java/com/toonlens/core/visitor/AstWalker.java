package com.toonlens.core.visitor;

import com.toonlens.core.ast.AstNode;
import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DataRowNode;
import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.EmptyNode;
import com.toonlens.core.ast.FieldNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;

import java.util.Objects;

/**
 * Depth-first, pre-order traversal of a syntax tree.
 *
 * <p>For every node the walker first notifies its {@link NodeVisitListener} with the node's
 * depth, then calls the matching {@link AstVisitor} method, then descends into the node's
 * children. Children are enumerated as follows:
 * <ul>
 *   <li>document and block: their child nodes</li>
 *   <li>simple array: its values</li>
 *   <li>structured array: its fields, then its data rows</li>
 *   <li>data row: its values</li>
 *   <li>key-value pair, field, value, empty: none</li>
 * </ul>
 * Every node is visited exactly once. Depth increases by one per level regardless of node
 * type, so the cells of a row are one level below the row.
 *
 * <p>The walker holds no per-walk state and can be shared.
 */
public class AstWalker {

    private final NodeVisitListener listener;

    public AstWalker() {
        this(NodeVisitListener.NONE);
    }

    public AstWalker(NodeVisitListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Walks the tree rooted at {@code root}.
     *
     * @param root node to start from, visited at depth 0
     * @param visitor visitor to dispatch to
     */
    public void walk(AstNode root, AstVisitor visitor) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");
        walkNode(root, visitor, 0);
    }

    private void walkNode(AstNode node, AstVisitor visitor, int depth) {
        listener.onNodeVisit(node, depth);
        dispatch(node, visitor);
        for (AstNode child : node.children()) {
            walkNode(child, visitor, depth + 1);
        }
    }

    /**
     * Calls the visitor method matching the node's type.
     *
     * @param node node to dispatch
     * @param visitor target visitor
     */
    public static void dispatch(AstNode node, AstVisitor visitor) {
        switch (node.type()) {
            case DOCUMENT -> visitor.visitDocument((DocumentNode) node);
            case KEY_VALUE_PAIR -> visitor.visitKeyValuePair((KeyValuePairNode) node);
            case BLOCK -> visitor.visitBlock((BlockNode) node);
            case SIMPLE_ARRAY -> visitor.visitSimpleArray((SimpleArrayNode) node);
            case STRUCTURED_ARRAY -> visitor.visitStructuredArray((StructuredArrayNode) node);
            case FIELD -> visitor.visitField((FieldNode) node);
            case DATA_ROW -> visitor.visitDataRow((DataRowNode) node);
            case VALUE -> visitor.visitValue((ValueNode) node);
            case EMPTY -> visitor.visitEmpty((EmptyNode) node);
        }
    }
}
