package com.toonlens.core.visitor;

import com.toonlens.core.ast.AstNode;

/**
 * Instrumentation hook called by {@link AstWalker} for every node, before the visitor.
 */
@FunctionalInterface
public interface NodeVisitListener {

    /** Listener that does nothing. */
    NodeVisitListener NONE = (node, depth) -> {
    };

    /**
     * Called when the walker reaches a node.
     *
     * @param node node being visited
     * @param depth nesting depth, 0 for the node the walk started at
     */
    void onNodeVisit(AstNode node, int depth);
}
