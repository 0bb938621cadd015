package com.toonlens.core.ast;

import java.util.List;

/**
 * Root of a Toon syntax tree, one child per top-level construct in source order.
 */
public final class DocumentNode extends AstNode {

    private final List<AstNode> children;

    public DocumentNode(Range range, List<? extends AstNode> children) {
        super(range);
        this.children = List.copyOf(children);
        adopt(this.children);
    }

    @Override
    public NodeType type() {
        return NodeType.DOCUMENT;
    }

    @Override
    public List<AstNode> children() {
        return children;
    }
}
