package com.toonlens.core.ast;

import java.util.List;

/**
 * A blank line, or a line that matched no recognized pattern.
 */
public final class EmptyNode extends AstNode {

    public EmptyNode(Range range) {
        super(range);
    }

    @Override
    public NodeType type() {
        return NodeType.EMPTY;
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }
}
