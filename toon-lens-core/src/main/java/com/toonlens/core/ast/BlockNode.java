package com.toonlens.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A header line {@code key:} with no inline value, followed by strictly more indented
 * child lines.
 *
 * <p>The parser only builds a block when at least one child exists, and the block's range
 * ends where its last child ends. The constructor accepts an empty child list so that
 * trees built by hand can still be validated.
 */
public final class BlockNode extends AstNode {

    private final String key;
    private final Range keyRange;
    private final int colonPosition;
    private final List<AstNode> children;

    public BlockNode(Range range, String key, Range keyRange, int colonPosition,
                     List<? extends AstNode> children) {
        super(range);
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.keyRange = Objects.requireNonNull(keyRange, "keyRange must not be null");
        this.colonPosition = colonPosition;
        this.children = List.copyOf(children);
        adopt(this.children);
    }

    @Override
    public NodeType type() {
        return NodeType.BLOCK;
    }

    @Override
    public List<AstNode> children() {
        return children;
    }

    public String key() {
        return key;
    }

    public Range keyRange() {
        return keyRange;
    }

    public int colonPosition() {
        return colonPosition;
    }
}
