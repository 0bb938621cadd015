package com.toonlens.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A single trimmed value: an element of a simple array or a cell of a data row.
 */
public final class ValueNode extends AstNode {

    private final String value;

    public ValueNode(Range range, String value) {
        super(range);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public NodeType type() {
        return NodeType.VALUE;
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    public String value() {
        return value;
    }
}
