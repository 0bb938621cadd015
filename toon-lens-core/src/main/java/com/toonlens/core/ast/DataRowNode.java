package com.toonlens.core.ast;

import java.util.List;
import java.util.Optional;

/**
 * One indented, comma-separated data line of a structured array.
 *
 * <p>The number of values is independent of the number of declared fields.
 */
public final class DataRowNode extends AstNode {

    private final List<ValueNode> values;

    public DataRowNode(Range range, List<ValueNode> values) {
        super(range);
        this.values = List.copyOf(values);
        adopt(this.values);
    }

    @Override
    public NodeType type() {
        return NodeType.DATA_ROW;
    }

    @Override
    public List<ValueNode> children() {
        return values;
    }

    public List<ValueNode> values() {
        return values;
    }

    /**
     * Returns the structured array this row belongs to.
     *
     * @return owning array, empty if the row has not been attached yet
     */
    public Optional<StructuredArrayNode> array() {
        return parent()
            .filter(StructuredArrayNode.class::isInstance)
            .map(StructuredArrayNode.class::cast);
    }
}
