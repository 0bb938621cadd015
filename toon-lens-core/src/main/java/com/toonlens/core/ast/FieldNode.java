package com.toonlens.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A column name declared in a structured array header.
 *
 * <p>A field has no explicit index. Its position in the parent's
 * {@link StructuredArrayNode#fields()} list is the index data row cells are matched against.
 */
public final class FieldNode extends AstNode {

    private final String name;

    public FieldNode(Range range, String name) {
        super(range);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public NodeType type() {
        return NodeType.FIELD;
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    public String name() {
        return name;
    }

    /**
     * Returns the zero-based position of this field within its structured array, or -1 when
     * the field is not attached to one.
     *
     * @return field index
     */
    public int index() {
        return parent()
            .filter(StructuredArrayNode.class::isInstance)
            .map(StructuredArrayNode.class::cast)
            .map(array -> indexOf(array.fields(), this))
            .orElse(-1);
    }

    private static int indexOf(List<FieldNode> fields, FieldNode field) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i) == field) {
                return i;
            }
        }
        return -1;
    }
}
