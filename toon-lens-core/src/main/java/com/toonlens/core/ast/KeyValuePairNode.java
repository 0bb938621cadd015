package com.toonlens.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A {@code key: value} line.
 *
 * <p>Both key and value are trimmed. An empty value is legal in the tree: it is how a
 * header with a colon but no indented followers is represented, and diagnostics report
 * it as a missing value.
 */
public final class KeyValuePairNode extends AstNode {

    private final String key;
    private final Range keyRange;
    private final String value;
    private final Range valueRange;
    private final int colonPosition;

    public KeyValuePairNode(Range range, String key, Range keyRange, String value, Range valueRange,
                            int colonPosition) {
        super(range);
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.keyRange = Objects.requireNonNull(keyRange, "keyRange must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.valueRange = Objects.requireNonNull(valueRange, "valueRange must not be null");
        this.colonPosition = colonPosition;
    }

    @Override
    public NodeType type() {
        return NodeType.KEY_VALUE_PAIR;
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    public String key() {
        return key;
    }

    public Range keyRange() {
        return keyRange;
    }

    public String value() {
        return value;
    }

    public Range valueRange() {
        return valueRange;
    }

    /**
     * Returns the character offset of the {@code :} separator on the node's line.
     *
     * @return colon offset
     */
    public int colonPosition() {
        return colonPosition;
    }
}
