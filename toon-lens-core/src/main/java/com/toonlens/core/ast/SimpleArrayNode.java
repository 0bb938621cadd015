package com.toonlens.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A flat array line {@code name[size]: v1,v2,...}.
 *
 * <p>The declared size is advisory. The parser keeps every value it finds; comparing the
 * count against {@link #declaredSize()} is left to validation.
 */
public final class SimpleArrayNode extends AstNode {

    private final String name;
    private final Range nameRange;
    private final int declaredSize;
    private final Range sizeRange;
    private final List<ValueNode> values;

    public SimpleArrayNode(Range range, String name, Range nameRange, int declaredSize, Range sizeRange,
                           List<ValueNode> values) {
        super(range);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.nameRange = Objects.requireNonNull(nameRange, "nameRange must not be null");
        this.declaredSize = declaredSize;
        this.sizeRange = Objects.requireNonNull(sizeRange, "sizeRange must not be null");
        this.values = List.copyOf(values);
        adopt(this.values);
    }

    @Override
    public NodeType type() {
        return NodeType.SIMPLE_ARRAY;
    }

    @Override
    public List<ValueNode> children() {
        return values;
    }

    public String name() {
        return name;
    }

    public Range nameRange() {
        return nameRange;
    }

    public int declaredSize() {
        return declaredSize;
    }

    public Range sizeRange() {
        return sizeRange;
    }

    public List<ValueNode> values() {
        return values;
    }
}
