package com.toonlens.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common envelope of every node in a Toon syntax tree.
 *
 * <p>Each node carries its {@link NodeType} discriminant, its source {@link Range} and a
 * non-owning reference to its parent. Ownership flows from the root to the children: a
 * node's children are handed to its constructor, which attaches itself as their parent
 * exactly once. The parent link is a lookup aid only; no traversal in this library walks
 * upwards except to resolve context (for example a data row finding its array).
 *
 * <p>Trees are immutable once built. A new parse always produces a new tree, and a node
 * cannot be attached to a second parent.
 *
 * <p>The set of node types is closed. Subclasses live in this package and cannot be
 * created elsewhere.
 */
public abstract class AstNode {

    private final Range range;
    private AstNode parent;

    AstNode(Range range) {
        this.range = Objects.requireNonNull(range, "range must not be null");
    }

    /**
     * Returns the node type discriminant.
     *
     * @return node type
     */
    public abstract NodeType type();

    /**
     * Returns the child nodes in traversal order. Leaf nodes return an empty list.
     *
     * @return immutable list of children
     */
    public abstract List<? extends AstNode> children();

    /**
     * Returns the source extent of this node.
     *
     * @return range of the node
     */
    public Range range() {
        return range;
    }

    /**
     * Returns the parent node, or empty for the root and for nodes not yet attached.
     *
     * @return parent node
     */
    public Optional<AstNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Attaches this node as the parent of each given child.
     *
     * @param nodes fully constructed child nodes
     */
    final void adopt(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            node.attachTo(this);
        }
    }

    private void attachTo(AstNode newParent) {
        if (parent != null) {
            throw new IllegalStateException(
                type().id() + " node at " + range + " is already attached to a " + parent.type().id());
        }
        parent = newParent;
    }

    @Override
    public String toString() {
        return type().id() + range;
    }
}
