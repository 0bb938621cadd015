package com.toonlens.core.ast;

/**
 * Discriminant shared by every {@link AstNode}.
 */
public enum NodeType {
    DOCUMENT("document"),
    KEY_VALUE_PAIR("key-value-pair"),
    BLOCK("block"),
    SIMPLE_ARRAY("simple-array"),
    STRUCTURED_ARRAY("structured-array"),
    FIELD("field"),
    DATA_ROW("data-row"),
    VALUE("value"),
    EMPTY("empty");

    private final String id;

    NodeType(String id) {
        this.id = id;
    }

    /**
     * Returns the external identifier of this node type (e.g. {@code "key-value-pair"}).
     *
     * @return node type identifier
     */
    public String id() {
        return id;
    }
}
