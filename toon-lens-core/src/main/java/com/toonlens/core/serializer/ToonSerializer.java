package com.toonlens.core.serializer;

import com.toonlens.core.ast.AstNode;
import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.FieldNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree back to canonical Toon text.
 *
 * <p>Output is normalized: one indent unit per nesting level, {@code key: value} with a
 * single space after the colon, comma-joined values without spaces. Top-level empty nodes
 * become blank lines; blank lines inside blocks are not part of the tree and are not
 * reproduced. Unrecognized lines are empty nodes too, so their text is lost; when such a
 * line is a block's only child, the block is written as a bare {@code key:} header
 * followed by a blank line and re-parses as a key-value pair with an empty value.
 *
 * <p>Re-parsing the output yields the same keys, values, names, declared sizes and
 * nesting as the tree that was serialized. Ranges differ.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ToonSerializer serializer = new ToonSerializer(new SerializerOptions("    ", "\n"));
 * String canonical = serializer.serialize(parser.parse(text));
 * }</pre>
 */
public class ToonSerializer {

    private final SerializerOptions options;

    public ToonSerializer() {
        this(SerializerOptions.defaults());
    }

    public ToonSerializer(SerializerOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Serializes a document.
     *
     * @param document tree to render
     * @return text with lines joined by the configured line ending, no trailing terminator
     *         unless the document ends with an empty node
     */
    public String serialize(DocumentNode document) {
        Objects.requireNonNull(document, "document must not be null");
        List<String> lines = new ArrayList<>();
        for (AstNode child : document.children()) {
            appendNode(child, 0, lines);
        }
        return String.join(options.lineEnding(), lines);
    }

    private void appendNode(AstNode node, int level, List<String> lines) {
        String indent = options.indent().repeat(level);
        switch (node.type()) {
            case KEY_VALUE_PAIR -> lines.add(indent + keyValuePair((KeyValuePairNode) node));
            case BLOCK -> appendBlock((BlockNode) node, level, lines);
            case SIMPLE_ARRAY -> lines.add(indent + simpleArray((SimpleArrayNode) node));
            case STRUCTURED_ARRAY -> appendStructuredArray((StructuredArrayNode) node, indent, lines);
            case EMPTY -> lines.add("");
            default -> throw new IllegalArgumentException(
                node.type().id() + " node cannot appear at statement level");
        }
    }

    private String keyValuePair(KeyValuePairNode node) {
        return node.value().isEmpty() ? node.key() + ":" : node.key() + ": " + node.value();
    }

    private void appendBlock(BlockNode node, int level, List<String> lines) {
        lines.add(options.indent().repeat(level) + node.key() + ":");
        for (AstNode child : node.children()) {
            appendNode(child, level + 1, lines);
        }
    }

    private String simpleArray(SimpleArrayNode node) {
        String header = node.name() + "[" + node.declaredSize() + "]:";
        return node.values().isEmpty() ? header : header + " " + joinValues(node.values());
    }

    private void appendStructuredArray(StructuredArrayNode node, String indent, List<String> lines) {
        String fields = node.fields().stream().map(FieldNode::name).collect(Collectors.joining(","));
        lines.add(indent + node.name() + "[" + node.declaredSize() + "]{" + fields + "}:");
        String rowIndent = indent + options.indent();
        node.dataRows().forEach(row -> lines.add(rowIndent + joinValues(row.values())));
    }

    private static String joinValues(List<ValueNode> values) {
        return values.stream().map(ValueNode::value).collect(Collectors.joining(","));
    }

    public SerializerOptions getOptions() {
        return options;
    }
}
