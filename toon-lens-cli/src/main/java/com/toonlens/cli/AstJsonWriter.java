package com.toonlens.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.toonlens.core.ast.AstNode;
import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.FieldNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.Position;
import com.toonlens.core.ast.Range;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Converts syntax trees to JSON.
 *
 * <p>Every node becomes an object with {@code type} and {@code range}, the attributes of
 * its node type, and {@code children} for non-leaf nodes. Ranges use the
 * {@code {start:{line,character}, end:{line,character}}} shape of editor protocols.
 */
public class AstJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Renders a tree as pretty-printed JSON.
     *
     * @param root node to render
     * @return JSON text
     */
    public String write(AstNode root) {
        try {
            return mapper.writeValueAsString(toJson(root));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render syntax tree", e);
        }
    }

    /**
     * Converts a tree to a Jackson object tree.
     *
     * @param node node to convert
     * @return JSON object for the node and its subtree
     */
    public ObjectNode toJson(AstNode node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("type", node.type().id());
        json.set("range", rangeJson(node.range()));

        switch (node.type()) {
            case KEY_VALUE_PAIR -> {
                KeyValuePairNode pair = (KeyValuePairNode) node;
                json.put("key", pair.key());
                json.set("keyRange", rangeJson(pair.keyRange()));
                json.put("value", pair.value());
                json.set("valueRange", rangeJson(pair.valueRange()));
                json.put("colonPosition", pair.colonPosition());
            }
            case BLOCK -> {
                BlockNode block = (BlockNode) node;
                json.put("key", block.key());
                json.set("keyRange", rangeJson(block.keyRange()));
            }
            case SIMPLE_ARRAY -> {
                SimpleArrayNode array = (SimpleArrayNode) node;
                json.put("name", array.name());
                json.put("declaredSize", array.declaredSize());
            }
            case STRUCTURED_ARRAY -> {
                StructuredArrayNode array = (StructuredArrayNode) node;
                json.put("name", array.name());
                json.put("declaredSize", array.declaredSize());
            }
            case FIELD -> json.put("name", ((FieldNode) node).name());
            case VALUE -> json.put("value", ((ValueNode) node).value());
            default -> {
                // Document, data row and empty nodes carry no attributes.
            }
        }

        if (!node.children().isEmpty()) {
            ArrayNode children = json.putArray("children");
            node.children().forEach(child -> children.add(toJson(child)));
        }
        return json;
    }

    private ObjectNode rangeJson(Range range) {
        ObjectNode json = mapper.createObjectNode();
        json.set("start", positionJson(range.start()));
        json.set("end", positionJson(range.end()));
        return json;
    }

    private ObjectNode positionJson(Position position) {
        ObjectNode json = mapper.createObjectNode();
        json.put("line", position.line());
        json.put("character", position.character());
        return json;
    }
}
