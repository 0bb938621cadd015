package com.toonlens.core.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DataRowNode;
import com.toonlens.core.ast.FieldNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.Position;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;
import com.toonlens.core.visitor.AstVisitor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Visitor that describes the token under a position as markdown.
 *
 * <p>The first node whose token contains the position wins; later matches are ignored.
 * Containment is half-open, so a position just past a token does not match it.
 *
 * <p><b>Hover texts:</b>
 * <ul>
 *   <li>key or value of a pair: the key and the value</li>
 *   <li>block key: the key and the number of children</li>
 *   <li>simple array name: declared size and value count</li>
 *   <li>simple array value: its 1-based index and the array name</li>
 *   <li>structured array name: declared size and field names</li>
 *   <li>field: its 1-based position among the fields</li>
 *   <li>data row cell at index {@code i}: the field at index {@code i} plus a
 *       go-to-definition command link; cells beyond the last field get no hover</li>
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * HoverProvider provider = new HoverProvider(new Position(3, 4), "file:///data.toon");
 * new AstWalker().walk(document, provider);
 * provider.getHover().ifPresent(hover -> show(hover.contents()));
 * }</pre>
 */
public class HoverProvider implements AstVisitor {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final String GO_TO_LOCATIONS = "command:editor.action.goToLocations?";

    private final Position position;
    private final String documentUri;
    private Hover result;

    public HoverProvider(Position position, String documentUri) {
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.documentUri = Objects.requireNonNull(documentUri, "documentUri must not be null");
    }

    public Optional<Hover> getHover() {
        return Optional.ofNullable(result);
    }

    public void clear() {
        result = null;
    }

    @Override
    public void visitKeyValuePair(KeyValuePairNode node) {
        if (found()) {
            return;
        }
        if (node.keyRange().contains(position)) {
            result = new Hover("**Key:** `" + node.key() + "`\n\n**Value:** " + node.value(), node.keyRange());
        } else if (node.valueRange().contains(position)) {
            result = new Hover("**Value:** " + node.value() + "\n\n**Key:** `" + node.key() + "`", node.valueRange());
        }
    }

    @Override
    public void visitBlock(BlockNode node) {
        if (found()) {
            return;
        }
        if (node.keyRange().contains(position)) {
            result = new Hover(
                "**Block:** `" + node.key() + "`\n\n**Children:** " + node.children().size(), node.keyRange());
        }
    }

    @Override
    public void visitSimpleArray(SimpleArrayNode node) {
        if (found()) {
            return;
        }
        if (node.nameRange().contains(position)) {
            result = new Hover("**Array:** `" + node.name() + "`"
                + "\n\n**Size:** " + node.declaredSize()
                + "\n\n**Values:** " + node.values().size(), node.nameRange());
            return;
        }

        List<ValueNode> values = node.values();
        for (int i = 0; i < values.size(); i++) {
            ValueNode value = values.get(i);
            if (value.range().contains(position)) {
                result = new Hover("**Value:** " + value.value()
                    + "\n\n**Index:** " + (i + 1) + " of " + values.size()
                    + "\n\n**Array:** `" + node.name() + "`", value.range());
                return;
            }
        }
    }

    @Override
    public void visitStructuredArray(StructuredArrayNode node) {
        if (found()) {
            return;
        }
        if (node.nameRange().contains(position)) {
            String fieldNames = node.fields().stream().map(FieldNode::name).collect(Collectors.joining(", "));
            result = new Hover("**Structured Array:** `" + node.name() + "`"
                + "\n\n**Size:** " + node.declaredSize()
                + "\n\n**Fields:** " + fieldNames, node.nameRange());
            return;
        }

        List<FieldNode> fields = node.fields();
        for (int i = 0; i < fields.size(); i++) {
            FieldNode field = fields.get(i);
            if (field.range().contains(position)) {
                result = new Hover("**Field:** " + field.name()
                    + "\n\n**Position:** " + (i + 1) + " of " + fields.size(), field.range());
                return;
            }
        }

        for (DataRowNode row : node.dataRows()) {
            List<ValueNode> cells = row.values();
            for (int i = 0; i < cells.size(); i++) {
                ValueNode cell = cells.get(i);
                if (cell.range().contains(position)) {
                    // Positional match only; extra cells have no field to describe.
                    node.fieldAt(i).ifPresent(field -> result = new Hover("**Field:** " + field.name()
                        + "\n\n**Value:** " + cell.value()
                        + "\n\n[Go to definition](" + GO_TO_LOCATIONS + goToLocationsArgs(field) + ")",
                        cell.range()));
                    return;
                }
            }
        }
    }

    private boolean found() {
        return result != null;
    }

    /**
     * Builds the URI-component-encoded argument list of the editor's go-to-locations
     * command: {@code [uri, position, [location]]}.
     */
    private String goToLocationsArgs(FieldNode field) {
        ArrayNode args = JSON_MAPPER.createArrayNode();
        args.add(documentUri);
        args.add(positionJson(position));
        ObjectNode location = args.addArray().addObject();
        location.put("uri", documentUri);
        ObjectNode range = location.putObject("range");
        range.set("start", positionJson(field.range().start()));
        range.set("end", positionJson(field.range().end()));
        try {
            return encodeUriComponent(JSON_MAPPER.writeValueAsString(args));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize go-to-definition arguments", e);
        }
    }

    private static ObjectNode positionJson(Position position) {
        ObjectNode json = JSON_MAPPER.createObjectNode();
        json.put("line", position.line());
        json.put("character", position.character());
        return json;
    }

    /**
     * Percent-encodes text the way a URI component is encoded in a browser: unreserved
     * characters and {@code !'()*~} stay literal, spaces become {@code %20}.
     *
     * @param text text to encode
     * @return encoded text
     */
    static String encodeUriComponent(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%21", "!")
            .replace("%27", "'")
            .replace("%28", "(")
            .replace("%29", ")")
            .replace("%7E", "~");
    }
}
