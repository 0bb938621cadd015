package com.toonlens.core.query;

import com.toonlens.core.ast.DataRowNode;
import com.toonlens.core.ast.Position;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;
import com.toonlens.core.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Visitor that resolves a structured-array cell to the field it belongs to.
 *
 * <p>A cell at index {@code i} of a data row is defined by the field at index {@code i}
 * of the enclosing array. Cells beyond the last field, and positions on anything other
 * than a data-row cell, have no definition.
 */
public class DefinitionProvider implements AstVisitor {

    private final Position position;
    private final String documentUri;
    private Location result;

    public DefinitionProvider(Position position, String documentUri) {
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.documentUri = Objects.requireNonNull(documentUri, "documentUri must not be null");
    }

    public Optional<Location> getDefinition() {
        return Optional.ofNullable(result);
    }

    public void clear() {
        result = null;
    }

    @Override
    public void visitStructuredArray(StructuredArrayNode node) {
        if (result != null) {
            return;
        }
        for (DataRowNode row : node.dataRows()) {
            List<ValueNode> cells = row.values();
            for (int i = 0; i < cells.size(); i++) {
                if (cells.get(i).range().contains(position)) {
                    node.fieldAt(i).ifPresent(field -> result = new Location(documentUri, field.range()));
                    return;
                }
            }
        }
    }
}
