package com.toonlens.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A tabular array: a header {@code name[size]{f1,f2,...}:} followed by indented data rows.
 *
 * <p>Children are enumerated fields first, then data rows. Row cells refer to fields by
 * position only, see {@link #fieldAt(int)}.
 */
public final class StructuredArrayNode extends AstNode {

    private final String name;
    private final Range nameRange;
    private final int declaredSize;
    private final Range sizeRange;
    private final List<FieldNode> fields;
    private final List<DataRowNode> dataRows;
    private final List<AstNode> children;

    public StructuredArrayNode(Range range, String name, Range nameRange, int declaredSize, Range sizeRange,
                               List<FieldNode> fields, List<DataRowNode> dataRows) {
        super(range);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.nameRange = Objects.requireNonNull(nameRange, "nameRange must not be null");
        this.declaredSize = declaredSize;
        this.sizeRange = Objects.requireNonNull(sizeRange, "sizeRange must not be null");
        this.fields = List.copyOf(fields);
        this.dataRows = List.copyOf(dataRows);

        List<AstNode> all = new ArrayList<>(this.fields.size() + this.dataRows.size());
        all.addAll(this.fields);
        all.addAll(this.dataRows);
        this.children = List.copyOf(all);
        adopt(this.children);
    }

    @Override
    public NodeType type() {
        return NodeType.STRUCTURED_ARRAY;
    }

    @Override
    public List<AstNode> children() {
        return children;
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

    public List<FieldNode> fields() {
        return fields;
    }

    public List<DataRowNode> dataRows() {
        return dataRows;
    }

    /**
     * Returns the field matched positionally to cell {@code index} of a data row.
     *
     * @param index zero-based cell index
     * @return the field, or empty when the row has more cells than there are fields
     */
    public Optional<FieldNode> fieldAt(int index) {
        if (index < 0 || index >= fields.size()) {
            return Optional.empty();
        }
        return Optional.of(fields.get(index));
    }
}
