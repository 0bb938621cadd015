package com.toonlens.core.parser;

import com.toonlens.core.ast.AstNode;
import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DataRowNode;
import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.EmptyNode;
import com.toonlens.core.ast.FieldNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.Position;
import com.toonlens.core.ast.Range;
import com.toonlens.core.ast.SimpleArrayNode;
import com.toonlens.core.ast.StructuredArrayNode;
import com.toonlens.core.ast.ValueNode;
import com.toonlens.core.parser.LineTokenizer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;

/**
 * Line-index cursor that classifies the lines of one document and builds its tree.
 *
 * <p>Each line is tried against the recognizers in priority order: structured array
 * header, simple array header, block header, key-value pair. The first match wins and
 * reports how many lines it consumed. A line nothing recognizes becomes an
 * {@link EmptyNode}.
 *
 * <p>One instance parses one document and is then discarded.
 */
final class LineClassifier {

    private record Classified(AstNode node, int linesConsumed) {
    }

    private final String[] lines;
    private final int maxNestingDepth;

    LineClassifier(String[] lines, int maxNestingDepth) {
        if (lines.length == 0) {
            throw new IllegalArgumentException("a document has at least one line");
        }
        this.lines = lines;
        this.maxNestingDepth = maxNestingDepth;
    }

    DocumentNode readDocument() {
        List<AstNode> children = new ArrayList<>();
        int index = 0;
        while (index < lines.length) {
            Classified classified = classify(index, 0);
            children.add(classified.node());
            index += classified.linesConsumed();
        }
        int last = lines.length - 1;
        return new DocumentNode(Range.of(0, 0, last, lines[last].length()), children);
    }

    /**
     * Classifies the line at {@code index}.
     *
     * @param index line index
     * @param depth number of enclosing blocks, 0 at top level
     */
    private Classified classify(int index, int depth) {
        String line = lines[index];
        if (LinePatterns.isBlank(line)) {
            return new Classified(empty(index), 1);
        }

        Classified classified = tryStructuredArray(index, depth);
        if (classified == null) {
            classified = trySimpleArray(index);
        }
        if (classified == null) {
            classified = tryBlock(index, depth);
        }
        if (classified == null) {
            classified = tryKeyValuePair(index);
        }
        return classified != null ? classified : new Classified(empty(index), 1);
    }

    private Classified tryStructuredArray(int index, int depth) {
        String line = lines[index];
        Matcher matcher = LinePatterns.STRUCTURED_ARRAY_HEADER.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        OptionalInt declaredSize = LinePatterns.parseSize(matcher.group(3));
        if (declaredSize.isEmpty()) {
            return null;
        }

        List<FieldNode> fields = new ArrayList<>();
        for (Token token : LineTokenizer.splitOnComma(line, matcher.start(4), matcher.end(4))) {
            fields.add(new FieldNode(token.range(index), token.text()));
        }

        // Top-level rows only need leading whitespace; nested rows must sit deeper than
        // their header so that the enclosing block's next sibling is not swallowed.
        int rowIndentFloor = depth == 0 ? 0 : LinePatterns.indentation(line);
        List<DataRowNode> rows = new ArrayList<>();
        int cursor = index + 1;
        while (cursor < lines.length
                && !LinePatterns.isBlank(lines[cursor])
                && LinePatterns.indentation(lines[cursor]) > rowIndentFloor) {
            rows.add(dataRow(cursor));
            cursor++;
        }

        int endLine = cursor - 1;
        StructuredArrayNode node = new StructuredArrayNode(
            Range.of(index, 0, endLine, lines[endLine].length()),
            matcher.group(2),
            Range.ofLine(index, matcher.start(2), matcher.end(2)),
            declaredSize.getAsInt(),
            Range.ofLine(index, matcher.start(3), matcher.end(3)),
            fields,
            rows);
        return new Classified(node, 1 + rows.size());
    }

    private DataRowNode dataRow(int index) {
        String line = lines[index];
        Token row = LineTokenizer.trim(line, 0, line.length());
        return new DataRowNode(row.range(index), values(index, row.start(), row.end()));
    }

    private Classified trySimpleArray(int index) {
        String line = lines[index];
        Matcher matcher = LinePatterns.SIMPLE_ARRAY_HEADER.matcher(line);
        if (!matcher.matches() || LinePatterns.hasFieldList(line)) {
            return null;
        }
        OptionalInt declaredSize = LinePatterns.parseSize(matcher.group(3));
        if (declaredSize.isEmpty()) {
            return null;
        }

        List<ValueNode> values = matcher.group(4).isBlank()
            ? List.of()
            : values(index, matcher.start(4), matcher.end(4));

        SimpleArrayNode node = new SimpleArrayNode(
            Range.ofLine(index, 0, line.length()),
            matcher.group(2),
            Range.ofLine(index, matcher.start(2), matcher.end(2)),
            declaredSize.getAsInt(),
            Range.ofLine(index, matcher.start(3), matcher.end(3)),
            values);
        return new Classified(node, 1);
    }

    private List<ValueNode> values(int index, int from, int to) {
        List<ValueNode> values = new ArrayList<>();
        for (Token token : LineTokenizer.splitOnComma(lines[index], from, to)) {
            values.add(new ValueNode(token.range(index), token.text()));
        }
        return values;
    }

    private Classified tryBlock(int index, int depth) {
        String line = lines[index];
        int colon = line.indexOf(':');
        if (colon < 0 || LinePatterns.hasBracketBefore(line, colon)) {
            return null;
        }
        if (!line.substring(colon + 1).isBlank()) {
            return null;
        }
        Token key = LineTokenizer.trim(line, 0, colon);
        if (key.text().isEmpty()) {
            return null;
        }

        int first = index + 1;
        if (first >= lines.length || LinePatterns.isBlank(lines[first])) {
            return null;
        }
        int childIndent = LinePatterns.indentation(lines[first]);
        if (childIndent <= LinePatterns.indentation(line)) {
            return null;
        }
        if (depth >= maxNestingDepth) {
            throw new ToonParseException(new ParseError(
                "Maximum nesting depth of " + maxNestingDepth + " exceeded",
                Range.ofLine(index, 0, line.length())));
        }

        List<AstNode> children = new ArrayList<>();
        int cursor = first;
        int consumedUpTo = first;
        while (cursor < lines.length) {
            String candidate = lines[cursor];
            if (LinePatterns.isBlank(candidate)) {
                cursor++;
                continue;
            }
            if (LinePatterns.indentation(candidate) < childIndent) {
                break;
            }
            Classified child = classify(cursor, depth + 1);
            children.add(child.node());
            cursor += child.linesConsumed();
            consumedUpTo = cursor;
        }

        AstNode last = children.get(children.size() - 1);
        BlockNode block = new BlockNode(
            new Range(new Position(index, 0), last.range().end()),
            key.text(),
            key.range(index),
            colon,
            children);
        return new Classified(block, consumedUpTo - index);
    }

    private Classified tryKeyValuePair(int index) {
        String line = lines[index];
        int colon = line.indexOf(':');
        if (colon < 0 || LinePatterns.hasBracketBefore(line, colon)) {
            return null;
        }

        Token key = LineTokenizer.trim(line, 0, colon);
        Token value = LineTokenizer.trim(line, colon + 1, line.length());
        Range valueRange = value.text().isEmpty()
            ? Range.ofLine(index, colon + 1, colon + 1)
            : value.range(index);

        KeyValuePairNode node = new KeyValuePairNode(
            Range.ofLine(index, 0, line.length()),
            key.text(),
            key.range(index),
            value.text(),
            valueRange,
            colon);
        return new Classified(node, 1);
    }

    private EmptyNode empty(int index) {
        return new EmptyNode(Range.ofLine(index, 0, lines[index].length()));
    }
}
