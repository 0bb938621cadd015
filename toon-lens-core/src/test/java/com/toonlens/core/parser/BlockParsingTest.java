package com.toonlens.core.parser;

import com.toonlens.core.ast.AstNode;
import com.toonlens.core.ast.BlockNode;
import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.KeyValuePairNode;
import com.toonlens.core.ast.NodeType;
import com.toonlens.core.ast.Position;
import com.toonlens.core.ast.Range;
import com.toonlens.core.ast.StructuredArrayNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for indentation-driven block recognition.
 */
class BlockParsingTest {

    private final ToonParser parser = new ToonParser();

    @Test
    void parse_headerWithIndentedChildren_formsBlock() {
        DocumentNode document = parser.parse("user:\n  name: Ada\n  age: 36");

        assertThat(document.children()).hasSize(1);
        BlockNode block = (BlockNode) document.children().get(0);
        assertThat(block.key()).isEqualTo("user");
        assertThat(block.keyRange()).isEqualTo(Range.ofLine(0, 0, 4));
        assertThat(block.colonPosition()).isEqualTo(4);
        assertThat(block.children()).hasSize(2);
        assertThat(block.children()).allMatch(child -> child.type() == NodeType.KEY_VALUE_PAIR);
        assertThat(block.children()).map(child -> ((KeyValuePairNode) child).key()).containsExactly("name", "age");
        assertThat(block.children()).map(child -> ((KeyValuePairNode) child).value()).containsExactly("Ada", "36");
    }

    @ParameterizedTest
    @CsvSource({
        "config, host, localhost, port, 8080",
        "a, b, 1, c, 2",
        "_private, x_1, yes, y_2, no"
    })
    void parse_anyKeyWithTwoChildren_formsBlockWithMatchingChildren(
            String key, String k1, String v1, String k2, String v2) {
        String text = key + ":\n  " + k1 + ": " + v1 + "\n  " + k2 + ": " + v2;

        DocumentNode document = parser.parse(text);

        BlockNode block = (BlockNode) document.children().get(0);
        assertThat(block.key()).isEqualTo(key);
        assertThat(block.children()).hasSize(2);
        KeyValuePairNode first = (KeyValuePairNode) block.children().get(0);
        KeyValuePairNode second = (KeyValuePairNode) block.children().get(1);
        assertThat(first.key()).isEqualTo(k1);
        assertThat(first.value()).isEqualTo(v1);
        assertThat(second.key()).isEqualTo(k2);
        assertThat(second.value()).isEqualTo(v2);
    }

    @Test
    void parse_block_rangeEndsAtLastChildEnd() {
        DocumentNode document = parser.parse("user:\n  name: Ada\n  age: 36\nnext: 1");

        BlockNode block = (BlockNode) document.children().get(0);
        AstNode last = block.children().get(block.children().size() - 1);
        assertThat(block.range().start()).isEqualTo(new Position(0, 0));
        assertThat(block.range().end()).isEqualTo(last.range().end());
        assertThat(block.range().end()).isEqualTo(new Position(2, 9));
    }

    @Test
    void parse_nestedBlocks_everyBlockRangeClosesOnItsLastChild() {
        DocumentNode document = parser.parse("""
            a:
              b:
                c: 1
                d:
                  e: 2
              f: 3
            g: 4""");

        List<BlockNode> blocks = new ArrayList<>();
        collectBlocks(document, blocks);

        assertThat(blocks).extracting(BlockNode::key).containsExactly("a", "b", "d");
        for (BlockNode block : blocks) {
            AstNode last = block.children().get(block.children().size() - 1);
            assertThat(block.range().end()).isEqualTo(last.range().end());
        }
        assertThat(document.children()).extracting(AstNode::type)
            .containsExactly(NodeType.BLOCK, NodeType.KEY_VALUE_PAIR);
    }

    @Test
    void parse_nestedBlock_childrenHaveBlockAsParent() {
        DocumentNode document = parser.parse("a:\n  b:\n    c: 1\n  d: 2");

        BlockNode outer = (BlockNode) document.children().get(0);
        BlockNode inner = (BlockNode) outer.children().get(0);
        assertThat(outer.children()).extracting(AstNode::type)
            .containsExactly(NodeType.BLOCK, NodeType.KEY_VALUE_PAIR);
        assertThat(inner.parent()).containsSame(outer);
        assertThat(inner.children().get(0).parent()).containsSame(inner);
        assertThat(outer.parent()).containsSame(document);
    }

    @Test
    void parse_blankLineInsideBlock_isSkipped() {
        DocumentNode document = parser.parse("a:\n  b: 1\n\n  c: 2\nd: 3");

        BlockNode block = (BlockNode) document.children().get(0);
        assertThat(block.children()).extracting(child -> ((KeyValuePairNode) child).key())
            .containsExactly("b", "c");
        assertThat(document.children()).extracting(AstNode::type)
            .containsExactly(NodeType.BLOCK, NodeType.KEY_VALUE_PAIR);
    }

    @Test
    void parse_blankLineAfterBlock_staysAtTopLevel() {
        DocumentNode document = parser.parse("a:\n  b: 1\n\nc: 2");

        assertThat(document.children()).extracting(AstNode::type)
            .containsExactly(NodeType.BLOCK, NodeType.EMPTY, NodeType.KEY_VALUE_PAIR);
    }

    @Test
    void parse_headerFollowedByBlankLine_isKeyValuePair() {
        DocumentNode document = parser.parse("a:\n\n  b: 1");

        assertThat(document.children().get(0).type()).isEqualTo(NodeType.KEY_VALUE_PAIR);
    }

    @Test
    void parse_headerFollowedBySameIndent_isKeyValuePair() {
        DocumentNode document = parser.parse("  a:\n  b: 1");

        assertThat(document.children()).extracting(AstNode::type)
            .containsExactly(NodeType.KEY_VALUE_PAIR, NodeType.KEY_VALUE_PAIR);
    }

    @Test
    void parse_structuredArrayInsideBlock_rowsDoNotSwallowSiblings() {
        DocumentNode document = parser.parse("""
            trip:
              hikes[1]{id}:
                1
              name: loop""");

        BlockNode block = (BlockNode) document.children().get(0);
        assertThat(block.children()).extracting(AstNode::type)
            .containsExactly(NodeType.STRUCTURED_ARRAY, NodeType.KEY_VALUE_PAIR);
        StructuredArrayNode array = (StructuredArrayNode) block.children().get(0);
        assertThat(array.dataRows()).hasSize(1);
        assertThat(array.parent()).containsSame(block);
    }

    @Test
    void parse_simpleArrayInsideBlock_isChild() {
        DocumentNode document = parser.parse("user:\n  tags[2]: a,b");

        BlockNode block = (BlockNode) document.children().get(0);
        assertThat(block.children().get(0).type()).isEqualTo(NodeType.SIMPLE_ARRAY);
    }

    private static void collectBlocks(AstNode node, List<BlockNode> blocks) {
        if (node instanceof BlockNode block) {
            blocks.add(block);
        }
        for (AstNode child : node.children()) {
            collectBlocks(child, blocks);
        }
    }
}
