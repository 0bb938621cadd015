package com.toonlens.core.parser;

import com.toonlens.core.parser.LineTokenizer.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LineTokenizer}.
 */
class LineTokenizerTest {

    @Test
    void trim_paddedSegment_returnsInnerOffsets() {
        Token token = LineTokenizer.trim("k:   value  ", 2, 12);

        assertThat(token).isEqualTo(new Token("value", 5, 10));
    }

    @Test
    void trim_blankSegment_returnsEmptyTokenAtEnd() {
        Token token = LineTokenizer.trim("k:   ", 2, 5);

        assertThat(token.text()).isEmpty();
        assertThat(token.start()).isEqualTo(5);
        assertThat(token.end()).isEqualTo(5);
    }

    @Test
    void splitOnComma_repeatedCells_keepsTheirOwnOffsets() {
        List<Token> tokens = LineTokenizer.splitOnComma("a, a ,a", 0, 7);

        assertThat(tokens).containsExactly(
            new Token("a", 0, 1), new Token("a", 3, 4), new Token("a", 6, 7));
    }

    @Test
    void splitOnComma_trailingComma_keepsEmptyCell() {
        List<Token> tokens = LineTokenizer.splitOnComma("x,", 0, 2);

        assertThat(tokens).extracting(Token::text).containsExactly("x", "");
    }

    @Test
    void splitOnComma_segmentOfLine_offsetsAreLineRelative() {
        List<Token> tokens = LineTokenizer.splitOnComma("tags[2]: b,c", 9, 12);

        assertThat(tokens).containsExactly(new Token("b", 9, 10), new Token("c", 11, 12));
    }
}
