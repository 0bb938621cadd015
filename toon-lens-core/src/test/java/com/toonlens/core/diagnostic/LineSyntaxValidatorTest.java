package com.toonlens.core.diagnostic;

import com.toonlens.core.ast.Range;
import com.toonlens.core.parser.ToonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LineSyntaxValidator}.
 */
class LineSyntaxValidatorTest {

    private final ToonParser parser = new ToonParser();
    private final LineSyntaxValidator validator = new LineSyntaxValidator();

    private List<Diagnostic> validate(String text) {
        return validator.validate(parser.parse(text), text);
    }

    @Test
    void validate_unclosedBracket_reportsMissingClosingBracket() {
        assertThat(validate("items[3: a")).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo(DiagnosticMessages.MISSING_CLOSING_BRACKET);
            assertThat(diagnostic.range()).isEqualTo(Range.ofLine(0, 5, 10));
        });
    }

    @Test
    void validate_emptyBrackets_reportsMissingArraySize() {
        assertThat(validate("items[]: a")).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo(DiagnosticMessages.MISSING_ARRAY_SIZE);
            assertThat(diagnostic.range()).isEqualTo(Range.ofLine(0, 5, 7));
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {"items[x]: a", "items[-1]: a", "items[99999999999]: a"})
    void validate_nonNumericOrOversizedSize_reportsInvalidArraySize(String line) {
        assertThat(validate(line)).singleElement()
            .extracting(Diagnostic::message)
            .isEqualTo(DiagnosticMessages.INVALID_ARRAY_SIZE);
    }

    @Test
    void validate_unclosedFieldList_reportsMissingClosingBrace() {
        assertThat(validate("items[2]{a,b: x")).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo(DiagnosticMessages.MISSING_CLOSING_BRACE);
            assertThat(diagnostic.range()).isEqualTo(Range.ofLine(0, 8, 15));
        });
    }

    @Test
    void validate_lineWithoutColon_reportsMissingColon() {
        assertThat(validate("hello world")).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo(DiagnosticMessages.MISSING_COLON);
            assertThat(diagnostic.range()).isEqualTo(Range.ofLine(0, 0, 11));
        });
    }

    @Test
    void validate_unrecognizedLineInsideBlock_isReported() {
        assertThat(validate("a:\n  oops")).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo(DiagnosticMessages.MISSING_COLON);
            assertThat(diagnostic.range()).isEqualTo(Range.ofLine(1, 0, 6));
        });
    }

    @Test
    void validate_wellFormedDocument_reportsNothing() {
        assertThat(validate("""
            user:
              name: Ada

            tags[2]: a,b
            note: see [1
            hikes[1]{id}:
              1
            """)).isEmpty();
    }

    @Test
    void validate_crlfText_reportsSameRangesAsLf() {
        assertThat(validate("a: 1\r\nhello\r\n")).singleElement()
            .extracting(Diagnostic::range)
            .isEqualTo(Range.ofLine(1, 0, 5));
    }
}
