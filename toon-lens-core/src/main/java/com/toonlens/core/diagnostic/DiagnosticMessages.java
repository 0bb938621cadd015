package com.toonlens.core.diagnostic;

/**
 * Message catalog for built-in diagnostics.
 *
 * <p>Editor integrations match on these texts, so they must not change. Parameterized
 * templates use {@code {declared}}, {@code {actual}} and {@code {expected}} placeholders;
 * the {@code format} helpers fill them in.
 */
public final class DiagnosticMessages {

    public static final String ARRAY_SIZE_INSUFFICIENT = "配列の要素数が不足しています（宣言: {declared}, 実際: {actual}）";
    public static final String ARRAY_SIZE_EXCEEDED = "配列の要素数が超過しています（宣言: {declared}, 実際: {actual}）";
    public static final String ARRAY_ROWS_MISMATCH = "配列の行数が宣言と一致しません（宣言: {declared}, 実際: {actual}）";
    public static final String FIELD_COUNT_INSUFFICIENT = "フィールド数が不足しています（期待: {expected}, 実際: {actual}）";
    public static final String FIELD_COUNT_EXCEEDED = "フィールド数が超過しています（期待: {expected}, 実際: {actual}）";
    public static final String MISSING_COLON = "コロンが見つかりません";
    public static final String MISSING_VALUE = "値が指定されていません";
    public static final String MISSING_KEY = "キーが指定されていません";
    public static final String MISSING_CLOSING_BRACKET = "閉じ角括弧が見つかりません";
    public static final String MISSING_ARRAY_SIZE = "配列サイズが指定されていません";
    public static final String INVALID_ARRAY_SIZE = "配列サイズは数値である必要があります";
    public static final String MISSING_CLOSING_BRACE = "閉じ波括弧が見つかりません";
    public static final String EMPTY_BLOCK = "ブロックに子要素がありません";

    private DiagnosticMessages() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Message for a simple array whose value count differs from its declared size.
     *
     * @param declared declared size
     * @param actual number of values present
     * @return insufficient or exceeded message
     */
    public static String arraySize(int declared, int actual) {
        String template = actual < declared ? ARRAY_SIZE_INSUFFICIENT : ARRAY_SIZE_EXCEEDED;
        return fillDeclared(template, declared, actual);
    }

    /**
     * Message for a structured array whose row count differs from its declared size.
     *
     * @param declared declared size
     * @param actual number of data rows present
     * @return row mismatch message
     */
    public static String arrayRows(int declared, int actual) {
        return fillDeclared(ARRAY_ROWS_MISMATCH, declared, actual);
    }

    /**
     * Message for a data row whose cell count differs from the field count.
     *
     * @param expected number of declared fields
     * @param actual number of cells in the row
     * @return insufficient or exceeded message
     */
    public static String fieldCount(int expected, int actual) {
        String template = actual < expected ? FIELD_COUNT_INSUFFICIENT : FIELD_COUNT_EXCEEDED;
        return template
            .replace("{expected}", Integer.toString(expected))
            .replace("{actual}", Integer.toString(actual));
    }

    private static String fillDeclared(String template, int declared, int actual) {
        return template
            .replace("{declared}", Integer.toString(declared))
            .replace("{actual}", Integer.toString(actual));
    }
}
