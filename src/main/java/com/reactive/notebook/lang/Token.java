package com.reactive.notebook.lang;

/**
 * A single lexical token of cell source.
 *
 * @param type   token category
 * @param text   the raw text (operator symbol, keyword or name)
 * @param value  decoded literal value for {@link TokenType#NUMBER} and
 *               {@link TokenType#STRING}, otherwise {@code null}
 * @param line   1-based source line
 * @param column 1-based source column
 */
public record Token(TokenType type, String text, Object value, int line, int column) {

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isOp(String op) {
        return is(TokenType.OP, op);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case EOF -> "end of input";
            case STRING -> "string literal";
            default -> "'" + text + "'";
        };
    }
}
