package com.exprtree.lexer;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Original text (empty for EOF)
 * @param position Offset of the first character in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "('" + text + "')";
    }
}
