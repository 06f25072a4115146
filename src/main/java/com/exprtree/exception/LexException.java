package com.exprtree.exception;

/**
 * Exception thrown when the lexer meets a character that starts no token.
 */
public class LexException extends ExprTreeException {

    private final char character;
    private final int position;

    public LexException(char character, int position, String input) {
        super("Invalid character '" + character + "' at position " + position + " in '" + input + "'");
        this.character = character;
        this.position = position;
    }

    public char character() {
        return character;
    }

    public int position() {
        return position;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.LEX;
    }
}
