package com.exprtree.exception;

/**
 * Exception thrown when the token stream does not match the grammar:
 * an unexpected token, a wrong token kind, or trailing input after a complete expression.
 */
public class ParseException extends ExprTreeException {

    private final int position;

    public ParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return offset in the input of the token that triggered the failure
     */
    public int position() {
        return position;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PARSE;
    }
}
