package com.exprtree.exception;

/**
 * Exception thrown when the right operand of a division evaluates to zero.
 */
public class DivisionByZeroException extends ExprTreeException {

    public DivisionByZeroException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DIVISION_BY_ZERO;
    }
}
