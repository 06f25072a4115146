package com.exprtree.exception;

/**
 * Exception thrown when an internal invariant is broken, such as an operator
 * symbol outside the four arithmetic operators reaching the AST.
 */
public class InvariantViolationException extends ExprTreeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVARIANT_VIOLATION;
    }
}
