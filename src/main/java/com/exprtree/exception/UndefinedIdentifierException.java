package com.exprtree.exception;

/**
 * Exception thrown when an identifier has no binding in the symbol table at evaluation time.
 */
public class UndefinedIdentifierException extends ExprTreeException {

    private final String name;

    public UndefinedIdentifierException(String name) {
        super("Undefined identifier: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNDEFINED_IDENTIFIER;
    }
}
