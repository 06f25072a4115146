package com.exprtree.exception;

/**
 * Base exception for the expression pipeline.
 * Every failure aborts the current expression; callers decide whether to go on with the next one.
 */
public abstract class ExprTreeException extends RuntimeException {

    protected ExprTreeException(String message) {
        super(message);
    }

    protected ExprTreeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the kind of failure, used by callers to branch without instanceof chains
     */
    public abstract ErrorKind kind();
}
