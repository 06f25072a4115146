package com.exprtree.exception;

/**
 * Closed set of failure kinds an expression pipeline can report.
 */
public enum ErrorKind {
    // Lexing
    LEX,

    // Parsing
    PARSE,

    // Evaluation
    UNDEFINED_IDENTIFIER,
    DIVISION_BY_ZERO,

    // Internal
    INVARIANT_VIOLATION,

    // Driver setup
    CONFIGURATION
}
