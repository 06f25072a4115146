package com.exprtree.lexer;

/**
 * Token types for arithmetic expressions.
 */
public enum TokenType {
    // Literals and names
    NUMBER,
    IDENTIFIER,

    // Operators
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Delimiters
    LPAREN,
    RPAREN,

    // Special
    EOF
}
