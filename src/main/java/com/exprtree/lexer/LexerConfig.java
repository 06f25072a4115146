package com.exprtree.lexer;

import java.util.Map;

/**
 * Character classes and the single-character token table used by the lexer.
 * Built once when the class loads and never modified.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Single-character operators and delimiters mapped to token types.
     */
    public static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.of(
            Symbols.PLUS, TokenType.PLUS,
            Symbols.MINUS, TokenType.MINUS,
            Symbols.STAR, TokenType.STAR,
            Symbols.SLASH, TokenType.SLASH,
            Symbols.LEFT_PAREN, TokenType.LPAREN,
            Symbols.RIGHT_PAREN, TokenType.RPAREN
    );

    /**
     * Operator and delimiter characters.
     */
    public static final class Symbols {
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';
        public static final char SPACE = ' ';
        public static final char TAB = '\t';

        private Symbols() {
        }
    }

    public static boolean isWhitespace(char c) {
        return c == Symbols.SPACE || c == Symbols.TAB;
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == Symbols.UNDERSCORE;
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
