package com.exprtree.lexer;

import com.exprtree.exception.LexException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.exprtree.lexer.LexerConfig.*;

/**
 * Lexer for arithmetic expressions.
 * <p>
 * Tokens are produced on demand: each call to {@link #next()} scans just far enough to
 * return one token, so an invalid character only fails once the consumer reaches it.
 * The stream always ends with a single {@link TokenType#EOF} token. To rescan, create a new lexer.
 * <p>
 * Recognition order: number, identifier, single-character operator or parenthesis.
 */
public final class Lexer implements Iterator<Token> {

    private final String input;
    private final int length;
    private int pos;
    private boolean eofEmitted;

    public Lexer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Scan the whole input into a list, EOF included.
     *
     * @param input Expression text
     * @return List of tokens
     */
    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        Lexer lexer = new Lexer(input);
        while (lexer.hasNext()) {
            tokens.add(lexer.next());
        }
        return tokens;
    }

    public String input() {
        return input;
    }

    @Override
    public boolean hasNext() {
        return !eofEmitted;
    }

    @Override
    public Token next() {
        if (eofEmitted) {
            throw new NoSuchElementException("Token stream already reached EOF");
        }

        skipWhitespace();

        if (isAtEnd()) {
            eofEmitted = true;
            return new Token(TokenType.EOF, "", pos);
        }

        char c = peek();
        if (isDigit(c)) {
            return readNumber();
        }
        if (isIdentifierStart(c)) {
            return readIdentifier();
        }

        TokenType single = SINGLE_CHAR_TOKENS.get(c);
        if (single != null) {
            int start = pos;
            advance();
            return new Token(single, String.valueOf(c), start);
        }

        throw new LexException(c, pos, input);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        // The fraction is only taken when a digit follows the dot
        if (pos + 1 < length && peek() == Symbols.DOT && isDigit(input.charAt(pos + 1))) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }

        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token readIdentifier() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        return new Token(TokenType.IDENTIFIER, input.substring(start, pos), start);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
