package com.exprtree.ast;

import com.exprtree.exception.InvariantViolationException;
import com.exprtree.lexer.TokenType;

/**
 * The four arithmetic operators a {@link BinaryOp} can carry.
 */
public enum Operator {
    PLUS('+', 1),
    MINUS('-', 1),
    STAR('*', 2),
    SLASH('/', 2);

    private final char symbol;
    private final int precedence;

    Operator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Binding strength, higher binds tighter. Used for rendering only; the parser
     * encodes precedence through its grammar layers.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * @throws InvariantViolationException if the symbol is not an arithmetic operator
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator op : values()) {
            if (op.symbol == symbol) {
                return op;
            }
        }
        throw new InvariantViolationException("Unknown operator: '" + symbol + "'");
    }

    /**
     * @throws InvariantViolationException if the token type is not an operator
     */
    public static Operator fromTokenType(TokenType type) {
        return switch (type) {
            case PLUS -> PLUS;
            case MINUS -> MINUS;
            case STAR -> STAR;
            case SLASH -> SLASH;
            default -> throw new InvariantViolationException("Unknown operator token: " + type);
        };
    }
}
