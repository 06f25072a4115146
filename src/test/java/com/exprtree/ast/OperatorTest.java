package com.exprtree.ast;

import com.exprtree.exception.ErrorKind;
import com.exprtree.exception.InvariantViolationException;
import com.exprtree.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Operator and node construction.
 */
class OperatorTest {

    @ParameterizedTest
    @DisplayName("Operator symbols map to their constants")
    @CsvSource({
            "+, PLUS",
            "-, MINUS",
            "*, STAR",
            "/, SLASH"
    })
    void symbolsMapToOperators(char symbol, Operator expected) {
        assertEquals(expected, Operator.fromSymbol(symbol));
        assertEquals(symbol, expected.symbol());
    }

    @Test
    @DisplayName("Unknown operator symbol is an invariant violation")
    void unknownSymbolRejected() {
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> Operator.fromSymbol('%'));

        assertEquals(ErrorKind.INVARIANT_VIOLATION, e.kind());
        assertTrue(e.getMessage().contains("%"));
    }

    @Test
    @DisplayName("Non-operator token type is an invariant violation")
    void nonOperatorTokenRejected() {
        assertEquals(Operator.STAR, Operator.fromTokenType(TokenType.STAR));
        assertThrows(InvariantViolationException.class, () -> Operator.fromTokenType(TokenType.LPAREN));
    }

    @Test
    @DisplayName("Multiplication binds tighter than addition")
    void precedenceOrder() {
        assertTrue(Operator.STAR.precedence() > Operator.PLUS.precedence());
        assertEquals(Operator.SLASH.precedence(), Operator.STAR.precedence());
        assertEquals(Operator.MINUS.precedence(), Operator.PLUS.precedence());
    }

    @Test
    @DisplayName("Number literals keep integer and decimal types apart")
    void numberLiteralTypes() {
        assertEquals(7L, new NumberLiteral("7").literal());
        assertEquals(7.0, new NumberLiteral("7.0").literal());
        assertInstanceOf(Long.class, new NumberLiteral("7").literal());
        assertInstanceOf(Double.class, new NumberLiteral("7.0").literal());
        assertInstanceOf(BigInteger.class, new NumberLiteral("9223372036854775808").literal());
    }

    @Test
    @DisplayName("Decoration starts empty and can be written and cleared")
    void decorationSlot() {
        Identifier node = new Identifier("x");
        assertTrue(node.value().isEmpty());

        node.decorate(3L);
        assertEquals(3L, node.value().orElseThrow());

        node.clearDecoration();
        assertTrue(node.value().isEmpty());
    }

    @Test
    @DisplayName("Binary operation requires both children")
    void binaryOpRequiresChildren() {
        assertThrows(NullPointerException.class,
                () -> new BinaryOp(Operator.PLUS, new Identifier("a"), null));
    }
}
