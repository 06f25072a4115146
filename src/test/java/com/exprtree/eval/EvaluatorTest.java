package com.exprtree.eval;

import com.exprtree.ast.BinaryOp;
import com.exprtree.ast.Node;
import com.exprtree.exception.DivisionByZeroException;
import com.exprtree.exception.ErrorKind;
import com.exprtree.exception.UndefinedIdentifierException;
import com.exprtree.parser.Parser;
import com.exprtree.symbol.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Evaluator.
 */
class EvaluatorTest {

    private SymbolTable symbols;

    @BeforeEach
    void setUp() {
        symbols = new SymbolTable();
    }

    private Number eval(String input) {
        return new Evaluator(symbols).eval(new Parser(input).parse());
    }

    @ParameterizedTest
    @DisplayName("Integer arithmetic stays integral")
    @CsvSource({
            "3 + 5 * 2, 13",
            "10 - 3 - 2, 5",
            "2 * (3 + 4), 14",
            "0 - 7, -7"
    })
    void integerArithmetic(String input, long expected) {
        Number result = eval(input);

        assertInstanceOf(Long.class, result);
        assertEquals(expected, result.longValue());
    }

    @ParameterizedTest
    @DisplayName("Division and decimal operands produce doubles")
    @CsvSource({
            "4 / 2, 2.0",
            "7 / 2, 3.5",
            "(3 + 5) * 2 - 4 / 2, 14.0",
            "1.5 + 1, 2.5",
            "2 * 0.25, 0.5",
            "8 / 4 / 2, 1.0"
    })
    void floatingArithmetic(String input, double expected) {
        Number result = eval(input);

        assertInstanceOf(Double.class, result);
        assertEquals(expected, result.doubleValue(), 1e-12);
    }

    @Test
    @DisplayName("Identifiers resolve through the symbol table")
    void identifiersResolve() {
        symbols.add("x", 5);
        symbols.add("y", 1);

        assertEquals(18L, eval("3 + x * (2 + y)"));
    }

    @Test
    @DisplayName("Identifier bound to a double promotes the result")
    void doubleBindingPromotes() {
        symbols.add("r", 0.5);

        assertEquals(2.5, eval("r * 5"));
    }

    @Test
    @DisplayName("Undefined identifier names the identifier")
    void undefinedIdentifier() {
        UndefinedIdentifierException e = assertThrows(UndefinedIdentifierException.class, () -> eval("z + 1"));

        assertEquals("z", e.name());
        assertEquals(ErrorKind.UNDEFINED_IDENTIFIER, e.kind());
    }

    @ParameterizedTest
    @DisplayName("Division by zero is reported for integer and decimal zero")
    @ValueSource(strings = {"1 / 0", "1 / 0.0", "1 / (2 - 2)", "1.5 / (0 * 3)"})
    void divisionByZero(String input) {
        DivisionByZeroException e = assertThrows(DivisionByZeroException.class, () -> eval(input));

        assertEquals(ErrorKind.DIVISION_BY_ZERO, e.kind());
    }

    @Test
    @DisplayName("Negative zero divisor is zero")
    void negativeZeroDivisor() {
        symbols.add("nz", -0.0);

        assertThrows(DivisionByZeroException.class, () -> eval("1 / nz"));
    }

    @Test
    @DisplayName("Both operands are evaluated before division fails")
    void noShortCircuit() {
        Node root = new Parser("q / 0").parse();

        assertThrows(UndefinedIdentifierException.class, () -> new Evaluator(symbols).eval(root));
    }

    @Test
    @DisplayName("Integer results past the long range widen to BigInteger")
    void integerWidening() {
        symbols.add("big", Long.MAX_VALUE);

        assertEquals(new BigInteger("9223372036854775808"), eval("big + 1"));
        assertEquals(new BigInteger("18446744073709551614"), eval("big * 2"));
        assertEquals(new BigInteger("-9223372036854775809"), eval("0 - big - 2"));
    }

    @Test
    @DisplayName("Large integer literals evaluate exactly")
    void largeIntegerLiteral() {
        assertEquals(new BigInteger("100000000000000000000"), eval("99999999999999999999 + 1"));
        assertEquals(9223372036854775807L, eval("9223372036854775807"));
    }

    @Test
    @DisplayName("Results that fit again come back as Long")
    void integerNarrowing() {
        Number result = eval("99999999999999999999 - 99999999999999999998");

        assertInstanceOf(Long.class, result);
        assertEquals(1L, result);
    }

    @Test
    @DisplayName("Big integers mix with doubles and division")
    void bigIntegerPromotion() {
        assertEquals(1.0e20, eval("100000000000000000000 * 1.0"));
        assertEquals(5.0e19, eval("100000000000000000000 / 2"));
        assertThrows(DivisionByZeroException.class, () -> eval("1 / (100000000000000000000 - 100000000000000000000)"));
    }

    @Test
    @DisplayName("Integer literals evaluate to Long")
    void integerLiteralIsLong() {
        assertInstanceOf(Long.class, eval("2 - 1"));
        assertEquals(1L, eval("2 - 1"));
    }

    @Test
    @DisplayName("Every node is decorated with its value")
    void decoratesEveryNode() {
        symbols.add("x", 5);
        BinaryOp root = (BinaryOp) new Parser("3 + x * 2").parse();

        new Evaluator(symbols).eval(root);

        assertEquals(13L, root.value().orElseThrow());
        assertEquals(3L, root.left().value().orElseThrow());
        BinaryOp product = (BinaryOp) root.right();
        assertEquals(10L, product.value().orElseThrow());
        assertEquals(5L, product.left().value().orElseThrow());
        assertEquals(2L, product.right().value().orElseThrow());
    }

    @Test
    @DisplayName("Re-evaluation yields identical decorations")
    void idempotent() {
        symbols.add("a", 20);
        symbols.add("b", 4);
        BinaryOp root = (BinaryOp) new Parser("a / b + 10").parse();
        Evaluator evaluator = new Evaluator(symbols);

        Number first = evaluator.eval(root);
        Number firstLeft = root.left().value().orElseThrow();
        Number second = evaluator.eval(root);

        assertEquals(first, second);
        assertEquals(firstLeft, root.left().value().orElseThrow());
        assertEquals(15.0, second);
    }

    @Test
    @DisplayName("Evaluation never modifies the symbol table")
    void symbolTableUntouched() {
        symbols.add("x", 1);

        eval("x + x * x");

        assertEquals(1, symbols.size());
        assertEquals(1L, symbols.get("x").orElseThrow());
    }
}
