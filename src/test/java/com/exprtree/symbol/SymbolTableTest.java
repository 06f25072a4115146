package com.exprtree.symbol;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SymbolTable.
 */
class SymbolTableTest {

    private SymbolTable table;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
    }

    @Test
    @DisplayName("Should return bound values and empty for unknown names")
    void shouldGetBoundValues() {
        table.add("x", 5);

        assertEquals(5L, table.get("x").orElseThrow());
        assertTrue(table.get("y").isEmpty());
        assertTrue(table.contains("x"));
        assertFalse(table.contains("y"));
    }

    @Test
    @DisplayName("Last write wins")
    void lastWriteWins() {
        table.add("x", 1);
        table.add("x", 2.5);

        assertEquals(2.5, table.get("x").orElseThrow());
        assertEquals(1, table.size());
    }

    @Test
    @DisplayName("Should normalise boxed numbers to Long or Double")
    void shouldNormaliseValues() {
        table.add("i", 3);
        table.add("s", (short) 4);
        table.add("f", 1.5f);

        assertInstanceOf(Long.class, table.get("i").orElseThrow());
        assertInstanceOf(Long.class, table.get("s").orElseThrow());
        assertEquals(1.5, table.get("f").orElseThrow());
    }

    @Test
    @DisplayName("BigInteger values stay big only outside the long range")
    void shouldNarrowBigIntegers() {
        table.add("small", BigInteger.TEN);
        table.add("large", new BigInteger("100000000000000000000"));

        assertEquals(10L, table.get("small").orElseThrow());
        assertEquals(new BigInteger("100000000000000000000"), table.get("large").orElseThrow());
    }

    @Test
    @DisplayName("Should reject unsupported number types and nulls")
    void shouldRejectUnsupported() {
        assertThrows(IllegalArgumentException.class, () -> table.add("d", new BigDecimal("1.5")));
        assertThrows(NullPointerException.class, () -> table.add("n", null));
        assertThrows(NullPointerException.class, () -> table.add(null, 1));
    }

    @Test
    @DisplayName("Lookup returns the full symbol with its kind")
    void lookupReturnsSymbol() {
        table.add("x", SymbolKind.NUMBER, 7L);

        Symbol symbol = table.lookup("x").orElseThrow();
        assertEquals(new Symbol("x", SymbolKind.NUMBER, 7L), symbol);
        assertEquals("number", symbol.kind().label());
    }

    @Test
    @DisplayName("Names keep insertion order")
    void namesInInsertionOrder() {
        table.add("b", 1);
        table.add("a", 2);
        table.add("c", 3);

        assertEquals(List.of("b", "a", "c"), table.names());
    }

    @Test
    @DisplayName("Describe lists each binding")
    void describe() {
        table.add("x", 5);
        table.add("y", 1.5);
        table.add("z", 1e16);

        assertEquals("Symbol table:\n  x : kind=number, value=5\n  y : kind=number, value=1.5"
                        + "\n  z : kind=number, value=1e+16",
                table.describe());
        assertEquals("Symbol table:", new SymbolTable().describe());
    }

    @Test
    @DisplayName("Tables built from the same map are independent")
    void tablesAreIndependent() {
        Map<String, Number> bindings = new LinkedHashMap<>();
        bindings.put("a", 20);
        SymbolTable first = SymbolTable.of(bindings);
        SymbolTable second = SymbolTable.of(bindings);

        first.add("b", 4);

        assertTrue(first.contains("b"));
        assertFalse(second.contains("b"));
    }
}
