package com.exprtree.symbol;

import com.exprtree.ast.Numbers;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name-to-value bindings for one evaluation session.
 * <p>
 * Filled by the caller before evaluation and only read by the evaluator.
 * Values are normalised on insertion: integral boxes become {@link Long}, a
 * {@link BigInteger} stays one only outside the long range, and {@link Float} and
 * {@link Double} become {@link Double}.
 * Not thread-safe; each session builds its own table.
 */
public class SymbolTable {

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    /**
     * Bind a numeric value, replacing any existing binding for the name.
     */
    public void add(String name, Number value) {
        add(name, SymbolKind.NUMBER, value);
    }

    public void add(String name, SymbolKind kind, Number value) {
        Objects.requireNonNull(name, "name");
        symbols.put(name, new Symbol(name, kind, normalize(name, value)));
    }

    /**
     * @return the value bound to the name, empty if there is none
     */
    public Optional<Number> get(String name) {
        return lookup(name).map(Symbol::value);
    }

    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public int size() {
        return symbols.size();
    }

    /**
     * @return bound names in insertion order
     */
    public List<String> names() {
        return List.copyOf(symbols.keySet());
    }

    /**
     * Render the table as a multi-line listing, one binding per line.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder("Symbol table:");
        for (Symbol symbol : symbols.values()) {
            sb.append('\n')
                    .append("  ").append(symbol.name())
                    .append(" : kind=").append(symbol.kind().label())
                    .append(", value=").append(Numbers.format(symbol.value()));
        }
        return sb.toString();
    }

    /**
     * Build a table from a map of bindings, iterating the map in its own order.
     */
    public static SymbolTable of(Map<String, ? extends Number> bindings) {
        SymbolTable table = new SymbolTable();
        bindings.forEach(table::add);
        return table;
    }

    private static Number normalize(String name, Number value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        if (value instanceof BigInteger) {
            return Numbers.narrow((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            return value.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported value type " + value.getClass().getSimpleName()
                + " for '" + name + "'; use long, BigInteger or double");
    }

    @Override
    public String toString() {
        return describe();
    }
}
