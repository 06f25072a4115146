package com.exprtree.config;

import com.exprtree.symbol.SymbolTable;

import java.util.Map;

/**
 * One expression for the driver to evaluate.
 *
 * @param expression Expression text
 * @param symbols    Identifier bindings, in declaration order
 */
public record ExampleConfig(String expression, Map<String, Number> symbols) {

    /**
     * Build a fresh symbol table holding this example's bindings.
     */
    public SymbolTable symbolTable() {
        return SymbolTable.of(symbols);
    }
}
