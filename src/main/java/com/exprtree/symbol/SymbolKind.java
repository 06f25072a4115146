package com.exprtree.symbol;

/**
 * Kind tag carried by a symbol. Only numeric bindings exist today.
 */
public enum SymbolKind {
    NUMBER("number");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
