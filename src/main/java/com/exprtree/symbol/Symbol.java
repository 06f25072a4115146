package com.exprtree.symbol;

import java.util.Objects;

/**
 * A named binding in a {@link SymbolTable}.
 *
 * @param name  Identifier name
 * @param kind  Kind tag
 * @param value Bound value, {@link Long} or {@link Double}
 */
public record Symbol(String name, SymbolKind kind, Number value) {

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }
}
