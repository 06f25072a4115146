package com.exprtree.ast;

import java.util.Objects;

/**
 * Named reference, resolved against the symbol table at evaluation time.
 */
public final class Identifier extends Node {

    private final String name;

    public Identifier(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return "Id(" + name + ")";
    }
}
