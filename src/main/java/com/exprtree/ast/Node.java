package com.exprtree.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Base of the expression syntax tree.
 * <p>
 * The set of node variants is closed. Consumers dispatch through {@link NodeVisitor},
 * so a new variant cannot be added without every consumer handling it.
 * <p>
 * Each node owns one decoration slot holding the value computed for it by the evaluator.
 * The slot starts empty; the tree structure itself never changes after parsing.
 */
public abstract sealed class Node permits NumberLiteral, Identifier, BinaryOp {

    private Number value;

    Node() {
    }

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * @return the evaluated value, empty if the node has not been evaluated
     */
    public Optional<Number> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Store the evaluated value for this node. Called by the evaluator once the node's
     * children, if any, have been evaluated.
     */
    public void decorate(Number value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public void clearDecoration() {
        this.value = null;
    }
}
