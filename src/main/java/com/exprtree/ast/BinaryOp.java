package com.exprtree.ast;

import java.util.Objects;

/**
 * Binary arithmetic operation. Each child belongs to exactly this node.
 */
public final class BinaryOp extends Node {

    private final Operator operator;
    private final Node left;
    private final Node right;

    public BinaryOp(Operator operator, Node left, Node right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return "BinOp(" + operator.symbol() + ", " + left + ", " + right + ")";
    }
}
