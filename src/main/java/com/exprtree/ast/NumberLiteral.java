package com.exprtree.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Numeric literal. The value is parsed when the node is built: an integer ({@link Long},
 * or {@link BigInteger} beyond the long range) when the text has no decimal point,
 * {@link Double} otherwise.
 */
public final class NumberLiteral extends Node {

    private final String text;
    private final Number literal;

    public NumberLiteral(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.literal = parse(text);
    }

    private static Number parse(String text) {
        if (text.indexOf('.') >= 0) {
            return Double.valueOf(text);
        }
        return Numbers.narrow(new BigInteger(text));
    }

    public String text() {
        return text;
    }

    /**
     * @return the value parsed from the literal text
     */
    public Number literal() {
        return literal;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return "Number(" + text + ")";
    }
}
