package com.exprtree.ast;

/**
 * Visitor over the closed set of node variants.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visitNumber(NumberLiteral node);

    R visitIdentifier(Identifier node);

    R visitBinaryOp(BinaryOp node);
}
