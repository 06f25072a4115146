package com.exprtree.eval;

import com.exprtree.ast.BinaryOp;
import com.exprtree.ast.Identifier;
import com.exprtree.ast.Node;
import com.exprtree.ast.NodeVisitor;
import com.exprtree.ast.NumberLiteral;
import com.exprtree.exception.UndefinedIdentifierException;
import com.exprtree.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Tree-walking evaluator.
 * <p>
 * Walks the tree in post-order: both children of a {@link BinaryOp} are evaluated, left
 * first, before the operator is applied. Every visited node is decorated with its value.
 * The symbol table is only read. Re-evaluating a tree overwrites the previous decorations.
 */
public class Evaluator implements NodeVisitor<Number> {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final SymbolTable symbols;

    public Evaluator(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    /**
     * Evaluate a tree and decorate its nodes.
     *
     * @param root Root of the tree
     * @return {@link Long} or {@link Double} result
     */
    public Number eval(Node root) {
        Number result = root.accept(this);
        log.debug("Evaluated {} = {}", root, result);
        return result;
    }

    @Override
    public Number visitNumber(NumberLiteral node) {
        return decorate(node, node.literal());
    }

    @Override
    public Number visitIdentifier(Identifier node) {
        Number value = symbols.get(node.name())
                .orElseThrow(() -> new UndefinedIdentifierException(node.name()));
        return decorate(node, value);
    }

    @Override
    public Number visitBinaryOp(BinaryOp node) {
        Number left = node.left().accept(this);
        Number right = node.right().accept(this);
        return decorate(node, Arithmetic.apply(node.operator(), left, right));
    }

    private Number decorate(Node node, Number value) {
        node.decorate(value);
        if (log.isTraceEnabled()) {
            log.trace("{} -> {}", node, value);
        }
        return value;
    }
}
