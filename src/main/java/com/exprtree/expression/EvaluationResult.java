package com.exprtree.expression;

import com.exprtree.ast.Node;
import com.exprtree.printer.TreePrinter;

/**
 * Outcome of running an expression through the full pipeline.
 *
 * @param root  Decorated syntax tree
 * @param value Value of the root node, {@link Long} or {@link Double}
 */
public record EvaluationResult(Node root, Number value) {

    /**
     * Render the decorated tree.
     */
    public String tree() {
        return TreePrinter.render(root);
    }
}
