package com.exprtree.printer;

import com.exprtree.ast.BinaryOp;
import com.exprtree.ast.Identifier;
import com.exprtree.ast.Node;
import com.exprtree.ast.NodeVisitor;
import com.exprtree.ast.NumberLiteral;
import com.exprtree.ast.Operator;

/**
 * Renders a tree back to expression text, adding parentheses only where precedence
 * or left-associativity requires them. Parsing the output yields an equivalent tree.
 */
public final class InfixRenderer implements NodeVisitor<String> {

    private static final InfixRenderer INSTANCE = new InfixRenderer();

    private InfixRenderer() {
    }

    public static String render(Node root) {
        return root.accept(INSTANCE);
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        return node.text();
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        Operator op = node.operator();
        String left = operand(node.left(), op, false);
        String right = operand(node.right(), op, true);
        return left + " " + op.symbol() + " " + right;
    }

    private String operand(Node child, Operator parent, boolean rightSide) {
        String text = child.accept(this);
        if (!(child instanceof BinaryOp binary)) {
            return text;
        }
        int childPrecedence = binary.operator().precedence();
        // a - (b - c) and a / (b * c) keep their grouping
        boolean needsParens = childPrecedence < parent.precedence()
                || (rightSide && childPrecedence == parent.precedence());
        return needsParens ? "(" + text + ")" : text;
    }
}
