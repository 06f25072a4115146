package com.exprtree.printer;

import com.exprtree.ast.BinaryOp;
import com.exprtree.ast.Identifier;
import com.exprtree.ast.Node;
import com.exprtree.ast.NodeVisitor;
import com.exprtree.ast.NumberLiteral;
import com.exprtree.ast.Numbers;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a (possibly decorated) tree as indented text for diagnostics.
 * <pre>
 * BinOp(+) -> val=13
 *   L:
 *     Number(3) -> val=3
 *   R:
 *     ...
 * </pre>
 * Values are formatted with {@link Numbers#format(Number)}. Undecorated nodes are printed
 * without the {@code -> val=} suffix. Never modifies the tree.
 */
public final class TreePrinter {

    private static final String STEP = "  ";

    private TreePrinter() {
    }

    public static String render(Node root) {
        List<String> lines = new ArrayList<>();
        root.accept(new LineCollector(lines, ""));
        return String.join("\n", lines);
    }

    private record LineCollector(List<String> lines, String indent) implements NodeVisitor<Void> {

        @Override
        public Void visitNumber(NumberLiteral node) {
            lines.add(indent + "Number(" + node.text() + ")" + suffix(node));
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node) {
            lines.add(indent + "Id(" + node.name() + ")" + suffix(node));
            return null;
        }

        @Override
        public Void visitBinaryOp(BinaryOp node) {
            lines.add(indent + "BinOp(" + node.operator().symbol() + ")" + suffix(node));
            LineCollector child = new LineCollector(lines, indent + STEP + STEP);
            lines.add(indent + STEP + "L:");
            node.left().accept(child);
            lines.add(indent + STEP + "R:");
            node.right().accept(child);
            return null;
        }

        private static String suffix(Node node) {
            return node.value().map(v -> " -> val=" + Numbers.format(v)).orElse("");
        }
    }
}
