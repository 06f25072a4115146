package com.exprtree.expression;

import com.exprtree.ast.Node;
import com.exprtree.eval.Evaluator;
import com.exprtree.lexer.Lexer;
import com.exprtree.parser.Parser;
import com.exprtree.symbol.SymbolTable;

/**
 * Entry point that runs text through lexer, parser and evaluator in one call.
 * <p>
 * Every call builds its own lexer, parser and evaluator, so one instance may be shared.
 * Failures surface as {@link com.exprtree.exception.ExprTreeException} subclasses and no
 * partial result is returned.
 */
public class ExpressionEvaluator {

    private final int maxDepth;

    public ExpressionEvaluator() {
        this(Parser.UNLIMITED_DEPTH);
    }

    /**
     * @param maxDepth Parenthesis nesting limit applied to every parse, or {@link Parser#UNLIMITED_DEPTH}
     */
    public ExpressionEvaluator(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Parse an expression without evaluating it.
     *
     * @param expression Expression text (e.g., '3 + x * (2 + y)')
     * @return Undecorated syntax tree
     */
    public Node parse(String expression) {
        return new Parser(new Lexer(expression), maxDepth).parse();
    }

    /**
     * Parse and evaluate an expression against a symbol table.
     *
     * @param expression Expression text
     * @param symbols    Bindings for the identifiers the expression uses
     * @return Decorated tree and its value
     */
    public EvaluationResult evaluate(String expression, SymbolTable symbols) {
        Node root = parse(expression);
        Number value = new Evaluator(symbols).eval(root);
        return new EvaluationResult(root, value);
    }

    public int maxDepth() {
        return maxDepth;
    }
}
