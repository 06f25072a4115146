package com.exprtree.parser;

import com.exprtree.ast.BinaryOp;
import com.exprtree.ast.Identifier;
import com.exprtree.ast.Node;
import com.exprtree.ast.NumberLiteral;
import com.exprtree.ast.Operator;
import com.exprtree.exception.ParseException;
import com.exprtree.lexer.Lexer;
import com.exprtree.lexer.Token;
import com.exprtree.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for arithmetic expressions.
 * Pulls tokens from a {@link Lexer} one at a time and builds the syntax tree by recursive descent.
 * <p>
 * Grammar (precedence: '*' '/' > '+' '-', all left-associative):
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := '(' expr ')' | NUMBER | IDENTIFIER
 * </pre>
 * Parenthesis nesting consumes call stack. Callers parsing untrusted input can bound it
 * with {@code maxDepth}; without one, depth is limited only by the thread's stack.
 */
public final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    public static final int UNLIMITED_DEPTH = 0;

    private final Lexer lexer;
    private final int maxDepth;
    private Token lookahead;
    private int depth;

    public Parser(String input) {
        this(new Lexer(input), UNLIMITED_DEPTH);
    }

    public Parser(Lexer lexer) {
        this(lexer, UNLIMITED_DEPTH);
    }

    /**
     * @param lexer    Token source, positioned at the start of the input
     * @param maxDepth Maximum parenthesis nesting, or {@link #UNLIMITED_DEPTH}
     */
    public Parser(Lexer lexer, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.lexer = lexer;
        this.maxDepth = maxDepth;
        this.lookahead = lexer.next();
    }

    /**
     * Parse a complete expression. Fails if any token other than EOF remains afterwards.
     *
     * @return Root of the syntax tree
     */
    public Node parse() {
        Node root = parseExpr();
        if (!check(TokenType.EOF)) {
            throw new ParseException("trailing input: " + describe(lookahead), lookahead.position());
        }
        log.debug("Parsed '{}' into {}", lexer.input(), root);
        return root;
    }

    private Node parseExpr() {
        Node node = parseTerm();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator op = Operator.fromTokenType(advance().type());
            Node right = parseTerm();
            node = new BinaryOp(op, node, right);
        }
        return node;
    }

    private Node parseTerm() {
        Node node = parseFactor();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Operator op = Operator.fromTokenType(advance().type());
            Node right = parseFactor();
            node = new BinaryOp(op, node, right);
        }
        return node;
    }

    private Node parseFactor() {
        // Parenthesized expression
        if (check(TokenType.LPAREN)) {
            Token open = advance();
            enterNesting(open);
            Node inner = parseExpr();
            expect(TokenType.RPAREN);
            depth--;
            return inner;
        }

        if (check(TokenType.NUMBER)) {
            return new NumberLiteral(advance().text());
        }

        if (check(TokenType.IDENTIFIER)) {
            return new Identifier(advance().text());
        }

        throw new ParseException("Unexpected token " + describe(lookahead), lookahead.position());
    }

    private void enterNesting(Token open) {
        depth++;
        if (maxDepth != UNLIMITED_DEPTH && depth > maxDepth) {
            throw new ParseException("nesting depth exceeds " + maxDepth + " at position "
                    + open.position(), open.position());
        }
    }

    /**
     * Consume the lookahead if it has the given type, otherwise fail naming both kinds.
     */
    Token expect(TokenType type) {
        if (!check(type)) {
            throw new ParseException("Expected " + type + " but found " + describe(lookahead),
                    lookahead.position());
        }
        return advance();
    }

    private boolean check(TokenType type) {
        return lookahead.type() == type;
    }

    private Token advance() {
        Token current = lookahead;
        if (current.type() != TokenType.EOF) {
            lookahead = lexer.next();
        }
        return current;
    }

    private static String describe(Token token) {
        return token + " at position " + token.position();
    }
}
