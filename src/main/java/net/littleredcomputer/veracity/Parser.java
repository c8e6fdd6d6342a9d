// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Recursive descent parser for the formula grammar. Each precedence level, loosest first, is
 * one method:
 * <pre>
 *   implication = disjunction { "→" var }
 *   disjunction = conjunction { "∨" conjunction }
 *   conjunction = negation { "∧" negation }
 *   negation    = "¬" negation | primary
 *   primary     = var | "(" implication ")"
 * </pre>
 * The consequent of an implication is a single variable token, never a subexpression.
 */
public class Parser {
    private final List<Token> tokens;
    private int next = 0;

    Parser(List<Token> tokens) {
        Preconditions.checkArgument(!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == Token.Kind.END,
                "token sequence must be terminated by END");
        this.tokens = ImmutableList.copyOf(tokens);
    }

    /**
     * @param input formula text
     * @return the syntax tree of the formula
     * @throws LexException if the text contains a character outside the grammar
     * @throws ParseException if the tokens do not form exactly one formula
     */
    public static Expression parse(String input) {
        return parse(Lexer.tokenize(input));
    }

    public static Expression parse(List<Token> tokens) {
        return new Parser(tokens).formula();
    }

    private Expression formula() {
        Expression e = implication();
        expect(Token.Kind.END, "operator or end of input");
        return e;
    }

    private Token peek() { return tokens.get(next); }

    private Token advance() {
        Token t = tokens.get(next);
        // END is sticky: we never move past it.
        if (t.kind() != Token.Kind.END) ++next;
        return t;
    }

    private Token expect(Token.Kind kind, String description) {
        if (peek().kind() != kind) throw new ParseException(description, peek());
        return advance();
    }

    private Expression implication() {
        Expression lhs = disjunction();
        while (peek().is(Operator.IMPLIES)) {
            advance();
            Token v = expect(Token.Kind.VARIABLE, "variable after '→'");
            lhs = Expression.implies(lhs, Expression.variable(v.identifier()));
        }
        return lhs;
    }

    private Expression disjunction() {
        Expression lhs = conjunction();
        while (peek().is(Operator.OR)) {
            advance();
            lhs = Expression.or(lhs, conjunction());
        }
        return lhs;
    }

    private Expression conjunction() {
        Expression lhs = negation();
        while (peek().is(Operator.AND)) {
            advance();
            lhs = Expression.and(lhs, negation());
        }
        return lhs;
    }

    private Expression negation() {
        if (peek().is(Operator.NOT)) {
            advance();
            return Expression.not(negation());
        }
        return primary();
    }

    private Expression primary() {
        Token t = peek();
        switch (t.kind()) {
            case VARIABLE:
                advance();
                return Expression.variable(t.identifier());
            case LPAREN: {
                advance();
                Expression e = implication();
                expect(Token.Kind.RPAREN, "')'");
                return e;
            }
            default:
                throw new ParseException("variable or '('", t);
        }
    }
}
