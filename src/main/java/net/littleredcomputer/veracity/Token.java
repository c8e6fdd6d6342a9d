// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A lexical unit of a formula. Tokens remember the offset in the source text at which they began
 * so that the parser can say where things went wrong.
 */
public final class Token {
    public enum Kind {
        VARIABLE,
        OPERATOR,
        LPAREN,
        RPAREN,
        END,
    }

    private final Kind kind;
    private final char identifier;  // meaningful only for VARIABLE
    private final Operator operator;  // null unless OPERATOR
    private final int position;

    private Token(Kind kind, char identifier, Operator operator, int position) {
        this.kind = kind;
        this.identifier = identifier;
        this.operator = operator;
        this.position = position;
    }

    static Token variable(char identifier, int position) { return new Token(Kind.VARIABLE, identifier, null, position); }
    static Token operator(Operator o, int position) { return new Token(Kind.OPERATOR, '\0', Preconditions.checkNotNull(o), position); }
    static Token lparen(int position) { return new Token(Kind.LPAREN, '\0', null, position); }
    static Token rparen(int position) { return new Token(Kind.RPAREN, '\0', null, position); }
    static Token end(int position) { return new Token(Kind.END, '\0', null, position); }

    public Kind kind() { return kind; }
    public int position() { return position; }

    public char identifier() {
        Preconditions.checkState(kind == Kind.VARIABLE, "%s token has no identifier", kind);
        return identifier;
    }

    public Operator operator() {
        Preconditions.checkState(kind == Kind.OPERATOR, "%s token has no operator", kind);
        return operator;
    }

    boolean is(Operator o) { return kind == Kind.OPERATOR && operator == o; }

    /**
     * @return a description of the token suitable for error messages
     */
    String describe() {
        switch (kind) {
            case VARIABLE: return "variable '" + identifier + "'";
            case OPERATOR: return "'" + operator + "'";
            case LPAREN: return "'('";
            case RPAREN: return "')'";
            default: return "end of input";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return kind == t.kind && identifier == t.identifier && operator == t.operator && position == t.position;
    }

    @Override
    public int hashCode() { return Objects.hash(kind, identifier, operator, position); }

    @Override
    public String toString() { return describe() + "@" + position; }
}
