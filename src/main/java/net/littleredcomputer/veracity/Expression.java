// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.util.Map;
import java.util.Objects;

/**
 * An immutable propositional formula. The set of node types is closed: consumers dispatch
 * through {@link Visitor}, so a new node type cannot be added without every consumer being
 * told about it by the compiler.
 */
public abstract class Expression {
    private static final int ATOM = 5;

    public interface Visitor<R> {
        R visit(Variable v);
        R visit(Negation n);
        R visit(Conjunction c);
        R visit(Disjunction d);
        R visit(Implication i);
        R visit(Literal l);
    }

    private Expression() {}

    public abstract <R> R accept(Visitor<R> visitor);

    abstract int precedence();

    abstract void appendTo(StringBuilder s);

    public static Variable variable(char identifier) { return new Variable(identifier); }
    public static Negation not(Expression operand) { return new Negation(operand); }
    public static Conjunction and(Expression lhs, Expression rhs) { return new Conjunction(lhs, rhs); }
    public static Disjunction or(Expression lhs, Expression rhs) { return new Disjunction(lhs, rhs); }
    public static Implication implies(Expression lhs, Variable rhs) { return new Implication(lhs, rhs); }
    public static Literal literal(boolean value) { return value ? Literal.TRUE : Literal.FALSE; }

    /**
     * Evaluate this formula at a point.
     * @param values truth value of (at least) every variable in the formula
     * @return the truth value of the formula
     * @throws IllegalArgumentException if a variable of the formula has no value
     */
    public boolean evaluate(Map<Character, Boolean> values) {
        return accept(new Visitor<Boolean>() {
            @Override public Boolean visit(Variable v) {
                Boolean b = values.get(v.identifier());
                Preconditions.checkArgument(b != null, "no value for variable %s", v.identifier());
                return b;
            }
            @Override public Boolean visit(Negation n) { return !n.operand().accept(this); }
            @Override public Boolean visit(Conjunction c) { return c.lhs().accept(this) && c.rhs().accept(this); }
            @Override public Boolean visit(Disjunction d) { return d.lhs().accept(this) || d.rhs().accept(this); }
            @Override public Boolean visit(Implication i) { return !i.lhs().accept(this) || i.rhs().accept(this); }
            @Override public Boolean visit(Literal l) { return l.value(); }
        });
    }

    /**
     * @return the distinct variables of the formula, in order of first (leftmost) occurrence
     */
    public ImmutableSet<Character> variables() {
        ImmutableSet.Builder<Character> b = ImmutableSet.builder();
        accept(new Visitor<Void>() {
            @Override public Void visit(Variable v) { b.add(v.identifier()); return null; }
            @Override public Void visit(Negation n) { return n.operand().accept(this); }
            @Override public Void visit(Conjunction c) { c.lhs().accept(this); return c.rhs().accept(this); }
            @Override public Void visit(Disjunction d) { d.lhs().accept(this); return d.rhs().accept(this); }
            @Override public Void visit(Implication i) { i.lhs().accept(this); return i.rhs().accept(this); }
            @Override public Void visit(Literal l) { return null; }
        });
        return b.build();
    }

    /**
     * Renders the formula in the input grammar, parenthesizing only where precedence or
     * left associativity demands it, so that parsing the result gives back an equal tree.
     */
    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        appendTo(s);
        return s.toString();
    }

    private static void appendOperand(StringBuilder s, Expression e, boolean parenthesize) {
        if (parenthesize) s.append('(');
        e.appendTo(s);
        if (parenthesize) s.append(')');
    }

    public static final class Variable extends Expression {
        private final char identifier;

        private Variable(char identifier) {
            Preconditions.checkArgument(Character.isLetter(identifier), "not a variable name: %s", identifier);
            this.identifier = identifier;
        }

        public char identifier() { return identifier; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
        @Override int precedence() { return ATOM; }
        @Override void appendTo(StringBuilder s) { s.append(identifier); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && ((Variable) o).identifier == identifier;
        }

        @Override
        public int hashCode() { return Character.hashCode(identifier); }
    }

    public static final class Literal extends Expression {
        private static final Literal TRUE = new Literal(true);
        private static final Literal FALSE = new Literal(false);
        private final boolean value;

        private Literal(boolean value) { this.value = value; }

        public boolean value() { return value; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
        @Override int precedence() { return ATOM; }
        @Override void appendTo(StringBuilder s) { s.append(value ? '⊤' : '⊥'); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && ((Literal) o).value == value;
        }

        @Override
        public int hashCode() { return Boolean.hashCode(value); }
    }

    public static final class Negation extends Expression {
        private final Expression operand;

        private Negation(Expression operand) {
            this.operand = Preconditions.checkNotNull(operand);
        }

        public Expression operand() { return operand; }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
        @Override int precedence() { return Operator.NOT.precedence(); }

        @Override
        void appendTo(StringBuilder s) {
            s.append(Operator.NOT.glyph());
            appendOperand(s, operand, operand.precedence() < precedence());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Negation && ((Negation) o).operand.equals(operand);
        }

        @Override
        public int hashCode() { return 31 * operand.hashCode() + Operator.NOT.ordinal(); }
    }

    /**
     * Common shape of the binary connectives. All of them associate to the left.
     */
    public abstract static class Binary extends Expression {
        private final Operator operator;
        private final Expression lhs;
        private final Expression rhs;

        private Binary(Operator operator, Expression lhs, Expression rhs) {
            this.operator = operator;
            this.lhs = Preconditions.checkNotNull(lhs);
            this.rhs = Preconditions.checkNotNull(rhs);
        }

        public Operator operator() { return operator; }
        public Expression lhs() { return lhs; }
        public Expression rhs() { return rhs; }

        @Override int precedence() { return operator.precedence(); }

        @Override
        void appendTo(StringBuilder s) {
            appendOperand(s, lhs, lhs.precedence() < precedence());
            s.append(operator.glyph());
            appendOperand(s, rhs, rhs.precedence() <= precedence());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary)) return false;
            Binary b = (Binary) o;
            return operator == b.operator && lhs.equals(b.lhs) && rhs.equals(b.rhs);
        }

        @Override
        public int hashCode() { return Objects.hash(operator, lhs, rhs); }
    }

    public static final class Conjunction extends Binary {
        private Conjunction(Expression lhs, Expression rhs) { super(Operator.AND, lhs, rhs); }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    public static final class Disjunction extends Binary {
        private Disjunction(Expression lhs, Expression rhs) { super(Operator.OR, lhs, rhs); }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /**
     * Material implication. The grammar only admits a bare variable as the consequent.
     */
    public static final class Implication extends Binary {
        private Implication(Expression lhs, Variable rhs) { super(Operator.IMPLIES, lhs, rhs); }

        @Override public Variable rhs() { return (Variable) super.rhs(); }

        @Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }
}
