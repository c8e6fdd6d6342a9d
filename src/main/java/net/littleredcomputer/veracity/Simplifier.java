// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import net.littleredcomputer.veracity.Expression.Conjunction;
import net.littleredcomputer.veracity.Expression.Disjunction;
import net.littleredcomputer.veracity.Expression.Implication;
import net.littleredcomputer.veracity.Expression.Literal;
import net.littleredcomputer.veracity.Expression.Negation;
import net.littleredcomputer.veracity.Expression.Variable;

/**
 * Bottom-up constant folding. Subformulas that are true or false whatever the values of their
 * variables are replaced by literals, and the literals are then propagated through the
 * connectives above them. Only two kinds of constant are recognized: a formula combined with
 * its own negation, and formulas built from constants. Equality is structural, so
 * {@code (P∧Q)∨¬(Q∧P)} is left alone.
 * <p>
 * The result is a fixed point: simplifying it again yields an equal tree.
 */
public final class Simplifier implements Expression.Visitor<Expression> {
    private static final Simplifier instance = new Simplifier();

    private Simplifier() {}

    public static Expression simplify(Expression e) {
        return e.accept(instance);
    }

    private static boolean isLiteral(Expression e, boolean value) {
        return e instanceof Literal && ((Literal) e).value() == value;
    }

    // Is one of a, b the negation of the other?
    private static boolean complementary(Expression a, Expression b) {
        return (a instanceof Negation && ((Negation) a).operand().equals(b))
                || (b instanceof Negation && ((Negation) b).operand().equals(a));
    }

    @Override
    public Expression visit(Variable v) { return v; }

    @Override
    public Expression visit(Literal l) { return l; }

    @Override
    public Expression visit(Negation n) {
        Expression e = n.operand().accept(this);
        if (e instanceof Literal) return Expression.literal(!((Literal) e).value());
        if (e instanceof Negation) return ((Negation) e).operand();
        return Expression.not(e);
    }

    @Override
    public Expression visit(Conjunction c) {
        Expression a = c.lhs().accept(this);
        Expression b = c.rhs().accept(this);
        if (isLiteral(a, false) || isLiteral(b, false)) return Expression.literal(false);
        if (isLiteral(a, true)) return b;
        if (isLiteral(b, true)) return a;
        if (complementary(a, b)) return Expression.literal(false);
        return Expression.and(a, b);
    }

    @Override
    public Expression visit(Disjunction d) {
        Expression a = d.lhs().accept(this);
        Expression b = d.rhs().accept(this);
        if (isLiteral(a, true) || isLiteral(b, true)) return Expression.literal(true);
        if (isLiteral(a, false)) return b;
        if (isLiteral(b, false)) return a;
        if (complementary(a, b)) return Expression.literal(true);
        return Expression.or(a, b);
    }

    @Override
    public Expression visit(Implication i) {
        // A → v is ¬A ∨ v; the consequent is a variable and so never constant.
        Expression a = i.lhs().accept(this);
        if (isLiteral(a, false)) return Expression.literal(true);
        if (isLiteral(a, true)) return i.rhs();
        if (a.equals(i.rhs())) return Expression.literal(true);
        return Expression.implies(a, i.rhs());
    }
}
