// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.collect.ImmutableList;

/**
 * Entry points for working with formulas such as {@code P∨(Q∧R)∧(¬S∨(T∨¬U→V)∧W)}.
 * <p>
 * Variables are single ASCII letters, case sensitive. The connectives, from tightest to
 * loosest binding, are ¬ ∧ ∨ →; the right hand side of → must be a single variable.
 * Whitespace is ignored.
 */
public final class Veracity {
    private Veracity() {}

    public static ImmutableList<Token> tokenize(String text) {
        return Lexer.tokenize(text);
    }

    public static Expression parse(String text) {
        return Parser.parse(text);
    }

    public static Expression simplify(Expression e) {
        return Simplifier.simplify(e);
    }

    public static ImmutableList<Assignment> solve(String text) {
        return new Solver().solve(text);
    }

    public static ImmutableList<Assignment> solve(Expression e) {
        return new Solver().solve(e);
    }

    public static boolean isSatisfiable(String text) {
        return !solve(text).isEmpty();
    }
}
