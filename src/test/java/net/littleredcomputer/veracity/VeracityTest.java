// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;

public class VeracityTest {

    @Test
    public void pipeline() {
        assertThat(Veracity.tokenize("P∨Q"), hasSize(4));
        Expression e = Veracity.parse("(P∧¬P)∨Q");
        assertThat(Veracity.simplify(e), is(Expression.variable('Q')));
        assertThat(Veracity.solve(e), contains(Assignment.of(ImmutableMap.of('Q', true))));
        assertThat(Veracity.solve("(P∧¬P)∨Q"), is(Veracity.solve(e)));
    }

    @Test
    public void satisfiability() {
        assertThat(Veracity.isSatisfiable("P∨¬P"), is(true));
        assertThat(Veracity.isSatisfiable("P∧(Q∨R)∧¬P"), is(false));
    }

    @Test(expected = LexException.class)
    public void solveRejectsBadCharacters() {
        Veracity.solve("P∧1");
    }

    @Test(expected = ParseException.class)
    public void solveRejectsBadStructure() {
        Veracity.solve("P→(Q∧R)");
    }
}
