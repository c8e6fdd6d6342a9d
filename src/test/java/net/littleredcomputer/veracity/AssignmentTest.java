// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class AssignmentTest {

    @Test
    public void empty() {
        assertThat(Assignment.empty().get('P'), isEmpty());
        assertThat(Assignment.empty().isEmpty(), is(true));
        assertThat(Assignment.empty().toString(), is("{}"));
    }

    @Test
    public void with() {
        Assignment a = Assignment.empty().with('P', true);
        Assignment b = a.with('Q', false);
        assertThat(b.get('P'), isPresentAndIs(true));
        assertThat(b.get('Q'), isPresentAndIs(false));
        assertThat(b.size(), is(2));
        assertThat(b.asMap(), is(ImmutableMap.of('P', true, 'Q', false)));
        // a itself is unchanged.
        assertThat(a.get('Q'), isEmpty());
        assertThat(a.size(), is(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void cannotRebind() {
        Assignment.empty().with('P', true).with('P', true);
    }

    @Test
    public void equalityIgnoresBindingOrder() {
        Assignment a = Assignment.empty().with('P', true).with('Q', false);
        assertThat(a, is(Assignment.of(ImmutableMap.of('Q', false, 'P', true))));
        assertThat(a.hashCode(), is(Assignment.of(ImmutableMap.of('Q', false, 'P', true)).hashCode()));
        assertThat(a, is(not(Assignment.of(ImmutableMap.of('Q', true, 'P', true)))));
    }

    @Test
    public void rendersInBindingOrder() {
        assertThat(Assignment.empty().with('Q', true).with('P', false).toString(), is("{Q: true, P: false}"));
    }

    @Test
    public void consistency() {
        Assignment a = Assignment.of(ImmutableMap.of('P', true, 'Q', false));
        assertThat(a.isConsistentWith(Assignment.empty()), is(true));
        assertThat(a.isConsistentWith(Assignment.of(ImmutableMap.of('P', true, 'R', true))), is(true));
        assertThat(a.isConsistentWith(Assignment.of(ImmutableMap.of('Q', true))), is(false));
        assertThat(a.isConsistentWith(ImmutableMap.of('P', false, 'Q', false, 'R', true)), is(false));
    }
}
