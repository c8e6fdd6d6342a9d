// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class FormulaTestBase {
    static final List<String> corpus = fromResource("formulas.txt");

    private static List<String> fromResource(String name) {
        return new BufferedReader(new InputStreamReader(
                FormulaTestBase.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8))
                .lines()
                .map(String::trim)
                .filter(s -> !s.isEmpty() && !s.startsWith("#"))
                .collect(toList());
    }

    /**
     * @return every total assignment to the given variables (2^n of them)
     */
    static List<Map<Character, Boolean>> points(List<Character> variables) {
        List<Map<Character, Boolean>> result = new ArrayList<>();
        for (List<Boolean> values : Lists.cartesianProduct(Collections.nCopies(variables.size(), ImmutableList.of(false, true)))) {
            Map<Character, Boolean> p = new HashMap<>();
            for (int i = 0; i < variables.size(); ++i) p.put(variables.get(i), values.get(i));
            result.add(p);
        }
        return result;
    }

    static List<Map<Character, Boolean>> points(Expression e) {
        return points(e.variables().asList());
    }

    // Any way of filling in the unbound variables of a model must satisfy e.
    void assertSound(Expression e, List<Assignment> models) {
        for (Assignment m : models) {
            for (Map<Character, Boolean> p : points(e)) {
                if (m.isConsistentWith(p)) assertThat(e + " under " + m + " at " + p, e.evaluate(p), is(true));
            }
        }
    }

    // Every satisfying point must be covered by some model.
    void assertComplete(Expression e, List<Assignment> models) {
        for (Map<Character, Boolean> p : points(e)) {
            if (e.evaluate(p)) {
                assertThat(e + " at " + p + " is missed by " + models,
                        models.stream().anyMatch(m -> m.isConsistentWith(p)), is(true));
            }
        }
    }

    void assertSolvedCorrectly(Expression e, List<Assignment> models) {
        assertSound(e, models);
        assertComplete(e, models);
    }
}
