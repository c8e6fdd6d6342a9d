// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * An immutable partial assignment of truth values to variables. Variables that are not bound
 * are unconstrained. Bindings are kept in the order in which they were made.
 */
public final class Assignment {
    private static final Assignment EMPTY = new Assignment(ImmutableMap.of());
    private static final Joiner.MapJoiner joiner = Joiner.on(", ").withKeyValueSeparator(": ");

    private final ImmutableMap<Character, Boolean> values;

    private Assignment(ImmutableMap<Character, Boolean> values) {
        this.values = values;
    }

    public static Assignment empty() { return EMPTY; }

    public static Assignment of(Map<Character, Boolean> values) {
        return new Assignment(ImmutableMap.copyOf(values));
    }

    public Optional<Boolean> get(char variable) {
        return Optional.ofNullable(values.get(variable));
    }

    /**
     * @return a copy of this assignment with one more binding
     * @throws IllegalArgumentException if the variable is already bound
     */
    public Assignment with(char variable, boolean value) {
        Preconditions.checkArgument(!values.containsKey(variable), "%s is already bound", variable);
        return new Assignment(ImmutableMap.<Character, Boolean>builder().putAll(values).put(variable, value).build());
    }

    /**
     * @return true if no variable is bound to different values here and in {@code other}
     */
    public boolean isConsistentWith(Assignment other) {
        return isConsistentWith(other.values);
    }

    public boolean isConsistentWith(Map<Character, Boolean> other) {
        for (Map.Entry<Character, Boolean> e : values.entrySet()) {
            Boolean b = other.get(e.getKey());
            if (b != null && !b.equals(e.getValue())) return false;
        }
        return true;
    }

    public int size() { return values.size(); }

    public boolean isEmpty() { return values.isEmpty(); }

    public ImmutableMap<Character, Boolean> asMap() { return values; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment && ((Assignment) o).values.equals(values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "{" + joiner.join(values) + "}"; }
}
