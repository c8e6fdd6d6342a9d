// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import java.util.Optional;

/**
 * The connectives of the formula grammar, loosest binding first.
 */
public enum Operator {
    IMPLIES('→', 1),
    OR('∨', 2),
    AND('∧', 3),
    NOT('¬', 4);

    private final char glyph;
    private final int precedence;

    Operator(char glyph, int precedence) {
        this.glyph = glyph;
        this.precedence = precedence;
    }

    public char glyph() { return glyph; }

    /** @return binding strength; a larger value binds more tightly */
    public int precedence() { return precedence; }

    static Optional<Operator> fromGlyph(int c) {
        for (Operator o : values()) if (o.glyph == c) return Optional.of(o);
        return Optional.empty();
    }

    @Override
    public String toString() { return String.valueOf(glyph); }
}
