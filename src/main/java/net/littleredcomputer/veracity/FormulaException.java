// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

/**
 * Raised when the text of a formula cannot be turned into an {@link Expression}. Nothing is
 * recovered: the caller must correct the input and try again.
 */
public abstract class FormulaException extends IllegalArgumentException {
    private final int position;

    FormulaException(String message, int position) {
        super(message);
        this.position = position;
    }

    /** @return character offset in the input at which the problem was detected */
    public int position() { return position; }
}
