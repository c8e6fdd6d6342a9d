// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

public class LexException extends FormulaException {
    private final int character;

    LexException(int character, int position) {
        super(String.format("unrecognized character '%s' (U+%04X) at position %d",
                new String(Character.toChars(character)), character, position), position);
        this.character = character;
    }

    /** @return the offending code point */
    public int character() { return character; }
}
