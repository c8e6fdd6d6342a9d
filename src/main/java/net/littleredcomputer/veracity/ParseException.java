// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

public class ParseException extends FormulaException {
    private final String expected;
    private final String found;

    ParseException(String expected, Token found) {
        super(String.format("expected %s but found %s at position %d", expected, found.describe(), found.position()),
                found.position());
        this.expected = expected;
        this.found = found.describe();
    }

    public String expected() { return expected; }
    public String found() { return found; }
}
