// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.veracity;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Splits formula text into tokens. Variables are single ASCII letters, so no lookahead is
 * ever needed: every non-blank character is a token on its own.
 */
public final class Lexer {
    private Lexer() {}

    private static boolean isVariable(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * @param input formula text
     * @return the tokens of the input, always terminated by an END token
     * @throws LexException at the first character that is not part of the grammar
     */
    public static ImmutableList<Token> tokenize(String input) {
        Preconditions.checkNotNull(input, "input");
        ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        for (int i = 0; i < input.length(); ) {
            final int c = input.codePointAt(i);
            if (Character.isWhitespace(c)) {
                // skip
            } else if (isVariable(c)) {
                tokens.add(Token.variable((char) c, i));
            } else if (c == '(') {
                tokens.add(Token.lparen(i));
            } else if (c == ')') {
                tokens.add(Token.rparen(i));
            } else {
                Optional<Operator> o = Operator.fromGlyph(c);
                if (!o.isPresent()) throw new LexException(c, i);
                tokens.add(Token.operator(o.get(), i));
            }
            i += Character.charCount(c);
        }
        return tokens.add(Token.end(input.length())).build();
    }
}
