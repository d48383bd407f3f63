package com.grammar.playground.analyzer.lexer;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One classified lexeme. {@code position} is the character offset in the
 * source, {@code line} is 1-based and only used for messages.
 */
public record Token(TokenType type, String lexeme, int position, int line) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lexeme, "lexeme");
    }

    /**
     * Literal value of the token: a {@link BigInteger} for NUMBER, a
     * {@link Double} for DECIMAL and the raw text otherwise.
     */
    public Object value() {
        return switch (type) {
            case NUMBER -> new BigInteger(lexeme);
            case DECIMAL -> Double.valueOf(lexeme);
            default -> lexeme;
        };
    }

    public TokenCategory category() {
        return type.category();
    }

    public String subtype() {
        return type.subtype();
    }

    public int endPosition() {
        return position + lexeme.length();
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + position;
    }
}
