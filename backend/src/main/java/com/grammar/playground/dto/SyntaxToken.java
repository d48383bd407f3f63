package com.grammar.playground.dto;

import com.grammar.playground.analyzer.lexer.Token;

public record SyntaxToken(
    Object lexeme,
    String tokenType,
    String category,
    int position
) {

    public static SyntaxToken from(Token token) {
        return new SyntaxToken(
                token.value(),
                token.subtype(),
                token.category().displayName(),
                token.position());
    }
}
