package com.grammar.playground.analyzer.lexer;

public enum TokenCategory {
    KEYWORD("Keywords"),
    IDENTIFIER("Identifier"),
    OPERATOR("Operator"),
    DELIMITER("Delimiter"),
    LITERAL("Literal");

    private final String displayName;

    TokenCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
