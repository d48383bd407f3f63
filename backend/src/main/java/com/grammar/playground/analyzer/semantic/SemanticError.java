package com.grammar.playground.analyzer.semantic;

public record SemanticError(Kind kind, String message) {

    public enum Kind {
        REDECLARATION,
        TYPE_MISMATCH,
        INVALID_OPERATION,
        // computed but never reported, use before declaration is accepted
        NOT_DECLARED
    }

    public boolean isReported() {
        return kind != Kind.NOT_DECLARED;
    }

    @Override
    public String toString() {
        return message;
    }
}
