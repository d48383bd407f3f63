package com.grammar.playground.analyzer.semantic;

import com.grammar.playground.analyzer.lexer.TokenType;

import java.util.Optional;

/**
 * Static types of the language plus the sentinels produced while typing an
 * expression.
 */
public enum TypeTag {
    INT("int", "integer"),
    DOUBLE("double", "decimal"),
    STRING("string", "string"),
    BOOL("bool", "boolean"),

    UNKNOWN("unknown", "unknown"),
    UNDECLARED("undeclared", "undeclared"),
    TYPE_ERROR("type_error", "type_error");

    private final String keyword;
    private final String displayName;

    TypeTag(String keyword, String displayName) {
        this.keyword = keyword;
        this.displayName = displayName;
    }

    /** Spelling in source and in the symbol table, e.g. {@code int}. */
    public String keyword() {
        return keyword;
    }

    /** Name used in messages, e.g. {@code integer}. */
    public String displayName() {
        return displayName;
    }

    public boolean isNumeric() {
        return this == INT || this == DOUBLE;
    }

    /** Declared type named by a type keyword token. */
    public static Optional<TypeTag> forKeyword(TokenType keyword) {
        return switch (keyword) {
            case INT -> Optional.of(INT);
            case DOUBLE -> Optional.of(DOUBLE);
            case STRING_TYPE -> Optional.of(STRING);
            case BOOL_TYPE -> Optional.of(BOOL);
            default -> Optional.empty();
        };
    }

    /** Type of a literal token, empty for anything that is not a literal. */
    public static Optional<TypeTag> forLiteral(TokenType literal) {
        return switch (literal) {
            case NUMBER -> Optional.of(INT);
            case DECIMAL -> Optional.of(DOUBLE);
            case STRING -> Optional.of(STRING);
            case BOOL -> Optional.of(BOOL);
            default -> Optional.empty();
        };
    }
}
