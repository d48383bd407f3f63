package com.grammar.playground.analyzer.lexer;

import static com.grammar.playground.analyzer.lexer.TokenCategory.DELIMITER;
import static com.grammar.playground.analyzer.lexer.TokenCategory.IDENTIFIER;
import static com.grammar.playground.analyzer.lexer.TokenCategory.KEYWORD;
import static com.grammar.playground.analyzer.lexer.TokenCategory.LITERAL;
import static com.grammar.playground.analyzer.lexer.TokenCategory.OPERATOR;

/**
 * Terminal symbols of the statement grammar. The subtype is the short
 * classification reported next to each lexeme.
 */
public enum TokenType {
    // keywords
    INT(KEYWORD, "int"),
    DOUBLE(KEYWORD, "double"),
    STRING_TYPE(KEYWORD, "string"),
    BOOL_TYPE(KEYWORD, "bool"),
    IF(KEYWORD, "if"),
    ELSE(KEYWORD, "else"),
    WHILE(KEYWORD, "while"),
    RETURN(KEYWORD, "return"),
    VOID(KEYWORD, "void"),

    ID(IDENTIFIER, "identifier"),

    // operators
    PLUS(OPERATOR, "+"),
    MINUS(OPERATOR, "-"),
    MULTIPLY(OPERATOR, "*"),
    DIVIDE(OPERATOR, "/"),
    ASSIGN(OPERATOR, "="),
    GT(OPERATOR, ">"),
    LT(OPERATOR, "<"),
    GE(OPERATOR, ">="),
    LE(OPERATOR, "<="),
    EQ(OPERATOR, "=="),
    NE(OPERATOR, "!="),

    // delimiters
    LPAREN(DELIMITER, "("),
    RPAREN(DELIMITER, ")"),
    LBRACE(DELIMITER, "{"),
    RBRACE(DELIMITER, "}"),
    SEMICOLON(DELIMITER, ";"),

    // literals
    NUMBER(LITERAL, "integer"),
    DECIMAL(LITERAL, "decimal"),
    STRING(LITERAL, "string"),
    BOOL(LITERAL, "boolean");

    private final TokenCategory category;
    private final String subtype;

    TokenType(TokenCategory category, String subtype) {
        this.category = category;
        this.subtype = subtype;
    }

    public TokenCategory category() {
        return category;
    }

    public String subtype() {
        return subtype;
    }

    public boolean isRelational() {
        return this == GT || this == LT || this == GE || this == LE || this == EQ || this == NE;
    }
}
