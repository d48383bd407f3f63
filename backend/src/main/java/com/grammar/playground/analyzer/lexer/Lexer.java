package com.grammar.playground.analyzer.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Splits a source string into classified tokens.
 * <p>
 * Scanning never aborts: an unrecognized character is reported as a lexical
 * error, skipped, and scanning resumes at the next character.
 */
public final class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> RESERVED = Map.ofEntries(
            Map.entry("int", TokenType.INT),
            Map.entry("double", TokenType.DOUBLE),
            Map.entry("string", TokenType.STRING_TYPE),
            Map.entry("bool", TokenType.BOOL_TYPE),
            Map.entry("true", TokenType.BOOL),
            Map.entry("false", TokenType.BOOL),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("void", TokenType.VOID));

    // checked before ONE_CHAR_OPS so that ">=" never splits into ">" "="
    private static final Map<String, TokenType> TWO_CHAR_OPS = Map.of(
            ">=", TokenType.GE,
            "<=", TokenType.LE,
            "==", TokenType.EQ,
            "!=", TokenType.NE);

    private static final Map<Character, TokenType> ONE_CHAR_OPS = Map.ofEntries(
            Map.entry('+', TokenType.PLUS),
            Map.entry('-', TokenType.MINUS),
            Map.entry('*', TokenType.MULTIPLY),
            Map.entry('/', TokenType.DIVIDE),
            Map.entry('=', TokenType.ASSIGN),
            Map.entry('>', TokenType.GT),
            Map.entry('<', TokenType.LT),
            Map.entry('(', TokenType.LPAREN),
            Map.entry(')', TokenType.RPAREN),
            Map.entry('{', TokenType.LBRACE),
            Map.entry('}', TokenType.RBRACE),
            Map.entry(';', TokenType.SEMICOLON));

    private final List<String> errors = new ArrayList<>();

    private String source;
    private int pos;
    private int line;

    /**
     * Tokenizes {@code source}. Errors from a previous call are discarded.
     */
    public List<Token> tokenize(String source) {
        this.source = source == null ? "" : source;
        this.pos = 0;
        this.line = 1;
        errors.clear();

        List<Token> tokens = new ArrayList<>();
        while (pos < this.source.length()) {
            char c = this.source.charAt(pos);

            if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '\n') {
                line++;
                pos++;
            } else if (c == '"' && this.source.indexOf('"', pos + 1) > 0) {
                int close = this.source.indexOf('"', pos + 1);
                tokens.add(emit(TokenType.STRING, close + 1));
            } else if (isDigit(c)) {
                tokens.add(scanNumber());
            } else if (isIdentifierStart(c)) {
                tokens.add(scanWord());
            } else {
                Token operator = scanOperator();
                if (operator != null) {
                    tokens.add(operator);
                } else {
                    String error = "Lexical Error: Illegal character '" + c + "' at position " + pos;
                    logger.warn(error);
                    errors.add(error);
                    pos++;
                }
            }
        }

        logger.debug("Tokenized {} characters into {} tokens", this.source.length(), tokens.size());
        return tokens;
    }

    /** Lexical errors reported by the last {@link #tokenize(String)} call. */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private Token scanNumber() {
        int end = skipDigits(pos);
        if (end + 1 < source.length() && source.charAt(end) == '.' && isDigit(source.charAt(end + 1))) {
            return emit(TokenType.DECIMAL, skipDigits(end + 1));
        }
        return emit(TokenType.NUMBER, end);
    }

    private Token scanWord() {
        int end = pos + 1;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        String word = source.substring(pos, end);
        return emit(RESERVED.getOrDefault(word, TokenType.ID), end);
    }

    private Token scanOperator() {
        if (pos + 1 < source.length()) {
            TokenType two = TWO_CHAR_OPS.get(source.substring(pos, pos + 2));
            if (two != null) {
                return emit(two, pos + 2);
            }
        }
        TokenType one = ONE_CHAR_OPS.get(source.charAt(pos));
        return one == null ? null : emit(one, pos + 1);
    }

    private Token emit(TokenType type, int end) {
        Token token = new Token(type, source.substring(pos, end), pos, line);
        pos = end;
        return token;
    }

    private int skipDigits(int from) {
        int end = from;
        while (end < source.length() && isDigit(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
