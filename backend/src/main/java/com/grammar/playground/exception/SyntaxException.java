package com.grammar.playground.exception;

public class SyntaxException extends Exception {

    public SyntaxException(String message) {
        super(message);
    }
}
