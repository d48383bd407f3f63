package com.grammar.playground.exception;

public class DerivationException extends Exception {

    public DerivationException(String message) {
        super(message);
    }
}
