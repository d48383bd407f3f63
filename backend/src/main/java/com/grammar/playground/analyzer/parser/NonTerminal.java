package com.grammar.playground.analyzer.parser;

public enum NonTerminal {
    STATEMENT("statement"),
    DECLARATION("declaration"),
    EXPRESSION("expression"),
    EXPRESSION_TAIL("expression'"),
    TERM("term"),
    TERM_TAIL("term'"),
    FACTOR("factor"),
    IF_STATEMENT("if_statement"),
    WHILE_STATEMENT("while_statement"),
    CONDITION("condition");

    private final String label;

    NonTerminal(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
