package com.grammar.playground.analyzer;

public enum AnalysisStatus {
    SUCCESS("success"),
    SYNTAX_ERROR("syntax_error"),
    SEMANTIC_ERROR("semantic_error");

    private final String code;

    AnalysisStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAccepted() {
        return this != SYNTAX_ERROR;
    }
}
