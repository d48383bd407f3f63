package com.grammar.playground.dto;

import com.grammar.playground.analyzer.semantic.SymbolEntry;

public record VariableInfo(String type, int line, boolean initialized) {

    public static VariableInfo from(SymbolEntry entry) {
        return new VariableInfo(entry.declaredType().keyword(), entry.declarationLine(), entry.initialized());
    }
}
