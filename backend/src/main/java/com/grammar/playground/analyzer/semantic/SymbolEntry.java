package com.grammar.playground.analyzer.semantic;

public record SymbolEntry(String name, TypeTag declaredType, int declarationLine, boolean initialized) {

    public SymbolEntry markInitialized() {
        return new SymbolEntry(name, declaredType, declarationLine, true);
    }
}
