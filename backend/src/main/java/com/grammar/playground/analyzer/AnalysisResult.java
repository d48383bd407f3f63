package com.grammar.playground.analyzer;

import com.grammar.playground.analyzer.lexer.Token;
import com.grammar.playground.analyzer.parser.DerivationNode;
import com.grammar.playground.analyzer.semantic.SemanticError;
import com.grammar.playground.analyzer.semantic.SymbolEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of analyzing one statement. The derivation tree and symbol table
 * are only present when the statement was syntactically accepted.
 */
public record AnalysisResult(
        String source,
        AnalysisStatus status,
        List<Token> tokens,
        List<String> lexicalErrors,
        List<String> syntaxErrors,
        DerivationNode derivationTree,
        List<SemanticError> semanticErrors,
        Map<String, SymbolEntry> symbols) {

    public static AnalysisResult syntaxError(String source, List<Token> tokens, List<String> lexicalErrors,
            String syntaxError) {
        return new AnalysisResult(source, AnalysisStatus.SYNTAX_ERROR, List.copyOf(tokens),
                List.copyOf(lexicalErrors), List.of(syntaxError), null, List.of(), Map.of());
    }

    public static AnalysisResult parsed(String source, List<Token> tokens, List<String> lexicalErrors,
            DerivationNode tree, List<SemanticError> semanticErrors, Map<String, SymbolEntry> symbols) {
        AnalysisStatus status = semanticErrors.isEmpty() ? AnalysisStatus.SUCCESS : AnalysisStatus.SEMANTIC_ERROR;
        return new AnalysisResult(source, status, List.copyOf(tokens), List.copyOf(lexicalErrors), List.of(),
                tree, List.copyOf(semanticErrors), symbols);
    }

    public Optional<DerivationNode> tree() {
        return Optional.ofNullable(derivationTree);
    }

    public List<String> productions() {
        return derivationTree == null ? List.of() : derivationTree.productions();
    }

    public List<String> semanticErrorMessages() {
        return semanticErrors.stream().map(SemanticError::message).toList();
    }
}
