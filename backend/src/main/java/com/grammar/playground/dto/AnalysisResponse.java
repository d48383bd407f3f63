package com.grammar.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        String inputExpression,
        String status,
        String resultType,
        String error,
        LexicalAnalysis lexicalAnalysis,
        SyntaxAnalysis syntaxAnalysis,
        SemanticAnalysis semanticAnalysis,
        Long analysisTimeMs
) {

    public record LexicalAnalysis(List<SyntaxToken> tokens, List<String> errors) {
    }

    public record SyntaxAnalysis(
            boolean accepted,
            List<String> errors,
            List<String> derivation,
            List<BnfStep> bnfDerivation) {
    }

    public record SemanticAnalysis(List<String> errors, Map<String, VariableInfo> variablesDeclared) {
    }

    public static AnalysisResponse completed(
            String inputExpression,
            String resultType,
            LexicalAnalysis lexicalAnalysis,
            SyntaxAnalysis syntaxAnalysis,
            SemanticAnalysis semanticAnalysis,
            long analysisTimeMs) {
        return new AnalysisResponse(
                inputExpression,
                "success".equals(resultType) ? "success" : "error",
                resultType,
                null,
                lexicalAnalysis,
                syntaxAnalysis,
                semanticAnalysis,
                analysisTimeMs);
    }

    public static AnalysisResponse invalidRequest(String inputExpression, String error) {
        return new AnalysisResponse(
                inputExpression,
                "error",
                "invalid_request",
                error,
                null,
                null,
                null,
                null);
    }

    public static AnalysisResponse internalError(String inputExpression, String error) {
        return new AnalysisResponse(
                inputExpression,
                "error",
                "internal_error",
                error,
                null,
                null,
                null,
                null);
    }
}
