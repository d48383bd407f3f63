package com.grammar.playground.service;

import com.grammar.playground.analyzer.AnalysisResult;
import com.grammar.playground.analyzer.StatementAnalyzer;
import com.grammar.playground.analyzer.derivation.BnfDerivationGenerator;
import com.grammar.playground.analyzer.derivation.DerivationTreePrinter;
import com.grammar.playground.analyzer.lexer.Token;
import com.grammar.playground.config.AnalyzerProperties;
import com.grammar.playground.dto.AnalysisRequest;
import com.grammar.playground.dto.AnalysisResponse;
import com.grammar.playground.dto.AnalysisResponse.LexicalAnalysis;
import com.grammar.playground.dto.AnalysisResponse.SemanticAnalysis;
import com.grammar.playground.dto.AnalysisResponse.SyntaxAnalysis;
import com.grammar.playground.dto.BnfStep;
import com.grammar.playground.dto.SyntaxToken;
import com.grammar.playground.dto.VariableInfo;
import com.grammar.playground.exception.DerivationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class GrammarAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(GrammarAnalysisService.class);

    private final AnalyzerProperties properties;

    private final BnfDerivationGenerator bnfDerivationGenerator = new BnfDerivationGenerator();

    public GrammarAnalysisService(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public AnalysisResponse analyze(AnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        String expression = request.sanitizedExpression();

        if (expression.isEmpty()) {
            return AnalysisResponse.invalidRequest(expression, "Missing or empty 'expression' field in request body");
        }

        if (expression.length() > properties.maxExpressionLength()) {
            return AnalysisResponse.invalidRequest(expression,
                    "Expression exceeds maximum length of " + properties.maxExpressionLength() + " characters");
        }

        logger.info("=== Starting analysis of {} characters ===", expression.length());

        // fresh symbol table per request
        AnalysisResult result = new StatementAnalyzer().analyze(expression);

        if (properties.traceEnabled()) {
            trace(result);
        }

        List<SyntaxToken> tokens = result.tokens().stream().map(SyntaxToken::from).toList();
        LexicalAnalysis lexical = new LexicalAnalysis(tokens, result.lexicalErrors());

        boolean accepted = result.status().isAccepted();
        SyntaxAnalysis syntax = new SyntaxAnalysis(
                accepted,
                result.syntaxErrors(),
                result.productions(),
                accepted ? BnfStep.numbered(deriveBnf(result)) : List.of());

        Map<String, VariableInfo> variables = new LinkedHashMap<>();
        if (accepted) {
            result.symbols().forEach((name, entry) -> variables.put(name, VariableInfo.from(entry)));
        }
        SemanticAnalysis semantic = new SemanticAnalysis(result.semanticErrorMessages(), variables);

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.info("=== Analysis completed in {}ms: {} ({} tokens, {} semantic errors) ===",
                analysisTime, result.status().code(), tokens.size(), result.semanticErrors().size());

        return AnalysisResponse.completed(expression, result.status().code(), lexical, syntax, semantic,
                analysisTime);
    }

    private List<String> deriveBnf(AnalysisResult result) {
        try {
            return bnfDerivationGenerator.generate(result.derivationTree(), result.source());
        } catch (DerivationException e) {
            logger.warn("BNF derivation skipped for '{}': {}", result.source(), e.getMessage());
            return List.of();
        }
    }

    private void trace(AnalysisResult result) {
        logger.info("=== TOKENS ===");
        for (int i = 0; i < result.tokens().size(); i++) {
            Token token = result.tokens().get(i);
            logger.info("Token {}: '{}' -> {} / {} at {}",
                    i, token.lexeme(), token.subtype(), token.category().displayName(), token.position());
        }
        result.lexicalErrors().forEach(error -> logger.info("  - {}", error));
        result.syntaxErrors().forEach(error -> logger.info("  - {}", error));
        result.tree().ifPresent(tree -> logger.info("=== PARSE TREE ===\n{}", DerivationTreePrinter.render(tree)));
        result.semanticErrors().forEach(error -> logger.info("  - {}", error.message()));
    }
}
