package com.grammar.playground.analyzer;

import com.grammar.playground.analyzer.lexer.Lexer;
import com.grammar.playground.analyzer.lexer.Token;
import com.grammar.playground.analyzer.parser.DerivationNode;
import com.grammar.playground.analyzer.parser.Parser;
import com.grammar.playground.analyzer.semantic.SemanticAnalyzer;
import com.grammar.playground.analyzer.semantic.SemanticError;
import com.grammar.playground.exception.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Lexer, parser and semantic pass for one statement.
 * <p>
 * Not thread-safe: the semantic analyzer's symbol table belongs to this
 * instance. Use one instance per request.
 */
public class StatementAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(StatementAnalyzer.class);

    private final Lexer lexer = new Lexer();
    private final SemanticAnalyzer semanticAnalyzer;

    public StatementAnalyzer() {
        this(new SemanticAnalyzer());
    }

    public StatementAnalyzer(SemanticAnalyzer semanticAnalyzer) {
        this.semanticAnalyzer = semanticAnalyzer;
    }

    /** Analyzes {@code source} against an empty symbol table. */
    public AnalysisResult analyze(String source) {
        semanticAnalyzer.reset();
        return analyzeRetainingSymbols(source);
    }

    /**
     * Analyzes {@code source} against the symbols left by earlier calls, so a
     * name declared by a previous statement counts as a redeclaration.
     */
    public AnalysisResult analyzeRetainingSymbols(String source) {
        List<Token> tokens = lexer.tokenize(source);
        List<String> lexicalErrors = lexer.getErrors();

        DerivationNode tree;
        try {
            tree = new Parser(tokens).parseStatement();
        } catch (SyntaxException e) {
            logger.debug("Rejected '{}': {}", source, e.getMessage());
            return AnalysisResult.syntaxError(source, tokens, lexicalErrors, e.getMessage());
        }

        // not-declared errors are computed but use before declaration is accepted
        List<SemanticError> reported = semanticAnalyzer.analyze(tree).stream()
                .filter(SemanticError::isReported)
                .toList();

        AnalysisResult result = AnalysisResult.parsed(source, tokens, lexicalErrors, tree, reported,
                semanticAnalyzer.getSymbols());
        logger.debug("Analyzed '{}': {}", source, result.status().code());
        return result;
    }
}
