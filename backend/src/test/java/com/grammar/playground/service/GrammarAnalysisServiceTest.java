package com.grammar.playground.service;

import com.grammar.playground.config.AnalyzerProperties;
import com.grammar.playground.dto.AnalysisRequest;
import com.grammar.playground.dto.AnalysisResponse;
import com.grammar.playground.dto.BnfStep;
import com.grammar.playground.dto.SyntaxToken;
import com.grammar.playground.dto.VariableInfo;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class GrammarAnalysisServiceTest {

    private final GrammarAnalysisService service =
            new GrammarAnalysisService(new AnalyzerProperties(10_000, false, List.of("*")));

    @Test
    void successfulDeclaration() {
        AnalysisResponse response = service.analyze(new AnalysisRequest("int x = 5"));

        assertThat(response.status()).isEqualTo("success");
        assertThat(response.resultType()).isEqualTo("success");
        assertThat(response.inputExpression()).isEqualTo("int x = 5");
        assertThat(response.lexicalAnalysis().tokens()).containsExactly(
                new SyntaxToken("int", "int", "Keywords", 0),
                new SyntaxToken("x", "identifier", "Identifier", 4),
                new SyntaxToken("=", "=", "Operator", 6),
                new SyntaxToken(BigInteger.valueOf(5), "integer", "Literal", 8));
        assertThat(response.syntaxAnalysis().accepted()).isTrue();
        assertThat(response.syntaxAnalysis().derivation()).hasSize(11);
        assertThat(response.syntaxAnalysis().bnfDerivation()).containsExactly(
                new BnfStep(1, "<expression> ::= <term>"),
                new BnfStep(2, "<term> ::= <factor>"),
                new BnfStep(3, "<factor> ::= 5"));
        assertThat(response.semanticAnalysis().errors()).isEmpty();
        assertThat(response.semanticAnalysis().variablesDeclared())
                .containsExactly(entry("x", new VariableInfo("int", 1, true)));
        assertThat(response.analysisTimeMs()).isNotNull();
    }

    @Test
    void syntaxErrorHidesTreeAndSymbols() {
        AnalysisResponse response = service.analyze(new AnalysisRequest("int = 5"));

        assertThat(response.status()).isEqualTo("error");
        assertThat(response.resultType()).isEqualTo("syntax_error");
        assertThat(response.syntaxAnalysis().accepted()).isFalse();
        assertThat(response.syntaxAnalysis().errors()).hasSize(1);
        assertThat(response.syntaxAnalysis().derivation()).isEmpty();
        assertThat(response.syntaxAnalysis().bnfDerivation()).isEmpty();
        assertThat(response.semanticAnalysis().variablesDeclared()).isEmpty();
        assertThat(response.lexicalAnalysis().tokens()).hasSize(3);
    }

    @Test
    void semanticErrorKeepsTreeAndSymbols() {
        AnalysisResponse response = service.analyze(new AnalysisRequest("double pi = 3"));

        assertThat(response.status()).isEqualTo("error");
        assertThat(response.resultType()).isEqualTo("semantic_error");
        assertThat(response.syntaxAnalysis().accepted()).isTrue();
        assertThat(response.syntaxAnalysis().derivation()).isNotEmpty();
        assertThat(response.semanticAnalysis().errors())
                .containsExactly("Semantic Error: Cannot assign integer value to decimal variable 'pi'");
        assertThat(response.semanticAnalysis().variablesDeclared())
                .containsEntry("pi", new VariableInfo("double", 1, false));
    }

    @Test
    void conditionsHaveTreeButNoBnfDerivation() {
        AnalysisResponse response = service.analyze(new AnalysisRequest("if(count >= 10)"));

        assertThat(response.resultType()).isEqualTo("success");
        assertThat(response.syntaxAnalysis().derivation()).first().isEqualTo("statement → if_statement");
        assertThat(response.syntaxAnalysis().bnfDerivation()).isEmpty();
    }

    @Test
    void inputIsSanitizedBeforeAnalysis() {
        AnalysisResponse response = service.analyze(new AnalysisRequest("  int\r\nx = 5\0  "));

        assertThat(response.inputExpression()).isEqualTo("int\nx = 5");
        assertThat(response.resultType()).isEqualTo("success");
        assertThat(response.semanticAnalysis().variablesDeclared().get("x").line()).isEqualTo(2);
    }

    @Test
    void deeplyNestedInputWithinTheLengthLimitIsASyntaxError() {
        AnalysisResponse response = service.analyze(
                new AnalysisRequest("(".repeat(4999) + "1" + ")".repeat(4999)));

        assertThat(response.resultType()).isEqualTo("syntax_error");
        assertThat(response.syntaxAnalysis().errors())
                .containsExactly("Syntax Error: Expression nested too deeply at position 100");
        assertThat(response.syntaxAnalysis().derivation()).isEmpty();
    }

    @Test
    void stringInitializerKeepsItsSpacesInTheBnfDerivation() {
        AnalysisResponse response = service.analyze(new AnalysisRequest("string s = \"hello world\""));

        assertThat(response.resultType()).isEqualTo("success");
        assertThat(response.syntaxAnalysis().bnfDerivation())
                .extracting(BnfStep::rule)
                .endsWith("<factor> ::= \"hello world\"");
    }

    @Test
    void blankInputIsRejected() {
        AnalysisResponse response = service.analyze(new AnalysisRequest(" \t "));

        assertThat(response.resultType()).isEqualTo("invalid_request");
        assertThat(response.error()).isEqualTo("Missing or empty 'expression' field in request body");
        assertThat(response.lexicalAnalysis()).isNull();
    }

    @Test
    void overlongInputIsRejected() {
        GrammarAnalysisService strict = new GrammarAnalysisService(new AnalyzerProperties(5, false, List.of("*")));

        AnalysisResponse response = strict.analyze(new AnalysisRequest("int x = 5"));

        assertThat(response.resultType()).isEqualTo("invalid_request");
        assertThat(response.error()).isEqualTo("Expression exceeds maximum length of 5 characters");
    }

    @Test
    void tracingDoesNotChangeTheResponse() {
        GrammarAnalysisService tracing = new GrammarAnalysisService(new AnalyzerProperties(10_000, true, List.of("*")));

        AnalysisResponse traced = tracing.analyze(new AnalysisRequest("x @ y"));
        AnalysisResponse plain = service.analyze(new AnalysisRequest("x @ y"));

        assertThat(traced.resultType()).isEqualTo(plain.resultType());
        assertThat(traced.lexicalAnalysis()).isEqualTo(plain.lexicalAnalysis());
    }

    @Test
    void requestsDoNotShareSymbols() {
        service.analyze(new AnalysisRequest("int x = 5"));

        assertThat(service.analyze(new AnalysisRequest("int x = 5")).resultType()).isEqualTo("success");
    }
}
