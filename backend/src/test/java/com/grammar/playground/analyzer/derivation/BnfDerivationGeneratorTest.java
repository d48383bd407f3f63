package com.grammar.playground.analyzer.derivation;

import com.grammar.playground.analyzer.lexer.Lexer;
import com.grammar.playground.analyzer.parser.DerivationNode;
import com.grammar.playground.analyzer.parser.Parser;
import com.grammar.playground.exception.DerivationException;
import com.grammar.playground.exception.SyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BnfDerivationGeneratorTest {

    private final BnfDerivationGenerator generator = new BnfDerivationGenerator();

    private static DerivationNode parse(String source) throws SyntaxException {
        return new Parser(new Lexer().tokenize(source)).parseStatement();
    }

    @Test
    void multiplicationIsDerivedInsideTheRightTerm() throws DerivationException {
        assertThat(generator.derive("a+b*c")).containsExactly(
                "<expression> ::= <expression> + <term>",
                "<expression> ::= <term>",
                "<term> ::= <factor>",
                "<factor> ::= a",
                "<term> ::= <term> * <factor>",
                "<term> ::= <factor>",
                "<factor> ::= b",
                "<factor> ::= c");
    }

    @Test
    void additionIsLeftAssociative() throws DerivationException {
        assertThat(generator.derive("a+b+c")).containsExactly(
                "<expression> ::= <expression> + <term>",
                "<expression> ::= <expression> + <term>",
                "<expression> ::= <term>",
                "<term> ::= <factor>",
                "<factor> ::= a",
                "<term> ::= <factor>",
                "<factor> ::= b",
                "<term> ::= <factor>",
                "<factor> ::= c");
    }

    @Test
    void parenthesesOverridePrecedence() throws DerivationException {
        assertThat(generator.derive("(a + b) * 2")).containsExactly(
                "<expression> ::= <term>",
                "<term> ::= <term> * <factor>",
                "<term> ::= <factor>",
                "<factor> ::= ( <expression> )",
                "<expression> ::= <expression> + <term>",
                "<expression> ::= <term>",
                "<term> ::= <factor>",
                "<factor> ::= a",
                "<term> ::= <factor>",
                "<factor> ::= b",
                "<factor> ::= 2");
    }

    @Test
    void whitespaceIsIgnored() throws DerivationException {
        assertThat(generator.derive(" x \t*  3.5 ")).isEqualTo(generator.derive("x*3.5"));
    }

    @Test
    void stringLiteralsKeepTheirContent() throws DerivationException {
        assertThat(generator.derive("\"hello world\" + \"(a+b)*c\"")).containsExactly(
                "<expression> ::= <expression> + <term>",
                "<expression> ::= <term>",
                "<term> ::= <factor>",
                "<factor> ::= \"hello world\"",
                "<term> ::= <factor>",
                "<factor> ::= \"(a+b)*c\"");
    }

    @Test
    void longChainsAreDerived() throws DerivationException {
        List<String> steps = generator.derive("1" + "+1".repeat(4999));

        assertThat(steps).hasSize(4999 + 1 + 2 * 5000);
        assertThat(steps.get(0)).isEqualTo("<expression> ::= <expression> + <term>");
        assertThat(steps.get(4999)).isEqualTo("<expression> ::= <term>");
    }

    @Test
    void deepNestingIsRejected() {
        String nested = "(".repeat(BnfDerivationGenerator.MAX_NESTING + 1) + "x"
                + ")".repeat(BnfDerivationGenerator.MAX_NESTING + 1);

        assertThatThrownBy(() -> generator.derive(nested))
                .isInstanceOf(DerivationException.class)
                .hasMessage("Expression nested too deeply");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "a+", "*b", "(a", "a)", "(a)(b)", "a-b", "a++b" })
    void malformedExpressionsAreRejected(String expression) {
        assertThatThrownBy(() -> generator.derive(expression))
                .isInstanceOf(DerivationException.class)
                .hasMessageStartingWith("Malformed expression");
    }

    @Test
    void generateUsesTheDeclarationInitializer() throws Exception {
        String source = "int total = 2 * 3";

        assertThat(generator.generate(parse(source), source)).containsExactly(
                "<expression> ::= <term>",
                "<term> ::= <term> * <factor>",
                "<term> ::= <factor>",
                "<factor> ::= 2",
                "<factor> ::= 3");
    }

    @Test
    void generateUsesTheWholeExpressionStatement() throws Exception {
        String source = "x + y * 2";

        assertThat(generator.generate(parse(source), source)).isEqualTo(generator.derive(source));
    }

    @Test
    void conditionsAndBareDeclarationsHaveNoDerivation() throws Exception {
        assertThat(generator.generate(parse("if(x > 9)"), "if(x > 9)")).isEmpty();
        assertThat(generator.generate(parse("int x"), "int x")).isEmpty();
        assertThat(generator.generate(null, "x")).isEmpty();
    }
}
