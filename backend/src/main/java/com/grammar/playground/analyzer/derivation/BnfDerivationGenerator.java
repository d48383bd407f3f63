package com.grammar.playground.analyzer.derivation;

import com.grammar.playground.analyzer.lexer.Token;
import com.grammar.playground.analyzer.parser.DerivationNode;
import com.grammar.playground.analyzer.parser.NonTerminal;
import com.grammar.playground.exception.DerivationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Re-derives the expression/term/factor production sequence of an expression
 * from its text alone.
 * <p>
 * Each level splits on the operators at parenthesis depth zero. Every split
 * but the last becomes a left-recursive step, which makes both {@code +} and
 * {@code *} left-associative and lets {@code *} bind inside the operands of
 * {@code +}. Text inside string literals is never split and keeps its
 * whitespace.
 */
public final class BnfDerivationGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BnfDerivationGenerator.class);

    static final int MAX_NESTING = 100;

    private static final Pattern TERMINAL = Pattern.compile(
            "[A-Za-z_][A-Za-z_0-9]*|\\d+(\\.\\d+)?|\"[^\"]*\"");

    /**
     * Derivation for the expression part of a parsed statement: the whole
     * statement for an expression statement, the initializer for a
     * declaration. Conditions and bare declarations have no such part.
     */
    public List<String> generate(DerivationNode statement, String source) throws DerivationException {
        if (statement == null || source == null) {
            return List.of();
        }

        Optional<DerivationNode> expression = derivableExpression(statement);
        if (expression.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = expression.get().tokens();
        String text = source.substring(tokens.get(0).position(), tokens.get(tokens.size() - 1).endPosition());
        return derive(text);
    }

    /**
     * Leftmost derivation of {@code expression}, one production per entry.
     *
     * @throws DerivationException if the text is not a well-formed expression
     *         of identifiers, numbers, string literals, {@code +}, {@code *}
     *         and parentheses, or nests parentheses deeper than
     *         {@value #MAX_NESTING}
     */
    public List<String> derive(String expression) throws DerivationException {
        String compact = compact(expression == null ? "" : expression);
        List<String> steps = new ArrayList<>();
        expressionRules(compact, 0, steps);
        logger.debug("Derived {} productions for '{}'", steps.size(), compact);
        return steps;
    }

    private void expressionRules(String expr, int nesting, List<String> steps) throws DerivationException {
        List<String> terms = splitTopLevel(expr, '+');
        for (int i = 1; i < terms.size(); i++) {
            steps.add("<expression> ::= <expression> + <term>");
        }
        steps.add("<expression> ::= <term>");
        for (String term : terms) {
            termRules(term, nesting, steps);
        }
    }

    private void termRules(String expr, int nesting, List<String> steps) throws DerivationException {
        List<String> factors = splitTopLevel(expr, '*');
        for (int i = 1; i < factors.size(); i++) {
            steps.add("<term> ::= <term> * <factor>");
        }
        steps.add("<term> ::= <factor>");
        for (String factor : factors) {
            factorRules(factor, nesting, steps);
        }
    }

    private void factorRules(String expr, int nesting, List<String> steps) throws DerivationException {
        if (expr.isEmpty()) {
            throw new DerivationException("Malformed expression: missing operand");
        }
        if (expr.charAt(0) == '(') {
            if (matchingParen(expr) != expr.length() - 1) {
                throw new DerivationException("Malformed expression: unbalanced parentheses in '" + expr + "'");
            }
            if (nesting == MAX_NESTING) {
                throw new DerivationException("Expression nested too deeply");
            }
            steps.add("<factor> ::= ( <expression> )");
            expressionRules(expr.substring(1, expr.length() - 1), nesting + 1, steps);
            return;
        }
        if (!TERMINAL.matcher(expr).matches()) {
            throw new DerivationException("Malformed expression: '" + expr + "' is not a factor");
        }
        steps.add("<factor> ::= " + expr);
    }

    // drops whitespace outside string literals
    private static String compact(String expr) {
        StringBuilder out = new StringBuilder(expr.length());
        boolean quoted = false;
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            }
            if (quoted || !Character.isWhitespace(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static List<String> splitTopLevel(String expr, char operator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        boolean quoted = false;
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == operator && depth == 0) {
                parts.add(expr.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(expr.substring(start));
        return parts;
    }

    private static int matchingParen(String expr) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static Optional<DerivationNode> derivableExpression(DerivationNode statement) {
        if (statement.getSymbol() != NonTerminal.STATEMENT || statement.getChildren().isEmpty()) {
            return Optional.empty();
        }
        DerivationNode body = statement.child(0);
        if (body.getSymbol() == NonTerminal.EXPRESSION) {
            return Optional.of(body);
        }
        if (body.getSymbol() == NonTerminal.DECLARATION) {
            return body.firstChild(NonTerminal.EXPRESSION);
        }
        return Optional.empty();
    }
}
