package com.grammar.playground.analyzer.parser;

import com.grammar.playground.analyzer.lexer.Token;
import com.grammar.playground.analyzer.lexer.TokenType;
import com.grammar.playground.exception.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Predictive recursive-descent parser for a single statement.
 *
 * <pre>
 * statement       → declaration | expression | if_statement | while_statement
 * declaration     → TYPE ID [ASSIGN expression]
 * expression      → term expression'
 * expression'     → PLUS term expression' | ε
 * term            → factor term'
 * term'           → MULTIPLY factor term' | ε
 * factor          → LPAREN expression RPAREN | ID | NUMBER | DECIMAL | STRING | BOOL
 * if_statement    → IF LPAREN condition RPAREN
 * while_statement → WHILE LPAREN condition RPAREN
 * condition       → expression RELOP expression
 * </pre>
 *
 * The first syntax error aborts the parse; there is no resynchronization.
 * Parenthesized factors may nest at most {@value #MAX_NESTING} deep. The
 * tail productions are built with loops, so long operator chains do not
 * grow the call stack.
 */
public final class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> TYPE_KEYWORDS =
            EnumSet.of(TokenType.INT, TokenType.DOUBLE, TokenType.STRING_TYPE, TokenType.BOOL_TYPE);

    private static final Set<TokenType> FACTOR_TERMINALS =
            EnumSet.of(TokenType.ID, TokenType.NUMBER, TokenType.DECIMAL, TokenType.STRING, TokenType.BOOL);

    static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private int current;
    private int nesting;

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Parses exactly one statement and requires every token to be consumed.
     *
     * @throws SyntaxException on the first token that no production accepts
     */
    public DerivationNode parseStatement() throws SyntaxException {
        current = 0;
        nesting = 0;
        DerivationNode statement = statement();
        if (!atEnd()) {
            throw unexpected(peek());
        }
        logger.debug("Parsed statement: {}", statement.productions());
        return statement;
    }

    private DerivationNode statement() throws SyntaxException {
        Token next = peek();
        if (next != null && TYPE_KEYWORDS.contains(next.type())) {
            return DerivationNode.interior(NonTerminal.STATEMENT, "declaration").add(declaration());
        }
        if (check(TokenType.IF)) {
            return DerivationNode.interior(NonTerminal.STATEMENT, "if_statement")
                    .add(guardedStatement(NonTerminal.IF_STATEMENT, TokenType.IF));
        }
        if (check(TokenType.WHILE)) {
            return DerivationNode.interior(NonTerminal.STATEMENT, "while_statement")
                    .add(guardedStatement(NonTerminal.WHILE_STATEMENT, TokenType.WHILE));
        }
        return DerivationNode.interior(NonTerminal.STATEMENT, "expression").add(expression());
    }

    private DerivationNode declaration() throws SyntaxException {
        Token type = advance();
        Token name = expect(TokenType.ID);

        if (!check(TokenType.ASSIGN)) {
            return DerivationNode.interior(NonTerminal.DECLARATION, type.type() + " ID")
                    .add(DerivationNode.leaf(type))
                    .add(DerivationNode.leaf(name));
        }

        Token assign = advance();
        return DerivationNode.interior(NonTerminal.DECLARATION, type.type() + " ID ASSIGN expression")
                .add(DerivationNode.leaf(type))
                .add(DerivationNode.leaf(name))
                .add(DerivationNode.leaf(assign))
                .add(expression());
    }

    private DerivationNode expression() throws SyntaxException {
        return DerivationNode.interior(NonTerminal.EXPRESSION, "term expression'")
                .add(term())
                .add(expressionTail());
    }

    private DerivationNode expressionTail() throws SyntaxException {
        DerivationNode head = null;
        DerivationNode last = null;
        while (check(TokenType.PLUS)) {
            DerivationNode tail = DerivationNode.interior(NonTerminal.EXPRESSION_TAIL, "+ term expression'")
                    .add(DerivationNode.leaf(advance()))
                    .add(term());
            if (last == null) {
                head = tail;
            } else {
                last.add(tail);
            }
            last = tail;
        }
        return closeChain(head, last, NonTerminal.EXPRESSION_TAIL);
    }

    private DerivationNode term() throws SyntaxException {
        return DerivationNode.interior(NonTerminal.TERM, "factor term'")
                .add(factor())
                .add(termTail());
    }

    private DerivationNode termTail() throws SyntaxException {
        DerivationNode head = null;
        DerivationNode last = null;
        while (check(TokenType.MULTIPLY)) {
            DerivationNode tail = DerivationNode.interior(NonTerminal.TERM_TAIL, "* factor term'")
                    .add(DerivationNode.leaf(advance()))
                    .add(factor());
            if (last == null) {
                head = tail;
            } else {
                last.add(tail);
            }
            last = tail;
        }
        return closeChain(head, last, NonTerminal.TERM_TAIL);
    }

    // every tail chain ends in an ε production
    private static DerivationNode closeChain(DerivationNode head, DerivationNode last, NonTerminal symbol) {
        DerivationNode epsilon = DerivationNode.interior(symbol, "ε");
        if (last == null) {
            return epsilon;
        }
        last.add(epsilon);
        return head;
    }

    private DerivationNode factor() throws SyntaxException {
        Token next = peek();
        if (next == null) {
            throw unexpected(null);
        }
        if (next.type() == TokenType.LPAREN) {
            if (nesting == MAX_NESTING) {
                throw new SyntaxException("Syntax Error: Expression nested too deeply at position " + next.position());
            }
            nesting++;
            DerivationNode factor = DerivationNode.interior(NonTerminal.FACTOR, "( expression )")
                    .add(DerivationNode.leaf(advance()))
                    .add(expression());
            factor.add(DerivationNode.leaf(expect(TokenType.RPAREN)));
            nesting--;
            return factor;
        }
        if (FACTOR_TERMINALS.contains(next.type())) {
            return DerivationNode.interior(NonTerminal.FACTOR, next.type().name())
                    .add(DerivationNode.leaf(advance()));
        }
        throw unexpected(next);
    }

    private DerivationNode guardedStatement(NonTerminal symbol, TokenType keyword) throws SyntaxException {
        DerivationNode node = DerivationNode.interior(symbol, keyword + " LPAREN condition RPAREN")
                .add(DerivationNode.leaf(expect(keyword)))
                .add(DerivationNode.leaf(expect(TokenType.LPAREN)))
                .add(condition());
        return node.add(DerivationNode.leaf(expect(TokenType.RPAREN)));
    }

    private DerivationNode condition() throws SyntaxException {
        DerivationNode left = expression();
        Token relation = peek();
        if (relation == null || !relation.type().isRelational()) {
            throw unexpected(relation);
        }
        advance();
        return DerivationNode.interior(NonTerminal.CONDITION, "expression " + relation.type() + " expression")
                .add(left)
                .add(DerivationNode.leaf(relation))
                .add(expression());
    }

    private Token expect(TokenType type) throws SyntaxException {
        Token next = peek();
        if (next == null || next.type() != type) {
            throw unexpected(next);
        }
        return advance();
    }

    private boolean check(TokenType type) {
        Token next = peek();
        return next != null && next.type() == type;
    }

    private Token peek() {
        return atEnd() ? null : tokens.get(current);
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private boolean atEnd() {
        return current >= tokens.size();
    }

    private static SyntaxException unexpected(Token token) {
        if (token == null) {
            return new SyntaxException("Syntax Error: Unexpected end of input");
        }
        return new SyntaxException("Syntax Error: Unexpected token " + token.type()
                + " ('" + token.lexeme() + "') at position " + token.position());
    }
}
