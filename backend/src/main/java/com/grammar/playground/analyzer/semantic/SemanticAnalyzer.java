package com.grammar.playground.analyzer.semantic;

import com.grammar.playground.analyzer.lexer.Token;
import com.grammar.playground.analyzer.lexer.TokenType;
import com.grammar.playground.analyzer.parser.DerivationNode;
import com.grammar.playground.analyzer.parser.NonTerminal;
import com.grammar.playground.analyzer.semantic.SemanticError.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable declaration tracking and static type checking over a derivation
 * tree.
 * <p>
 * The symbol table lives as long as the analyzer. Callers that analyze
 * independent inputs must {@link #reset()} in between, otherwise declarations
 * from one input are visible to the next.
 */
public final class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final SymbolTable symbols = new SymbolTable();

    public Optional<SemanticError> declareVariable(String name, TypeTag type, int line) {
        Optional<SymbolEntry> existing = symbols.lookup(name);
        if (existing.isPresent()) {
            return Optional.of(new SemanticError(Kind.REDECLARATION,
                    "Semantic Error: Variable '" + name + "' already declared at line "
                            + existing.get().declarationLine()));
        }
        symbols.declare(name, type, line);
        logger.debug("Declared {} {} at line {}", type.keyword(), name, line);
        return Optional.empty();
    }

    public Optional<SemanticError> checkVariable(String name) {
        if (symbols.contains(name)) {
            return Optional.empty();
        }
        return Optional.of(new SemanticError(Kind.NOT_DECLARED,
                "Semantic Error: Variable '" + name + "' not declared"));
    }

    /**
     * Type of an expression subtree. Operands and operators are folded left to
     * right in the order they appear, ignoring grouping; the first invalid
     * pair collapses the result to {@link TypeTag#TYPE_ERROR}.
     */
    public TypeTag expressionType(DerivationNode expression) {
        return fold(expression).type();
    }

    /**
     * Checks that an initializer fits the declared type. Numeric promotion is
     * allowed inside the expression but not at the declaration itself, so an
     * int expression does not fit a double variable.
     */
    public Optional<SemanticError> checkCompatibility(TypeTag declaredType, DerivationNode expression,
            String varName) {
        Folding folding = fold(expression);
        TypeTag actual = folding.type();

        if (actual == TypeTag.UNDECLARED || actual == TypeTag.UNKNOWN) {
            return Optional.empty();
        }
        if (actual == TypeTag.TYPE_ERROR) {
            return Optional.of(new SemanticError(Kind.INVALID_OPERATION,
                    "Semantic Error: Cannot perform '" + folding.operator().subtype() + "' operation between "
                            + folding.left().displayName() + " and " + folding.right().displayName()
                            + " in assignment to variable '" + varName + "'"));
        }
        if (actual != declaredType) {
            return Optional.of(new SemanticError(Kind.TYPE_MISMATCH,
                    "Semantic Error: Cannot assign " + actual.displayName() + " value to "
                            + declaredType.displayName() + " variable '" + varName + "'"));
        }
        return Optional.empty();
    }

    /**
     * Runs the declaration and reference checks over a statement tree in
     * source order. A declaration's initializer is visited before the
     * variable is declared, so {@code int x = x} refers to an undeclared x.
     *
     * @return every error found, including the unreported not-declared kind
     */
    public List<SemanticError> analyze(DerivationNode statement) {
        List<SemanticError> errors = new ArrayList<>();
        visit(statement, errors);
        logger.debug("Semantic pass found {} errors, {} symbols declared", errors.size(), symbols.size());
        return errors;
    }

    public Map<String, SymbolEntry> getSymbols() {
        return symbols.snapshot();
    }

    public void reset() {
        symbols.clear();
    }

    static boolean isOperationValid(TypeTag left, TokenType operator, TypeTag right) {
        if (operator != TokenType.PLUS && operator != TokenType.MULTIPLY) {
            return false;
        }
        if (left.isNumeric() && right.isNumeric()) {
            return true;
        }
        return operator == TokenType.PLUS && left == TypeTag.STRING && right == TypeTag.STRING;
    }

    static TypeTag resultType(TypeTag left, TypeTag right) {
        if (left == TypeTag.DOUBLE || right == TypeTag.DOUBLE) {
            return TypeTag.DOUBLE;
        }
        if (left == TypeTag.STRING || right == TypeTag.STRING) {
            return TypeTag.STRING;
        }
        return left;
    }

    private void visit(DerivationNode root, List<SemanticError> errors) {
        Deque<DerivationNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DerivationNode node = pending.pop();
            if (node.getSymbol() == NonTerminal.DECLARATION) {
                visitDeclaration(node, errors);
                continue;
            }
            if (node.getSymbol() == NonTerminal.FACTOR && node.child(0).isLeaf()
                    && node.child(0).getToken().type() == TokenType.ID) {
                checkVariable(node.child(0).getToken().lexeme()).ifPresent(errors::add);
            }
            List<DerivationNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    private void visitDeclaration(DerivationNode declaration, List<SemanticError> errors) {
        Token typeKeyword = declaration.child(0).getToken();
        Token name = declaration.child(1).getToken();
        DerivationNode initializer = declaration.firstChild(NonTerminal.EXPRESSION).orElse(null);

        if (initializer != null) {
            visit(initializer, errors);
        }

        TypeTag declared = TypeTag.forKeyword(typeKeyword.type())
                .orElseThrow(() -> new IllegalStateException("Not a type keyword: " + typeKeyword));

        Optional<SemanticError> redeclared = declareVariable(name.lexeme(), declared, name.line());
        if (redeclared.isPresent()) {
            errors.add(redeclared.get());
            return;
        }
        if (initializer == null) {
            return;
        }

        Optional<SemanticError> incompatible = checkCompatibility(declared, initializer, name.lexeme());
        if (incompatible.isPresent()) {
            errors.add(incompatible.get());
        } else {
            symbols.markInitialized(name.lexeme());
        }
    }

    private Folding fold(DerivationNode expression) {
        if (expression == null) {
            return Folding.of(TypeTag.UNKNOWN);
        }

        List<TypeTag> operands = new ArrayList<>();
        List<TokenType> operators = new ArrayList<>();
        collect(expression, operands, operators);

        if (operands.isEmpty()) {
            return Folding.of(TypeTag.UNKNOWN);
        }

        TypeTag running = operands.get(0);
        for (int i = 0; i < operators.size() && i + 1 < operands.size(); i++) {
            TokenType operator = operators.get(i);
            TypeTag next = operands.get(i + 1);
            if (!isOperationValid(running, operator, next)) {
                return new Folding(TypeTag.TYPE_ERROR, running, operator, next);
            }
            running = resultType(running, next);
        }
        return Folding.of(running);
    }

    private void collect(DerivationNode expression, List<TypeTag> operands, List<TokenType> operators) {
        for (DerivationNode node : DerivationNode.preOrder(expression)) {
            if (!node.isLeaf()) {
                continue;
            }
            TokenType type = node.getToken().type();
            if (type == TokenType.PLUS || type == TokenType.MULTIPLY) {
                operators.add(type);
            } else if (type == TokenType.ID) {
                operands.add(symbols.lookup(node.getToken().lexeme())
                        .map(SymbolEntry::declaredType)
                        .orElse(TypeTag.UNDECLARED));
            } else {
                TypeTag.forLiteral(type).ifPresent(operands::add);
            }
        }
    }

    /** Result of folding an expression; the operand pair is set only for TYPE_ERROR. */
    private record Folding(TypeTag type, TypeTag left, TokenType operator, TypeTag right) {

        static Folding of(TypeTag type) {
            return new Folding(type, null, null, null);
        }
    }
}
