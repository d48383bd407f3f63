package com.grammar.playground.analyzer.parser;

import com.grammar.playground.analyzer.lexer.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One application of a grammar production. Interior nodes carry the
 * non-terminal they expand; leaves carry the token they matched. Children are
 * owned by their parent, so the tree never shares a node.
 */
public final class DerivationNode {

    private final NonTerminal symbol;
    private final Token token;
    private final String production;
    private final List<DerivationNode> children = new ArrayList<>();

    private DerivationNode(NonTerminal symbol, Token token, String production) {
        this.symbol = symbol;
        this.token = token;
        this.production = Objects.requireNonNull(production, "production");
    }

    public static DerivationNode interior(NonTerminal symbol, String rightHandSide) {
        return new DerivationNode(Objects.requireNonNull(symbol, "symbol"), null,
                symbol.label() + " → " + rightHandSide);
    }

    public static DerivationNode leaf(Token token) {
        String shown = token.value().toString();
        return new DerivationNode(null, token, token.type().name() + " → " + shown);
    }

    public DerivationNode add(DerivationNode child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    public String getLabel() {
        return symbol != null ? symbol.label() : token.type().name();
    }

    public String getProduction() {
        return production;
    }

    /** Non-terminal of an interior node, {@code null} for leaves. */
    public NonTerminal getSymbol() {
        return symbol;
    }

    /** Token of a leaf, {@code null} for interior nodes. */
    public Token getToken() {
        return token;
    }

    public boolean isLeaf() {
        return token != null;
    }

    public List<DerivationNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public DerivationNode child(int index) {
        return children.get(index);
    }

    /** Productions of this subtree in pre-order, i.e. leftmost derivation order. */
    public List<String> productions() {
        List<String> out = new ArrayList<>();
        collectProductions(this, out);
        return out;
    }

    /** Leaf tokens of this subtree, left to right. */
    public List<Token> tokens() {
        List<Token> out = new ArrayList<>();
        collectTokens(this, out);
        return out;
    }

    public Optional<DerivationNode> firstChild(NonTerminal wanted) {
        return children.stream().filter(c -> c.symbol == wanted).findFirst();
    }

    private static void collectProductions(DerivationNode root, List<String> out) {
        for (DerivationNode node : preOrder(root)) {
            out.add(node.production);
        }
    }

    private static void collectTokens(DerivationNode root, List<Token> out) {
        for (DerivationNode node : preOrder(root)) {
            if (node.token != null) {
                out.add(node.token);
            }
        }
    }

    /**
     * Nodes of the subtree rooted at {@code root} in pre-order. Iterative, as
     * operator chains nest as deep as the statement is long.
     */
    public static List<DerivationNode> preOrder(DerivationNode root) {
        List<DerivationNode> out = new ArrayList<>();
        Deque<DerivationNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DerivationNode node = pending.pop();
            out.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return production;
    }
}
