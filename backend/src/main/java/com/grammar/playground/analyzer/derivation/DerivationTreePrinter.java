package com.grammar.playground.analyzer.derivation;

import com.grammar.playground.analyzer.parser.DerivationNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders a derivation tree as indented text, one production per line.
 */
public final class DerivationTreePrinter {

    private DerivationTreePrinter() {
    }

    public static String render(DerivationNode root) {
        if (root == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        Deque<Line> pending = new ArrayDeque<>();
        pending.push(new Line(root, 0, ""));
        while (!pending.isEmpty()) {
            Line line = pending.pop();
            out.append(line.prefix()).append(line.level() > 0 ? "├── " : "")
                    .append(line.node().getProduction()).append('\n');

            List<DerivationNode> children = line.node().getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                boolean last = i == children.size() - 1;
                String childPrefix = line.level() == 0 ? line.prefix() : line.prefix() + (last ? "    " : "│   ");
                pending.push(new Line(children.get(i), line.level() + 1, childPrefix));
            }
        }
        return out.toString();
    }

    private record Line(DerivationNode node, int level, String prefix) {
    }
}
