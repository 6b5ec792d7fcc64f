package io.github.cyfko.approvalql.core.utils;

import io.github.cyfko.approvalql.core.api.RuleVisitor;
import io.github.cyfko.approvalql.core.model.AndOrNode;
import io.github.cyfko.approvalql.core.model.AnonymousNode;
import io.github.cyfko.approvalql.core.model.FunctionNode;
import io.github.cyfko.approvalql.core.model.NotNode;
import io.github.cyfko.approvalql.core.model.NounNode;
import io.github.cyfko.approvalql.core.model.RuleNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a parse tree back into canonical rule text.
 * <p>
 * A joiner's right operand and the child of {@code not} extend to the end of the enclosing level, so they
 * are written bare; only a compound left operand of a joiner is parenthesised. The output parses back into
 * an equal tree and never nests deeper than the text the tree was parsed from.
 * </p>
 * <p>
 * Rendering works on an explicit stack, so arbitrarily long joiner and {@code not} chains are supported.
 * </p>
 *
 * <pre>{@code
 * RuleFormatter.format(parser.parse("a and (b or c)"));        // "a and b or c"
 * RuleFormatter.format(parser.parse("(not x) and {p,q}[n=1]")); // "(not x) and {p, q}[n=1]"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RuleFormatter {

    /** Splits a node into literal text and child nodes still to be rendered, in output order. */
    private static final RuleVisitor<List<Object>> EXPANDER = new RuleVisitor<>() {
        @Override
        public List<Object> visitNoun(NounNode node) {
            return List.of(node.name() + attributes(node.attributes()));
        }

        @Override
        public List<Object> visitAnonymous(AnonymousNode node) {
            return List.of("{" + String.join(", ", node.members()) + "}" + attributes(node.attributes()));
        }

        @Override
        public List<Object> visitFunction(FunctionNode node) {
            List<Object> parts = new ArrayList<>();
            parts.add(node.name() + "(");
            for (int i = 0; i < node.parameters().size(); i++) {
                if (i > 0) parts.add(", ");
                parts.add(node.parameters().get(i));
            }
            parts.add(")");
            return parts;
        }

        @Override
        public List<Object> visitAndOr(AndOrNode node) {
            String joiner = " " + node.joiner().keyword() + " ";
            RuleNode left = node.left();
            if (left instanceof AndOrNode || left instanceof NotNode) {
                return List.of("(", left, ")" + joiner, node.right());
            }
            return List.of(left, joiner, node.right());
        }

        @Override
        public List<Object> visitNot(NotNode node) {
            return List.of("not ", node.child());
        }
    };

    private RuleFormatter() {}

    /**
     * @param rule the tree to render
     * @return rule text that parses back into an equal tree
     */
    public static String format(RuleNode rule) {
        Objects.requireNonNull(rule, "rule");

        StringBuilder text = new StringBuilder();
        Deque<Object> work = new ArrayDeque<>();
        work.push(rule);
        while (!work.isEmpty()) {
            Object next = work.pop();
            if (next instanceof RuleNode node) {
                List<Object> parts = node.accept(EXPANDER);
                for (int i = parts.size() - 1; i >= 0; i--) {
                    work.push(parts.get(i));
                }
            } else {
                text.append(next);
            }
        }
        return text.toString();
    }

    private static String attributes(Map<String, String> attributes) {
        if (attributes.isEmpty()) return "";
        return attributes.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(",", "[", "]"));
    }
}
