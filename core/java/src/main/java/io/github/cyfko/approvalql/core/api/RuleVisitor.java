package io.github.cyfko.approvalql.core.api;

import io.github.cyfko.approvalql.core.model.AndOrNode;
import io.github.cyfko.approvalql.core.model.AnonymousNode;
import io.github.cyfko.approvalql.core.model.FunctionNode;
import io.github.cyfko.approvalql.core.model.NotNode;
import io.github.cyfko.approvalql.core.model.NounNode;
import io.github.cyfko.approvalql.core.model.RuleNode;

/**
 * Variant dispatch over a parsed approval rule.
 * <p>
 * Evaluators, validators and printers implement this interface and call {@link RuleNode#accept(RuleVisitor)}
 * on the root. Visiting children is left to the implementation, so a visitor decides its own traversal order
 * and may short-circuit.
 * </p>
 *
 * <pre>{@code
 * int nouns = rule.accept(new RuleVisitor<Integer>() {
 *     public Integer visitNoun(NounNode node)           { return 1; }
 *     public Integer visitAnonymous(AnonymousNode node) { return 0; }
 *     public Integer visitFunction(FunctionNode node)   { return node.parameters().stream().mapToInt(p -> p.accept(this)).sum(); }
 *     public Integer visitAndOr(AndOrNode node)         { return node.left().accept(this) + node.right().accept(this); }
 *     public Integer visitNot(NotNode node)             { return node.child().accept(this); }
 * });
 * }</pre>
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RuleVisitor<R> {

    R visitNoun(NounNode node);

    R visitAnonymous(AnonymousNode node);

    R visitFunction(FunctionNode node);

    R visitAndOr(AndOrNode node);

    R visitNot(NotNode node);
}
