package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;

import java.util.Objects;

/**
 * Negation of the child expression.
 *
 * @param child the negated expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NotNode(RuleNode child) implements RuleNode {

    public NotNode {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
