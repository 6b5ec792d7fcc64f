package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;

import java.util.Objects;

/**
 * A joiner with both operands.
 *
 * @param joiner {@link Joiner#AND} or {@link Joiner#OR}
 * @param left   left operand
 * @param right  right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AndOrNode(Joiner joiner, RuleNode left, RuleNode right) implements RuleNode {

    public AndOrNode {
        Objects.requireNonNull(joiner, "joiner");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public static AndOrNode and(RuleNode left, RuleNode right) {
        return new AndOrNode(Joiner.AND, left, right);
    }

    public static AndOrNode or(RuleNode left, RuleNode right) {
        return new AndOrNode(Joiner.OR, left, right);
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitAndOr(this);
    }
}
