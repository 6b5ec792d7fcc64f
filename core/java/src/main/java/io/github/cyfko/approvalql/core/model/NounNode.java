package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;

import java.util.Map;

/**
 * A bare name such as a user, an org or a special group ({@code us}, {@code them}, {@code anyone}),
 * optionally qualified by an attribute block.
 *
 * @param name       the noun, never empty
 * @param attributes attribute block in source order, empty when absent
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NounNode(String name, Map<String, String> attributes) implements RuleNode {

    public NounNode {
        Attributes.requireName(name, "name");
        attributes = Attributes.copyOf(attributes);
    }

    public NounNode(String name) {
        this(name, Map.of());
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitNoun(this);
    }
}
