package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;

import java.util.List;
import java.util.Map;

/**
 * An ad-hoc group written as {@code {a, b, c}}, optionally qualified by an attribute block.
 * The member list may be empty.
 *
 * @param members    member names in source order
 * @param attributes attribute block in source order, empty when absent
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AnonymousNode(List<String> members, Map<String, String> attributes) implements RuleNode {

    public AnonymousNode {
        members = List.copyOf(members);
        members.forEach(member -> Attributes.requireName(member, "member"));
        attributes = Attributes.copyOf(attributes);
    }

    public AnonymousNode(List<String> members) {
        this(members, Map.of());
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitAnonymous(this);
    }
}
