package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;

import java.util.List;

/**
 * A call such as {@code nof(a, b, 1)}. Every argument is a full expression.
 *
 * @param name       the function name
 * @param parameters the arguments in source order, at least one
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionNode(String name, List<RuleNode> parameters) implements RuleNode {

    public FunctionNode {
        Attributes.requireName(name, "name");
        parameters = List.copyOf(parameters);
        if (parameters.isEmpty()) {
            throw new IllegalArgumentException("function " + name + " requires at least one parameter");
        }
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
