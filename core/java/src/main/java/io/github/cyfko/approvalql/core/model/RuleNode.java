package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;

/**
 * A node of a parsed approval rule.
 * <p>
 * The hierarchy is closed: a tree is made of exactly five variants, all immutable records.
 * </p>
 * <table border="1">
 * <caption>Node variants</caption>
 * <thead>
 * <tr><th>Variant</th><th>Source form</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link NounNode}</td><td>name, optional attribute block</td><td>{@code reviewers[self=false]}</td></tr>
 * <tr><td>{@link AnonymousNode}</td><td>brace-delimited set, optional attribute block</td><td>{@code {alice, bob}[count=2]}</td></tr>
 * <tr><td>{@link FunctionNode}</td><td>name followed by parenthesised arguments</td><td>{@code nof(a, b, 1)}</td></tr>
 * <tr><td>{@link AndOrNode}</td><td>{@code and} / {@code or} joiner</td><td>{@code a or b}</td></tr>
 * <tr><td>{@link NotNode}</td><td>{@code not} prefix</td><td>{@code not them}</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Consumers dispatch on the variant with {@link #accept(RuleVisitor)}. Two trees are structurally equal
 * exactly when they are {@link Object#equals(Object) equal}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface RuleNode permits NounNode, AnonymousNode, FunctionNode, AndOrNode, NotNode {

    /**
     * Dispatches to the visitor method matching this node's variant.
     *
     * @param visitor the visitor
     * @param <R>     result type
     * @return whatever the visitor returns
     */
    <R> R accept(RuleVisitor<R> visitor);
}
