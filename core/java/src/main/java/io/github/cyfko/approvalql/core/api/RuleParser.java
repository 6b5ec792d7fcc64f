package io.github.cyfko.approvalql.core.api;

import io.github.cyfko.approvalql.core.exception.RuleSyntaxException;
import io.github.cyfko.approvalql.core.model.RuleNode;
import io.github.cyfko.approvalql.core.parsing.RuleScanner;
import io.github.cyfko.approvalql.core.parsing.Token;

import java.util.List;

/**
 * Parser for the approval rule language.
 * <p>
 * A rule combines nouns (people, orgs, special groups), anonymous sets and function calls with
 * {@code and}, {@code or}, {@code not} and parentheses:
 * </p>
 * <pre>
 * a and b or (us and them) or anyone and not d
 *   or f[self=true,count=10]
 *   and nof(a, b, c[self=false,count=2] and (d or e), 1)
 * </pre>
 *
 * <h2>Grammar</h2>
 * <pre>
 * Expr     := Unary (Joiner Unary)*
 * Joiner   := 'and' | 'or'
 * Unary    := 'not' Unary | Primary
 * Primary  := '(' Expr ')'
 *           | Name '(' Expr (',' Expr)* ')'
 *           | Name Attr?
 *           | Set Attr?
 * Set      := '{' (Name (',' Name)*)? '}'
 * Attr     := '[' Name '=' Name (',' Name '=' Name)* ']'
 * </pre>
 *
 * <h2>Tree Shape</h2>
 * <p>
 * {@code and} and {@code or} share one precedence level. Each joiner takes the operand before it as its left
 * child and everything after it as its right child, so {@code a and b or c} is {@code and(a, or(b, c))}.
 * A {@code not} covers what follows it up to the end of the enclosing expression, so
 * {@code not a and b} is {@code not(and(a, b))}. Parentheses delimit an operand explicitly:
 * {@code (a and b) or c} is {@code or(and(a, b), c)}.
 * </p>
 *
 * <h2>Error Detection</h2>
 * <p>
 * The first problem aborts the parse with a {@link RuleSyntaxException}; no recovery is attempted.
 * </p>
 * <pre>{@code
 * parser.parse("foo[and]");    // invalid 'and' at position 5
 * parser.parse("foo[a=1");     // missing ']' at position 7
 * parser.parse("foo[a,b,c]");  // invalid ',' at position 6
 * parser.parse("a and b)");    // premature end of tokens
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Must be deterministic: the same input yields equal trees or the same message</li>
 *   <li>Must be safe for concurrent use on different inputs</li>
 *   <li>Must never return a tree violating the node invariants</li>
 * </ul>
 *
 * @see RuleScanner
 * @see RuleNode
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RuleParser {

    /**
     * Scans and parses rule text.
     *
     * @param ruleExpression the rule text, must not be null or empty
     * @return the root of the parse tree
     * @throws RuleSyntaxException if the text is empty, exceeds the parser's limits or is not a valid rule
     */
    RuleNode parse(String ruleExpression) throws RuleSyntaxException;

    /**
     * Parses an already scanned token sequence. Every token must be consumed.
     *
     * @param tokens tokens as produced by {@link RuleScanner#scan(String)}
     * @return the root of the parse tree
     * @throws RuleSyntaxException if the tokens do not form a valid rule
     * @throws NullPointerException if tokens is null
     */
    RuleNode parse(List<Token> tokens) throws RuleSyntaxException;
}
