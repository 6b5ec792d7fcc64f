package io.github.cyfko.approvalql.core.impl;

import io.github.cyfko.approvalql.core.api.RuleParser;
import io.github.cyfko.approvalql.core.config.RulePolicy;
import io.github.cyfko.approvalql.core.exception.RuleSyntaxException;
import io.github.cyfko.approvalql.core.model.RuleNode;
import io.github.cyfko.approvalql.core.parsing.RuleScanner;
import io.github.cyfko.approvalql.core.parsing.RuleTreeBuilder;
import io.github.cyfko.approvalql.core.parsing.Token;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link RuleParser}: {@link RuleScanner} followed by a {@link RuleTreeBuilder}.
 * <p>
 * The parser holds nothing but its {@link RulePolicy}; every call works on its own builder, so one
 * instance can serve any number of threads.
 * </p>
 *
 * <h2>DoS Protection (Complexity Limits)</h2>
 * <ul>
 *   <li><strong>Expression Length</strong>: rule text longer than {@link RulePolicy#maxExpressionLength()} is rejected before scanning</li>
 *   <li><strong>Nesting Depth</strong>: groups and calls nested deeper than {@link RulePolicy#maxNestingDepth()} are rejected while parsing</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * RuleParser parser = new BasicRuleParser();
 * RuleNode rule = parser.parse("us and not them or nof({alice, bob}, 1)");
 *
 * // Strict configuration (rules from untrusted repositories)
 * RuleParser strictParser = new BasicRuleParser(RulePolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicRuleParser implements RuleParser {

    private static final Logger logger = Logger.getLogger(BasicRuleParser.class.getName());

    private final RulePolicy rulePolicy;

    /**
     * Default constructor using {@link RulePolicy#defaults()}.
     */
    public BasicRuleParser() {
        this(RulePolicy.defaults());
    }

    /**
     * Constructor with custom limits.
     *
     * @param rulePolicy the complexity limits to enforce
     * @throws IllegalArgumentException if rulePolicy is null
     */
    public BasicRuleParser(RulePolicy rulePolicy) {
        if (rulePolicy == null) {
            throw new IllegalArgumentException("Rule policy is required");
        }
        this.rulePolicy = rulePolicy;
    }

    public RulePolicy getRulePolicy() {
        return rulePolicy;
    }

    @Override
    public RuleNode parse(String ruleExpression) throws RuleSyntaxException {
        if (ruleExpression == null || ruleExpression.isEmpty()) {
            throw new RuleSyntaxException("rule expression cannot be null or empty");
        }

        int length = ruleExpression.codePointCount(0, ruleExpression.length());
        if (length > rulePolicy.maxExpressionLength()) {
            logger.fine(() -> String.format("Rejected rule of %d characters under %s", length, rulePolicy.policyName()));
            throw new RuleSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    length, rulePolicy.maxExpressionLength(), rulePolicy.policyName()
            ));
        }

        return parse(RuleScanner.scan(ruleExpression));
    }

    @Override
    public RuleNode parse(List<Token> tokens) throws RuleSyntaxException {
        Objects.requireNonNull(tokens, "tokens");

        RuleNode root = new RuleTreeBuilder(tokens, rulePolicy).build();
        logger.fine(() -> "Parsed rule of " + tokens.size() + " tokens");
        return root;
    }
}
