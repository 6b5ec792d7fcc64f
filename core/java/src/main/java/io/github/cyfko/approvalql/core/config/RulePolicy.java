package io.github.cyfko.approvalql.core.config;

/**
 * Configuration of rule parser complexity limits for DoS protection.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum length of the rule text in code points (default: 10000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum nesting of groups and function arguments (default: 64)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * RulePolicy policy = RulePolicy.defaults();
 *
 * // Strict (rules submitted by untrusted repository owners)
 * RulePolicy policy = RulePolicy.strict();
 *
 * // Relaxed (rules maintained by administrators)
 * RulePolicy policy = RulePolicy.relaxed();
 *
 * // Custom
 * RulePolicy policy = RulePolicy.builder()
 *     .maxExpressionLength(2000)
 *     .maxNestingDepth(8)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum code point length of the rule text
 * @param maxNestingDepth     maximum depth of nested parentheses, groups and calls alike
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RulePolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or any limit is not positive
     */
    public RulePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration, large enough for any hand-written approval rule.
     * <ul>
     *   <li>Max Expression Length: 10000 code points</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return default configuration
     */
    public static RulePolicy defaults() {
        return new RulePolicy(PolicyName.DEFAULT_POLICY.name(), 10_000, 64);
    }

    /**
     * Strict configuration for rules coming from untrusted sources.
     * <ul>
     *   <li>Max Expression Length: 1000 code points</li>
     *   <li>Max Nesting Depth: 16</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static RulePolicy strict() {
        return new RulePolicy(PolicyName.STRICT_POLICY.name(), 1_000, 16);
    }

    /**
     * Relaxed configuration for trusted, generated rules.
     * <ul>
     *   <li>Max Expression Length: 100000 code points</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static RulePolicy relaxed() {
        return new RulePolicy(PolicyName.RELAXED_POLICY.name(), 100_000, 256);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 10_000;
        private int _maxNestingDepth = 64;

        private Builder() {}

        public RulePolicy build() {
            return new RulePolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
