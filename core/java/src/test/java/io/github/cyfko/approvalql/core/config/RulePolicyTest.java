package io.github.cyfko.approvalql.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RulePolicy Tests")
class RulePolicyTest {

    @Nested
    @DisplayName("Presets")
    class PresetTests {

        @Test
        @DisplayName("Default preset")
        void testDefaults() {
            RulePolicy policy = RulePolicy.defaults();

            assertEquals("DEFAULT_POLICY", policy.policyName());
            assertEquals(10_000, policy.maxExpressionLength());
            assertEquals(64, policy.maxNestingDepth());
        }

        @Test
        @DisplayName("Strict preset is tighter than default")
        void testStrict() {
            RulePolicy policy = RulePolicy.strict();

            assertEquals("STRICT_POLICY", policy.policyName());
            assertEquals(1_000, policy.maxExpressionLength());
            assertEquals(16, policy.maxNestingDepth());
        }

        @Test
        @DisplayName("Relaxed preset is looser than default")
        void testRelaxed() {
            RulePolicy policy = RulePolicy.relaxed();

            assertEquals("RELAXED_POLICY", policy.policyName());
            assertTrue(policy.maxExpressionLength() > RulePolicy.defaults().maxExpressionLength());
            assertTrue(policy.maxNestingDepth() > RulePolicy.defaults().maxNestingDepth());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Builder starts from default limits")
        void testBuilderDefaults() {
            RulePolicy policy = RulePolicy.builder().build();

            assertEquals("CUSTOM_POLICY", policy.policyName());
            assertEquals(RulePolicy.defaults().maxExpressionLength(), policy.maxExpressionLength());
            assertEquals(RulePolicy.defaults().maxNestingDepth(), policy.maxNestingDepth());
        }

        @Test
        @DisplayName("Builder overrides")
        void testBuilderOverrides() {
            RulePolicy policy = RulePolicy.builder()
                    .policyName("REPO_RULES")
                    .maxExpressionLength(200)
                    .maxNestingDepth(4)
                    .build();

            assertEquals(new RulePolicy("REPO_RULES", 200, 4), policy);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @ParameterizedTest
        @ValueSource(ints = {0, -1})
        @DisplayName("Non-positive expression length is rejected")
        void testInvalidLength(int length) {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> RulePolicy.builder().maxExpressionLength(length).build());
            assertEquals("maxExpressionLength must be positive, got: " + length, exception.getMessage());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -5})
        @DisplayName("Non-positive nesting depth is rejected")
        void testInvalidDepth(int depth) {
            assertThrows(IllegalArgumentException.class, () -> RulePolicy.builder().maxNestingDepth(depth).build());
        }

        @Test
        @DisplayName("Blank name is rejected")
        void testBlankName() {
            assertThrows(IllegalArgumentException.class, () -> new RulePolicy(" ", 10, 1));
            assertThrows(IllegalArgumentException.class, () -> new RulePolicy(null, 10, 1));
        }
    }
}
