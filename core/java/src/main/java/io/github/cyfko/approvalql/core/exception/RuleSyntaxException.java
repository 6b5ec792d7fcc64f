package io.github.cyfko.approvalql.core.exception;

import io.github.cyfko.approvalql.core.api.RuleParser;
import io.github.cyfko.approvalql.core.impl.BasicRuleParser;

import java.util.OptionalInt;

/**
 * Exception thrown when an approval rule expression cannot be turned into a parse tree.
 * <p>
 * The message is meant to be shown to the author of the rule as is. Whenever the failure can be
 * tied to a character of the input, the message ends with {@code "at position <p>"} and the same
 * 1-based code point offset is available through {@link #getPosition()}.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("foo[and]");    // → "invalid 'and' at position 5"
 * parser.parse("foo[a=1");     // → "missing ']' at position 7"
 * parser.parse("{a b}");       // → "missing ',' at position 4"
 * parser.parse("a b");         // → "invalid noun b at position 3"
 * parser.parse("(a) b)");      // → "invalid noun b at position 5"
 * parser.parse("a)");          // → "premature end of tokens"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     RuleNode rule = parser.parse(userRule);
 * } catch (RuleSyntaxException e) {
 *     return ResponseEntity.badRequest().body("Invalid approval rule: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see RuleParser
 * @see BasicRuleParser
 */
public class RuleSyntaxException extends RuntimeException {

    private final int position;

    /**
     * Constructor with an explanatory error message and no position.
     *
     * @param message the message describing the syntax error
     */
    public RuleSyntaxException(String message) {
        super(message);
        this.position = -1;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public RuleSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    /**
     * Constructor with an explanatory message and the offending position.
     *
     * @param message  the message describing the syntax error, already mentioning the position
     * @param position 1-based code point offset into the rule text, must be positive
     * @throws IllegalArgumentException if position is not positive
     */
    public RuleSyntaxException(String message, int position) {
        super(message);
        if (position < 1) {
            throw new IllegalArgumentException("position must be positive, got: " + position);
        }
        this.position = position;
    }

    /**
     * Returns the 1-based code point offset the error refers to.
     *
     * @return the position, or an empty optional for errors not tied to a single character
     *         (empty input, leftover tokens, policy violations)
     */
    public OptionalInt getPosition() {
        return position > 0 ? OptionalInt.of(position) : OptionalInt.empty();
    }
}
