package io.github.cyfko.approvalql.core.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass scanner turning approval rule text into positioned tokens.
 * <p>
 * Characters fall in three classes:
 * </p>
 * <ul>
 *   <li><strong>Delimiters</strong> {@code [ ] = ( ) { } ,}: close the pending name, then emit a one-character token</li>
 *   <li><strong>Whitespace</strong> (space, tab, CR, LF): close the pending name, emit nothing</li>
 *   <li><strong>Anything else</strong>: appended to the pending name</li>
 * </ul>
 * <p>
 * A closed name becomes {@link TokenKind#AND}, {@link TokenKind#OR} or {@link TokenKind#NOT} when it is exactly
 * {@code and}, {@code or} or {@code not}, otherwise {@link TokenKind#NAME}.
 * Positions are 1-based and count code points, so a character outside the BMP occupies a single position.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = RuleScanner.scan("us and f[self=true]");
 * // NAME "us"@1, AND "and"@4, NAME "f"@8, LBRACKET@9, NAME "self"@10, EQUAL@14, NAME "true"@15, RBRACKET@19
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RuleScanner {

    private RuleScanner() {}

    /**
     * Scans the given text. Never fails: every input has a token sequence, possibly empty.
     *
     * @param text the rule text
     * @return an unmodifiable list of tokens in source order
     * @throws NullPointerException if text is null
     */
    public static List<Token> scan(String text) {
        Objects.requireNonNull(text, "text");

        List<Token> tokens = new ArrayList<>();
        StringBuilder pendingName = new StringBuilder();
        int pendingStart = 0;

        int position = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            position++;

            TokenKind delimiter = TokenKind.ofDelimiter(codePoint);
            if (delimiter != null) {
                flushName(pendingName, pendingStart, tokens);
                tokens.add(Token.delimiter(delimiter, position));
            } else if (isWhitespace(codePoint)) {
                flushName(pendingName, pendingStart, tokens);
            } else {
                if (pendingName.length() == 0) {
                    pendingStart = position;
                }
                pendingName.appendCodePoint(codePoint);
            }
        }

        flushName(pendingName, pendingStart, tokens);
        return Collections.unmodifiableList(tokens);
    }

    private static void flushName(StringBuilder pendingName, int start, List<Token> tokens) {
        if (pendingName.length() == 0) return;
        tokens.add(Token.name(pendingName.toString(), start));
        pendingName.setLength(0);
    }

    private static boolean isWhitespace(int codePoint) {
        return codePoint == ' ' || codePoint == '\t' || codePoint == '\r' || codePoint == '\n';
    }
}
