package io.github.cyfko.approvalql.core.parsing;

import java.util.Objects;

/**
 * A positioned token of an approval rule.
 *
 * @param kind     the token kind
 * @param lexeme   the source text of the token; the symbol itself for delimiters
 * @param position 1-based code point offset of the token's first character
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String lexeme, int position) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
        if (position < 1) {
            throw new IllegalArgumentException("position must be positive, got: " + position);
        }
    }

    /**
     * Creates a delimiter token, using the kind's symbol as lexeme.
     *
     * @param kind     a delimiter kind
     * @param position 1-based position
     * @return the token
     */
    public static Token delimiter(TokenKind kind, int position) {
        if (kind.symbol() == null) {
            throw new IllegalArgumentException(kind + " is not a delimiter");
        }
        return new Token(kind, kind.symbol(), position);
    }

    /**
     * Creates a name or keyword token; the kind is derived from the lexeme.
     *
     * @param lexeme   the name
     * @param position 1-based position
     * @return the token
     */
    public static Token name(String lexeme, int position) {
        if (lexeme.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        return new Token(TokenKind.ofName(lexeme), lexeme, position);
    }
}
