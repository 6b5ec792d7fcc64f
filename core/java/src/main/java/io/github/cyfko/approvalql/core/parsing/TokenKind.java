package io.github.cyfko.approvalql.core.parsing;

/**
 * Kinds of tokens produced by {@link RuleScanner}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {
    /** Any run of characters that is neither whitespace nor a delimiter, keywords excepted. */
    NAME(null),
    LBRACKET("["),
    RBRACKET("]"),
    EQUAL("="),
    LPAREN("("),
    RPAREN(")"),
    COMMA(","),
    AND(null),
    OR(null),
    NOT(null),
    LBRACE("{"),
    RBRACE("}");

    private final String symbol;

    TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the one-character source text of a delimiter, {@code null} for names and keywords
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Classifies a completed name. Keywords are matched exactly: {@code "AND"} is a plain name.
     *
     * @param lexeme the accumulated characters
     * @return {@link #AND}, {@link #OR}, {@link #NOT} or {@link #NAME}
     */
    static TokenKind ofName(String lexeme) {
        return switch (lexeme) {
            case "and" -> AND;
            case "or" -> OR;
            case "not" -> NOT;
            default -> NAME;
        };
    }

    /**
     * Maps a delimiter code point to its kind.
     *
     * @param codePoint the character to look up
     * @return the delimiter kind, or {@code null} if the character is not a delimiter
     */
    static TokenKind ofDelimiter(int codePoint) {
        return switch (codePoint) {
            case '[' -> LBRACKET;
            case ']' -> RBRACKET;
            case '=' -> EQUAL;
            case '(' -> LPAREN;
            case ')' -> RPAREN;
            case ',' -> COMMA;
            case '{' -> LBRACE;
            case '}' -> RBRACE;
            default -> null;
        };
    }
}
