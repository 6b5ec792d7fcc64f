package io.github.cyfko.approvalql.core.model;

/**
 * Binary connectives. Both have the same precedence.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Joiner {
    AND("and"),
    OR("or");

    private final String keyword;

    Joiner(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the keyword as written in rule text
     */
    public String keyword() {
        return keyword;
    }
}
