package io.github.cyfko.approvalql.core.parsing;

import io.github.cyfko.approvalql.core.config.RulePolicy;
import io.github.cyfko.approvalql.core.exception.RuleSyntaxException;
import io.github.cyfko.approvalql.core.model.AndOrNode;
import io.github.cyfko.approvalql.core.model.AnonymousNode;
import io.github.cyfko.approvalql.core.model.FunctionNode;
import io.github.cyfko.approvalql.core.model.Joiner;
import io.github.cyfko.approvalql.core.model.NotNode;
import io.github.cyfko.approvalql.core.model.NounNode;
import io.github.cyfko.approvalql.core.model.RuleNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the parse tree of one token sequence. Instances are single-use and not thread-safe.
 *
 * <h2>Construction</h2>
 * <p>
 * Each expression level keeps a stack of pending operators (a {@code not}, or a joiner that already owns its
 * left operand) and at most one complete operand, the {@code tail}. Operands only ever land in the deepest
 * pending slot, so the tree grows along its right spine:
 * </p>
 * <ul>
 *   <li>an operand fills the deepest pending slot, or becomes the root when nothing is pending</li>
 *   <li>{@code not} pushes a pending negation</li>
 *   <li>a joiner takes the tail as its left operand and pushes itself</li>
 *   <li>closing the level folds the stack from the deepest entry to the root</li>
 * </ul>
 * <p>
 * Hence {@code a and b or c} folds into {@code and(a, or(b, c))}. Parenthesised groups and function arguments
 * are parsed as fresh levels and come back as complete operands.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RuleTreeBuilder {

    private enum Level {
        /** Whole input; stops at the end of the tokens or at a stray {@code )}. */
        TOP,
        /** Inside {@code ( ... )}; stops at {@code )}. */
        GROUP,
        /** One function argument; stops at {@code ,} or {@code )}. */
        ARGUMENT
    }

    @FunctionalInterface
    private interface PendingOperator {
        RuleNode complete(RuleNode operand);
    }

    private final List<Token> tokens;
    private final RulePolicy policy;
    private int cursor;
    private int depth;

    /**
     * @param tokens tokens to parse
     * @param policy limits to enforce
     */
    public RuleTreeBuilder(List<Token> tokens, RulePolicy policy) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Parses all tokens.
     *
     * @return the root node
     * @throws RuleSyntaxException on the first syntax error
     */
    public RuleNode build() {
        if (tokens.isEmpty()) {
            throw new RuleSyntaxException("rule expression cannot be null or empty");
        }
        RuleNode root = parseExpression(Level.TOP, null);
        if (cursor != tokens.size()) {
            throw new RuleSyntaxException("premature end of tokens");
        }
        return root;
    }

    private RuleNode parseExpression(Level level, Token opener) {
        Deque<PendingOperator> pending = new ArrayDeque<>();
        RuleNode tail = null;

        while (cursor < tokens.size()) {
            Token token = tokens.get(cursor);
            switch (token.kind()) {
                case NAME -> {
                    if (tail != null) {
                        throw new RuleSyntaxException(
                                String.format("invalid noun %s at position %d", token.lexeme(), token.position()),
                                token.position());
                    }
                    tail = isFollowedBy(TokenKind.LPAREN) ? parseFunction(token) : parseNoun(token);
                }
                case LBRACE -> {
                    if (tail != null) throw invalid(token);
                    tail = parseAnonymous(token);
                }
                case NOT -> {
                    if (tail != null) throw invalid(token);
                    pending.push(NotNode::new);
                    cursor++;
                }
                case AND, OR -> {
                    if (tail == null) throw invalid(token);
                    RuleNode left = tail;
                    Joiner joiner = token.kind() == TokenKind.AND ? Joiner.AND : Joiner.OR;
                    pending.push(right -> new AndOrNode(joiner, left, right));
                    tail = null;
                    cursor++;
                }
                case LPAREN -> {
                    if (tail != null) throw invalid(token);
                    tail = parseGroup(token);
                }
                case RPAREN -> {
                    if (tail == null) throw invalid(token);
                    return fold(pending, tail);
                }
                case COMMA -> {
                    if (level != Level.ARGUMENT || tail == null) throw invalid(token);
                    return fold(pending, tail);
                }
                default -> throw invalid(token);
            }
        }

        if (level != Level.TOP) {
            throw missing(")", opener.position());
        }
        if (tail == null) {
            Token last = tokens.get(tokens.size() - 1);
            throw new RuleSyntaxException(
                    String.format("missing operand after '%s' at position %d", last.lexeme(), last.position()),
                    last.position());
        }
        return fold(pending, tail);
    }

    private static RuleNode fold(Deque<PendingOperator> pending, RuleNode tail) {
        RuleNode node = tail;
        while (!pending.isEmpty()) {
            node = pending.pop().complete(node);
        }
        return node;
    }

    private RuleNode parseGroup(Token lparen) {
        enter(lparen);
        cursor++;
        RuleNode group = parseExpression(Level.GROUP, lparen);
        cursor++; // ')'
        depth--;
        return group;
    }

    private RuleNode parseFunction(Token name) {
        Token lparen = tokens.get(cursor + 1);
        enter(lparen);
        cursor += 2;

        List<RuleNode> parameters = new ArrayList<>();
        while (true) {
            parameters.add(parseExpression(Level.ARGUMENT, lparen));
            Token separator = tokens.get(cursor++);
            if (separator.kind() == TokenKind.RPAREN) {
                break;
            }
        }
        depth--;
        return new FunctionNode(name.lexeme(), parameters);
    }

    private RuleNode parseNoun(Token name) {
        cursor++;
        Map<String, String> attributes = isAt(TokenKind.LBRACKET) ? parseAttributes() : Map.of();
        return new NounNode(name.lexeme(), attributes);
    }

    private RuleNode parseAnonymous(Token lbrace) {
        cursor++;
        List<String> members = new ArrayList<>();
        if (cursor >= tokens.size()) {
            throw missing("}", lbrace.position());
        }
        if (tokens.get(cursor).kind() == TokenKind.RBRACE) {
            cursor++;
        } else {
            readMembers(members);
        }
        Map<String, String> attributes = isAt(TokenKind.LBRACKET) ? parseAttributes() : Map.of();
        return new AnonymousNode(members, attributes);
    }

    private void readMembers(List<String> members) {
        while (true) {
            if (cursor >= tokens.size()) {
                throw missing("}", lastPosition());
            }
            Token member = tokens.get(cursor);
            if (member.kind() != TokenKind.NAME) {
                throw invalid(member);
            }
            members.add(member.lexeme());
            cursor++;

            if (cursor >= tokens.size()) {
                throw missing("}", lastPosition());
            }
            Token next = tokens.get(cursor);
            switch (next.kind()) {
                case RBRACE -> {
                    cursor++;
                    return;
                }
                case COMMA -> cursor++;
                default -> throw missing(",", next.position());
            }
        }
    }

    private Map<String, String> parseAttributes() {
        Token lbracket = tokens.get(cursor++);
        if (cursor >= tokens.size()) {
            throw missing("]", lbracket.position());
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        String key = null;
        AttributeState state = AttributeState.IN_ATTRIB;
        while (cursor < tokens.size()) {
            Token token = tokens.get(cursor++);
            switch (token.kind()) {
                case NAME -> {
                    if (state == AttributeState.IN_ATTRIB || state == AttributeState.IN_COMMA) {
                        key = token.lexeme();
                        state = AttributeState.IN_NAME;
                    } else if (state == AttributeState.IN_EQ) {
                        // a repeated key keeps its last value
                        attributes.put(key, token.lexeme());
                        state = AttributeState.IN_VAL;
                    } else {
                        throw invalid(token);
                    }
                }
                case EQUAL -> {
                    if (state != AttributeState.IN_NAME) throw invalid(token);
                    state = AttributeState.IN_EQ;
                }
                case COMMA -> {
                    if (state != AttributeState.IN_VAL) throw invalid(token);
                    state = AttributeState.IN_COMMA;
                }
                case RBRACKET -> {
                    if (state != AttributeState.IN_VAL) throw invalid(token);
                    return attributes;
                }
                default -> throw invalid(token);
            }
        }
        throw missing("]", lastPosition());
    }

    private void enter(Token lparen) {
        if (++depth > policy.maxNestingDepth()) {
            throw new RuleSyntaxException(String.format(
                    "Expression nesting too deep (max: %d) at position %d",
                    policy.maxNestingDepth(), lparen.position()), lparen.position());
        }
    }

    private boolean isAt(TokenKind kind) {
        return cursor < tokens.size() && tokens.get(cursor).kind() == kind;
    }

    private boolean isFollowedBy(TokenKind kind) {
        return cursor + 1 < tokens.size() && tokens.get(cursor + 1).kind() == kind;
    }

    private int lastPosition() {
        return tokens.get(tokens.size() - 1).position();
    }

    private static RuleSyntaxException invalid(Token token) {
        return new RuleSyntaxException(
                String.format("invalid '%s' at position %d", token.lexeme(), token.position()),
                token.position());
    }

    private static RuleSyntaxException missing(String symbol, int position) {
        return new RuleSyntaxException(String.format("missing '%s' at position %d", symbol, position), position);
    }
}
