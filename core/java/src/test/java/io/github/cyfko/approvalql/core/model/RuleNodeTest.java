package io.github.cyfko.approvalql.core.model;

import io.github.cyfko.approvalql.core.api.RuleVisitor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the parse tree records: invariants, defensive copies and visitor dispatch.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("RuleNode Tests")
class RuleNodeTest {

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Function requires at least one parameter")
        void testFunctionWithoutParameters() {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> new FunctionNode("nof", List.of()));
            assertEquals("function nof requires at least one parameter", exception.getMessage());
        }

        @Test
        @DisplayName("Joiner requires both operands")
        void testAndOrOperands() {
            NounNode a = new NounNode("a");

            assertThrows(NullPointerException.class, () -> AndOrNode.and(a, null));
            assertThrows(NullPointerException.class, () -> AndOrNode.or(null, a));
            assertThrows(NullPointerException.class, () -> new AndOrNode(null, a, a));
        }

        @Test
        @DisplayName("Negation requires a child")
        void testNotChild() {
            assertThrows(NullPointerException.class, () -> new NotNode(null));
        }

        @Test
        @DisplayName("Names and attribute values must not be empty")
        void testEmptyNames() {
            assertThrows(IllegalArgumentException.class, () -> new NounNode(""));
            assertThrows(IllegalArgumentException.class, () -> new NounNode("a", Map.of("self", "")));
            assertThrows(IllegalArgumentException.class, () -> new AnonymousNode(List.of("a", "")));
            assertThrows(IllegalArgumentException.class, () -> new FunctionNode("", List.of(new NounNode("a"))));
        }

        @Test
        @DisplayName("Empty anonymous set is valid")
        void testEmptyAnonymous() {
            AnonymousNode node = new AnonymousNode(List.of());

            assertTrue(node.members().isEmpty());
            assertTrue(node.attributes().isEmpty());
        }
    }

    @Nested
    @DisplayName("Defensive Copies")
    class CopyTests {

        @Test
        @DisplayName("Later changes to the source collections are not visible")
        void testCopies() {
            Map<String, String> attributes = new HashMap<>(Map.of("count", "2"));
            List<String> members = new ArrayList<>(List.of("alice"));
            AnonymousNode node = new AnonymousNode(members, attributes);

            attributes.put("self", "true");
            members.add("bob");

            assertEquals(List.of("alice"), node.members());
            assertEquals(Map.of("count", "2"), node.attributes());
        }

        @Test
        @DisplayName("Attribute equality ignores order")
        void testAttributeEquality() {
            Map<String, String> first = new LinkedHashMap<>();
            first.put("self", "false");
            first.put("count", "1");
            Map<String, String> second = new LinkedHashMap<>();
            second.put("count", "1");
            second.put("self", "false");

            assertEquals(new NounNode("b", first), new NounNode("b", second));
            assertEquals(new NounNode("b", first).hashCode(), new NounNode("b", second).hashCode());
        }
    }

    @Nested
    @DisplayName("Visitor Dispatch")
    class VisitorTests {

        @SuppressWarnings("unchecked")
        private final RuleVisitor<String> visitor = mock(RuleVisitor.class);

        @Test
        @DisplayName("Each variant calls its own visit method")
        void testDispatch() {
            NounNode noun = new NounNode("a");
            AnonymousNode anonymous = new AnonymousNode(List.of("b"));
            FunctionNode function = new FunctionNode("f", List.of(noun));
            AndOrNode andOr = AndOrNode.or(noun, anonymous);
            NotNode not = new NotNode(noun);

            when(visitor.visitNoun(noun)).thenReturn("noun");
            when(visitor.visitAnonymous(anonymous)).thenReturn("anonymous");
            when(visitor.visitFunction(function)).thenReturn("function");
            when(visitor.visitAndOr(andOr)).thenReturn("andOr");
            when(visitor.visitNot(not)).thenReturn("not");

            assertEquals("noun", noun.accept(visitor));
            assertEquals("anonymous", anonymous.accept(visitor));
            assertEquals("function", function.accept(visitor));
            assertEquals("andOr", andOr.accept(visitor));
            assertEquals("not", not.accept(visitor));
        }

        @Test
        @DisplayName("Dispatch does not visit children on its own")
        void testNoImplicitTraversal() {
            NotNode not = new NotNode(AndOrNode.and(new NounNode("a"), new NounNode("b")));

            not.accept(visitor);

            verify(visitor).visitNot(not);
            verifyNoMoreInteractions(visitor);
        }
    }
}
