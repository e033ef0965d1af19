package io.github.cyfko.truthtable.core.ast;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.parsing.Lexer;
import io.github.cyfko.truthtable.core.parsing.PostfixConverter;
import io.github.cyfko.truthtable.core.parsing.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link PostfixTreeBuilder} and the labels of {@link ExpressionTree}.
 */
@DisplayName("PostfixTreeBuilder Tests")
class PostfixTreeBuilderTest {

    private static ExpressionTree tree(String expression) {
        return PostfixTreeBuilder.build(PostfixConverter.toPostfix(Lexer.tokenize(expression)));
    }

    @Nested
    @DisplayName("Tree structure")
    class StructureTests {

        @Test
        @DisplayName("Binary operands are rebuilt in (left, right) order")
        void testOperandOrder() {
            ExpressionTree tree = tree("p -> q");
            Node root = tree.root();

            assertEquals(Node.Kind.BINARY, root.kind());
            assertEquals(Operator.IMP, root.operator());
            assertEquals("p", tree.node(root.left()).name());
            assertEquals("q", tree.node(root.right()).name());
        }

        @Test
        @DisplayName("Ids are unique, increasing and equal to arena index")
        void testIds() {
            ExpressionTree tree = tree("(a & b) | (a & b)");

            assertEquals(7, tree.size());
            for (int i = 0; i < tree.size(); i++) {
                assertEquals(i, tree.node(i).id());
            }
            assertEquals(6, tree.root().id());
        }

        @Test
        @DisplayName("Operands always precede their combinator")
        void testPostOrder() {
            ExpressionTree tree = tree("!(a ^ (b -> !c)) <-> d");

            for (Node node : tree.nodes()) {
                if (node.kind() == Node.Kind.UNARY) {
                    assertTrue(node.left() < node.id());
                } else if (node.kind() == Node.Kind.BINARY) {
                    assertTrue(node.left() < node.right());
                    assertTrue(node.right() < node.id());
                }
            }
        }

        @Test
        @DisplayName("Same variable twice gives two distinct nodes")
        void testNoSharing() {
            ExpressionTree tree = tree("p xor p");
            Node root = tree.root();

            assertNotEquals(root.left(), root.right());
            assertEquals(tree.label(tree.node(root.left())), tree.label(tree.node(root.right())));
        }

        @Test
        @DisplayName("Constants become constant leaves")
        void testConstants() {
            ExpressionTree tree = tree("1 <-> 0");

            assertTrue(tree.node(tree.root().left()).value());
            assertFalse(tree.node(tree.root().right()).value());
            assertEquals(Node.Kind.CONSTANT, tree.node(0).kind());
        }
    }

    @Nested
    @DisplayName("Canonical labels")
    class LabelTests {

        @ParameterizedTest(name = "{0}  =>  {1}")
        @CsvSource(delimiter = ';', value = {
            "a;                       a",
            "true;                    T",
            "0;                       F",
            "a & b;                   (a & b)",
            "a and b or c;            ((a & b) | c)",
            "!a;                      !a",
            "!(a & b);                !(a & b)",
            "!!a;                     !(!a)",
            "p -> q -> r;             (p -> (q -> r))",
            "a <=> b;                 (a <-> b)",
            "a ⊕ ¬b;                  (a ^ !b)",
            "a | 1;                   (a | T)",
            "!(!(a) | b);             !(!a | b)"
        })
        void testLabels(String expression, String expected) {
            assertEquals(expected, tree(expression).label());
        }
    }

    @Nested
    @DisplayName("Malformed postfix")
    class ErrorTests {

        @ParameterizedTest
        @ValueSource(strings = {"a & ", "& a", "a | b &", "a -> "})
        void testMissingBinaryOperands(String expression) {
            ExpressionSyntaxException exception = assertThrows(ExpressionSyntaxException.class,
                () -> tree(expression));
            assertTrue(exception.getMessage().contains("missing operands for binary operator"));
        }

        @Test
        @DisplayName("NOT without operand")
        void testMissingUnaryOperand() {
            ExpressionSyntaxException exception = assertThrows(ExpressionSyntaxException.class,
                () -> tree("!"));
            assertEquals("Invalid expression: missing operand for unary operator '!'", exception.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"a b", "a (b)", "!a b", "p q & r"})
        void testLeftoverValues(String expression) {
            ExpressionSyntaxException exception = assertThrows(ExpressionSyntaxException.class,
                () -> tree(expression));
            assertTrue(exception.getMessage().contains("values left after parsing"));
        }

        @Test
        @DisplayName("Empty postfix")
        void testEmpty() {
            assertThrows(ExpressionSyntaxException.class, () -> PostfixTreeBuilder.build(List.of()));
        }

        @Test
        @DisplayName("Parenthesis in postfix")
        void testParenthesisToken() {
            assertThrows(ExpressionSyntaxException.class,
                () -> PostfixTreeBuilder.build(List.of(Token.leftParen(1))));
        }
    }
}
