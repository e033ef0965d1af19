package io.github.cyfko.truthtable.core.ast;

import io.github.cyfko.truthtable.core.parsing.Lexer;
import io.github.cyfko.truthtable.core.parsing.PostfixConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SubexpressionCollector Tests")
class SubexpressionCollectorTest {

    private static ExpressionTree tree(String expression) {
        return PostfixTreeBuilder.build(PostfixConverter.toPostfix(Lexer.tokenize(expression)));
    }

    private static List<String> labels(String expression) {
        return SubexpressionCollector.collect(tree(expression)).stream().map(Subexpression::label).toList();
    }

    @Test
    @DisplayName("Operands come before their combinator")
    void testPostOrder() {
        assertEquals(List.of("(a & b)", "!(a & b)"), labels("!(a & b)"));
        assertEquals(List.of("(a & b)", "!c", "((a & b) | !c)"), labels("a & b | !c"));
    }

    @Test
    @DisplayName("Left subtree is listed before right subtree")
    void testLeftBeforeRight() {
        assertEquals(List.of("(a | b)", "(c ^ d)", "((a | b) -> (c ^ d))"), labels("(a | b) -> (c ^ d)"));
    }

    @Test
    @DisplayName("Identical sub-expressions appear once")
    void testDeduplication() {
        List<String> labels = labels("(a & b) | (a & b)");

        assertEquals(List.of("(a & b)", "((a & b) | (a & b))"), labels);
        assertEquals(1, labels.stream().filter("(a & b)"::equals).count());
    }

    @Test
    @DisplayName("De-duplication keeps the first node")
    void testFirstOccurrenceKept() {
        ExpressionTree tree = tree("(a & b) | (a & b)");
        List<Subexpression> steps = SubexpressionCollector.collect(tree);

        assertEquals(2, steps.get(0).node().id());
    }

    @Test
    @DisplayName("Different surface forms with the same rendering merge")
    void testSurfaceFormsMerge() {
        assertEquals(List.of("(a & b)", "((a & b) <-> (a & b))"), labels("(a and b) iff (a ∧ b)"));
    }

    @Test
    @DisplayName("Leaves are not steps")
    void testLeavesSkipped() {
        assertTrue(labels("a").isEmpty());
        assertTrue(labels("true").isEmpty());
    }

    @Test
    @DisplayName("Nested negations")
    void testNestedNegation() {
        assertEquals(List.of("!a", "!(!a)"), labels("!!a"));
    }
}
