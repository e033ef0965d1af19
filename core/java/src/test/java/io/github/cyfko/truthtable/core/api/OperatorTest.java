package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.EvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Operator Tests")
class OperatorTest {

    @Nested
    @DisplayName("Registry metadata")
    class MetadataTests {

        @ParameterizedTest(name = "{0}: arity={1}, precedence={2}, {3}")
        @CsvSource({
            "NOT, 1, 5, RIGHT",
            "AND, 2, 4, LEFT",
            "XOR, 2, 3, LEFT",
            "OR,  2, 2, LEFT",
            "IMP, 2, 1, RIGHT",
            "IFF, 2, 0, LEFT"
        })
        void testPrecedenceTable(Operator operator, int arity, int precedence, Operator.Associativity associativity) {
            assertEquals(arity, operator.getArity());
            assertEquals(precedence, operator.getPrecedence());
            assertEquals(associativity, operator.getAssociativity());
        }

        @Test
        @DisplayName("Only NOT is unary")
        void testOnlyNotIsUnary() {
            for (Operator operator : Operator.values()) {
                assertEquals(operator == Operator.NOT, operator.isUnary(), operator.name());
            }
        }

        @Test
        @DisplayName("Display labels")
        void testLabels() {
            assertEquals("!", Operator.NOT.getLabel());
            assertEquals("&", Operator.AND.getLabel());
            assertEquals("^", Operator.XOR.getLabel());
            assertEquals("|", Operator.OR.getLabel());
            assertEquals("->", Operator.IMP.getLabel());
            assertEquals("<->", Operator.IFF.getLabel());
        }
    }

    @Nested
    @DisplayName("Truth functions")
    class TruthFunctionTests {

        @ParameterizedTest(name = "{0} {1} -> and={2}, xor={3}, or={4}, imp={5}, iff={6}")
        @CsvSource({
            "false, false, false, false, false, true,  true",
            "false, true,  false, true,  true,  true,  false",
            "true,  false, false, true,  true,  false, false",
            "true,  true,  true,  false, true,  true,  true"
        })
        void testBinaryOperators(boolean a, boolean b, boolean and, boolean xor, boolean or, boolean imp, boolean iff) {
            assertEquals(and, Operator.AND.apply(a, b));
            assertEquals(xor, Operator.XOR.apply(a, b));
            assertEquals(or, Operator.OR.apply(a, b));
            assertEquals(imp, Operator.IMP.apply(a, b));
            assertEquals(iff, Operator.IFF.apply(a, b));
        }

        @Test
        @DisplayName("NOT negates")
        void testNot() {
            assertFalse(Operator.NOT.apply(true));
            assertTrue(Operator.NOT.apply(false));
        }

        @Test
        @DisplayName("Wrong operand count is rejected")
        void testArityMismatch() {
            EvaluationException exception = assertThrows(EvaluationException.class,
                () -> Operator.AND.apply(true));
            assertEquals(EvaluationException.Reason.UNSUPPORTED_ARITY, exception.getReason());

            assertThrows(EvaluationException.class, () -> Operator.NOT.apply(true, false));
        }
    }
}
