package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.exception.LexicalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link Lexer}.
 */
@DisplayName("Lexer Tests")
class LexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private static List<String> raws(List<Token> tokens) {
        return tokens.stream().map(Token::raw).toList();
    }

    @Nested
    @DisplayName("Operators")
    class OperatorTests {

        @ParameterizedTest(name = "''{0}'' lexes as {1}")
        @CsvSource({
            "'<=>', IFF", "'<->', IFF", "'↔', IFF", "iff, IFF",
            "'->', IMP", "'=>', IMP", "'→', IMP", "implies, IMP",
            "'⊕', XOR", "'^', XOR", "xor, XOR",
            "'∧', AND", "'&', AND", "and, AND",
            "'∨', OR", "'|', OR", "or, OR"
        })
        void testBinaryForms(String form, Operator expected) {
            List<Token> tokens = Lexer.tokenize("p " + form + " q");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER), types(tokens));
            assertEquals(expected, tokens.get(1).operator());
            assertEquals(form, tokens.get(1).raw());
        }

        @ParameterizedTest
        @ValueSource(strings = {"¬", "~", "!", "not "})
        void testNegationForms(String form) {
            List<Token> tokens = Lexer.tokenize(form + "p");

            assertEquals(2, tokens.size());
            assertEquals(Operator.NOT, tokens.get(0).operator());
            assertEquals("p", tokens.get(1).name());
        }

        @Test
        @DisplayName("'<=>' is never split into '<', '=', '>'")
        void testLongestMatch() {
            List<Token> tokens = Lexer.tokenize("p<=>q");

            assertEquals(List.of("p", "<=>", "q"), raws(tokens));
            assertEquals(Operator.IFF, tokens.get(1).operator());
        }

        @Test
        @DisplayName("Symbols need no surrounding whitespace")
        void testCompactSymbols() {
            List<Token> tokens = Lexer.tokenize("!(a&b)->c<->d");

            assertEquals(List.of("!", "(", "a", "&", "b", ")", "->", "c", "<->", "d"), raws(tokens));
        }

        @ParameterizedTest
        @ValueSource(strings = {"AND", "And", "aNd"})
        void testWordOperatorsAreCaseInsensitive(String form) {
            List<Token> tokens = Lexer.tokenize("p " + form + " q");

            assertEquals(Operator.AND, tokens.get(1).operator());
            assertEquals(form, tokens.get(1).raw());
        }

        @ParameterizedTest
        @ValueSource(strings = {"impliesX", "android", "orange", "nothing", "iffy", "xorbit"})
        @DisplayName("Operator words only match whole identifiers")
        void testWordOperatorInsideIdentifier(String word) {
            List<Token> tokens = Lexer.tokenize(word);

            assertEquals(1, tokens.size());
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals(word, tokens.get(0).name());
        }
    }

    @Nested
    @DisplayName("Constants")
    class ConstantTests {

        @ParameterizedTest
        @ValueSource(strings = {"TRUE", "True", "true", "T", "t", "1"})
        void testTrueForms(String form) {
            List<Token> tokens = Lexer.tokenize(form);

            assertEquals(1, tokens.size());
            assertEquals(TokenType.CONSTANT, tokens.get(0).type());
            assertTrue(tokens.get(0).value());
        }

        @ParameterizedTest
        @ValueSource(strings = {"FALSE", "False", "false", "F", "f", "0"})
        void testFalseForms(String form) {
            List<Token> tokens = Lexer.tokenize(form);

            assertEquals(1, tokens.size());
            assertEquals(TokenType.CONSTANT, tokens.get(0).type());
            assertFalse(tokens.get(0).value());
        }

        @Test
        @DisplayName("Digit followed by letters is a constant then an identifier")
        void testDigitThenWord() {
            List<Token> tokens = Lexer.tokenize("1x");

            assertEquals(List.of(TokenType.CONSTANT, TokenType.IDENTIFIER), types(tokens));
        }
    }

    @Nested
    @DisplayName("Identifiers")
    class IdentifierTests {

        @ParameterizedTest
        @ValueSource(strings = {"p", "x1", "_tmp", "snake_case", "camelCase", "UPPER", "a__1"})
        void testIdentifiers(String name) {
            List<Token> tokens = Lexer.tokenize(name);

            assertEquals(1, tokens.size());
            assertEquals(name, tokens.get(0).name());
        }

        @Test
        @DisplayName("Identifiers keep their casing")
        void testCaseSensitive() {
            List<Token> tokens = Lexer.tokenize("Rain | rain");

            assertEquals("Rain", tokens.get(0).name());
            assertEquals("rain", tokens.get(2).name());
        }

        @Test
        @DisplayName("Positions are 1-based against the trimmed input")
        void testPositions() {
            List<Token> tokens = Lexer.tokenize("   ab <-> c");

            assertEquals(1, tokens.get(0).position());
            assertEquals(4, tokens.get(1).position());
            assertEquals(8, tokens.get(2).position());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Unexpected character reports character and position")
        void testUnexpectedCharacter() {
            LexicalException exception = assertThrows(LexicalException.class, () -> Lexer.tokenize("a $ b"));

            assertEquals("Unexpected character '$' at position 3", exception.getMessage());
            assertEquals(OptionalInt.of(3), exception.getPosition());
        }

        @Test
        @DisplayName("Lone '-' and '<' are not operators")
        void testPartialSymbols() {
            assertThrows(LexicalException.class, () -> Lexer.tokenize("a - b"));
            assertThrows(LexicalException.class, () -> Lexer.tokenize("a < b"));
            assertThrows(LexicalException.class, () -> Lexer.tokenize("a = b"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"2", "10", "01", "a & 23"})
        void testMalformedNumbers(String input) {
            LexicalException exception = assertThrows(LexicalException.class, () -> Lexer.tokenize(input));

            assertTrue(exception.getMessage().startsWith("Unexpected number"));
            assertTrue(exception.getMessage().contains("Only 0 or 1 are allowed as constants."));
        }

        @Test
        @DisplayName("Null input is rejected")
        void testNull() {
            assertThrows(NullPointerException.class, () -> Lexer.tokenize(null));
        }
    }

    @Test
    @DisplayName("Blank input yields no tokens")
    void testBlank() {
        assertTrue(Lexer.tokenize("").isEmpty());
        assertTrue(Lexer.tokenize(" \t\n").isEmpty());
    }

    @Test
    @DisplayName("Mixed notation")
    void testMixedNotation() {
        List<Token> tokens = Lexer.tokenize("(rain ∧ ¬umbrella) implies wet OR TRUE");

        assertEquals(
            List.of(TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.OPERATOR,
                TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.OPERATOR, TokenType.IDENTIFIER,
                TokenType.OPERATOR, TokenType.CONSTANT),
            types(tokens)
        );
    }
}
