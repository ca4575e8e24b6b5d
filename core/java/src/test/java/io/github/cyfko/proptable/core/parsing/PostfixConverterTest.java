package io.github.cyfko.proptable.core.parsing;

import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.exception.SyntaxErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link PostfixConverter}.
 */
@DisplayName("PostfixConverter Tests")
class PostfixConverterTest {

    @Nested
    @DisplayName("Valid Expressions - Conversion Tests")
    class ValidConversionTests {

        @Test
        void singleAtom() {
            assertEquals(List.of("p"), PostfixConverter.toPostfix("p"));
        }

        @Test
        void negation() {
            assertEquals(List.of("p", "~"), PostfixConverter.toPostfix("~p"));
            assertEquals(List.of("p", "~", "~"), PostfixConverter.toPostfix("~~p"));
        }

        @Test
        void binaryConnectives() {
            assertEquals(List.of("p", "q", "&"), PostfixConverter.toPostfix("p&q"));
            assertEquals(List.of("p", "q", "+"), PostfixConverter.toPostfix("p+q"));
            assertEquals(List.of("p", "q", "<"), PostfixConverter.toPostfix("p<q"));
        }

        @Test
        @DisplayName("Binary connectives chain to the left")
        void leftAssociative() {
            assertEquals(List.of("p", "q", "&", "r", "|"), PostfixConverter.toPostfix("p&q|r"));
            assertEquals(List.of("p", "q", ">", "r", ">"), PostfixConverter.toPostfix("p>q>r"));
        }

        @Test
        @DisplayName("Negation binds to its immediate operand")
        void negationBindsTightly() {
            assertEquals(List.of("p", "~", "q", "&"), PostfixConverter.toPostfix("~p&q"));
            assertEquals(List.of("p", "q", "~", "&", "r", "|"), PostfixConverter.toPostfix("p&~q|r"));
        }

        @Test
        @DisplayName("Parentheses override chaining")
        void parentheses() {
            assertEquals(List.of("p", "q", "r", "|", "&"), PostfixConverter.toPostfix("p&(q|r)"));
            assertEquals(List.of("p", "q", "|", "~"), PostfixConverter.toPostfix("~(p|q)"));
        }

        @Test
        @DisplayName("Digit runs are group references")
        void tokenReferences() {
            assertEquals(List.of("0", "~", "12", "&"), PostfixConverter.toPostfix("~0&12"));
        }
    }

    @Nested
    @DisplayName("Invalid Expressions")
    class InvalidExpressions {

        @Test
        void blank() {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> PostfixConverter.toPostfix(" "));
            assertEquals(SyntaxErrorKind.EMPTY_INPUT, e.getKind());
            assertThrows(FormulaSyntaxException.class, () -> PostfixConverter.toPostfix(null));
        }

        @Test
        void unmatchedParentheses() {
            FormulaSyntaxException open = assertThrows(FormulaSyntaxException.class, () -> PostfixConverter.toPostfix("(p&q"));
            assertEquals(SyntaxErrorKind.UNBALANCED_PARENTHESES, open.getKind());
            assertEquals("(", open.getOffendingText());

            FormulaSyntaxException close = assertThrows(FormulaSyntaxException.class, () -> PostfixConverter.toPostfix("p&q)"));
            assertEquals(")", close.getOffendingText());
        }

        @Test
        void unknownCharacter() {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> PostfixConverter.toPostfix("p!q"));
            assertEquals(SyntaxErrorKind.INVALID_CHARACTER, e.getKind());
            assertEquals("!", e.getOffendingText());
        }
    }
}
