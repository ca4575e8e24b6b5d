package io.github.cyfko.proptable.core.parsing;

import io.github.cyfko.proptable.core.api.Connective;
import io.github.cyfko.proptable.core.api.Expression;
import io.github.cyfko.proptable.core.expression.AtomExpression;
import io.github.cyfko.proptable.core.expression.BinaryExpression;
import io.github.cyfko.proptable.core.expression.NegationExpression;
import io.github.cyfko.proptable.core.expression.TokenReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link PostfixExpressionBuilder}.
 */
@DisplayName("PostfixExpressionBuilder Tests")
class PostfixExpressionBuilderTest {

    @Nested
    @DisplayName("Tree construction")
    class TreeConstruction {

        @Test
        void atom() {
            assertEquals(new AtomExpression('p'), PostfixExpressionBuilder.build(List.of("p")));
        }

        @Test
        void tokenReference() {
            assertEquals(new TokenReference(10), PostfixExpressionBuilder.build(List.of("10")));
        }

        @Test
        void negation() {
            Expression tree = PostfixExpressionBuilder.build(List.of("p", "~"));
            assertEquals(new NegationExpression(new AtomExpression('p')), tree);
        }

        @Test
        @DisplayName("Left operand is popped second")
        void operandOrder() {
            Expression tree = PostfixExpressionBuilder.build(List.of("p", "q", ">"));
            assertEquals(new BinaryExpression(Connective.IMPLIES, new AtomExpression('p'), new AtomExpression('q')), tree);
        }

        @Test
        void chained() {
            Expression tree = PostfixExpressionBuilder.build(List.of("p", "q", "&", "0", "~", "|"));
            assertEquals("((p&q)|~0)", tree.toString());
        }
    }

    @Nested
    @DisplayName("Malformed postfix")
    class Malformed {

        @Test
        void emptyList() {
            assertThrows(IllegalArgumentException.class, () -> PostfixExpressionBuilder.build(List.of()));
            assertThrows(NullPointerException.class, () -> PostfixExpressionBuilder.build(null));
        }

        @Test
        void negationWithoutOperand() {
            assertThrows(IllegalArgumentException.class, () -> PostfixExpressionBuilder.build(List.of("~")));
        }

        @Test
        void binaryWithOneOperand() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> PostfixExpressionBuilder.build(List.of("p", "&")));
            assertTrue(e.getMessage().contains("requires two operands"));
        }

        @Test
        void leftoverOperands() {
            assertThrows(IllegalArgumentException.class, () -> PostfixExpressionBuilder.build(List.of("p", "q")));
        }

        @Test
        void unknownToken() {
            assertThrows(IllegalArgumentException.class, () -> PostfixExpressionBuilder.build(List.of("pq")));
            assertThrows(IllegalArgumentException.class, () -> PostfixExpressionBuilder.build(List.of("(")));
        }
    }
}
