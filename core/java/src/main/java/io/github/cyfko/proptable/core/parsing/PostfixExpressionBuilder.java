package io.github.cyfko.proptable.core.parsing;

import io.github.cyfko.proptable.core.api.Connective;
import io.github.cyfko.proptable.core.api.Expression;
import io.github.cyfko.proptable.core.expression.AtomExpression;
import io.github.cyfko.proptable.core.expression.TokenReference;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds an {@link Expression} tree from postfix tokens in a single pass.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token in postfix expression:
 *   - If LETTER: push an atom
 *   - If DIGITS: push a reference to the group with that key
 *   - If NOT (~): pop operand, push its negation
 *   - If binary connective: pop right, pop left, push left.combine(connective, right)
 *
 * Stack should contain exactly ONE expression at the end.
 * </pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PostfixConverter
 */
public final class PostfixExpressionBuilder {

    private PostfixExpressionBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the expression tree.
     *
     * @param postfixTokens postfix tokens as produced by {@link PostfixConverter#toPostfix(String)}
     * @return the root of the expression tree
     * @throws IllegalArgumentException if the tokens do not form exactly one well-formed expression
     * @throws NullPointerException     if postfixTokens is null
     */
    public static Expression build(List<String> postfixTokens) {
        if (postfixTokens == null) {
            throw new NullPointerException("postfixTokens cannot be null");
        }
        if (postfixTokens.isEmpty()) {
            throw new IllegalArgumentException("Cannot build expression from empty postfix expression");
        }

        Deque<Expression> stack = new ArrayDeque<>();

        for (String token : postfixTokens) {
            char first = token.isEmpty() ? '\0' : token.charAt(0);

            if (Character.isDigit(first)) {
                stack.push(new TokenReference(Integer.parseInt(token)));
            } else if (token.length() == 1 && first >= 'a' && first <= 'z') {
                stack.push(new AtomExpression(first));
            } else if (token.length() == 1 && first == Connective.NOT.getSymbol()) {
                if (stack.isEmpty()) {
                    throw new IllegalArgumentException(
                            "Malformed postfix expression: NOT operator (~) without operand.");
                }
                stack.push(stack.pop().not());
            } else if (token.length() == 1 && Connective.isConnective(first)) {
                Connective connective = Connective.fromSymbol(first);
                if (stack.size() < 2) {
                    throw new IllegalArgumentException(String.format(
                            "Malformed postfix expression: %s operator (%s) requires two operands. " +
                            "Stack contains only %d expression(s).",
                            connective, first, stack.size()));
                }
                Expression right = stack.pop();
                Expression left = stack.pop();
                stack.push(left.combine(connective, right));
            } else {
                throw new IllegalArgumentException("Malformed postfix expression: unexpected token '" + token + "'");
            }
        }

        if (stack.size() != 1) {
            throw new IllegalArgumentException(String.format(
                    "Malformed postfix expression: evaluation resulted in %d expressions on stack (expected 1).",
                    stack.size()));
        }

        return stack.pop();
    }
}
