package io.github.cyfko.proptable.core.parsing;

import io.github.cyfko.proptable.core.api.Connective;
import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.exception.SyntaxErrorKind;

import java.util.*;

/**
 * Infix to postfix converter for propositional expressions (Shunting-Yard).
 * <p>
 * Operands are single letters (propositions) and runs of digits (references to extracted
 * groups). Connectives are those of {@link Connective}:
 * </p>
 * <ul>
 *   <li>{@code ~}: precedence 2, right associative (prefix)</li>
 *   <li>{@code & | + > <}: precedence 1, left associative</li>
 * </ul>
 * <p>
 * All binary connectives share one precedence level, so {@code a&b|c} reads as
 * {@code (a&b)|c}. Parentheses are honoured when present.
 * </p>
 *
 * <p><strong>Performance characteristics:</strong></p>
 * <ul>
 *   <li>Time: O(n) where n = expression length</li>
 *   <li>Single pass tokenization + conversion, no regex matching</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<String> postfix = PostfixConverter.toPostfix("~0&b");
 * // Result: ["0", "~", "b", "&"]
 * }</pre>
 *
 * <p>
 * Only structural problems (unknown characters, unmatched parentheses) are detected here. Full
 * grammar checks belong to {@link GrammarRule}; operand counts are checked by
 * {@link PostfixExpressionBuilder}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PostfixConverter {

    private static final Map<String, Integer> PRECEDENCE = Map.of(
            "~", 2, "&", 1, "|", 1, "+", 1, ">", 1, "<", 1);

    private PostfixConverter() {}

    /**
     * Converts an infix expression to postfix tokens.
     *
     * @param expression a normalized expression, possibly containing group references
     * @return postfix tokens
     * @throws FormulaSyntaxException if the expression is blank, contains an unknown character or
     *                                has unmatched parentheses
     */
    public static List<String> toPostfix(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new FormulaSyntaxException(SyntaxErrorKind.EMPTY_INPUT, null);
        }

        List<String> output = new ArrayList<>(expression.length());
        Deque<String> operators = new ArrayDeque<>();

        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);

            if (Character.isDigit(c)) {
                int start = i;
                while (i < expression.length() && Character.isDigit(expression.charAt(i))) {
                    i++;
                }
                output.add(expression.substring(start, i));
                continue;
            }

            if (c >= 'a' && c <= 'z') {
                output.add(String.valueOf(c));
            } else if (c == '(') {
                operators.push("(");
            } else if (c == ')') {
                while (!operators.isEmpty() && !operators.peek().equals("(")) {
                    output.add(operators.pop());
                }
                if (operators.isEmpty()) {
                    throw new FormulaSyntaxException(SyntaxErrorKind.UNBALANCED_PARENTHESES, ")");
                }
                operators.pop();
            } else if (c == Connective.NOT.getSymbol()) {
                // prefix operator: nothing to its left can be reduced yet
                operators.push("~");
            } else if (Connective.isConnective(c)) {
                String op = String.valueOf(c);
                while (!operators.isEmpty() && isHigherOrEqualPrecedence(operators.peek(), op)) {
                    output.add(operators.pop());
                }
                operators.push(op);
            } else {
                throw new FormulaSyntaxException(SyntaxErrorKind.INVALID_CHARACTER, String.valueOf(c));
            }
            i++;
        }

        while (!operators.isEmpty()) {
            String op = operators.pop();
            if (op.equals("(")) {
                throw new FormulaSyntaxException(SyntaxErrorKind.UNBALANCED_PARENTHESES, "(");
            }
            output.add(op);
        }

        return output;
    }

    private static boolean isHigherOrEqualPrecedence(String stackOp, String token) {
        if ("(".equals(stackOp)) return false;
        return PRECEDENCE.getOrDefault(stackOp, 0) >= PRECEDENCE.getOrDefault(token, 0);
    }
}
