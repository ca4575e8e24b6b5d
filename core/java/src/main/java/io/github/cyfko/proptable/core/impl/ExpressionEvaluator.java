package io.github.cyfko.proptable.core.impl;

import io.github.cyfko.proptable.core.api.EvaluationContext;
import io.github.cyfko.proptable.core.api.Expression;
import io.github.cyfko.proptable.core.parsing.PostfixConverter;
import io.github.cyfko.proptable.core.parsing.PostfixExpressionBuilder;

import java.util.Objects;

/**
 * Compiles expression text into {@link Expression} trees and evaluates them.
 * <p>
 * Text may contain proposition letters, group references (decimal keys), the six connectives and
 * parentheses. Compilation is done once; the resulting tree is then evaluated against an
 * {@link EvaluationContext} for each row.
 * </p>
 *
 * <pre>{@code
 * Expression tree = ExpressionEvaluator.compile("~0>q");
 * boolean value = tree.evaluate(context);
 *
 * // one-shot form
 * boolean value = ExpressionEvaluator.evaluate("p&q", context);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    /**
     * Compiles expression text.
     *
     * @param expression the expression text
     * @return the expression tree
     * @throws io.github.cyfko.proptable.core.exception.FormulaSyntaxException if the text cannot be converted
     * @throws IllegalArgumentException if operands and connectives do not match up
     */
    public static Expression compile(String expression) {
        return PostfixExpressionBuilder.build(PostfixConverter.toPostfix(expression));
    }

    /**
     * Compiles and evaluates expression text in one call.
     *
     * @param expression the expression text
     * @param context    the current atom and group values
     * @return the truth value of the expression
     */
    public static boolean evaluate(String expression, EvaluationContext context) {
        Objects.requireNonNull(context, "context");
        return compile(expression).evaluate(context);
    }
}
