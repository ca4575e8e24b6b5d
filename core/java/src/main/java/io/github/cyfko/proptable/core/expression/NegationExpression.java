package io.github.cyfko.proptable.core.expression;

import io.github.cyfko.proptable.core.api.EvaluationContext;
import io.github.cyfko.proptable.core.api.Expression;

import java.util.Objects;

/**
 * Negation of an operand.
 *
 * @param operand the negated expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NegationExpression(Expression operand) implements Expression {

    public NegationExpression {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return !operand.evaluate(context);
    }

    @Override
    public String toString() {
        return "~" + operand;
    }
}
