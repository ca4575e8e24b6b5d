package io.github.cyfko.proptable.core.expression;

import io.github.cyfko.proptable.core.api.EvaluationContext;
import io.github.cyfko.proptable.core.api.Expression;

/**
 * Leaf expression reading the current value of a proposition.
 *
 * @param letter the proposition letter
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AtomExpression(char letter) implements Expression {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.atomValue(letter);
    }

    @Override
    public String toString() {
        return String.valueOf(letter);
    }
}
