package io.github.cyfko.proptable.core.expression;

import io.github.cyfko.proptable.core.api.EvaluationContext;
import io.github.cyfko.proptable.core.api.Expression;

/**
 * Leaf expression standing for a parenthesized group.
 * <p>
 * The group itself is not re-evaluated: its value has already been computed for the current row
 * and is read back from the {@link EvaluationContext}.
 * </p>
 *
 * @param key the group key in the token table
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TokenReference(int key) implements Expression {

    public TokenReference {
        if (key < 0) {
            throw new IllegalArgumentException("Token key must not be negative, got: " + key);
        }
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.tokenValue(key);
    }

    @Override
    public String toString() {
        return String.valueOf(key);
    }
}
