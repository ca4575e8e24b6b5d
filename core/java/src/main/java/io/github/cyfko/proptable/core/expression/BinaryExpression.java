package io.github.cyfko.proptable.core.expression;

import io.github.cyfko.proptable.core.api.Connective;
import io.github.cyfko.proptable.core.api.EvaluationContext;
import io.github.cyfko.proptable.core.api.Expression;

import java.util.Objects;

/**
 * Application of a binary connective to two operands.
 * <p>
 * Both operands are always evaluated; the connectives are total functions over two booleans.
 * </p>
 *
 * @param connective the binary connective
 * @param left       the left operand
 * @param right      the right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BinaryExpression(Connective connective, Expression left, Expression right) implements Expression {

    public BinaryExpression {
        Objects.requireNonNull(connective, "connective");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (connective.isUnary()) {
            throw new IllegalArgumentException("Binary expression requires a binary connective, got: " + connective);
        }
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        boolean l = left.evaluate(context);
        boolean r = right.evaluate(context);
        return connective.apply(l, r);
    }

    @Override
    public String toString() {
        return "(" + left + connective.getSymbol() + right + ")";
    }
}
