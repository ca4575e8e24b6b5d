package io.github.cyfko.proptable.core.api;

import io.github.cyfko.proptable.core.expression.BinaryExpression;
import io.github.cyfko.proptable.core.expression.NegationExpression;

/**
 * A compiled propositional expression.
 * <p>
 * Expressions are immutable trees built once per formula and evaluated once per row of the
 * truth table. Variable state (the current atom values and the values already computed for
 * groups in the current row) is supplied by the {@link EvaluationContext}.
 * </p>
 *
 * <h2>Composition</h2>
 * <p>
 * Like the operands they model, expressions compose into new expressions without being modified:
 * </p>
 * <pre>{@code
 * Expression p = new AtomExpression('p');
 * Expression q = new AtomExpression('q');
 * Expression implication = p.combine(Connective.IMPLIES, q);   // p > q
 * Expression negated = implication.not();                      // ~(p > q)
 * }</pre>
 *
 * @see EvaluationContext
 * @see Connective
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Expression {

    /**
     * Computes the value of this expression under the context's current assignment.
     *
     * @param context the current atom and group values
     * @return the truth value of the expression
     * @throws IllegalStateException if a referenced group has not been evaluated yet in this row
     */
    boolean evaluate(EvaluationContext context);

    /**
     * Creates the negation of this expression.
     *
     * @return a new expression representing ~this
     */
    default Expression not() {
        return new NegationExpression(this);
    }

    /**
     * Combines this expression with another one through a binary connective.
     *
     * @param connective the binary connective
     * @param other      the right operand
     * @return a new expression representing (this connective other)
     * @throws IllegalArgumentException if the connective is unary
     */
    default Expression combine(Connective connective, Expression other) {
        return new BinaryExpression(connective, this, other);
    }
}
