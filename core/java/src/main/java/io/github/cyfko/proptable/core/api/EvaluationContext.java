package io.github.cyfko.proptable.core.api;

import io.github.cyfko.proptable.core.model.AtomRegistry;

import java.util.Objects;

/**
 * Mutable evaluation state of one formula during truth table generation.
 * <p>
 * The context holds the {@link AtomRegistry} with the current assignment, and the values of the
 * parenthesized groups already evaluated in the current row. Groups must be evaluated in
 * ascending key order: a group may only read the values of smaller keys, which are the groups
 * nested inside it.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Created for exactly one formula</li>
 *   <li>{@link #beginRow(boolean[])} for each assignment</li>
 *   <li>{@link #recordTokenValue(int, boolean)} for each group, in key order</li>
 *   <li>Discarded after the table is complete</li>
 * </ol>
 *
 * <p>Instances are not thread-safe and must never be reused for another formula.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationContext {

    private final AtomRegistry atoms;
    private final boolean[] tokenValues;
    private int evaluatedTokens;

    /**
     * @param atoms      the registry of the formula's propositions
     * @param tokenCount number of groups of the formula
     */
    public EvaluationContext(AtomRegistry atoms, int tokenCount) {
        this.atoms = Objects.requireNonNull(atoms, "atoms");
        if (tokenCount < 0) {
            throw new IllegalArgumentException("tokenCount must not be negative, got: " + tokenCount);
        }
        this.tokenValues = new boolean[tokenCount];
    }

    /**
     * Starts a new row: writes the assignment to the registry and forgets group values.
     *
     * @param assignment one value per proposition in ascending letter order
     */
    public void beginRow(boolean[] assignment) {
        atoms.assign(assignment);
        evaluatedTokens = 0;
    }

    /**
     * @param letter a proposition letter
     * @return its value in the current row
     */
    public boolean atomValue(char letter) {
        return atoms.valueOf(letter);
    }

    /**
     * Returns the value already computed for a group in the current row.
     *
     * @param key the group key
     * @return the group value
     * @throws IllegalStateException if the group has not been evaluated yet in this row
     */
    public boolean tokenValue(int key) {
        if (key < 0 || key >= evaluatedTokens) {
            throw new IllegalStateException(String.format(
                    "Token %d read before being evaluated (%d of %d tokens evaluated in this row)",
                    key, evaluatedTokens, tokenValues.length));
        }
        return tokenValues[key];
    }

    /**
     * Stores the value of the next group of the current row.
     *
     * @param key   the group key, must equal the number of groups already recorded
     * @param value the group value
     * @throws IllegalStateException if groups are not recorded in key order
     */
    public void recordTokenValue(int key, boolean value) {
        if (key != evaluatedTokens || key >= tokenValues.length) {
            throw new IllegalStateException(String.format(
                    "Tokens must be evaluated in discovery order: expected token %d, got %d", evaluatedTokens, key));
        }
        tokenValues[key] = value;
        evaluatedTokens++;
    }

    public int tokenCount() {
        return tokenValues.length;
    }
}
