package io.github.cyfko.proptable.core.model;

/**
 * A simple proposition, named by a single lowercase letter, bound to its current truth value.
 * <p>
 * Instances are owned by an {@link AtomRegistry}. The value is rewritten once per row while a
 * truth table is being generated.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AtomicProposition {

    private final char letter;
    private boolean value;

    AtomicProposition(char letter) {
        if (letter < 'a' || letter > 'z') {
            throw new IllegalArgumentException("Atomic proposition must be a lowercase letter, got: '" + letter + "'");
        }
        this.letter = letter;
        this.value = true;
    }

    public char getLetter() {
        return letter;
    }

    public String getName() {
        return String.valueOf(letter);
    }

    public boolean getValue() {
        return value;
    }

    void setValue(boolean value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return letter + "=" + (value ? "T" : "F");
    }
}
