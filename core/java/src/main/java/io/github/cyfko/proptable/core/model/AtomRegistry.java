package io.github.cyfko.proptable.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Ordered registry of the distinct atomic propositions of one formula.
 * <p>
 * Letters are kept in ascending order, which fixes both the first columns of a truth table and
 * the enumeration order of assignments. The registry is the only owner of its
 * {@link AtomicProposition} instances: values are written through {@link #assign(boolean[])} and
 * read through {@link #valueOf(char)}.
 * </p>
 *
 * <p>A registry belongs to a single table generation run and must not be shared between formulas.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AtomRegistry {

    private final Map<Character, AtomicProposition> atoms;
    private final List<AtomicProposition> ordered;

    private AtomRegistry(Map<Character, AtomicProposition> atoms) {
        this.atoms = atoms;
        this.ordered = Collections.unmodifiableList(new ArrayList<>(atoms.values()));
    }

    /**
     * Creates a registry holding one proposition per distinct letter.
     *
     * @param letters letters to register, duplicates are ignored
     * @return a new registry, all values initially {@code true}
     * @throws IllegalArgumentException if a letter is not in {@code a-z}
     */
    public static AtomRegistry of(Collection<Character> letters) {
        Objects.requireNonNull(letters, "letters");
        Map<Character, AtomicProposition> atoms = new TreeMap<>();
        for (Character letter : letters) {
            atoms.computeIfAbsent(letter, AtomicProposition::new);
        }
        return new AtomRegistry(atoms);
    }

    /**
     * @return propositions in ascending letter order
     */
    public List<AtomicProposition> atoms() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }

    public boolean contains(char letter) {
        return atoms.containsKey(letter);
    }

    /**
     * Returns the current value of the given proposition.
     *
     * @param letter the proposition letter
     * @return its current truth value
     * @throws IllegalArgumentException if the letter is not registered
     */
    public boolean valueOf(char letter) {
        if (!contains(letter)) {
            throw new IllegalArgumentException(String.format(
                    "Unknown proposition '%s'. Registered propositions: %s", letter, atoms.keySet()));
        }
        return atoms.get(letter).getValue();
    }

    /**
     * Writes one assignment, positionally, to the registered propositions.
     *
     * @param values one value per proposition, in ascending letter order
     * @throws IllegalArgumentException if the number of values does not match the registry size
     */
    public void assign(boolean[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length != ordered.size()) {
            throw new IllegalArgumentException(String.format(
                    "Assignment has %d values but %d propositions are registered", values.length, ordered.size()));
        }
        for (int i = 0; i < values.length; i++) {
            ordered.get(i).setValue(values[i]);
        }
    }

    @Override
    public String toString() {
        return "AtomRegistry" + ordered;
    }
}
