package io.github.cyfko.proptable.core.model;

/**
 * Semantic class of a formula, read from the last column of its truth table.
 * <p>
 * The three classes partition all formulas. Satisfiability is reported through
 * {@link #isSatisfiable()} rather than as a class of its own: a satisfiable formula is either a
 * tautology or contingent.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FormulaClassification {
    /** True under every assignment. */
    TAUTOLOGY("valid (tautology, also satisfiable)", true),
    /** False under every assignment. */
    CONTRADICTION("contradiction (unsatisfiable)", false),
    /** True under some assignments and false under others. */
    CONTINGENT("contingent (also satisfiable)", true);

    private final String label;
    private final boolean satisfiable;

    FormulaClassification(String label, boolean satisfiable) {
        this.label = label;
        this.satisfiable = satisfiable;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSatisfiable() {
        return satisfiable;
    }
}
