package io.github.cyfko.proptable.core.impl;

import io.github.cyfko.proptable.core.model.FormulaClassification;
import io.github.cyfko.proptable.core.model.TruthTable;

import java.util.Collection;
import java.util.Objects;

/**
 * Classifies a formula from the values of its last truth table column.
 * <ul>
 *   <li>all true: {@link FormulaClassification#TAUTOLOGY}</li>
 *   <li>all false: {@link FormulaClassification#CONTRADICTION}</li>
 *   <li>otherwise: {@link FormulaClassification#CONTINGENT}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaClassifier {

    private FormulaClassifier() {}

    public static FormulaClassification classify(TruthTable table) {
        Objects.requireNonNull(table, "table");
        return classify(table.resultColumn());
    }

    /**
     * @param results the formula value for every assignment
     * @return the classification
     * @throws IllegalArgumentException if no value is given
     */
    public static FormulaClassification classify(Collection<Boolean> results) {
        Objects.requireNonNull(results, "results");
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Cannot classify a formula without any evaluated row");
        }

        boolean anyTrue = results.contains(Boolean.TRUE);
        boolean anyFalse = results.contains(Boolean.FALSE);

        if (!anyFalse) {
            return FormulaClassification.TAUTOLOGY;
        }
        if (!anyTrue) {
            return FormulaClassification.CONTRADICTION;
        }
        return FormulaClassification.CONTINGENT;
    }
}
