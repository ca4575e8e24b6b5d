package io.github.cyfko.proptable.core.model;

import java.util.Objects;

/**
 * Complete result of analysing one formula.
 *
 * @param formula        the validated and tokenized formula
 * @param table          its truth table
 * @param classification the class read from the table
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaAnalysis(TokenizedFormula formula, TruthTable table, FormulaClassification classification) {

    public FormulaAnalysis {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(classification, "classification");
    }
}
