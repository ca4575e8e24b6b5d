package io.github.cyfko.proptable.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A validated formula split into its flat root expression and its group table.
 *
 * @param formula     the normalized formula (whitespace removed, lowercase)
 * @param flatFormula the root expression with every group replaced by its token key
 * @param tokens      the extracted groups
 * @param atoms       distinct proposition letters in ascending order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TokenizedFormula(String formula, String flatFormula, TokenTable tokens, List<Character> atoms) {

    public TokenizedFormula {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(flatFormula, "flatFormula");
        Objects.requireNonNull(tokens, "tokens");
        atoms = List.copyOf(Objects.requireNonNull(atoms, "atoms"));
    }
}
