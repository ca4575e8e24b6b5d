package io.github.cyfko.proptable.core.api;

import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.model.TokenizedFormula;
import io.github.cyfko.proptable.core.utils.ValidationResult;

/**
 * Parser for propositional formulas.
 * <p>
 * Transforms raw user input into a {@link TokenizedFormula}: the normalized formula, its
 * parenthesized groups extracted into a token table, and its sorted atoms.
 * </p>
 *
 * <h2>Grammar</h2>
 * <ul>
 *   <li>Atoms are single letters {@code a-z}; input is case-insensitive</li>
 *   <li>Connectives: {@code ~ & | + > <} (see {@link Connective})</li>
 *   <li>Round parentheses group sub-expressions and may be nested</li>
 *   <li>Whitespace is ignored</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 *
 * TokenizedFormula f1 = parser.parse("p > q");
 * TokenizedFormula f2 = parser.parse("~(p & q) < (~p | ~q)");
 *
 * parser.parse("p && q");   // FormulaSyntaxException: BINARY_OPERATOR_ARITY
 * parser.parse("a(b)");     // FormulaSyntaxException: LETTER_PAREN_ADJACENCY
 * }</pre>
 *
 * @see FormulaSyntaxException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Validates and tokenizes a formula.
     *
     * @param formula the raw formula, must not be null
     * @return the tokenized formula
     * @throws FormulaSyntaxException if the formula violates the grammar
     * @throws NullPointerException   if formula is null
     */
    TokenizedFormula parse(String formula) throws FormulaSyntaxException;

    /**
     * Validates a formula without throwing on grammar violations.
     *
     * @param formula the raw formula, must not be null
     * @return a successful result, or a failure carrying the diagnostic
     */
    default ValidationResult validate(String formula) {
        try {
            parse(formula);
            return ValidationResult.success();
        } catch (FormulaSyntaxException e) {
            return ValidationResult.failure(e);
        }
    }
}
