package io.github.cyfko.proptable.core.exception;

/**
 * Diagnostic kinds reported by the formula grammar validator.
 * <p>
 * Each kind carries a user-facing description of the rule that was violated. The
 * description is combined with the offending substring by {@link FormulaSyntaxException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SyntaxErrorKind {
    EMPTY_INPUT("Input cannot be empty"),
    FORMULA_TOO_LONG("Formula exceeds the maximum allowed length"),
    DIGIT("Input cannot contain digits"),
    INVALID_CHARACTER("Input cannot contain unallowed characters"),
    MULTI_LETTER_ATOM("Every simple proposition can only be represented by a single letter"),
    INVALID_GROUP_OPEN("A group can only begin with: ( ~ or letter"),
    INVALID_GROUP_CLOSE("A group can only end with: ) or letter"),
    MISPLACED_NEGATION("~ operator cannot appear between two propositions or at the end"),
    BINARY_OPERATOR_ARITY("Binary operators can only have 2 operands"),
    LETTER_PAREN_ADJACENCY("Parentheses cannot be adjacent to letters or to other groups: a( )a )("),
    UNBALANCED_PARENTHESES("Input cannot contain unmatched parentheses"),
    TOO_MANY_ATOMS("Formula contains too many distinct propositions");

    private final String description;

    SyntaxErrorKind(String description) {
        this.description = description;
    }

    /**
     * Returns the human readable rule violated by this kind of error.
     *
     * @return the rule description, never {@code null}
     */
    public String getDescription() {
        return description;
    }
}
