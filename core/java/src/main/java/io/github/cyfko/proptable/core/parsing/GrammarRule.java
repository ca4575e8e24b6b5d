package io.github.cyfko.proptable.core.parsing;

import io.github.cyfko.proptable.core.exception.SyntaxErrorKind;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Character-level rules of the formula grammar, in priority order.
 * <p>
 * The rules run on the normalized formula (no whitespace, lowercase). They are checked in
 * declaration order and the first violated rule wins; within a rule, the leftmost match is
 * reported as the offending substring.
 * </p>
 *
 * <p>Balanced parentheses are not a character-level property and are checked after
 * tokenization, see {@link FormulaTokenizer}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum GrammarRule {
    DIGIT(SyntaxErrorKind.DIGIT, "[0-9]"),
    INVALID_CHARACTER(SyntaxErrorKind.INVALID_CHARACTER, "[^a-z()~&|+<>]"),
    MULTI_LETTER_ATOM(SyntaxErrorKind.MULTI_LETTER_ATOM, "[a-z]{2,}"),
    INVALID_GROUP_OPEN(SyntaxErrorKind.INVALID_GROUP_OPEN, "\\([^(~a-z]"),
    INVALID_GROUP_CLOSE(SyntaxErrorKind.INVALID_GROUP_CLOSE, "[^a-z)]\\)"),
    MISPLACED_NEGATION(SyntaxErrorKind.MISPLACED_NEGATION, "[a-z)]~|~$"),
    BINARY_OPERATOR_ARITY(SyntaxErrorKind.BINARY_OPERATOR_ARITY,
            "^[&|+<>]|[^)a-z][&|+<>]|[&|+<>][^a-z(~]|[&|+<>]$"),
    LETTER_PAREN_ADJACENCY(SyntaxErrorKind.LETTER_PAREN_ADJACENCY, "[a-z]\\(|\\)[a-z]|\\)\\(");

    private final SyntaxErrorKind kind;
    private final Pattern pattern;

    GrammarRule(SyntaxErrorKind kind, String regex) {
        this.kind = kind;
        this.pattern = Pattern.compile(regex);
    }

    public SyntaxErrorKind getKind() {
        return kind;
    }

    /**
     * Looks for a violation of this rule.
     *
     * @param formula the normalized formula
     * @return the leftmost offending substring, or empty if the rule holds
     */
    public Optional<String> findViolation(String formula) {
        Matcher matcher = pattern.matcher(formula);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
