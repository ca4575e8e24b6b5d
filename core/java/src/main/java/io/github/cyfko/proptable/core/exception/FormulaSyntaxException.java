package io.github.cyfko.proptable.core.exception;

import io.github.cyfko.proptable.core.api.FormulaParser;
import io.github.cyfko.proptable.core.impl.BasicFormulaParser;

import java.util.Objects;

/**
 * Exception thrown when a propositional formula violates the input grammar.
 * <p>
 * Every rejection is keyed to a {@link SyntaxErrorKind} and to the smallest substring of the
 * normalized input that exhibits the problem, so that callers can show the user exactly what to
 * fix before prompting again.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");
 * // → "Input cannot be empty!"
 *
 * parser.parse("p&&q");
 * // → "Binary operators can only have 2 operands! (ex. &&)"
 *
 * parser.parse("a(b)");
 * // → "Parentheses cannot be adjacent to letters or to other groups: a( )a )(! (ex. a()"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TokenizedFormula formula = parser.parse(line);
 * } catch (FormulaSyntaxException e) {
 *     out.println(e.getMessage());
 *     // ask again
 * }
 * }</pre>
 *
 * <p>None of these errors is fatal: validation completes before any evaluation state is created,
 * so resubmitting corrected input is always enough to recover.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaParser
 * @see BasicFormulaParser
 */
public class FormulaSyntaxException extends RuntimeException {

    private final SyntaxErrorKind kind;
    private final String offendingText;

    /**
     * Creates an exception for the given violated rule.
     *
     * @param kind          the violated rule
     * @param offendingText minimal substring showing the violation, or {@code null} when the rule
     *                      concerns the input as a whole (empty input, for instance)
     */
    public FormulaSyntaxException(SyntaxErrorKind kind, String offendingText) {
        super(formatMessage(kind, offendingText));
        this.kind = kind;
        this.offendingText = offendingText;
    }

    /**
     * Creates an exception with a custom detail message.
     *
     * @param kind          the violated rule
     * @param offendingText minimal substring showing the violation, may be {@code null}
     * @param message       the detail message
     */
    public FormulaSyntaxException(SyntaxErrorKind kind, String offendingText, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.offendingText = offendingText;
    }

    /**
     * @return the violated rule
     */
    public SyntaxErrorKind getKind() {
        return kind;
    }

    /**
     * @return the offending substring, or {@code null} if the error concerns the whole input
     */
    public String getOffendingText() {
        return offendingText;
    }

    private static String formatMessage(SyntaxErrorKind kind, String offendingText) {
        Objects.requireNonNull(kind, "kind");
        if (offendingText == null || offendingText.isEmpty()) {
            return kind.getDescription() + "!";
        }
        return kind.getDescription() + "! (ex. " + offendingText + ")";
    }
}
