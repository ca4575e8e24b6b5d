package io.github.cyfko.proptable.core.utils;

import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.exception.SyntaxErrorKind;

/**
 * Result of validating a formula without exceptions.
 * <p>
 * The result is either a success or a failure carrying the violated rule, the offending
 * substring and the message that {@link FormulaSyntaxException} would have carried.
 * </p>
 *
 * <p>Instances are immutable and created via {@link #success()} and
 * {@link #failure(FormulaSyntaxException)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = parser.validate(line);
 * if (!result.isValid()) {
 *     System.out.println(result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null, null, null);

    private final boolean valid;
    private final SyntaxErrorKind kind;
    private final String offendingText;
    private final String errorMessage;

    private ValidationResult(boolean valid, SyntaxErrorKind kind, String offendingText, String errorMessage) {
        this.valid = valid;
        this.kind = kind;
        this.offendingText = offendingText;
        this.errorMessage = errorMessage;
    }

    /**
     * @return a valid result with no diagnostic
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates a failed result from the exception describing the violation.
     *
     * @param cause the grammar violation
     * @return an invalid result carrying the diagnostic
     */
    public static ValidationResult failure(FormulaSyntaxException cause) {
        return new ValidationResult(false, cause.getKind(), cause.getOffendingText(), cause.getMessage());
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the violated rule, or null if valid
     */
    public SyntaxErrorKind getKind() {
        return kind;
    }

    /**
     * @return the offending substring, or null if valid or not applicable
     */
    public String getOffendingText() {
        return offendingText;
    }

    /**
     * @return the error message, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, kind=" + kind + ", error=" + errorMessage + "]";
    }
}
