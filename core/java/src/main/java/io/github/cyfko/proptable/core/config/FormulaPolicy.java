package io.github.cyfko.proptable.core.config;

/**
 * Size limits applied to formulas before a truth table is generated.
 * <p>
 * Table generation is exponential in the number of distinct propositions, so the policy bounds
 * both the raw length of a formula and the number of atoms it may contain.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: maximum length of the normalized formula (default: 5000)</li>
 *   <li><strong>maxAtoms</strong>: maximum number of distinct propositions (default: 16, i.e. 65536 rows)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * FormulaPolicy policy = FormulaPolicy.defaults();
 * FormulaPolicy policy = FormulaPolicy.strict();
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxAtoms(4)
 *     .build();
 * }</pre>
 *
 * @param policyName       name used in diagnostics
 * @param maxFormulaLength maximum character length of the normalized formula
 * @param maxAtoms         maximum number of distinct atomic propositions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    int maxAtoms
) {

    /**
     * Hard ceiling on {@link #maxAtoms()}: propositions are single letters {@code a-z}.
     */
    public static final int ATOM_CEILING = 26;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxAtoms <= 0 || maxAtoms > ATOM_CEILING) {
            throw new IllegalArgumentException("maxAtoms must be in [1, " + ATOM_CEILING + "], got: " + maxAtoms);
        }
    }

    /**
     * Default configuration, suitable for interactive use.
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Max Atoms: 16</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 16);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Formula Length: 256 characters</li>
     *   <li>Max Atoms: 8</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 256, 8);
    }

    /**
     * Relaxed configuration for trusted batch-like use.
     * <ul>
     *   <li>Max Formula Length: 10000 characters</li>
     *   <li>Max Atoms: 20</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 20);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder{
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private int _maxAtoms = 16;

        private Builder(){}

        public FormulaPolicy build(){
            return new FormulaPolicy(_policyName, _maxFormulaLength, _maxAtoms);
        }

        public Builder policyName(String policyName){ this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength){ this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxAtoms(int maxAtoms){ this._maxAtoms = maxAtoms; return this; }
    }

    public enum PolicyName{
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
