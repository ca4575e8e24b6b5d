package io.github.cyfko.proptable.core.api;

/**
 * Enumeration of the logical connectives accepted in formulas.
 * <p>
 * Each connective is written with a single ASCII symbol. Negation is the only unary connective;
 * the five binary ones share a single precedence level and associate to the left, so mixing them
 * meaningfully requires parentheses.
 * </p>
 *
 * <table border="1">
 * <caption>Connective Reference</caption>
 * <thead>
 * <tr><th>Connective</th><th>Symbol</th><th>Arity</th><th>False when</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>~</td><td>1</td><td>operand is true</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>2</td><td>any operand is false</td></tr>
 * <tr><td>OR</td><td>|</td><td>2</td><td>both operands are false</td></tr>
 * <tr><td>XOR</td><td>+</td><td>2</td><td>operands are equal</td></tr>
 * <tr><td>IMPLIES</td><td>&gt;</td><td>2</td><td>left is true and right is false</td></tr>
 * <tr><td>EQUIVALENT</td><td>&lt;</td><td>2</td><td>operands differ</td></tr>
 * </tbody>
 * </table>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Connective c = Connective.fromSymbol('>');
 * boolean value = c.apply(true, false); // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Connective {
    NOT('~'),
    AND('&'),
    OR('|'),
    XOR('+'),
    IMPLIES('>'),
    EQUIVALENT('<');

    private final char symbol;

    Connective(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the ASCII symbol of the connective.
     *
     * @return the symbol used in formulas
     */
    public char getSymbol() {
        return symbol;
    }

    public boolean isUnary() {
        return this == NOT;
    }

    /**
     * Applies this binary connective.
     *
     * @param left  the left operand
     * @param right the right operand
     * @return the resulting truth value
     * @throws UnsupportedOperationException if called on {@link #NOT}
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left != right;
            case IMPLIES -> !left || right;
            case EQUIVALENT -> left == right;
            case NOT -> throw new UnsupportedOperationException("NOT is a unary connective");
        };
    }

    /**
     * Finds the connective written with the given symbol.
     *
     * @param symbol the symbol to look up
     * @return the matching connective
     * @throws IllegalArgumentException if the symbol is not a connective
     */
    public static Connective fromSymbol(char symbol) {
        for (Connective connective : values()) {
            if (connective.symbol == symbol) return connective;
        }
        throw new IllegalArgumentException("Unknown connective symbol: '" + symbol + "'");
    }

    /**
     * @param c a character of a formula
     * @return {@code true} if {@code c} is the symbol of a connective
     */
    public static boolean isConnective(char c) {
        for (Connective connective : values()) {
            if (connective.symbol == c) return true;
        }
        return false;
    }
}
