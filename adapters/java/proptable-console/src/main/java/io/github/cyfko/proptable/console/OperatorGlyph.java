package io.github.cyfko.proptable.console;

import io.github.cyfko.proptable.core.api.Connective;

/**
 * Display glyphs of the connectives.
 * <p>
 * Binary glyphs are padded with spaces so that rendered formulas stay readable; XOR takes an
 * extra trailing space because {@code ⊕} renders wider than one cell in most terminals.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorGlyph {
    NOT(Connective.NOT, "¬"),
    AND(Connective.AND, " ∧ "),
    OR(Connective.OR, " ∨ "),
    XOR(Connective.XOR, " ⊕  "),
    IMPLIES(Connective.IMPLIES, " → "),
    EQUIVALENT(Connective.EQUIVALENT, " ≡ ");

    private final Connective connective;
    private final String glyph;

    OperatorGlyph(Connective connective, String glyph) {
        this.connective = connective;
        this.glyph = glyph;
    }

    public Connective getConnective() {
        return connective;
    }

    public String getGlyph() {
        return glyph;
    }

    /**
     * Replaces every connective symbol of a formula with its glyph.
     *
     * @param formula formula text using ASCII connectives
     * @return the display form
     */
    public static String toDisplay(String formula) {
        StringBuilder sb = new StringBuilder(formula.length() * 2);
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            sb.append(Connective.isConnective(c) ? of(Connective.fromSymbol(c)).getGlyph() : String.valueOf(c));
        }
        return sb.toString();
    }

    public static OperatorGlyph of(Connective connective) {
        for (OperatorGlyph g : values()) {
            if (g.connective == connective) return g;
        }
        throw new IllegalArgumentException("No glyph for connective " + connective);
    }
}
