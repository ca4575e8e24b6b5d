package io.github.cyfko.proptable.core.parsing;

import io.github.cyfko.proptable.core.model.TokenTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the parenthesized groups of a formula into a {@link TokenTable}.
 * <p>
 * Each pass replaces every innermost group (a group containing no parentheses, together with
 * an optional {@code ~} right before it) with the decimal key of a new token. Passes repeat until
 * no such group is left, so the number of passes is the nesting depth of the formula.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>
 * ~((a&amp;b)|c)&gt;(d)
 *
 * pass 1:  ~(0|c)&gt;1        0 → (a&amp;b)   1 → (d)
 * pass 2:  2&gt;1             2 → ~(0|c)
 * </pre>
 *
 * <p>
 * Keys are handed out in discovery order, left to right within a pass, so a token only ever
 * refers to keys created in earlier passes. Every occurrence of a group gets its own key, even
 * when the same text appears twice.
 * </p>
 *
 * <p>
 * Parentheses left in the flat result mean the formula was unbalanced. Detecting that is up to
 * the caller.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaTokenizer {

    private static final Pattern INNERMOST_GROUP = Pattern.compile("~?\\([^()]*\\)");

    private FormulaTokenizer() {}

    /**
     * Result of a tokenization.
     *
     * @param flatFormula the formula with every extracted group replaced by its key
     * @param tokens      the extracted groups
     */
    public record Tokenization(String flatFormula, TokenTable tokens) {

        /**
         * @return {@code true} if some parenthesis could not be matched
         */
        public boolean hasUnmatchedParenthesis() {
            return flatFormula.indexOf('(') >= 0 || flatFormula.indexOf(')') >= 0;
        }
    }

    /**
     * Tokenizes a normalized formula.
     *
     * @param formula the normalized formula, must not contain digits
     * @return the flat formula and its token table
     * @throws IllegalArgumentException if the formula contains digits, which would clash with keys
     */
    public static Tokenization tokenize(String formula) {
        Objects.requireNonNull(formula, "formula");
        for (int i = 0; i < formula.length(); i++) {
            if (Character.isDigit(formula.charAt(i))) {
                throw new IllegalArgumentException("Formula must not contain digits before tokenization: " + formula);
            }
        }

        List<String> texts = new ArrayList<>();
        String working = formula;

        while (true) {
            Matcher matcher = INNERMOST_GROUP.matcher(working);
            if (!matcher.find()) {
                break;
            }
            StringBuilder next = new StringBuilder(working.length());
            do {
                texts.add(matcher.group());
                matcher.appendReplacement(next, String.valueOf(texts.size() - 1));
            } while (matcher.find());
            matcher.appendTail(next);
            working = next.toString();
        }

        return new Tokenization(working, texts.isEmpty() ? TokenTable.empty() : new TokenTable(texts));
    }
}
