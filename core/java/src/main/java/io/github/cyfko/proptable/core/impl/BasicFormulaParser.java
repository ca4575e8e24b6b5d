package io.github.cyfko.proptable.core.impl;

import io.github.cyfko.proptable.core.api.FormulaParser;
import io.github.cyfko.proptable.core.config.FormulaPolicy;
import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.exception.SyntaxErrorKind;
import io.github.cyfko.proptable.core.model.TokenizedFormula;
import io.github.cyfko.proptable.core.parsing.FormulaTokenizer;
import io.github.cyfko.proptable.core.parsing.GrammarRule;

import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Default {@link FormulaParser}: grammar validation followed by group tokenization.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li><strong>Normalization</strong>: whitespace removed, letters lowercased</li>
 *   <li><strong>Policy</strong>: length limit of the configured {@link FormulaPolicy}</li>
 *   <li><strong>Grammar</strong>: the {@link GrammarRule}s, in priority order</li>
 *   <li><strong>Tokenization</strong>: {@link FormulaTokenizer}; any parenthesis left over is reported
 *       as {@link SyntaxErrorKind#UNBALANCED_PARENTHESES}</li>
 *   <li><strong>Atoms</strong>: distinct letters, sorted, bounded by the policy's atom limit</li>
 * </ol>
 *
 * <p>Nothing is evaluated here; the parser is stateless and can be shared.</p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 * TokenizedFormula formula = parser.parse("(P & Q) > P");
 * formula.formula();      // "(p&q)>p"
 * formula.flatFormula();  // "0>p"
 * formula.atoms();        // [p, q]
 *
 * FormulaParser strict = new BasicFormulaParser(FormulaPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(BasicFormulaParser.class.getName());

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final FormulaPolicy formulaPolicy;

    /**
     * Default constructor using {@link FormulaPolicy#defaults()}.
     */
    public BasicFormulaParser() {
        this(FormulaPolicy.defaults());
    }

    /**
     * @param formulaPolicy the size limits to enforce
     * @throws IllegalArgumentException if formulaPolicy is null
     */
    public BasicFormulaParser(FormulaPolicy formulaPolicy) {
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.formulaPolicy = formulaPolicy;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    /**
     * Removes all whitespace and lowercases the input.
     *
     * @param input raw user input
     * @return the normalized formula
     */
    public static String normalize(String input) {
        return WHITESPACE.matcher(input).replaceAll("").toLowerCase(Locale.ROOT);
    }

    @Override
    public TokenizedFormula parse(String input) throws FormulaSyntaxException {
        Objects.requireNonNull(input, "formula");
        String formula = normalize(input);

        try {
            return parseNormalized(formula);
        } catch (FormulaSyntaxException e) {
            log.fine(() -> String.format("Rejected formula '%s': %s", formula, e.getKind()));
            throw e;
        }
    }

    private TokenizedFormula parseNormalized(String formula) {
        if (formula.isEmpty()) {
            throw new FormulaSyntaxException(SyntaxErrorKind.EMPTY_INPUT, null);
        }

        if (formula.length() > formulaPolicy.maxFormulaLength()) {
            throw new FormulaSyntaxException(SyntaxErrorKind.FORMULA_TOO_LONG, null, String.format(
                    "Formula too long (%d characters, max: %d). Policy applied: %s",
                    formula.length(), formulaPolicy.maxFormulaLength(), formulaPolicy.policyName()));
        }

        for (GrammarRule rule : GrammarRule.values()) {
            Optional<String> violation = rule.findViolation(formula);
            if (violation.isPresent()) {
                throw new FormulaSyntaxException(rule.getKind(), violation.get());
            }
        }

        FormulaTokenizer.Tokenization tokenization = FormulaTokenizer.tokenize(formula);
        if (tokenization.hasUnmatchedParenthesis()) {
            throw new FormulaSyntaxException(SyntaxErrorKind.UNBALANCED_PARENTHESES,
                    firstParenthesis(tokenization.flatFormula()));
        }

        List<Character> atoms = collectAtoms(formula);
        if (atoms.size() > formulaPolicy.maxAtoms()) {
            throw new FormulaSyntaxException(SyntaxErrorKind.TOO_MANY_ATOMS, null, String.format(
                    "Formula contains too many distinct propositions (%d, max: %d). Policy applied: %s",
                    atoms.size(), formulaPolicy.maxAtoms(), formulaPolicy.policyName()));
        }

        return new TokenizedFormula(formula, tokenization.flatFormula(), tokenization.tokens(), atoms);
    }

    private static List<Character> collectAtoms(String formula) {
        SortedSet<Character> letters = new TreeSet<>();
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (c >= 'a' && c <= 'z') {
                letters.add(c);
            }
        }
        return new ArrayList<>(letters);
    }

    private static String firstParenthesis(String flatFormula) {
        for (int i = 0; i < flatFormula.length(); i++) {
            char c = flatFormula.charAt(i);
            if (c == '(' || c == ')') return String.valueOf(c);
        }
        return null;
    }
}
