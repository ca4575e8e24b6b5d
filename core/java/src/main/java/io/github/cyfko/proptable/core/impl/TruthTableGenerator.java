package io.github.cyfko.proptable.core.impl;

import io.github.cyfko.proptable.core.api.EvaluationContext;
import io.github.cyfko.proptable.core.api.Expression;
import io.github.cyfko.proptable.core.model.AtomRegistry;
import io.github.cyfko.proptable.core.model.AtomicProposition;
import io.github.cyfko.proptable.core.model.TokenTable;
import io.github.cyfko.proptable.core.model.TokenizedFormula;
import io.github.cyfko.proptable.core.model.TruthRow;
import io.github.cyfko.proptable.core.model.TruthTable;
import io.github.cyfko.proptable.core.utils.Assignments;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Generates the truth table of a tokenized formula by exhaustive enumeration.
 * <p>
 * Every group of the token table and the flat root formula are compiled once. Then, for each
 * assignment in {@link Assignments} order:
 * </p>
 * <ol>
 *   <li>the assignment is written to the formula's {@link AtomRegistry} through the {@link EvaluationContext}</li>
 *   <li>groups are evaluated in key order, each value recorded so enclosing groups can read it</li>
 *   <li>the root formula is evaluated last</li>
 * </ol>
 * <p>
 * Runtime is O(2^n × m) for n propositions and m the combined size of the compiled expressions.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableGenerator {

    private static final Logger log = Logger.getLogger(TruthTableGenerator.class.getName());

    /**
     * Generates the table.
     *
     * @param formula a formula produced by a {@link io.github.cyfko.proptable.core.api.FormulaParser}
     * @return its truth table
     */
    public TruthTable generate(TokenizedFormula formula) {
        Objects.requireNonNull(formula, "formula");

        TokenTable tokens = formula.tokens();
        List<Expression> groups = new ArrayList<>(tokens.size());
        for (String text : tokens.texts()) {
            groups.add(ExpressionEvaluator.compile(text));
        }
        Expression root = ExpressionEvaluator.compile(formula.flatFormula());

        AtomRegistry registry = AtomRegistry.of(formula.atoms());
        EvaluationContext context = new EvaluationContext(registry, tokens.size());

        List<String> header = new ArrayList<>(registry.size() + tokens.size() + 1);
        for (AtomicProposition atom : registry.atoms()) {
            header.add(atom.getName());
        }
        for (int key = 0; key < tokens.size(); key++) {
            header.add(tokens.expand(key));
        }
        header.add(formula.formula());

        long start = System.nanoTime();
        Assignments assignments = Assignments.over(registry.size());
        List<TruthRow> rows = new ArrayList<>(assignments.count());

        for (boolean[] assignment : assignments) {
            context.beginRow(assignment);
            List<Boolean> values = new ArrayList<>(header.size());
            for (boolean value : assignment) {
                values.add(value);
            }
            for (int key = 0; key < groups.size(); key++) {
                boolean value = groups.get(key).evaluate(context);
                context.recordTokenValue(key, value);
                values.add(value);
            }
            values.add(root.evaluate(context));
            rows.add(new TruthRow(values));
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.fine(() -> String.format(
                "Truth table for '%s' generated: %d rows x %d columns in %d ms",
                formula.formula(), rows.size(), header.size(), durationMs));

        return new TruthTable(header, rows, registry.size());
    }
}
