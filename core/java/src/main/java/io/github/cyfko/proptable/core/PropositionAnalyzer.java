package io.github.cyfko.proptable.core;

import io.github.cyfko.proptable.core.api.FormulaParser;
import io.github.cyfko.proptable.core.config.FormulaPolicy;
import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.impl.BasicFormulaParser;
import io.github.cyfko.proptable.core.impl.FormulaClassifier;
import io.github.cyfko.proptable.core.impl.TruthTableGenerator;
import io.github.cyfko.proptable.core.model.FormulaAnalysis;
import io.github.cyfko.proptable.core.model.TokenizedFormula;
import io.github.cyfko.proptable.core.model.TruthTable;

import java.util.Objects;

/**
 * Entry point of the core: parses a formula, builds its truth table and classifies it.
 *
 * <pre>{@code
 * PropositionAnalyzer analyzer = new PropositionAnalyzer();
 * FormulaAnalysis analysis = analyzer.analyze("(p & q) > p");
 *
 * analysis.table().rowCount();     // 4
 * analysis.classification();       // TAUTOLOGY
 * }</pre>
 *
 * <p>Each call works on freshly created evaluation state; nothing is carried over from a
 * previous formula.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PropositionAnalyzer {

    private final FormulaParser parser;
    private final TruthTableGenerator generator;

    public PropositionAnalyzer() {
        this(new BasicFormulaParser());
    }

    public PropositionAnalyzer(FormulaPolicy policy) {
        this(new BasicFormulaParser(policy));
    }

    public PropositionAnalyzer(FormulaParser parser) {
        this(parser, new TruthTableGenerator());
    }

    public PropositionAnalyzer(FormulaParser parser, TruthTableGenerator generator) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public FormulaParser getParser() {
        return parser;
    }

    /**
     * Analyses one formula.
     *
     * @param input raw user input
     * @return the table and classification of the formula
     * @throws FormulaSyntaxException if the input violates the grammar
     */
    public FormulaAnalysis analyze(String input) throws FormulaSyntaxException {
        TokenizedFormula formula = parser.parse(input);
        TruthTable table = generator.generate(formula);
        return new FormulaAnalysis(formula, table, FormulaClassifier.classify(table));
    }
}
