package io.github.cyfko.proptable.console;

import io.github.cyfko.proptable.core.PropositionAnalyzer;
import io.github.cyfko.proptable.core.config.FormulaPolicy;
import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.model.FormulaAnalysis;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interactive console for truth tables.
 * <p>
 * Reads one formula per line, prints its truth table and its classification. Invalid input is
 * reported with the violated rule and the user is asked again until a valid formula is entered.
 * </p>
 *
 * <h2>Command line</h2>
 * <ul>
 *   <li>{@code -h}, {@code --help}: print the input rules and exit</li>
 *   <li>{@code -f <formula>}: analyse a single formula and exit</li>
 *   <li>{@code --strict}: apply {@link FormulaPolicy#strict()}</li>
 *   <li>no formula: interactive mode, ended by {@code quit} or end of input</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PropTableConsole {

    private static final Logger log = Logger.getLogger(PropTableConsole.class.getName());

    private static final String HELP_PARAM = "-h";
    private static final String HELP_LONG_PARAM = "--help";
    private static final String FORMULA_PARAM = "-f";
    private static final String STRICT_PARAM = "--strict";
    private static final String QUIT_COMMAND = "quit";

    static final String BANNER = """
            PropTable
            Displays the truth table of a complex proposition and determines its type:
            - tautology: all interpretations are true;
            - satisfiable: there is a true interpretation;
            - contingent: there is at least one true and one false interpretation;
            - unsatisfiable: all interpretations are false.
            """;

    static final String RULES = """
            Rules for valid input:
            - use a single letter for a simple proposition
            - logical operators are:
              ~ (¬ not)
              & (∧ and)
              | (∨ or)
              + (⊕ exclusive or, xor)
              > (→ implies, if)
              < (≡ equivalent, iff)
            - allowed characters: spaces, letters, parentheses (round) and listed operators
            - parentheses may be nested in other parentheses, but they must be paired
            """;

    static final String PROMPT = "Type a complex proposition (or 'quit'): ";
    static final String RETRY = "Type valid input (see rules above)! Try again:";

    private final PropositionAnalyzer analyzer;
    private final TruthTableRenderer renderer;
    private final BufferedReader in;
    private final PrintWriter out;

    public PropTableConsole(PropositionAnalyzer analyzer, Reader in, Writer out) {
        this(analyzer, new TruthTableRenderer(), in, out);
    }

    public PropTableConsole(PropositionAnalyzer analyzer, TruthTableRenderer renderer, Reader in, Writer out) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
        this.in = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        this.out = out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out, true);
    }

    /**
     * Runs the interactive loop until {@code quit} or end of input.
     *
     * @return the number of formulas analysed
     */
    public int run() {
        out.println(BANNER);
        out.println(RULES);

        int analysed = 0;
        while (true) {
            out.println();
            out.println(PROMPT);
            out.flush();
            FormulaAnalysis analysis = readValidFormula();
            if (analysis == null) {
                break;
            }
            print(analysis);
            analysed++;
        }
        out.flush();
        return analysed;
    }

    /**
     * Analyses a single formula and prints the result or the diagnostic.
     *
     * @param formula raw formula text
     * @return {@code 0} on success, {@code 1} if the formula is invalid
     */
    public int analyzeOnce(String formula) {
        try {
            print(analyzer.analyze(formula));
            return 0;
        } catch (FormulaSyntaxException e) {
            out.println(e.getMessage());
            out.flush();
            return 1;
        }
    }

    private FormulaAnalysis readValidFormula() {
        while (true) {
            String line = readLine();
            if (line == null || QUIT_COMMAND.equalsIgnoreCase(line.trim())) {
                return null;
            }
            try {
                return analyzer.analyze(line);
            } catch (FormulaSyntaxException e) {
                out.println(e.getMessage());
                out.println(RETRY);
                out.flush();
            }
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read formula from input", e);
        }
    }

    private void print(FormulaAnalysis analysis) {
        out.println();
        out.print(renderer.render(analysis.table()));
        out.println();
        out.println("The proposition is: " + analysis.classification().getLabel() + ".");
        out.flush();
        log.fine(() -> String.format("Analysed '%s' as %s",
                analysis.formula().formula(), analysis.classification()));
    }

    public static void main(String[] args) {
        String formula = null;
        FormulaPolicy policy = FormulaPolicy.defaults();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case HELP_PARAM, HELP_LONG_PARAM -> {
                    System.out.println(BANNER);
                    System.out.println(RULES);
                    printUsage();
                    return;
                }
                case FORMULA_PARAM -> {
                    if (i + 1 >= args.length) {
                        System.err.println("Missing formula after " + FORMULA_PARAM);
                        printUsage();
                        System.exit(2);
                    }
                    formula = args[++i];
                }
                case STRICT_PARAM -> policy = FormulaPolicy.strict();
                default -> {
                    System.err.println("Unknown argument: " + args[i]);
                    printUsage();
                    System.exit(2);
                }
            }
        }

        PrintWriter stdout = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        PropTableConsole console = new PropTableConsole(
                new PropositionAnalyzer(policy),
                new InputStreamReader(System.in, StandardCharsets.UTF_8),
                stdout);

        try {
            if (formula != null) {
                System.exit(console.analyzeOnce(formula));
            }
            console.run();
        } catch (UncheckedIOException e) {
            log.log(Level.SEVERE, "Console input failed", e);
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: proptable [-h|--help] [--strict] [-f <formula>]");
    }
}
