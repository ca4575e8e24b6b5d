package io.github.cyfko.proptable.console;

import io.github.cyfko.proptable.core.PropositionAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PropTableConsole Tests")
class PropTableConsoleTest {

    private PropositionAnalyzer analyzer;
    private StringWriter output;

    @BeforeEach
    void setUp() {
        analyzer = spy(new PropositionAnalyzer());
        output = new StringWriter();
    }

    private PropTableConsole consoleReading(String input) {
        return new PropTableConsole(analyzer, new StringReader(input), output);
    }

    @Nested
    @DisplayName("Interactive loop")
    class InteractiveLoop {

        @Test
        @DisplayName("Banner and rules are printed before the first prompt")
        void printsBannerAndRules() {
            consoleReading("quit\n").run();

            String text = output.toString();
            assertTrue(text.contains("Rules for valid input:"));
            assertTrue(text.indexOf("Rules for valid input:") < text.indexOf(PropTableConsole.PROMPT));
        }

        @Test
        @DisplayName("Invalid input is reported and the user is asked again")
        void repromptsOnInvalidInput() {
            int analysed = consoleReading("p&&q\np|~p\nquit\n").run();

            String text = output.toString();
            assertEquals(1, analysed);
            assertTrue(text.contains("Binary operators can only have 2 operands! (ex. &&)"));
            assertTrue(text.contains(PropTableConsole.RETRY));
            assertTrue(text.contains("The proposition is: valid (tautology, also satisfiable)."));
            verify(analyzer).analyze("p&&q");
            verify(analyzer).analyze("p|~p");
            verify(analyzer, never()).analyze("quit");
        }

        @Test
        void analysesSeveralFormulasUntilEndOfInput() {
            int analysed = consoleReading("p\np & ~p\n").run();

            String text = output.toString();
            assertEquals(2, analysed);
            assertTrue(text.contains("The proposition is: contingent (also satisfiable)."));
            assertTrue(text.contains("The proposition is: contradiction (unsatisfiable)."));
        }

        @Test
        void endOfInputStopsImmediately() {
            assertEquals(0, consoleReading("").run());
            verifyNoInteractions(analyzer);
        }

        @Test
        void quitIgnoresCaseAndSpaces() {
            assertEquals(0, consoleReading("  QUIT \np\n").run());
        }
    }

    @Nested
    @DisplayName("Single formula")
    class SingleFormula {

        @Test
        void validFormulaPrintsTable() {
            int status = consoleReading("").analyzeOnce("p>q");

            String text = output.toString();
            assertEquals(0, status);
            assertTrue(text.contains("\t p | q | p → q "));
            assertTrue(text.contains("The proposition is: contingent (also satisfiable)."));
        }

        @Test
        void invalidFormulaPrintsDiagnostic() {
            int status = consoleReading("").analyzeOnce("a(b)");

            assertEquals(1, status);
            assertTrue(output.toString().contains("(ex. a()"));
            assertFalse(output.toString().contains("The proposition is"));
        }
    }

    @Test
    void constructorRejectsNulls() {
        assertThrows(NullPointerException.class,
                () -> new PropTableConsole(null, new StringReader(""), output));
        assertThrows(NullPointerException.class,
                () -> new PropTableConsole(analyzer, null, new StringReader(""), output));
    }
}
