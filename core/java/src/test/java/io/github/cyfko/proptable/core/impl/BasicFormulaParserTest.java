package io.github.cyfko.proptable.core.impl;

import io.github.cyfko.proptable.core.api.FormulaParser;
import io.github.cyfko.proptable.core.config.FormulaPolicy;
import io.github.cyfko.proptable.core.exception.FormulaSyntaxException;
import io.github.cyfko.proptable.core.exception.SyntaxErrorKind;
import io.github.cyfko.proptable.core.model.TokenizedFormula;
import io.github.cyfko.proptable.core.utils.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link BasicFormulaParser}.
 * <p>
 * Covers normalization, every grammar rule with its reported substring, rule priority,
 * balanced parentheses and policy limits.
 * </p>
 */
@DisplayName("BasicFormulaParser Tests")
class BasicFormulaParserTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicFormulaParser();
    }

    private FormulaSyntaxException reject(String input) {
        return assertThrows(FormulaSyntaxException.class, () -> parser.parse(input));
    }

    @Nested
    @DisplayName("Valid formulas")
    class ValidFormulas {

        @Test
        @DisplayName("Whitespace is removed and letters are lowercased")
        void normalization() {
            TokenizedFormula formula = parser.parse(" (P & Q)\t> p ");

            assertEquals("(p&q)>p", formula.formula());
            assertEquals("0>p", formula.flatFormula());
            assertEquals(List.of("(p&q)"), formula.tokens().texts());
            assertEquals(List.of('p', 'q'), formula.atoms());
        }

        @Test
        @DisplayName("Atoms are distinct and sorted alphabetically")
        void atomsAreSorted() {
            assertEquals(List.of('a', 'b', 'z'), parser.parse("z|(b&a)|~z").atoms());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "p", "~p", "~~p", "p&q", "p|q", "p+q", "p>q", "p<q",
                "~(p)", "((p))", "~(p&q)>(~p|~q)", "(p>q)<(~q>~p)", "a&b&c&d&e"
        })
        void acceptsWellFormedFormulas(String input) {
            assertDoesNotThrow(() -> parser.parse(input));
            assertTrue(parser.validate(input).isValid());
        }

        @ParameterizedTest
        @ValueSource(strings = {"~((a&b)|c)>(d)", "P > q", "(p&q)|(p&q)"})
        @DisplayName("Parsing the normalized formula again gives the same result")
        void parsingIsIdempotent(String input) {
            TokenizedFormula first = parser.parse(input);
            TokenizedFormula second = parser.parse(first.formula());

            assertEquals(first.formula(), second.formula());
            assertEquals(first.flatFormula(), second.flatFormula());
            assertEquals(first.tokens().texts(), second.tokens().texts());
            assertEquals(first.atoms(), second.atoms());
        }

        @Test
        void nullInputIsRejected() {
            assertThrows(NullPointerException.class, () -> parser.parse(null));
        }
    }

    @Nested
    @DisplayName("Grammar violations")
    class GrammarViolations {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        void emptyInput(String input) {
            FormulaSyntaxException e = reject(input);

            assertEquals(SyntaxErrorKind.EMPTY_INPUT, e.getKind());
            assertNull(e.getOffendingText());
            assertEquals("Input cannot be empty!", e.getMessage());
        }

        @ParameterizedTest(name = "''{0}'' is rejected as {1} at ''{2}''")
        @CsvSource(delimiter = ';', value = {
                "p&q1; DIGIT; 1",
                "p#q; INVALID_CHARACTER; #",
                "p*q; INVALID_CHARACTER; *",
                "ab; MULTI_LETTER_ATOM; ab",
                "(&p); INVALID_GROUP_OPEN; (&",
                "(); INVALID_GROUP_OPEN; ()",
                "(p&); INVALID_GROUP_CLOSE; &)",
                "p~q; MISPLACED_NEGATION; p~",
                "p~; MISPLACED_NEGATION; p~",
                "~; MISPLACED_NEGATION; ~",
                "p&&q; BINARY_OPERATOR_ARITY; &&",
                "&p; BINARY_OPERATOR_ARITY; &",
                "p&; BINARY_OPERATOR_ARITY; &",
                "~&p; BINARY_OPERATOR_ARITY; ~&",
                "a(b); LETTER_PAREN_ADJACENCY; a(",
                "(a)b; LETTER_PAREN_ADJACENCY; )b",
                "(a)(b); LETTER_PAREN_ADJACENCY; )(",
                "(p&q; UNBALANCED_PARENTHESES; (",
                "p&q); UNBALANCED_PARENTHESES; )",
                "((p); UNBALANCED_PARENTHESES; ("
        })
        void reportsKindAndOffendingText(String input, SyntaxErrorKind kind, String offending) {
            FormulaSyntaxException e = reject(input);

            assertEquals(kind, e.getKind());
            assertEquals(offending, e.getOffendingText());
        }

        @Test
        @DisplayName("Message combines the rule and the offending text")
        void message() {
            assertEquals("Binary operators can only have 2 operands! (ex. &&)", reject("p&&q").getMessage());
        }

        @Test
        @DisplayName("Digits take priority over any other violation")
        void digitsFirst() {
            assertEquals(SyntaxErrorKind.DIGIT, reject("p*q1").getKind());
            assertEquals(SyntaxErrorKind.DIGIT, reject("ab&&1").getKind());
        }

        @Test
        @DisplayName("Invalid characters take priority over structural violations")
        void invalidCharacterBeforeStructure() {
            assertEquals(SyntaxErrorKind.INVALID_CHARACTER, reject("(p&&q!").getKind());
        }

        @Test
        void validateReportsWithoutThrowing() {
            ValidationResult result = parser.validate("a(b)");

            assertFalse(result.isValid());
            assertEquals(SyntaxErrorKind.LETTER_PAREN_ADJACENCY, result.getKind());
            assertEquals("a(", result.getOffendingText());
            assertNotNull(result.getErrorMessage());
        }
    }

    @Nested
    @DisplayName("Policy limits")
    class PolicyLimits {

        @Test
        void constructorRequiresPolicy() {
            assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(null));
            assertEquals(FormulaPolicy.defaults(), new BasicFormulaParser().getFormulaPolicy());
        }

        @Test
        @DisplayName("Length is measured after normalization")
        void formulaTooLong() {
            FormulaParser shortOnly = new BasicFormulaParser(FormulaPolicy.builder().maxFormulaLength(5).build());

            assertDoesNotThrow(() -> shortOnly.parse("p  &  q"));
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> shortOnly.parse("p&q&r&s"));
            assertEquals(SyntaxErrorKind.FORMULA_TOO_LONG, e.getKind());
            assertTrue(e.getMessage().contains("CUSTOM_POLICY"));
        }

        @Test
        @DisplayName("Only distinct propositions count toward the atom limit")
        void tooManyAtoms() {
            FormulaParser twoAtoms = new BasicFormulaParser(FormulaPolicy.builder().maxAtoms(2).build());

            assertDoesNotThrow(() -> twoAtoms.parse("p&q&p|~q"));
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> twoAtoms.parse("p&q&r"));
            assertEquals(SyntaxErrorKind.TOO_MANY_ATOMS, e.getKind());
            assertTrue(e.getMessage().contains("max: 2"));
        }

        @Test
        void strictPolicy() {
            FormulaParser strict = new BasicFormulaParser(FormulaPolicy.strict());

            assertDoesNotThrow(() -> strict.parse("a&b&c&d&e&f&g&h"));
            assertEquals(SyntaxErrorKind.TOO_MANY_ATOMS,
                    assertThrows(FormulaSyntaxException.class, () -> strict.parse("a&b&c&d&e&f&g&h&i")).getKind());
        }
    }
}
