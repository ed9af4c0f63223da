package org.tableaux.tableau;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tableaux.formula.Formula;

import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaClassifier Tests")
class FormulaClassifierTest {

    @Nested
    @DisplayName("Classical laws")
    class LawTests {

        @Test
        @DisplayName("Excluded middle is a tautology")
        void testExcludedMiddle() {
            assertEquals(Classification.TAUTOLOGY, FormulaClassifier.classify("A|~A"));
        }

        @Test
        @DisplayName("Noncontradiction: A&~A is a contradiction")
        void testNoncontradiction() {
            assertEquals(Classification.CONTRADICTION, FormulaClassifier.classify("A&~A"));
        }

        @Test
        @DisplayName("A&B is a contingency")
        void testContingency() {
            assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify("A&B"));
            assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify("A->B"));
            assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify("A"));
        }

        @Test
        @DisplayName("Modus ponens")
        void testModusPonens() {
            assertEquals(Classification.TAUTOLOGY, FormulaClassifier.classify("((A->B)&A)->B"));
        }

        @Test
        @DisplayName("Modus tollens")
        void testModusTollens() {
            assertEquals(Classification.TAUTOLOGY, FormulaClassifier.classify("((A->B)&~B)->~A"));
        }

        @Test
        @DisplayName("Double negation biconditional")
        void testDoubleNegation() {
            assertEquals(Classification.TAUTOLOGY, FormulaClassifier.classify("(A->~~A)&((~~A)->A)"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "((A->B)&(B->C))->(A->C)",
                "(A->(B->A))",
                "(A->B) -> ((~B) -> (~A))",
                "((~(A&B))->((~A)|(~B))) & (((~A)|(~B))->(~(A&B)))",
                "[p ∧ q] → {p ∨ r}"
        })
        @DisplayName("Further tautologies")
        void testTautologies(String text) {
            assertEquals(Classification.TAUTOLOGY, FormulaClassifier.classify(text));
        }

        @ParameterizedTest
        @ValueSource(strings = {"(A|B)&((~A)&(~B))", "~(A->A)", "(A->B)&(A&(~B))"})
        @DisplayName("Further contradictions")
        void testContradictions(String text) {
            assertEquals(Classification.CONTRADICTION, FormulaClassifier.classify(text));
        }

        @Test
        @DisplayName("Upper and lower case letters are different variables")
        void testCaseSensitiveVariables() {
            assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify("A|~a"));
            assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify("A&~a"));
        }
    }

    @Nested
    @DisplayName("Sentinels")
    class SentinelTests {

        @ParameterizedTest
        @ValueSource(strings = {"(A&B", "A&&B", "", "A ? B"})
        @DisplayName("Parse failures are reported as invalid formula")
        void testInvalidFormula(String text) {
            Classification classification = FormulaClassifier.classify(text);
            assertEquals(Classification.INVALID_FORMULA, classification);
            assertEquals("invalid formula", classification.getLabel());
        }

        @Test
        @DisplayName("Null text is an invalid formula")
        void testNull() {
            assertEquals(Classification.INVALID_FORMULA, FormulaClassifier.classify((String) null));
        }

        @Test
        @DisplayName("Decision table over the two closures")
        void testDecisionTable() {
            assertEquals(Classification.CONTINGENCY, Classification.fromClosures(false, false));
            assertEquals(Classification.TAUTOLOGY, Classification.fromClosures(false, true));
            assertEquals(Classification.CONTRADICTION, Classification.fromClosures(true, false));
            assertEquals(Classification.TABLEAUX_ERROR, Classification.fromClosures(true, true));
        }

        @Test
        @DisplayName("Labels are the stable result strings")
        void testLabels() {
            assertEquals("tautology", Classification.TAUTOLOGY.toString());
            assertEquals("contradiction", Classification.CONTRADICTION.toString());
            assertEquals("contingency", Classification.CONTINGENCY.toString());
            assertEquals("tableaux error", Classification.TABLEAUX_ERROR.toString());
        }
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1, 2, 3, 5, 8, 13, 21, 34, 55, 89, 144, 233})
    @DisplayName("Random formulas: exactly one classification, agreeing with the truth table")
    void testRandomFormulasAgreeWithTruthTable(long seed) {
        Random random = new Random(seed);
        Set<Classification> allowed = EnumSet.of(
                Classification.TAUTOLOGY, Classification.CONTRADICTION, Classification.CONTINGENCY);

        for (int i = 0; i < 40; i++) {
            Formula formula = RandomFormulas.generate(random, 5);
            Classification classification = FormulaClassifier.classify(formula);

            assertTrue(allowed.contains(classification), () -> "Esito inatteso per " + formula + ": " + classification);
            assertEquals(RandomFormulas.truthTable(formula), classification, formula::toString);
        }
    }

    @Test
    @DisplayName("Long conjunction chains do not exhaust the call stack")
    void testLongChain() {
        Formula chain = Formula.proposition("A");
        String letters = "ABCDEFGHIJ";
        for (int i = 0; i < 50_000; i++) {
            chain = Formula.conjunction(Formula.proposition(String.valueOf(letters.charAt(i % letters.length()))), chain);
        }
        assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify(chain));
        assertEquals(Classification.CONTRADICTION, FormulaClassifier.classify(Formula.conjunction(chain, Formula.negation(Formula.proposition("J")))));
    }

    @ParameterizedTest
    @ValueSource(ints = {50_000, 50_001})
    @DisplayName("Deep negation towers classify from text without exhausting the call stack")
    void testDeepNegationFromText(int depth) {
        String negations = "~".repeat(depth);
        boolean even = depth % 2 == 0;

        assertEquals(Classification.CONTINGENCY, FormulaClassifier.classify(negations + "A"));
        assertEquals(even ? Classification.TAUTOLOGY : Classification.CONTRADICTION,
                FormulaClassifier.classify(negations + "(A|~A)"));
        assertEquals(even ? Classification.CONTRADICTION : Classification.TAUTOLOGY,
                FormulaClassifier.classify(negations + "(A&~A)"));
    }
}
