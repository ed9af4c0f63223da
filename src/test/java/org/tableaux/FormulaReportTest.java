package org.tableaux;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tableaux.parser.Notation;
import org.tableaux.tableau.Classification;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaReport Tests")
class FormulaReportTest {

    @Test
    @DisplayName("Valid formula in the requested notation")
    void testValidFormula() {
        FormulaReport report = FormulaReport.of("A|~A", Notation.PREFIX, false);

        assertTrue(report.isSuccessful());
        assertEquals("A|~A", report.getInput());
        assertTrue(report.getParseResult().isSuccess());
        assertEquals("∨ A ¬A", report.getRendering());
        assertEquals(Classification.TAUTOLOGY, report.getClassification());
        assertNull(report.getBranches());
    }

    @Test
    @DisplayName("Invalid formula keeps the parser message")
    void testInvalidFormula() {
        FormulaReport report = FormulaReport.of("(A&B", Notation.INFIX, true);

        assertFalse(report.isSuccessful());
        assertEquals(Classification.INVALID_FORMULA, report.getClassification());
        assertNull(report.getRendering());
        assertNull(report.getBranches());

        String text = report.format();
        assertTrue(text.contains("Parsing: fallito"));
        assertTrue(text.contains("Classificazione: invalid formula"));
    }

    @Test
    @DisplayName("Branches of both tableaux are listed on request")
    void testBranches() {
        FormulaReport report = FormulaReport.of("A&B", Notation.INFIX, true);

        assertNotNull(report.getBranches());
        assertEquals(1, report.getBranches().getFormulaBranches().size());
        assertEquals(2, report.getBranches().getNegationBranches().size());

        String text = report.format();
        assertTrue(text.contains("Formula: A&B"));
        assertTrue(text.contains("Parsing: (A ∧ B)"));
        assertTrue(text.contains("Classificazione: contingency"));
        assertTrue(text.contains("Rami della formula (1):"));
        assertTrue(text.contains("Rami della negazione (2):"));
        assertTrue(text.contains(" aperto"));
    }

    @Test
    @DisplayName("Closed branches are marked")
    void testClosedBranchMarker() {
        String text = FormulaReport.of("A&~A", Notation.POSTFIX, true).format();

        assertTrue(text.contains("Parsing: A A¬ ∧"));
        assertTrue(text.contains(" chiuso"));
        assertEquals(text, FormulaReport.of("A&~A", Notation.POSTFIX, true).toString());
    }

    @Test
    @DisplayName("Deeply nested input is rendered and classified")
    void testDeepNesting() {
        String input = "!".repeat(50_000) + "A";
        FormulaReport report = FormulaReport.of(input, Notation.PREFIX, true);

        assertTrue(report.isSuccessful());
        assertEquals(input, report.getInput());
        assertEquals("¬".repeat(50_000) + "A", report.getRendering());
        assertEquals(Classification.CONTINGENCY, report.getClassification());
        assertEquals(1, report.getBranches().getFormulaBranches().size());
    }
}
