package org.tableaux.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tableaux.formula.Formula;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaPrinter Tests")
class FormulaPrinterTest {

    private static final Formula A = Formula.proposition("A");
    private static final Formula B = Formula.proposition("B");
    private static final Formula FORMULA = Formula.implication(Formula.conjunction(A, Formula.negation(B)), A);

    @Test
    @DisplayName("Prefix notation")
    void testPrefix() {
        assertEquals("→ ∧ A ¬B A", FormulaPrinter.print(FORMULA, Notation.PREFIX));
    }

    @Test
    @DisplayName("Infix notation parenthesizes every application")
    void testInfix() {
        assertEquals("((A ∧ (¬B)) → A)", FormulaPrinter.print(FORMULA, Notation.INFIX));
    }

    @Test
    @DisplayName("Postfix notation")
    void testPostfix() {
        assertEquals("A B¬ ∧ A →", FormulaPrinter.print(FORMULA, Notation.POSTFIX));
    }

    @Test
    @DisplayName("A proposition prints as its identifier in every notation")
    void testProposition() {
        for (Notation notation : Notation.values()) {
            assertEquals("x", FormulaPrinter.print(Formula.proposition("x"), notation));
        }
    }

    @Test
    @DisplayName("Output always uses canonical spellings")
    void testCanonicalSpellings() {
        Formula parsed = InfixFormulaParser.parse("(p >> q) \\/ (r /\\ !s)").requireFormula();
        assertEquals("((p → q) ∨ (r ∧ (¬s)))", FormulaPrinter.print(parsed, Notation.INFIX));
    }

    @Test
    @DisplayName("Notation names are case insensitive")
    void testNotationNames() {
        assertEquals(Notation.PREFIX, Notation.fromName("Prefix"));
        assertEquals(Notation.POSTFIX, Notation.fromName("postfix"));
        assertThrows(IllegalArgumentException.class, () -> Notation.fromName("polish"));
    }

    @Test
    @DisplayName("Deeply nested formulas print in every notation")
    void testDeepNesting() {
        int depth = 50_000;
        Formula formula = A;
        for (int i = 0; i < depth; i++) {
            formula = Formula.negation(formula);
        }

        assertEquals("¬".repeat(depth) + "A", FormulaPrinter.print(formula, Notation.PREFIX));
        assertEquals("(¬".repeat(depth) + "A" + ")".repeat(depth), FormulaPrinter.print(formula, Notation.INFIX));
        assertEquals("A" + "¬".repeat(depth), FormulaPrinter.print(formula, Notation.POSTFIX));
        assertEquals("¬".repeat(depth) + "A", formula.toString());
    }

    @Test
    @DisplayName("Deep binary chains print left to right")
    void testDeepBinaryChain() {
        int depth = 50_000;
        Formula formula = A;
        for (int i = 0; i < depth; i++) {
            formula = Formula.conjunction(B, formula);
        }

        String infix = FormulaPrinter.print(formula, Notation.INFIX);
        assertTrue(infix.startsWith("(B ∧ (B ∧ "));
        assertTrue(infix.endsWith("A" + ")".repeat(depth)));
        assertEquals(formula, InfixFormulaParser.parse(infix).requireFormula());
    }
}
