package org.tableaux.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tableaux.formula.Formula;
import org.tableaux.formula.SymbolKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InferenceRuleCatalog Tests")
class InferenceRuleCatalogTest {

    private static final Formula A = Formula.proposition("A");
    private static final Formula B = Formula.proposition("B");

    private static final Set<SymbolKind> FORMULA_KINDS = EnumSet.of(
            SymbolKind.PROPOSITION, SymbolKind.NEGATION,
            SymbolKind.CONJUNCTION, SymbolKind.DISJUNCTION, SymbolKind.IMPLICATION);

    private static Formula sample(SymbolKind kind) {
        return switch (kind) {
            case PROPOSITION -> A;
            case NEGATION -> Formula.negation(A);
            default -> Formula.of(kind, A, B);
        };
    }

    @Nested
    @DisplayName("Coverage")
    class CoverageTests {

        @Test
        @DisplayName("Every compound formula matches exactly one rule, literals match none")
        void testExhaustiveAndExclusive() {
            for (SymbolKind outer : List.of(SymbolKind.NEGATION, SymbolKind.CONJUNCTION,
                    SymbolKind.DISJUNCTION, SymbolKind.IMPLICATION)) {
                for (SymbolKind inner : FORMULA_KINDS) {
                    Formula child = sample(inner);
                    Formula formula = outer == SymbolKind.NEGATION
                            ? Formula.negation(child)
                            : Formula.of(outer, child, B);

                    long matches = 0;
                    for (InferenceRule rule : InferenceRule.values()) {
                        if (rule.getPattern().matches(RulePattern.of(formula))) {
                            matches++;
                        }
                    }

                    if (formula.isLiteral()) {
                        assertEquals(0, matches, formula.toString());
                        assertEquals(Optional.empty(), InferenceRuleCatalog.lookup(formula));
                    } else {
                        assertEquals(1, matches, formula.toString());
                        assertTrue(InferenceRuleCatalog.lookup(formula).isPresent());
                    }
                }
            }
            assertEquals(Optional.empty(), InferenceRuleCatalog.lookup(A));
        }

        @Test
        @DisplayName("Seven rules, three of them branching")
        void testPartition() {
            assertEquals(7, InferenceRule.values().length);
            Set<InferenceRule> branching = EnumSet.noneOf(InferenceRule.class);
            for (InferenceRule rule : InferenceRule.values()) {
                if (rule.isBranching()) {
                    branching.add(rule);
                }
            }
            assertEquals(EnumSet.of(InferenceRule.NEGATED_CONJUNCTION, InferenceRule.DISJUNCTION, InferenceRule.IMPLICATION),
                    branching);
        }

        @Test
        @DisplayName("Lookup by pattern honours the wildcard")
        void testLookupByPattern() {
            assertEquals(Optional.of(InferenceRule.CONJUNCTION),
                    InferenceRuleCatalog.lookup(SymbolKind.CONJUNCTION, SymbolKind.IMPLICATION));
            assertEquals(Optional.of(InferenceRule.NEGATED_DISJUNCTION),
                    InferenceRuleCatalog.lookup(SymbolKind.NEGATION, SymbolKind.DISJUNCTION));
            assertEquals(Optional.empty(),
                    InferenceRuleCatalog.lookup(SymbolKind.NEGATION, SymbolKind.PROPOSITION));
        }

        @Test
        @DisplayName("Pattern equality is exact, matching is not")
        void testPatternEquality() {
            RulePattern wildcard = new RulePattern(SymbolKind.DISJUNCTION, SymbolKind.WILDCARD);
            RulePattern concrete = new RulePattern(SymbolKind.DISJUNCTION, SymbolKind.NEGATION);

            assertTrue(wildcard.matches(concrete));
            assertNotEquals(wildcard, concrete);
            assertEquals(concrete, RulePattern.of(Formula.disjunction(Formula.negation(A), B)));
        }
    }

    @Nested
    @DisplayName("Non-branching rules")
    class NonBranchingTests {

        @Test
        @DisplayName("¬¬φ ⇒ φ")
        void testDoubleNegation() {
            Formula formula = Formula.negation(Formula.negation(A));
            assertEquals(List.of(List.of(A)), InferenceRule.DOUBLE_NEGATION.apply(formula));
            assertFalse(InferenceRuleCatalog.isBranching(formula));
        }

        @Test
        @DisplayName("φ∧ψ ⇒ {φ, ψ}")
        void testConjunction() {
            assertEquals(List.of(List.of(A, B)), InferenceRule.CONJUNCTION.apply(Formula.conjunction(A, B)));
        }

        @Test
        @DisplayName("¬(φ∨ψ) ⇒ {¬φ, ¬ψ}")
        void testNegatedDisjunction() {
            assertEquals(List.of(List.of(Formula.negation(A), Formula.negation(B))),
                    InferenceRule.NEGATED_DISJUNCTION.apply(Formula.negation(Formula.disjunction(A, B))));
        }

        @Test
        @DisplayName("¬(φ→ψ) ⇒ {φ, ¬ψ}")
        void testNegatedImplication() {
            assertEquals(List.of(List.of(A, Formula.negation(B))),
                    InferenceRule.NEGATED_IMPLICATION.apply(Formula.negation(Formula.implication(A, B))));
        }
    }

    @Nested
    @DisplayName("Branching rules")
    class BranchingTests {

        @Test
        @DisplayName("¬(φ∧ψ) ⇒ {¬φ} | {¬ψ}")
        void testNegatedConjunction() {
            Formula formula = Formula.negation(Formula.conjunction(A, B));
            assertEquals(List.of(List.of(Formula.negation(A)), List.of(Formula.negation(B))),
                    InferenceRule.NEGATED_CONJUNCTION.apply(formula));
            assertTrue(InferenceRuleCatalog.isBranching(formula));
        }

        @Test
        @DisplayName("φ∨ψ ⇒ {φ} | {ψ}")
        void testDisjunction() {
            assertEquals(List.of(List.of(A), List.of(B)), InferenceRule.DISJUNCTION.apply(Formula.disjunction(A, B)));
        }

        @Test
        @DisplayName("φ→ψ ⇒ {¬φ} | {ψ}")
        void testImplication() {
            assertEquals(List.of(List.of(Formula.negation(A)), List.of(B)),
                    InferenceRule.IMPLICATION.apply(Formula.implication(A, B)));
        }
    }

    @Test
    @DisplayName("Applying a rule to a foreign shape is a contract failure")
    void testWrongShape() {
        assertThrows(IllegalArgumentException.class, () -> InferenceRule.CONJUNCTION.apply(Formula.disjunction(A, B)));
        assertThrows(IllegalArgumentException.class, () -> InferenceRule.DOUBLE_NEGATION.apply(Formula.negation(A)));
        assertThrows(IllegalArgumentException.class, () -> InferenceRuleCatalog.isBranching(A));
    }
}
