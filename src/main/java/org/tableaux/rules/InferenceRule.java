package org.tableaux.rules;

import org.tableaux.formula.Formula;
import org.tableaux.formula.SymbolKind;

import java.util.List;

/**
 * REGOLE DI ESPANSIONE DEL TABLEAU
 *
 * Ogni regola è individuata dal suo {@link RulePattern} e produce la lista delle
 * alternative: una sola per le regole lineari, due per quelle che diramano.
 *
 * LINEARI (un solo insieme di successori):
 * • ¬¬φ ⇒ {φ}
 * • φ∧ψ ⇒ {φ, ψ}
 * • ¬(φ∨ψ) ⇒ {¬φ, ¬ψ}
 * • ¬(φ→ψ) ⇒ {φ, ¬ψ}
 *
 * DIRAMANTI (due alternative esplorate separatamente):
 * • ¬(φ∧ψ) ⇒ {¬φ} | {¬ψ}
 * • φ∨ψ ⇒ {φ} | {ψ}
 * • φ→ψ ⇒ {¬φ} | {ψ}
 */
public enum InferenceRule {

    DOUBLE_NEGATION(SymbolKind.NEGATION, SymbolKind.NEGATION, false) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            return List.of(List.of(formula.child(0).child(0)));
        }
    },

    CONJUNCTION(SymbolKind.CONJUNCTION, SymbolKind.WILDCARD, false) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            return List.of(List.of(formula.child(0), formula.child(1)));
        }
    },

    NEGATED_DISJUNCTION(SymbolKind.NEGATION, SymbolKind.DISJUNCTION, false) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            Formula disjunction = formula.child(0);
            return List.of(List.of(disjunction.child(0).negate(), disjunction.child(1).negate()));
        }
    },

    NEGATED_IMPLICATION(SymbolKind.NEGATION, SymbolKind.IMPLICATION, false) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            Formula implication = formula.child(0);
            return List.of(List.of(implication.child(0), implication.child(1).negate()));
        }
    },

    NEGATED_CONJUNCTION(SymbolKind.NEGATION, SymbolKind.CONJUNCTION, true) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            Formula conjunction = formula.child(0);
            return List.of(List.of(conjunction.child(0).negate()), List.of(conjunction.child(1).negate()));
        }
    },

    DISJUNCTION(SymbolKind.DISJUNCTION, SymbolKind.WILDCARD, true) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            return List.of(List.of(formula.child(0)), List.of(formula.child(1)));
        }
    },

    IMPLICATION(SymbolKind.IMPLICATION, SymbolKind.WILDCARD, true) {
        @Override
        protected List<List<Formula>> expand(Formula formula) {
            return List.of(List.of(formula.child(0).negate()), List.of(formula.child(1)));
        }
    };

    private final RulePattern pattern;
    private final boolean branching;

    InferenceRule(SymbolKind outer, SymbolKind firstChild, boolean branching) {
        this.pattern = new RulePattern(outer, firstChild);
        this.branching = branching;
    }

    public RulePattern getPattern() {
        return pattern;
    }

    public boolean isBranching() {
        return branching;
    }

    /**
     * Applica la regola a una formula compatibile con il suo pattern.
     *
     * @param formula formula composta
     * @return alternative di successori: una lista se lineare, due se diramante
     * @throws IllegalArgumentException se la formula non corrisponde al pattern
     */
    public List<List<Formula>> apply(Formula formula) {
        if (!pattern.matches(RulePattern.of(formula))) {
            throw new IllegalArgumentException("La regola " + name() + " non si applica a " + formula);
        }
        return expand(formula);
    }

    protected abstract List<List<Formula>> expand(Formula formula);
}
