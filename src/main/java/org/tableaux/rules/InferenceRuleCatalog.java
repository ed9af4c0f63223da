package org.tableaux.rules;

import org.tableaux.formula.Formula;
import org.tableaux.formula.SymbolKind;

import java.util.Optional;

/**
 * CATALOGO DELLE REGOLE - Ricerca della regola applicabile a una formula composta
 *
 * I sette pattern coprono tutte le formule composte ben formate: ogni formula è un
 * letterale oppure corrisponde a esattamente un pattern. Una ricerca senza esito su una
 * formula composta indica quindi una violazione di invariante, non un caso previsto.
 */
public final class InferenceRuleCatalog {

    private InferenceRuleCatalog() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula formula da espandere
     * @return la regola il cui pattern corrisponde, vuoto per i letterali
     */
    public static Optional<InferenceRule> lookup(Formula formula) {
        return lookup(RulePattern.of(formula));
    }

    /**
     * @param concrete pattern concreto (senza jolly)
     * @return la prima regola il cui pattern corrisponde
     */
    public static Optional<InferenceRule> lookup(RulePattern concrete) {
        for (InferenceRule rule : InferenceRule.values()) {
            if (rule.getPattern().matches(concrete)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public static Optional<InferenceRule> lookup(SymbolKind outer, SymbolKind firstChild) {
        return lookup(new RulePattern(outer, firstChild));
    }

    /**
     * @return true se la formula si espande con una regola diramante
     * @throws IllegalArgumentException se nessuna regola si applica
     */
    public static boolean isBranching(Formula formula) {
        return lookup(formula)
                .map(InferenceRule::isBranching)
                .orElseThrow(() -> new IllegalArgumentException("Nessuna regola per " + formula));
    }
}
