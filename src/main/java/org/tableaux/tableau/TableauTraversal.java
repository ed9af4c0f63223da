package org.tableaux.tableau;

import org.tableaux.formula.Formula;
import org.tableaux.rules.InferenceRule;
import org.tableaux.rules.InferenceRuleCatalog;
import org.tableaux.rules.RulePattern;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * VISITA DEL TABLEAU - Ricerca in profondità con backtracking su stack esplicito
 *
 * Implementa una volta sola la macchina a stati del metodo dei tableaux; le sottoclassi
 * decidono cosa produrre alle foglie e come combinare le due alternative di una diramazione.
 *
 * PASSO ELEMENTARE (in ordine di priorità):
 * 1. newFormulas non vuoto: estrae una formula; se è un letterale la aggiunge a literals
 *    (o chiude il cammino se il complemento è già presente e la sottoclasse lo richiede),
 *    altrimenti la sposta sullo stack lineare o diramante secondo la sua regola
 * 2. nonBranchingFormulas non vuoto: applica la regola e mette i successori in newFormulas
 * 3. branchingFormulas non vuoto: applica la regola ed esplora le due alternative, una per volta
 * 4. tutto vuoto: il cammino è esaurito
 *
 * DISCIPLINA DI UNDO:
 * Ogni modifica allo stato viene registrata in un journal; risalendo, ogni voce viene
 * annullata esattamente, su ogni percorso di uscita. Le alternative sorelle non vedono
 * mai il lavoro l'una dell'altra e lo stato torna al contenuto iniziale.
 *
 * COMPLESSITÀ:
 * La profondità del journal è limitata dalla dimensione della formula e non usa lo stack
 * di chiamata della JVM. Il numero di rami cresce invece in modo esponenziale: al più 2^k
 * con k = {@link Formula#binaryConnectiveCount()}. Nessun limite viene imposto; i chiamanti
 * possono rifiutare in anticipo formule troppo grandi.
 *
 * @param <R> risultato prodotto dalla visita
 * @version 1.0.0
 */
public abstract class TableauTraversal<R> {

    private static final Logger LOGGER = Logger.getLogger(TableauTraversal.class.getName());

    private TableauStatistics statistics = new TableauStatistics();

    //region PUNTI DI ESTENSIONE

    /**
     * @return true se un letterale il cui complemento è già sul cammino chiude il ramo
     */
    protected abstract boolean closesOnComplement();

    /**
     * Risultato di un cammino chiuso da una coppia complementare.
     */
    protected abstract R closedBranch(AnalyticTableau tableau);

    /**
     * Risultato di un cammino esaurito, senza più formule da espandere.
     */
    protected abstract R exhaustedBranch(AnalyticTableau tableau);

    /**
     * Combina il risultato accumulato sulle alternative precedenti con quello dell'ultima.
     */
    protected abstract R combine(R accumulated, R next);

    /**
     * @param accumulated risultato delle alternative già esplorate
     * @return false per saltare le alternative rimanenti di una diramazione
     */
    protected abstract boolean exploresNextAlternative(R accumulated);

    //endregion

    //region VISITA

    /**
     * Visita completa del tableau a partire dal suo stato corrente.
     *
     * @param tableau stato da visitare, riportato al contenuto iniziale al termine
     * @return risultato della radice
     * @throws TableauException se una formula composta non corrisponde a nessuna regola
     */
    public final R traverse(AnalyticTableau tableau) {
        statistics = new TableauStatistics();
        Deque<JournalEntry> journal = new ArrayDeque<>();

        R result = descend(tableau, journal);

        while (!journal.isEmpty()) {
            JournalEntry entry = journal.peek();

            if (entry.action == Action.SPLIT) {
                removeSuccessors(tableau, entry.alternatives.get(entry.current).size());
                entry.accumulated = entry.current == 0 ? result : combine(entry.accumulated, result);
                entry.current++;

                if (entry.current < entry.alternatives.size() && exploresNextAlternative(entry.accumulated)) {
                    pushSuccessors(tableau, entry.alternatives.get(entry.current));
                    result = descend(tableau, journal);
                    continue;
                }
                result = entry.accumulated;
            }

            journal.pop();
            undo(tableau, entry);
        }

        statistics.stopTimer();
        return result;
    }

    /**
     * @return metriche dell'ultima visita eseguita da questa istanza
     */
    public TableauStatistics getStatistics() {
        return statistics;
    }

    /**
     * Avanza finché il cammino corrente non si chiude o non si esaurisce.
     */
    private R descend(AnalyticTableau tableau, Deque<JournalEntry> journal) {
        while (true) {
            statistics.incrementSteps();
            statistics.recordDepth(journal.size());

            if (!tableau.newFormulas().isEmpty()) {
                Formula formula = tableau.newFormulas().pop();

                if (formula.isLiteral()) {
                    if (closesOnComplement() && tableau.literals().contains(formula.complement())) {
                        tableau.newFormulas().push(formula);
                        statistics.incrementClosedBranches();
                        LOGGER.finest(() -> "Ramo chiuso da " + formula + " su " + tableau.literals());
                        return closedBranch(tableau);
                    }
                    boolean added = tableau.literals().add(formula);
                    journal.push(new JournalEntry(Action.LITERAL, formula, added, 0, null));
                } else {
                    boolean branching = requireRule(formula).isBranching();
                    (branching ? tableau.branchingFormulas() : tableau.nonBranchingFormulas()).push(formula);
                    journal.push(new JournalEntry(Action.CLASSIFIED, formula, branching, 0, null));
                }

            } else if (!tableau.nonBranchingFormulas().isEmpty()) {
                Formula formula = tableau.nonBranchingFormulas().pop();
                List<Formula> successors = requireRule(formula).apply(formula).get(0);
                pushSuccessors(tableau, successors);
                statistics.incrementExpansions();
                journal.push(new JournalEntry(Action.EXPANDED, formula, false, successors.size(), null));

            } else if (!tableau.branchingFormulas().isEmpty()) {
                Formula formula = tableau.branchingFormulas().pop();
                List<List<Formula>> alternatives = requireRule(formula).apply(formula);
                pushSuccessors(tableau, alternatives.get(0));
                statistics.incrementExpansions();
                journal.push(new JournalEntry(Action.SPLIT, formula, false, 0, alternatives));

            } else {
                if (TableauBranches.isClosed(tableau.literals())) {
                    statistics.incrementClosedBranches();
                } else {
                    statistics.incrementOpenBranches();
                }
                LOGGER.finest(() -> "Ramo esaurito con letterali " + tableau.literals());
                return exhaustedBranch(tableau);
            }
        }
    }

    //endregion

    //region OPERAZIONI SULLO STATO

    private InferenceRule requireRule(Formula formula) {
        return InferenceRuleCatalog.lookup(formula).orElseThrow(() -> new TableauException(
                "Nessuna regola per il pattern " + RulePattern.of(formula) + " della formula " + formula));
    }

    private static void pushSuccessors(AnalyticTableau tableau, List<Formula> successors) {
        for (Formula successor : successors) {
            tableau.newFormulas().push(successor);
        }
    }

    private static void removeSuccessors(AnalyticTableau tableau, int count) {
        for (int i = 0; i < count; i++) {
            tableau.newFormulas().pop();
        }
    }

    /**
     * Annulla esattamente la modifica registrata nella voce.
     */
    private void undo(AnalyticTableau tableau, JournalEntry entry) {
        switch (entry.action) {
            case LITERAL -> {
                if (entry.added) {
                    tableau.literals().remove(entry.formula);
                }
                tableau.newFormulas().push(entry.formula);
            }
            case CLASSIFIED -> {
                (entry.added ? tableau.branchingFormulas() : tableau.nonBranchingFormulas()).pop();
                tableau.newFormulas().push(entry.formula);
            }
            case EXPANDED -> {
                removeSuccessors(tableau, entry.successorCount);
                tableau.nonBranchingFormulas().push(entry.formula);
            }
            case SPLIT -> tableau.branchingFormulas().push(entry.formula);
        }
    }

    //endregion

    //region JOURNAL DI UNDO

    private enum Action {
        LITERAL,
        CLASSIFIED,
        EXPANDED,
        SPLIT
    }

    /**
     * Voce del journal: un passo della discesa con quanto serve per annullarlo.
     *
     * Per LITERAL {@code added} indica se il letterale era nuovo; per CLASSIFIED indica lo
     * stack diramante. Le voci SPLIT tengono le alternative e il risultato accumulato.
     */
    private final class JournalEntry {
        final Action action;
        final Formula formula;
        final boolean added;
        final int successorCount;
        final List<List<Formula>> alternatives;
        int current = 0;
        R accumulated;

        JournalEntry(Action action, Formula formula, boolean added,
                             int successorCount, List<List<Formula>> alternatives) {
            this.action = action;
            this.formula = formula;
            this.added = added;
            this.successorCount = successorCount;
            this.alternatives = alternatives;
        }
    }

    //endregion
}
