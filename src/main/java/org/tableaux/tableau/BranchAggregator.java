package org.tableaux.tableau;

import org.tableaux.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * AGGREGATORE DEI RAMI - Elenca tutti i rami terminali di un tableau
 *
 * Stessa visita di {@link TableauProver}, ma nessun cammino viene chiuso in anticipo:
 * ogni ramo è espanso fino in fondo e produce l'insieme dei letterali accumulati.
 * Il risultato contiene quindi sia i rami aperti sia quelli chiusi, nell'ordine di visita.
 *
 * È l'interfaccia usata da chi traduce i rami in vincoli per un SAT solver esterno.
 */
public class BranchAggregator extends TableauTraversal<List<Set<Formula>>> {

    private static final Logger LOGGER = Logger.getLogger(BranchAggregator.class.getName());

    /**
     * @param formula formula alla radice
     * @return un insieme di letterali per ogni ramo terminale
     */
    public List<Set<Formula>> aggregate(Formula formula) {
        return traverse(new AnalyticTableau(formula));
    }

    /**
     * Rami del tableau di f e del tableau di ¬f.
     *
     * @param formula formula da espandere
     * @return le due liste di rami
     * @throws TableauException per violazioni di invariante del motore
     */
    public static TableauBranches branches(Formula formula) {
        BranchAggregator aggregator = new BranchAggregator();

        List<Set<Formula>> formulaBranches = aggregator.aggregate(formula);
        LOGGER.fine(() -> "Rami di " + formula + ": " + formulaBranches.size());

        List<Set<Formula>> negationBranches = aggregator.aggregate(formula.negate());
        LOGGER.fine(() -> "Rami di " + formula.negate() + ": " + negationBranches.size());

        return new TableauBranches(formulaBranches, negationBranches);
    }

    @Override
    protected boolean closesOnComplement() {
        return false;
    }

    @Override
    protected List<Set<Formula>> closedBranch(AnalyticTableau tableau) {
        // Non raggiungibile: closesOnComplement() è false
        return exhaustedBranch(tableau);
    }

    @Override
    protected List<Set<Formula>> exhaustedBranch(AnalyticTableau tableau) {
        Set<Formula> snapshot = Collections.unmodifiableSet(new LinkedHashSet<>(tableau.literals()));
        List<Set<Formula>> branches = new ArrayList<>();
        branches.add(snapshot);
        return branches;
    }

    @Override
    protected List<Set<Formula>> combine(List<Set<Formula>> accumulated, List<Set<Formula>> next) {
        accumulated.addAll(next);
        return accumulated;
    }

    @Override
    protected boolean exploresNextAlternative(List<Set<Formula>> accumulated) {
        return true;
    }
}
