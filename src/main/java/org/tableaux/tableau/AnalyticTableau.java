package org.tableaux.tableau;

import org.tableaux.formula.Formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * STATO DEL TABLEAU - Frontiera mutabile di un singolo cammino
 *
 * Quattro collezioni disgiunte:
 * • newFormulas: stack delle formule ancora da classificare
 * • literals: insieme dei letterali veri sul cammino corrente
 * • nonBranchingFormulas: stack delle formule composte con regola lineare
 * • branchingFormulas: stack delle formule composte con regola diramante
 *
 * Lo stato rappresenta un solo cammino alla volta. La visita lo modifica in place e lo
 * riporta esattamente al contenuto iniziale prima di restituire il risultato: al termine
 * di {@link TableauTraversal#traverse} resta solo la formula di partenza in newFormulas.
 *
 * Un'istanza serve una sola visita e non va condivisa tra thread.
 */
public final class AnalyticTableau {

    private final Deque<Formula> newFormulas = new ArrayDeque<>();
    private final Set<Formula> literals = new LinkedHashSet<>();
    private final Deque<Formula> nonBranchingFormulas = new ArrayDeque<>();
    private final Deque<Formula> branchingFormulas = new ArrayDeque<>();

    /**
     * Stato iniziale con la sola formula di partenza da classificare.
     *
     * @param seed formula alla radice del tableau
     */
    public AnalyticTableau(Formula seed) {
        newFormulas.push(Objects.requireNonNull(seed, "La formula di partenza non può essere null"));
    }

    //region ACCESSO PER IL MOTORE

    Deque<Formula> newFormulas() {
        return newFormulas;
    }

    Set<Formula> literals() {
        return literals;
    }

    Deque<Formula> nonBranchingFormulas() {
        return nonBranchingFormulas;
    }

    Deque<Formula> branchingFormulas() {
        return branchingFormulas;
    }

    //endregion

    //region VISTE IN SOLA LETTURA

    /**
     * @return copia di newFormulas, dalla cima dello stack verso il fondo
     */
    public List<Formula> getNewFormulas() {
        return Collections.unmodifiableList(new ArrayList<>(newFormulas));
    }

    public Set<Formula> getLiterals() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(literals));
    }

    public List<Formula> getNonBranchingFormulas() {
        return Collections.unmodifiableList(new ArrayList<>(nonBranchingFormulas));
    }

    public List<Formula> getBranchingFormulas() {
        return Collections.unmodifiableList(new ArrayList<>(branchingFormulas));
    }

    //endregion

    @Override
    public String toString() {
        return "AnalyticTableau{new=" + newFormulas
                + ", literals=" + literals
                + ", nonBranching=" + nonBranchingFormulas
                + ", branching=" + branchingFormulas + "}";
    }
}
