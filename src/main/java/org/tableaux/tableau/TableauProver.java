package org.tableaux.tableau;

import org.tableaux.formula.Formula;

/**
 * Verifica di chiusura: il tableau chiude se ogni cammino contiene una coppia complementare.
 *
 * Una diramazione chiude solo se chiudono entrambe le alternative; appena la prima resta
 * aperta la seconda non viene esplorata.
 */
public class TableauProver extends TableauTraversal<Boolean> {

    /**
     * @param formula formula alla radice
     * @return true se il tableau chiude, cioè la formula è insoddisfacibile
     * @throws TableauException per violazioni di invariante del motore
     */
    public boolean closes(Formula formula) {
        return traverse(new AnalyticTableau(formula));
    }

    @Override
    protected boolean closesOnComplement() {
        return true;
    }

    @Override
    protected Boolean closedBranch(AnalyticTableau tableau) {
        return Boolean.TRUE;
    }

    @Override
    protected Boolean exhaustedBranch(AnalyticTableau tableau) {
        return Boolean.FALSE;
    }

    @Override
    protected Boolean combine(Boolean accumulated, Boolean next) {
        return accumulated && next;
    }

    @Override
    protected boolean exploresNextAlternative(Boolean accumulated) {
        return accumulated;
    }
}
