package org.tableaux.tableau;

/**
 * Esiti della classificazione di una formula.
 *
 * INVALID_FORMULA deriva solo da un parsing fallito; TABLEAUX_ERROR segnala una violazione
 * di invariante (pattern senza regola, oppure f e ¬f entrambe insoddisfacibili).
 */
public enum Classification {
    TAUTOLOGY("tautology"),
    CONTRADICTION("contradiction"),
    CONTINGENCY("contingency"),
    INVALID_FORMULA("invalid formula"),
    TABLEAUX_ERROR("tableaux error");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    /**
     * @return etichetta testuale stabile, es. "tautology"
     */
    public String getLabel() {
        return label;
    }

    /**
     * Tabella di decisione sulle due chiusure.
     *
     * @param formulaCloses il tableau di f chiude (f insoddisfacibile)
     * @param negationCloses il tableau di ¬f chiude (f valida)
     * @return la classificazione; TABLEAUX_ERROR se chiudono entrambi
     */
    public static Classification fromClosures(boolean formulaCloses, boolean negationCloses) {
        if (!formulaCloses && !negationCloses) return CONTINGENCY;
        if (!formulaCloses) return TAUTOLOGY;
        if (!negationCloses) return CONTRADICTION;
        return TABLEAUX_ERROR;
    }

    @Override
    public String toString() {
        return label;
    }
}
