package org.tableaux.tableau;

/**
 * Violazione di un invariante interno del metodo dei tableaux.
 *
 * Non dipende dall'input dell'utente: per formule costruite con i cinque costrutti supportati
 * non dovrebbe mai verificarsi. {@link FormulaClassifier} la intercetta e la riporta come
 * {@link Classification#TABLEAUX_ERROR}.
 */
public class TableauException extends RuntimeException {

    public TableauException(String message) {
        super(message);
    }
}
