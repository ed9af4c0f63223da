package org.tableaux.parser;

import org.tableaux.formula.Formula;

import java.util.Objects;
import java.util.Optional;

/**
 * RISULTATO DEL PARSING - Contenitore immutabile per l'esito di {@link InfixFormulaParser#parse}
 *
 * Il parsing non lancia eccezioni per testo malformato: l'esito negativo porta con sé il
 * motivo, così un chiamante può processare molte stringhe candidate in sequenza.
 */
public final class ParseResult {

    private final boolean success;
    private final Formula formula;
    private final String errorMessage;

    private ParseResult(boolean success, Formula formula, String errorMessage) {
        this.success = success;
        this.formula = formula;
        this.errorMessage = errorMessage;
    }

    public static ParseResult success(Formula formula) {
        return new ParseResult(true, Objects.requireNonNull(formula, "formula"), null);
    }

    public static ParseResult failure(String errorMessage) {
        return new ParseResult(false, null, Objects.requireNonNull(errorMessage, "errorMessage"));
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return l'albero prodotto, vuoto se il parsing è fallito
     */
    public Optional<Formula> getFormula() {
        return Optional.ofNullable(formula);
    }

    /**
     * @return l'albero prodotto
     * @throws IllegalStateException se il parsing è fallito
     */
    public Formula requireFormula() {
        if (!success) {
            throw new IllegalStateException("Parsing fallito: " + errorMessage);
        }
        return formula;
    }

    /**
     * @return motivo del fallimento, null in caso di successo
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return success ? "ParseResult[OK: " + formula + "]" : "ParseResult[ERRORE: " + errorMessage + "]";
    }
}
