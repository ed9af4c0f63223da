package org.tableaux.tableau;

import org.tableaux.formula.Formula;
import org.tableaux.parser.InfixFormulaParser;
import org.tableaux.parser.ParseResult;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLASSIFICATORE - Tautologia, contraddizione o contingenza con due tableaux
 *
 * Costruisce il tableau di f e quello di ¬f:
 * • C = il tableau di f chiude (f insoddisfacibile)
 * • T = il tableau di ¬f chiude (f valida)
 *
 * | C     | T     | esito          |
 * |-------|-------|----------------|
 * | false | false | contingency    |
 * | false | true  | tautology      |
 * | true  | false | contradiction  |
 * | true  | true  | tableaux error |
 *
 * Non lancia mai eccezioni: testo malformato dà INVALID_FORMULA, una violazione di
 * invariante del motore dà TABLEAUX_ERROR e viene registrata nel log.
 *
 * @version 1.0.0
 */
public final class FormulaClassifier {

    private static final Logger LOGGER = Logger.getLogger(FormulaClassifier.class.getName());

    private FormulaClassifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param text formula in notazione infissa
     * @return la classificazione, INVALID_FORMULA se il parsing fallisce
     */
    public static Classification classify(String text) {
        ParseResult parsed = InfixFormulaParser.parse(text);
        if (!parsed.isSuccess()) {
            return Classification.INVALID_FORMULA;
        }
        return classify(parsed.requireFormula());
    }

    /**
     * @param formula albero già costruito
     * @return TAUTOLOGY, CONTRADICTION, CONTINGENCY o TABLEAUX_ERROR
     */
    public static Classification classify(Formula formula) {
        try {
            TableauProver prover = new TableauProver();

            boolean formulaCloses = prover.closes(formula);
            TableauStatistics formulaStats = prover.getStatistics();
            LOGGER.fine(() -> "Tableau di " + formula + " chiuso=" + formulaCloses + " [" + formulaStats + "]");

            Formula negated = formula.negate();
            boolean negationCloses = prover.closes(negated);
            TableauStatistics negationStats = prover.getStatistics();
            LOGGER.fine(() -> "Tableau di " + negated + " chiuso=" + negationCloses + " [" + negationStats + "]");

            Classification classification = Classification.fromClosures(formulaCloses, negationCloses);
            if (classification == Classification.TABLEAUX_ERROR) {
                LOGGER.severe(() -> "Entrambi i tableaux chiusi per " + formula
                        + ": f e ¬f non possono essere entrambe insoddisfacibili");
            }
            return classification;

        } catch (TableauException e) {
            LOGGER.log(Level.SEVERE, e, () -> "Errore interno del tableau per " + formula);
            return Classification.TABLEAUX_ERROR;
        }
    }
}
