package org.tableaux;

import org.tableaux.formula.Formula;
import org.tableaux.parser.FormulaPrinter;
import org.tableaux.parser.InfixFormulaParser;
import org.tableaux.parser.Notation;
import org.tableaux.parser.ParseResult;
import org.tableaux.tableau.BranchAggregator;
import org.tableaux.tableau.Classification;
import org.tableaux.tableau.FormulaClassifier;
import org.tableaux.tableau.TableauBranches;
import org.tableaux.tableau.TableauException;

import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REPORT DI UNA FORMULA - Verifica completa di una stringa candidata
 *
 * Raccoglie in un unico oggetto immutabile l'esito del parsing, la rappresentazione nella
 * notazione richiesta, la classificazione e, se richiesti, i rami dei due tableaux.
 */
public final class FormulaReport {

    private static final Logger LOGGER = Logger.getLogger(FormulaReport.class.getName());

    private final String input;
    private final ParseResult parseResult;
    private final String rendering;
    private final Classification classification;
    private final TableauBranches branches;

    private FormulaReport(String input, ParseResult parseResult, String rendering,
                          Classification classification, TableauBranches branches) {
        this.input = input;
        this.parseResult = parseResult;
        this.rendering = rendering;
        this.classification = classification;
        this.branches = branches;
    }

    /**
     * Esegue la verifica completa.
     *
     * @param input formula in notazione infissa
     * @param notation notazione della rappresentazione riportata
     * @param includeBranches true per elencare anche i rami dei due tableaux
     * @return report, mai null
     */
    public static FormulaReport of(String input, Notation notation, boolean includeBranches) {
        ParseResult parsed = InfixFormulaParser.parse(input);
        if (!parsed.isSuccess()) {
            return new FormulaReport(input, parsed, null, Classification.INVALID_FORMULA, null);
        }

        Formula formula = parsed.requireFormula();
        String rendering = FormulaPrinter.print(formula, notation);
        Classification classification = FormulaClassifier.classify(formula);

        TableauBranches branches = null;
        if (includeBranches) {
            try {
                branches = BranchAggregator.branches(formula);
            } catch (TableauException e) {
                LOGGER.log(Level.SEVERE, e, () -> "Impossibile elencare i rami di " + formula);
            }
        }
        return new FormulaReport(input, parsed, rendering, classification, branches);
    }

    public String getInput() {
        return input;
    }

    public ParseResult getParseResult() {
        return parseResult;
    }

    public Classification getClassification() {
        return classification;
    }

    /**
     * @return rappresentazione della formula, null se il parsing è fallito
     */
    public String getRendering() {
        return rendering;
    }

    /**
     * @return rami dei due tableaux, null se non richiesti o non disponibili
     */
    public TableauBranches getBranches() {
        return branches;
    }

    /**
     * @return true se parsing riuscito e nessun errore del tableau
     */
    public boolean isSuccessful() {
        return parseResult.isSuccess() && classification != Classification.TABLEAUX_ERROR;
    }

    /**
     * Testo su più righe stampato dal driver.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Formula: ").append(input).append('\n');

        if (!parseResult.isSuccess()) {
            sb.append("Parsing: fallito (").append(parseResult.getErrorMessage()).append(")\n");
            sb.append("Classificazione: ").append(classification.getLabel()).append('\n');
            return sb.toString();
        }

        sb.append("Parsing: ").append(rendering).append('\n');
        sb.append("Classificazione: ").append(classification.getLabel()).append('\n');

        if (branches != null) {
            appendBranches(sb, "Rami della formula", branches.getFormulaBranches());
            appendBranches(sb, "Rami della negazione", branches.getNegationBranches());
        }
        return sb.toString();
    }

    private static void appendBranches(StringBuilder sb, String title, List<Set<Formula>> branchList) {
        sb.append(title).append(" (").append(branchList.size()).append("):\n");
        int index = 1;
        for (Set<Formula> branch : branchList) {
            sb.append("  ").append(index++).append(". ").append(branch)
                    .append(TableauBranches.isClosed(branch) ? " chiuso" : " aperto")
                    .append('\n');
        }
    }

    @Override
    public String toString() {
        return format();
    }
}
