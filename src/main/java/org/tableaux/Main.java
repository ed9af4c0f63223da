package org.tableaux;

import org.tableaux.parser.Notation;
import org.tableaux.tableau.Classification;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PROVER A TABLEAUX ANALITICI - Driver da linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formule passate come argomenti, lette da file o, in assenza, formule di esempio
 * 2. PARSING: notazione infissa -&gt; albero (token ANTLR, nessuna precedenza tra connettivi)
 * 3. CLASSIFICAZIONE: tableau di f e tableau di ¬f
 * 4. OUTPUT: rappresentazione, classificazione ed eventualmente i rami di entrambi i tableaux
 *
 * MODALITÀ OPERATIVE:
 * - Formule come argomenti: java -jar tableaux-prover.jar "A|~A" "A&amp;B"
 * - File (-f): una formula per riga, righe vuote e commenti (#) ignorati
 * - Rami (-b): stampa anche i rami terminali dei due tableaux
 * - Notazione (-n): prefix, infix (default) o postfix
 *
 * @version 1.0.0
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String BRANCHES_PARAM = "-b";
    private static final String NOTATION_PARAM = "-n";

    /**
     * Prefisso delle righe di commento nei file di formule
     */
    private static final String COMMENT_PREFIX = "#";

    /**
     * Formule di esempio usate quando non viene fornito alcun input
     */
    static final List<String> SAMPLE_FORMULAS = List.of(
            "A|~A",                                                 // terzo escluso
            "A&~A",                                                 // non contraddizione
            "A&B",                                                  // contingenza
            "A->B",
            "((A->B)&A)->B",                                        // modus ponens
            "((A->B)&~B)->~A",                                      // modus tollens
            "(A->~~A)&((~~A)->A)",                                  // doppia negazione
            "((A->B)&(B->C))->(A->C)",                              // sillogismo ipotetico
            "(A->(B->A))",                                          // indebolimento
            "(A->B) -> ((~B) -> (~A))",                             // contrapposizione
            "((~(A&B))->((~A)|(~B))) & (((~A)|(~B))->(~(A&B)))"     // De Morgan
    );

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO PROVER A TABLEAUX <---");

        try {
            ProverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            int failures = run(config, System.out);
            if (failures > 0) {
                System.out.println("[W] Formule non verificate: " + failures);
            }
        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE PROVER <---");
        }
    }

    /**
     * Classifica tutte le formule della configurazione e stampa i report.
     *
     * @param config configurazione validata
     * @param out destinazione dei report
     * @return numero di formule non valide o con errore del tableau
     * @throws IOException se il file di input non è leggibile
     */
    static int run(ProverConfiguration config, PrintStream out) throws IOException {
        List<String> formulas = collectFormulas(config);
        Map<Classification, Integer> summary = new EnumMap<>(Classification.class);
        int failures = 0;

        for (String formula : formulas) {
            FormulaReport report = FormulaReport.of(formula, config.notation, config.printBranches);
            out.println(report.format());

            summary.merge(report.getClassification(), 1, Integer::sum);
            if (!report.isSuccessful()) {
                failures++;
                LOGGER.warning("Formula non verificata: '" + report.getInput() + "' -> " + report.getClassification());
            }
        }

        out.println("-->> RIEPILOGO <<--");
        out.println("Formule elaborate: " + formulas.size());
        for (Map.Entry<Classification, Integer> entry : summary.entrySet()) {
            out.println(entry.getKey().getLabel() + ": " + entry.getValue());
        }
        return failures;
    }

    /**
     * Gestisce errori critici dell'applicazione con logging completo.
     *
     * @param e eccezione critica che ha causato il fallimento
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    //endregion

    //region ACQUISIZIONE DELLE FORMULE

    /**
     * Formule da argomenti e file, nell'ordine; le formule di esempio se non ce ne sono.
     */
    private static List<String> collectFormulas(ProverConfiguration config) throws IOException {
        List<String> formulas = new ArrayList<>(config.formulas);

        if (config.inputPath != null) {
            formulas.addAll(readFormulaFile(Paths.get(config.inputPath)));
        }

        if (formulas.isEmpty()) {
            System.out.println("[I] Nessuna formula fornita: uso delle formule di esempio");
            formulas.addAll(SAMPLE_FORMULAS);
        }
        return formulas;
    }

    /**
     * Legge un file con una formula per riga.
     *
     * @param path percorso del file
     * @return formule non vuote, commenti esclusi
     * @throws IOException se il file non è leggibile
     */
    static List<String> readFormulaFile(Path path) throws IOException {
        List<String> formulas = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            formulas.add(trimmed);
        }
        LOGGER.fine("Lette " + formulas.size() + " formule da " + path);
        return formulas;
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @param args array di parametri da processare
     * @return configurazione validata o null se help/errore
     */
    private static ProverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> PROVER A TABLEAUX ANALITICI <<::");
        System.out.println("Classifica formule proposizionali come tautologie, contraddizioni o contingenze\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar tableaux-prover.jar [opzioni] [formule...]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -h              Mostra questo help");
        System.out.println("  -f <file>       Legge le formule da file (una per riga, # per i commenti)");
        System.out.println("  -b              Stampa anche i rami dei tableaux di f e di ¬f");
        System.out.println("  -n <notazione>  Notazione di output: prefix, infix (default), postfix\n");

        System.out.println("SINTASSI DELLE FORMULE:");
        System.out.println("  Proposizioni:   una lettera A-Z o a-z (maiuscole e minuscole distinte)");
        System.out.println("  Negazione:      ¬  ~  !");
        System.out.println("  Congiunzione:   ∧  &  /\\");
        System.out.println("  Disgiunzione:   ∨  |  \\/");
        System.out.println("  Implicazione:   →  ->  >>");
        System.out.println("  Parentesi:      ( )  [ ]  { }\n");

        System.out.println("  Tutti i connettivi hanno la stessa precedenza: usare le parentesi per");
        System.out.println("  raggruppare. \"A & B | C\" equivale a \"A & (B | C)\".\n");

        System.out.println("ESEMPI:");
        System.out.println("  java -jar tableaux-prover.jar \"A|~A\" \"((A->B)&A)->B\"");
        System.out.println("  java -jar tableaux-prover.jar -b -n prefix -f formule.txt");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione, immutabile.
     */
    static final class ProverConfiguration {
        final List<String> formulas;
        final String inputPath;
        final boolean printBranches;
        final Notation notation;

        ProverConfiguration(List<String> formulas, String inputPath, boolean printBranches, Notation notation) {
            this.formulas = Collections.unmodifiableList(new ArrayList<>(formulas));
            this.inputPath = inputPath;
            this.printBranches = printBranches;
            this.notation = notation;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    static final class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: mostra help e termina
         * -f &lt;file&gt;: formule da file
         * -b: stampa i rami
         * -n &lt;notazione&gt;: notazione di output
         * qualsiasi altro argomento non preceduto da '-' è una formula
         *
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri non validi
         */
        ProverConfiguration parse(String[] args) {
            List<String> formulas = new ArrayList<>();
            String inputPath = null;
            boolean printBranches = false;
            Notation notation = Notation.INFIX;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        if (inputPath != null) {
                            throw new IllegalArgumentException("Parametro -f specificato più volte");
                        }
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }

                    case BRANCHES_PARAM -> printBranches = true;

                    case NOTATION_PARAM -> notation = Notation.fromName(getNextArgument(args, ++i, "notazione"));

                    default -> {
                        // "->" non è un'opzione: un trattino seguito da '>' è l'implicazione
                        if (args[i].startsWith("-") && args[i].length() == 2 && Character.isLetter(args[i].charAt(1))) {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                        formulas.add(args[i]);
                    }
                }
            }

            return new ProverConfiguration(formulas, inputPath, printBranches, notation);
        }

        private static String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per il parametro: " + description);
            }
            return args[index];
        }

        private static void validateFileExists(String path) {
            Path file = Paths.get(path);
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("File non trovato: " + path);
            }
            if (!Files.isReadable(file)) {
                throw new IllegalArgumentException("File non leggibile: " + path);
            }
        }
    }

    //endregion
}
