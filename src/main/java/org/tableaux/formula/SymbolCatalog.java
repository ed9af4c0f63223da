package org.tableaux.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CATALOGO DEI SIMBOLI - Grafie testuali accettate per ogni tipo di simbolo
 *
 * Ogni connettivo e ogni stile di parentesi ha una o più grafie accettate; la prima
 * della lista è la grafia canonica usata in output.
 *
 * GRAFIE ACCETTATE:
 * • Negazione: ¬ ~ !
 * • Congiunzione: ∧ &amp; /\
 * • Disgiunzione: ∨ | \/
 * • Implicazione: → -&gt; &gt;&gt;
 * • Parentesi: ( [ { e le rispettive chiusure ) ] }
 * • Proposizioni: una lettera latina A-Z o a-z (52 variabili distinte)
 *
 * Le stesse grafie sono riconosciute dal lexer ANTLR FormulaLexer.
 */
public final class SymbolCatalog {

    //region TABELLE DELLE GRAFIE

    private static final String PROPOSITION_LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private static final List<String> LEFT_PARENTHESES = List.of("(", "[", "{");
    private static final List<String> RIGHT_PARENTHESES = List.of(")", "]", "}");

    private static final Map<SymbolKind, List<String>> SPELLINGS = buildSpellings();

    private static Map<SymbolKind, List<String>> buildSpellings() {
        Map<SymbolKind, List<String>> spellings = new EnumMap<>(SymbolKind.class);

        List<String> letters = new ArrayList<>();
        for (char letter : PROPOSITION_LETTERS.toCharArray()) {
            letters.add(String.valueOf(letter));
        }

        spellings.put(SymbolKind.PROPOSITION, Collections.unmodifiableList(letters));
        spellings.put(SymbolKind.NEGATION, List.of("¬", "~", "!"));
        spellings.put(SymbolKind.CONJUNCTION, List.of("∧", "&", "/\\"));
        spellings.put(SymbolKind.DISJUNCTION, List.of("∨", "|", "\\/"));
        spellings.put(SymbolKind.IMPLICATION, List.of("→", "->", ">>"));
        spellings.put(SymbolKind.LEFT_PAREN, LEFT_PARENTHESES);
        spellings.put(SymbolKind.RIGHT_PAREN, RIGHT_PARENTHESES);
        spellings.put(SymbolKind.WILDCARD, List.of());
        spellings.put(SymbolKind.UNKNOWN, List.of());
        return Collections.unmodifiableMap(spellings);
    }

    private SymbolCatalog() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region INTERROGAZIONE DEL CATALOGO

    /**
     * Tutte le grafie accettate per il tipo richiesto, grafia canonica in testa.
     *
     * @param kind tipo di simbolo
     * @return lista immutabile, vuota per WILDCARD e UNKNOWN
     */
    public static List<String> spellings(SymbolKind kind) {
        return SPELLINGS.getOrDefault(kind, List.of());
    }

    /**
     * Grafia canonica usata in output.
     *
     * @param kind connettivo o parentesi
     * @return la prima grafia della lista
     * @throws IllegalArgumentException per tipi senza grafia fissa (proposizioni e sentinelle)
     */
    public static String defaultSpelling(SymbolKind kind) {
        if (kind == SymbolKind.PROPOSITION) {
            throw new IllegalArgumentException("Le proposizioni non hanno una grafia canonica: si usa l'identificatore");
        }
        List<String> spellings = spellings(kind);
        if (spellings.isEmpty()) {
            throw new IllegalArgumentException("Nessuna grafia per il tipo " + kind);
        }
        return spellings.get(0);
    }

    /**
     * Cerca, all'inizio del suffisso {@code input[offset..]}, una grafia accettata per il tipo.
     *
     * Restituisce la prima grafia della lista che è prefisso del suffisso; le grafie di uno
     * stesso tipo non sono mai prefisso l'una dell'altra, quindi coincide con la più lunga.
     *
     * @param kind tipo richiesto
     * @param input testo sorgente
     * @param offset posizione di inizio del suffisso
     * @return la grafia trovata, vuoto se nessuna corrisponde
     */
    public static Optional<String> match(SymbolKind kind, String input, int offset) {
        if (input == null || offset < 0 || offset >= input.length()) {
            return Optional.empty();
        }
        for (String spelling : spellings(kind)) {
            if (input.startsWith(spelling, offset)) {
                return Optional.of(spelling);
            }
        }
        return Optional.empty();
    }

    /**
     * Tipo corrispondente a una grafia completa.
     *
     * @param spelling testo di un singolo simbolo
     * @return il tipo la cui lista contiene la grafia, UNKNOWN altrimenti
     */
    public static SymbolKind kindOf(String spelling) {
        for (Map.Entry<SymbolKind, List<String>> entry : SPELLINGS.entrySet()) {
            if (entry.getValue().contains(spelling)) {
                return entry.getKey();
            }
        }
        return SymbolKind.UNKNOWN;
    }

    /**
     * @param identifier candidato identificatore
     * @return true se è una singola lettera latina
     */
    public static boolean isPropositionLetter(String identifier) {
        return identifier != null
                && identifier.length() == 1
                && PROPOSITION_LETTERS.indexOf(identifier.charAt(0)) >= 0;
    }

    /**
     * Parentesi speculare dello stesso stile: ( ↔ ), [ ↔ ], { ↔ }.
     *
     * @param parenthesis grafia di una parentesi
     * @return la parentesi corrispondente, vuoto se l'argomento non è una parentesi
     */
    public static Optional<String> mirror(String parenthesis) {
        int index = LEFT_PARENTHESES.indexOf(parenthesis);
        if (index >= 0) {
            return Optional.of(RIGHT_PARENTHESES.get(index));
        }
        index = RIGHT_PARENTHESES.indexOf(parenthesis);
        if (index >= 0) {
            return Optional.of(LEFT_PARENTHESES.get(index));
        }
        return Optional.empty();
    }

    //endregion
}
