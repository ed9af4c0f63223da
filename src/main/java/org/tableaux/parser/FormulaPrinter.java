package org.tableaux.parser;

import org.tableaux.formula.Formula;
import org.tableaux.formula.SymbolCatalog;
import org.tableaux.formula.SymbolKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * STAMPA DELLE FORMULE - Direzione inversa del parser
 *
 * Produce il testo di una formula usando sempre le grafie canoniche del catalogo.
 *
 * FORMATI:
 * • PREFIX: "∧ A B", negazione "¬A"
 * • INFIX: "(A ∧ B)", negazione "(¬A)"; ogni applicazione è parenthesizzata, quindi il
 *   testo si rilegge senza ambiguità anche con il parser privo di precedenze
 * • POSTFIX: "A B ∧", negazione "A¬"
 *
 * Funzione pura: le formule ben formate sono garantite dal costruttore di {@link Formula}.
 * La visita usa uno stack esplicito, quindi la profondità dell'albero non è limitata
 * dallo stack di chiamata.
 */
public final class FormulaPrinter {

    private FormulaPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula formula da stampare
     * @param notation formato di output
     * @return rappresentazione testuale
     */
    public static String print(Formula formula, Notation notation) {
        StringBuilder builder = new StringBuilder();

        // Stack di lavoro: Formula da espandere oppure String da emettere così com'è
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(formula);

        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof String) {
                builder.append((String) item);
            } else {
                expand((Formula) item, notation, pending);
            }
        }
        return builder.toString();
    }

    /**
     * Sostituisce un nodo con la sequenza dei suoi pezzi, spinti in ordine inverso.
     */
    private static void expand(Formula formula, Notation notation, Deque<Object> pending) {
        SymbolKind kind = formula.getKind();

        if (kind == SymbolKind.PROPOSITION) {
            pending.push(formula.getIdentifier());
            return;
        }

        String symbol = SymbolCatalog.defaultSpelling(kind);
        List<Object> parts;

        if (kind == SymbolKind.NEGATION) {
            Formula operand = formula.child(0);
            parts = switch (notation) {
                case PREFIX -> List.of(symbol, operand);
                case INFIX -> List.of("(" + symbol, operand, ")");
                case POSTFIX -> List.of(operand, symbol);
            };
        } else {
            Formula left = formula.child(0);
            Formula right = formula.child(1);
            parts = switch (notation) {
                case PREFIX -> List.of(symbol + " ", left, " ", right);
                case INFIX -> List.of("(", left, " " + symbol + " ", right, ")");
                case POSTFIX -> List.of(left, " ", right, " " + symbol);
            };
        }

        for (int i = parts.size() - 1; i >= 0; i--) {
            pending.push(parts.get(i));
        }
    }
}
