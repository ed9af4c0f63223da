package org.tableaux.formula;

/**
 * TIPI DI SIMBOLO - Enumerazione chiusa delle identità del linguaggio proposizionale
 *
 * Copre proposizioni atomiche, connettivi e parentesi, più due sentinelle:
 * • WILDCARD: corrisponde a qualunque tipo, usata solo nella ricerca dei pattern delle regole
 * • UNKNOWN: tipo non valido o di default
 *
 * L'uguaglianza dell'enum resta quella ordinaria; la semantica "corrisponde a tutto"
 * è confinata in {@link #matches(SymbolKind)}.
 */
public enum SymbolKind {
    PROPOSITION,
    NEGATION,
    CONJUNCTION,
    DISJUNCTION,
    IMPLICATION,
    LEFT_PAREN,
    RIGHT_PAREN,
    WILDCARD,
    UNKNOWN;

    /**
     * Confronto per pattern: WILDCARD da entrambi i lati corrisponde a qualunque tipo.
     *
     * @param other tipo da confrontare
     * @return true se i tipi coincidono o uno dei due è WILDCARD
     */
    public boolean matches(SymbolKind other) {
        if (other == null) {
            return false;
        }
        return this == other || this == WILDCARD || other == WILDCARD;
    }

    /**
     * @return true per i quattro connettivi logici
     */
    public boolean isConnective() {
        return switch (this) {
            case NEGATION, CONJUNCTION, DISJUNCTION, IMPLICATION -> true;
            default -> false;
        };
    }

    /**
     * @return true per congiunzione, disgiunzione e implicazione
     */
    public boolean isBinary() {
        return this == CONJUNCTION || this == DISJUNCTION || this == IMPLICATION;
    }

    /**
     * Numero di figli richiesti da un nodo di questo tipo.
     *
     * @return 0 per le proposizioni, 1 per la negazione, 2 per i connettivi binari
     * @throws IllegalStateException per tipi che non possono comparire in una formula
     */
    public int arity() {
        return switch (this) {
            case PROPOSITION -> 0;
            case NEGATION -> 1;
            case CONJUNCTION, DISJUNCTION, IMPLICATION -> 2;
            default -> throw new IllegalStateException("Il tipo " + this + " non può comparire in una formula");
        };
    }
}
