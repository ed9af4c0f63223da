package org.tableaux.formula;

import org.tableaux.parser.FormulaPrinter;
import org.tableaux.parser.Notation;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero immutabile etichettato dal tipo di simbolo
 *
 * FORME AMMESSE:
 * • PROPOSITION(id): foglia, id è una lettera latina (case-sensitive)
 * • NEGATION(φ): esattamente un figlio
 * • CONJUNCTION / DISJUNCTION / IMPLICATION(φ, ψ): esattamente due figli, ordine significativo
 *
 * INVARIANTI:
 * • L'arità è verificata in costruzione: una violazione è un errore di contratto
 * • Nessun nodo viene modificato dopo la costruzione, i sottoalberi sono condivisi liberamente
 * • Uguaglianza e hash sono strutturali (tipo, identificatore, figli ricorsivamente), quindi le
 *   formule sono usabili come elementi di insiemi e chiavi di mappe
 * • Nessuna visita è ricorsiva: alberi profondi decine di migliaia di livelli restano gestibili
 */
public final class Formula {

    //region STRUTTURA DATI

    /** Tipo del nodo */
    private final SymbolKind kind;

    /** Figli in ordine; lista vuota per le proposizioni */
    private final List<Formula> children;

    /** Identificatore della variabile (solo per PROPOSITION) */
    private final String identifier;

    /** Hash strutturale calcolato una volta sola, l'albero è immutabile */
    private final int hash;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    private Formula(SymbolKind kind, List<Formula> children, String identifier) {
        this.kind = kind;
        this.children = children;
        this.identifier = identifier;
        this.hash = Objects.hash(kind, identifier, children);
    }

    /**
     * Costruisce una proposizione atomica.
     *
     * @param identifier lettera latina A-Z o a-z
     * @return foglia PROPOSITION
     * @throws IllegalArgumentException se l'identificatore non è una singola lettera latina
     */
    public static Formula proposition(String identifier) {
        if (!SymbolCatalog.isPropositionLetter(identifier)) {
            throw new IllegalArgumentException("Identificatore di proposizione non valido: " + identifier);
        }
        return new Formula(SymbolKind.PROPOSITION, List.of(), identifier);
    }

    public static Formula negation(Formula child) {
        return of(SymbolKind.NEGATION, child);
    }

    public static Formula conjunction(Formula left, Formula right) {
        return of(SymbolKind.CONJUNCTION, left, right);
    }

    public static Formula disjunction(Formula left, Formula right) {
        return of(SymbolKind.DISJUNCTION, left, right);
    }

    public static Formula implication(Formula left, Formula right) {
        return of(SymbolKind.IMPLICATION, left, right);
    }

    /**
     * Costruisce un nodo connettivo verificandone l'arità.
     *
     * @param kind uno dei quattro connettivi
     * @param children figli in ordine (uno per la negazione, due per i connettivi binari)
     * @return nuovo nodo immutabile
     * @throws IllegalArgumentException se il tipo non è un connettivo o l'arità è errata
     * @throws NullPointerException se un figlio è null
     */
    public static Formula of(SymbolKind kind, Formula... children) {
        if (kind == null || !kind.isConnective()) {
            throw new IllegalArgumentException("Tipo non valido per un nodo connettivo: " + kind);
        }
        if (children == null || children.length != kind.arity()) {
            int found = children == null ? 0 : children.length;
            throw new IllegalArgumentException(String.format(
                    "Il connettivo %s richiede %d figli, trovati %d", kind, kind.arity(), found));
        }
        for (Formula child : children) {
            Objects.requireNonNull(child, "Un figlio di una formula non può essere null");
        }
        return new Formula(kind, Collections.unmodifiableList(Arrays.asList(children.clone())), null);
    }

    //endregion

    //region ACCESSO E CLASSIFICAZIONE

    public SymbolKind getKind() {
        return kind;
    }

    public List<Formula> getChildren() {
        return children;
    }

    /**
     * @return identificatore della proposizione, null per i nodi connettivi
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Figlio in posizione {@code index}.
     *
     * @throws IndexOutOfBoundsException se il nodo non ha quel figlio
     */
    public Formula child(int index) {
        return children.get(index);
    }

    public boolean isProposition() {
        return kind == SymbolKind.PROPOSITION;
    }

    /**
     * Letterale: una proposizione o la negazione di una proposizione.
     */
    public boolean isLiteral() {
        return isProposition() || (kind == SymbolKind.NEGATION && children.get(0).isProposition());
    }

    /**
     * Letterale complementare: p ↔ ¬p.
     *
     * @return la negazione di una proposizione, o la proposizione sotto una negazione
     * @throws IllegalStateException se la formula non è un letterale
     */
    public Formula complement() {
        if (isProposition()) {
            return negation(this);
        }
        if (isLiteral()) {
            return children.get(0);
        }
        throw new IllegalStateException("Il complemento è definito solo per i letterali: " + this);
    }

    /**
     * @return ¬this
     */
    public Formula negate() {
        return negation(this);
    }

    /**
     * Numero di nodi dell'albero.
     */
    public int size() {
        int size = 0;
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            size++;
            node.children.forEach(pending::push);
        }
        return size;
    }

    /**
     * Numero di connettivi binari: 2^k limita il numero di rami di un tableau della formula.
     */
    public int binaryConnectiveCount() {
        int count = 0;
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            if (node.kind.isBinary()) {
                count++;
            }
            node.children.forEach(pending::push);
        }
        return count;
    }

    /**
     * Identificatori delle proposizioni che compaiono nella formula, in ordine.
     */
    public Set<String> propositions() {
        Set<String> identifiers = new TreeSet<>();
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            if (node.isProposition()) {
                identifiers.add(node.identifier);
            }
            node.children.forEach(pending::push);
        }
        return Collections.unmodifiableSet(identifiers);
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;

        // Confronto a coppie su stack esplicito, come le altre visite dell'albero
        Deque<Formula[]> pending = new ArrayDeque<>();
        pending.push(new Formula[]{this, (Formula) obj});

        while (!pending.isEmpty()) {
            Formula[] pair = pending.pop();
            Formula left = pair[0];
            Formula right = pair[1];
            if (left == right) continue;

            if (left.hash != right.hash
                    || left.kind != right.kind
                    || !Objects.equals(left.identifier, right.identifier)
                    || left.children.size() != right.children.size()) {
                return false;
            }
            for (int i = 0; i < left.children.size(); i++) {
                pending.push(new Formula[]{left.children.get(i), right.children.get(i)});
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione prefissa canonica, es. "∧ A ¬B".
     */
    @Override
    public String toString() {
        return FormulaPrinter.print(this, Notation.PREFIX);
    }

    //endregion
}
