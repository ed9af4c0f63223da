package org.tableaux.rules;

import org.tableaux.formula.Formula;
import org.tableaux.formula.SymbolKind;

import java.util.Objects;

/**
 * Pattern di due simboli che seleziona una regola: (connettivo esterno, tipo del primo figlio).
 *
 * La seconda posizione può essere {@link SymbolKind#WILDCARD}. Il confronto con il jolly
 * avviene solo in {@link #matches}; equals e hashCode restano esatti.
 */
public final class RulePattern {

    private final SymbolKind outer;
    private final SymbolKind firstChild;

    public RulePattern(SymbolKind outer, SymbolKind firstChild) {
        this.outer = Objects.requireNonNull(outer, "outer");
        this.firstChild = Objects.requireNonNull(firstChild, "firstChild");
    }

    /**
     * Pattern concreto di una formula; per le foglie il secondo simbolo è UNKNOWN.
     */
    public static RulePattern of(Formula formula) {
        SymbolKind childKind = formula.getChildren().isEmpty()
                ? SymbolKind.UNKNOWN
                : formula.child(0).getKind();
        return new RulePattern(formula.getKind(), childKind);
    }

    public SymbolKind getOuter() {
        return outer;
    }

    public SymbolKind getFirstChild() {
        return firstChild;
    }

    /**
     * @param concrete pattern estratto da una formula
     * @return true se entrambe le posizioni corrispondono, jolly compreso
     */
    public boolean matches(RulePattern concrete) {
        return outer.matches(concrete.outer) && firstChild.matches(concrete.firstChild);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RulePattern)) return false;
        RulePattern other = (RulePattern) obj;
        return outer == other.outer && firstChild == other.firstChild;
    }

    @Override
    public int hashCode() {
        return Objects.hash(outer, firstChild);
    }

    @Override
    public String toString() {
        return "[" + outer + ", " + firstChild + "]";
    }
}
