package org.tableaux.tableau;

import org.tableaux.formula.Formula;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rami terminali dei due tableaux di una formula: quello di f e quello di ¬f.
 */
public final class TableauBranches {

    private final List<Set<Formula>> formulaBranches;
    private final List<Set<Formula>> negationBranches;

    public TableauBranches(List<Set<Formula>> formulaBranches, List<Set<Formula>> negationBranches) {
        this.formulaBranches = List.copyOf(Objects.requireNonNull(formulaBranches, "formulaBranches"));
        this.negationBranches = List.copyOf(Objects.requireNonNull(negationBranches, "negationBranches"));
    }

    /**
     * @return rami del tableau di f
     */
    public List<Set<Formula>> getFormulaBranches() {
        return formulaBranches;
    }

    /**
     * @return rami del tableau di ¬f
     */
    public List<Set<Formula>> getNegationBranches() {
        return negationBranches;
    }

    /**
     * Un ramo è chiuso se contiene una proposizione insieme alla sua negazione.
     *
     * @param branch letterali del ramo
     * @return true se esiste una coppia complementare
     */
    public static boolean isClosed(Collection<Formula> branch) {
        for (Formula literal : branch) {
            if (literal.isProposition() && branch.contains(literal.negate())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true se tutti i rami sono chiusi (una lista vuota non capita mai: c'è sempre almeno un ramo)
     */
    public static boolean allClosed(List<Set<Formula>> branches) {
        return branches.stream().allMatch(TableauBranches::isClosed);
    }

    @Override
    public String toString() {
        return "TableauBranches{formula=" + formulaBranches + ", negation=" + negationBranches + "}";
    }
}
