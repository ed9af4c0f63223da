package org.tableaux.tableau;

/**
 * STATISTICHE DEL TABLEAU - Metriche raccolte durante una visita
 *
 * • steps: passi elementari del motore (classificazioni ed espansioni)
 * • expansions: applicazioni di regole, lineari e diramanti
 * • closedBranches: cammini chiusi da una coppia di letterali complementari
 * • openBranches: cammini esauriti senza contraddizione
 * • maxDepth: profondità massima raggiunta dal journal di undo
 * • executionTimeMs: durata della visita
 */
public class TableauStatistics {

    //region CONTATORI

    private long steps = 0;
    private long expansions = 0;
    private long closedBranches = 0;
    private long openBranches = 0;
    private int maxDepth = 0;

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia subito la misurazione del tempo.
     */
    public TableauStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region AGGIORNAMENTO

    void incrementSteps() {
        steps++;
    }

    void incrementExpansions() {
        expansions++;
    }

    void incrementClosedBranches() {
        closedBranches++;
    }

    void incrementOpenBranches() {
        openBranches++;
    }

    void recordDepth(int depth) {
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    /**
     * Ferma il timer; le chiamate successive non hanno effetto.
     */
    void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSO

    public long getSteps() {
        return steps;
    }

    public long getExpansions() {
        return expansions;
    }

    public long getClosedBranches() {
        return closedBranches;
    }

    public long getOpenBranches() {
        return openBranches;
    }

    /**
     * @return numero di foglie raggiunte, chiuse o aperte
     */
    public long getTotalBranches() {
        return closedBranches + openBranches;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("passi=%d, espansioni=%d, rami chiusi=%d, rami aperti=%d, profondità max=%d, tempo=%dms",
                steps, expansions, closedBranches, openBranches, maxDepth, getExecutionTimeMs());
    }
}
