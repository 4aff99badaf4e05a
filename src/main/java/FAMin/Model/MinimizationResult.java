package FAMin.Model;

import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a minimization, for reporting.
 * @param minimized - the minimal automaton
 * @param originalStates - states of the input DA
 * @param reachableStates - states of the input DA reachable from its start state
 * @param partition - final partition of the reachable states
 * @param equivalenceTable - reachable input state to the minimized state representing it
 */
public record MinimizationResult(DA minimized,
                                 int originalStates,
                                 int reachableStates,
                                 Partition partition,
                                 Map<String, String> equivalenceTable) {

    public int minimizedStates() {
        return minimized.size();
    }

    public int unreachableRemoved() {
        return originalStates - reachableStates;
    }

    /**
     * @return share of the input states that were removed, in percent.
     */
    public double reductionPercentage() {
        if (originalStates == 0) {
            return 0.0;
        }
        return 100.0 * (originalStates - minimizedStates()) / originalStates;
    }

    /**
     * @return input states per minimized state.
     */
    public double reductionFactor() {
        return minimizedStates() == 0 ? 0.0 : (double) originalStates / minimizedStates();
    }

    @Override
    public String toString() {
        return "DA states: " + originalStates + ", unreachable removed: " + unreachableRemoved()
            + ", minimized states: " + minimizedStates()
            + ", reduction: " + String.format(Locale.ROOT, "%.1f%%", reductionPercentage());
    }
}
