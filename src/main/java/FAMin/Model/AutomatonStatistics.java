package FAMin.Model;

import java.util.Locale;

/**
 * Size figures of an automaton.
 * For an NA, transitions are counted once per destination, epsilon moves included, and
 * {@code complete} means every (state, symbol) pair has at least one destination.
 */
public record AutomatonStatistics(AutomatonKind kind,
                                  int states,
                                  int symbols,
                                  int acceptingStates,
                                  int transitions,
                                  boolean complete,
                                  boolean deterministic) {

    /**
     * @return |transitions| / (|states| * |alphabet|), or 0 if either is empty.
     */
    public double transitionDensity() {
        final long maxTransitions = (long) states * symbols;
        return maxTransitions == 0 ? 0.0 : (double) transitions / maxTransitions;
    }

    @Override
    public String toString() {
        return kind + ": " + states + " states, " + symbols + " symbols, " + acceptingStates + " accepting, "
            + transitions + " transitions, density " + String.format(Locale.ROOT, "%.3f", transitionDensity())
            + (complete ? ", complete" : ", incomplete")
            + (deterministic ? "" : ", nondeterministic");
    }
}
