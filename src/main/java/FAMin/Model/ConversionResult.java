package FAMin.Model;

import java.util.Locale;

/**
 * Outcome of a subset construction, for reporting.
 * @param dfa - the determinized automaton
 * @param nfaStates - states of the input NA
 * @param dfaStates - states of the produced DA
 * @param epsilonMoves - whether the input NA had epsilon moves
 */
public record ConversionResult(DA dfa, int nfaStates, int dfaStates, boolean epsilonMoves) {

    /**
     * @return DA states per NA state.
     */
    public double expansionFactor() {
        return nfaStates == 0 ? 0.0 : (double) dfaStates / nfaStates;
    }

    @Override
    public String toString() {
        return "NA states: " + nfaStates + ", DA states: " + dfaStates
            + ", expansion factor: " + String.format(Locale.ROOT, "%.2f", expansionFactor())
            + (epsilonMoves ? ", epsilon moves eliminated" : "");
    }
}
