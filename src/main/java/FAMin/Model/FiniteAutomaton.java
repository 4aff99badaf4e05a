package FAMin.Model;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Common read-only view of the two automaton variants.
 * States and symbols are plain strings; all returned collections are unmodifiable.
 */
public sealed interface FiniteAutomaton permits DA, NA {

    AutomatonKind kind();

    Set<String> getStates();

    Set<String> getAlphabet();

    String getStart();

    Set<String> getAcceptingStates();

    default boolean isAccepting(String state) {
        return getAcceptingStates().contains(state);
    }

    default int size() {
        return getStates().size();
    }

    int transitionCount();

    /**
     * Simulate the automaton on a sequence of symbols.
     * A symbol outside the alphabet, or a missing transition, rejects.
     */
    boolean accepts(Iterable<String> input);

    /**
     * Simulate the automaton on a word, one symbol per code point.
     */
    default boolean acceptsWord(String word) {
        return accepts(symbolsOf(word));
    }

    /**
     * Breadth-first traversal from the start state. The start state is always contained.
     */
    Set<String> reachableStates();

    AutomatonStatistics statistics();

    static List<String> symbolsOf(String word) {
        return word.codePoints().mapToObj(Character::toString).collect(Collectors.toList());
    }
}
