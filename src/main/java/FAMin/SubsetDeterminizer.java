package FAMin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

import FAMin.Model.ConversionResult;
import FAMin.Model.DA;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.NA;
import FAMin.Registry.SubsetRegistry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rabin-Scott subset construction.
 * <p>
 * Each DA state stands for an epsilon-closed set of NA states and is named after its members, sorted:
 * {@code {q0,q1}}. Empty successor sets produce no transition, so the result may be incomplete;
 * no sink state is added. Worst case the result has 2^n states for an NA with n states.
 */
public class SubsetDeterminizer {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetDeterminizer.class);

    private SubsetDeterminizer() {
    }

    public static DA determinize(NA nfa) {
        return determinizeWithSummary(nfa).dfa();
    }

    /**
     * Determinize the NA and report state counts before and after.
     * @param nfa - NA to convert; not modified
     * @return the equivalent DA with its conversion statistics
     * @throws InvalidAutomatonException if the NA has no states, no symbols, or an unknown start state
     */
    public static ConversionResult determinizeWithSummary(NA nfa) {
        checkPreconditions(nfa);

        final List<String> nfaStates = sorted(nfa.getStates());
        final Object2IntMap<String> stateIndex = new Object2IntOpenHashMap<>();
        stateIndex.defaultReturnValue(-1);
        for (String state : nfaStates) {
            stateIndex.put(state, stateIndex.size());
        }
        final List<String> symbols = sorted(nfa.getAlphabet());

        final SubsetRegistry registry = new SubsetRegistry();
        final List<String> names = new ArrayList<>();
        final Set<String> usedNames = new HashSet<>();
        final Deque<DeterminizeRecord> worklist = new ArrayDeque<>();

        final DA.Builder out = DA.builder().addSymbols(nfa.getAlphabet());

        final BitSet init = toBitSet(nfa.epsilonClosure(Set.of(nfa.getStart())), stateIndex);
        final DeterminizeRecord initRecord = register(nfa, init, nfaStates, registry, names, usedNames, out);
        out.setStart(initRecord.name());
        worklist.add(initRecord);

        while (!worklist.isEmpty()) {
            final DeterminizeRecord curr = worklist.poll();
            final List<String> members = members(curr.subset(), nfaStates);

            for (String sym : symbols) {
                final BitSet succ = toBitSet(nfa.successorClosure(members, sym), stateIndex);
                if (succ.isEmpty()) {
                    continue; // implicit rejection
                }
                final int index = registry.get(succ);
                final String succName;
                if (index == SubsetRegistry.MISSING_ELEMENT) {
                    // add new state to DA and to worklist
                    final DeterminizeRecord succRecord = register(nfa, succ, nfaStates, registry, names, usedNames, out);
                    worklist.add(succRecord);
                    succName = succRecord.name();
                } else {
                    succName = names.get(index);
                }
                out.addTransition(curr.name(), sym, succName);
            }
        }

        final DA dfa = out.build();
        LOG.debug("Subset construction: {} NA states -> {} DA states, {} transitions",
            nfa.size(), dfa.size(), dfa.transitionCount());
        return new ConversionResult(dfa, nfa.size(), dfa.size(), nfa.hasEpsilonTransitions());
    }

    private static void checkPreconditions(NA nfa) {
        if (nfa.getStates().isEmpty()) {
            throw new InvalidAutomatonException("cannot determinize an automaton without states");
        }
        if (nfa.getAlphabet().isEmpty()) {
            throw new InvalidAutomatonException("cannot determinize an automaton with an empty alphabet");
        }
        if (!nfa.getStates().contains(nfa.getStart())) {
            throw new InvalidAutomatonException("start state '" + nfa.getStart() + "' is not a state");
        }
    }

    private static DeterminizeRecord register(NA nfa, BitSet subset, List<String> nfaStates, SubsetRegistry registry,
                                              List<String> names, Set<String> usedNames, DA.Builder out) {
        final int index = registry.put(subset);
        String name = subsetName(subset, nfaStates);
        if (!usedNames.add(name)) {
            // member names containing ',', '{' or '}' can render two subsets alike
            name = name + "#" + index;
            usedNames.add(name);
        }
        names.add(name);

        out.addState(name);
        for (String member : members(subset, nfaStates)) {
            if (nfa.isAccepting(member)) {
                out.addAccepting(name);
                break;
            }
        }
        return new DeterminizeRecord(subset, name);
    }

    /**
     * @return {@code {m1,m2,...}} with members in natural string order.
     */
    static String subsetName(BitSet subset, List<String> sortedStates) {
        final StringJoiner joiner = new StringJoiner(",", "{", "}");
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            joiner.add(sortedStates.get(i));
        }
        return joiner.toString();
    }

    private static BitSet toBitSet(Collection<String> states, Object2IntMap<String> stateIndex) {
        final BitSet result = new BitSet(stateIndex.size());
        for (String state : states) {
            final int index = stateIndex.getInt(state);
            if (index < 0) {
                throw new InvalidAutomatonException("transition destination '" + state + "' is not a state");
            }
            result.set(index);
        }
        return result;
    }

    private static List<String> members(BitSet subset, List<String> sortedStates) {
        final List<String> result = new ArrayList<>(subset.cardinality());
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            result.add(sortedStates.get(i));
        }
        return result;
    }

    private static List<String> sorted(Collection<String> values) {
        final List<String> result = new ArrayList<>(values);
        result.sort(null);
        return result;
    }

    private record DeterminizeRecord(BitSet subset, String name) { }
}
