package FAMin.Interop;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FAMin.Model.DA;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.NA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.MutableDFA;
import net.automatalib.automaton.fsa.MutableNFA;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion to and from AutomataLib's compact automata.
 * AutomataLib states are plain integers; on the way back they are named {@code s0, s1, ...}
 * in the order the source automaton lists them.
 */
public final class AutomataLibBridge {
    public static final String STATE_PREFIX = "s";

    private AutomataLibBridge() {
    }

    /**
     * @return CompactDFA with the same states in the same order and the alphabet sorted; missing transitions
     * stay undefined.
     */
    public static CompactDFA<String> toCompactDFA(DA dfa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(sorted(dfa.getAlphabet()));
        final CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());
        copyInto(dfa, out);
        return out;
    }

    /**
     * Epsilon moves are eliminated on the way: the initial states are the epsilon closure of the start
     * state, and every transition leads to all states of the closure of its destination.
     */
    public static CompactNFA<String> toCompactNFA(NA nfa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(sorted(nfa.getAlphabet()));
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.size());
        copyInto(nfa, alphabet, out);
        return out;
    }

    private static <S> void copyInto(DA dfa, MutableDFA<S, String> out) {
        final Map<String, S> mapping = new HashMap<>();
        for (String state : dfa.getStates()) {
            final S outState = state.equals(dfa.getStart())
                ? out.addInitialState(dfa.isAccepting(state))
                : out.addState(dfa.isAccepting(state));
            mapping.put(state, outState);
        }
        for (String state : dfa.getStates()) {
            for (Map.Entry<String, String> t : dfa.getTransitions(state).entrySet()) {
                out.setTransition(mapping.get(state), t.getKey(), lookup(mapping, t.getValue()));
            }
        }
    }

    private static <S> void copyInto(NA nfa, Collection<String> alphabet, MutableNFA<S, String> out) {
        final Map<String, S> mapping = new HashMap<>();
        for (String state : nfa.getStates()) {
            mapping.put(state, out.addState(nfa.isAccepting(state)));
        }
        for (String state : nfa.epsilonClosure(Set.of(nfa.getStart()))) {
            out.setInitial(lookup(mapping, state), true);
        }
        for (String state : nfa.getStates()) {
            for (String sym : alphabet) {
                for (String succ : nfa.successorClosure(Set.of(state), sym)) {
                    out.addTransition(mapping.get(state), sym, lookup(mapping, succ));
                }
            }
        }
    }

    public static <S> DA fromDFA(DFA<S, String> dfa, Collection<String> alphabet) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new InvalidAutomatonException("automaton has no initial state");
        }
        final Map<S, String> names = names(dfa.getStates());
        final DA.Builder out = DA.builder()
            .addSymbols(alphabet)
            .setStart(names.get(init));
        for (S state : dfa.getStates()) {
            final String name = names.get(state);
            out.addState(name);
            if (dfa.isAccepting(state)) {
                out.addAccepting(name);
            }
            for (String sym : alphabet) {
                final S succ = dfa.getSuccessor(state, sym);
                if (succ != null) {
                    out.addTransition(name, sym, names.get(succ));
                }
            }
        }
        return out.build();
    }

    public static DA fromDFA(CompactDFA<String> dfa) {
        return fromDFA(dfa, dfa.getInputAlphabet());
    }

    /**
     * Several initial states become epsilon moves from a fresh start state.
     * @throws InvalidAutomatonException if the automaton has no initial state
     */
    public static <S> NA fromNFA(NFA<S, String> nfa, Collection<String> alphabet) {
        final Set<S> inits = nfa.getInitialStates();
        if (inits.isEmpty()) {
            throw new InvalidAutomatonException("automaton has no initial state");
        }
        final Map<S, String> names = names(nfa.getStates());
        final NA.Builder out = NA.builder().addSymbols(alphabet);
        for (S state : nfa.getStates()) {
            final String name = names.get(state);
            out.addState(name);
            if (nfa.isAccepting(state)) {
                out.addAccepting(name);
            }
            for (String sym : alphabet) {
                for (S succ : nfa.getTransitions(state, sym)) {
                    out.addTransition(name, sym, names.get(succ));
                }
            }
        }

        if (inits.size() == 1) {
            out.setStart(names.get(inits.iterator().next()));
        } else {
            final String start = freshName(names.values());
            out.addState(start).setStart(start);
            for (S init : inits) {
                out.addEpsilonTransition(start, names.get(init));
            }
        }
        return out.build();
    }

    public static NA fromNFA(CompactNFA<String> nfa) {
        return fromNFA(nfa, nfa.getInputAlphabet());
    }

    private static <S> Map<S, String> names(Collection<S> states) {
        final Map<S, String> names = new HashMap<>();
        for (S state : states) {
            names.put(state, STATE_PREFIX + names.size());
        }
        return names;
    }

    private static String freshName(Collection<String> taken) {
        String name = "init";
        while (taken.contains(name)) {
            name = name + "'";
        }
        return name;
    }

    private static <S> S lookup(Map<String, S> mapping, String state) {
        final S result = mapping.get(state);
        if (result == null) {
            throw new InvalidAutomatonException("unknown state '" + state + "'");
        }
        return result;
    }

    private static List<String> sorted(Collection<String> values) {
        final List<String> result = new ArrayList<>(values);
        result.sort(null);
        return result;
    }
}
