package FAMin;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FAMin.Model.DA;
import FAMin.Model.FiniteAutomaton;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.NA;
import FAMin.Model.ValidationReport;

/**
 * Structural well-formedness checks shared by the transformations and the import boundary.
 */
public class AutomatonValidator {
    private static final int MAX_LISTED_PAIRS = 10;

    private AutomatonValidator() {
    }

    /**
     * Collect every structural problem of the automaton, without stopping at the first one.
     * @param automaton - automaton to check
     * @return errors (broken invariants), warnings, statistics and unreachable states
     */
    public static ValidationReport validate(FiniteAutomaton automaton) {
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final Set<String> states = automaton.getStates();

        if (states.isEmpty()) {
            errors.add("automaton has no states");
        }
        final boolean startKnown = states.contains(automaton.getStart());
        if (!startKnown) {
            errors.add("start state '" + automaton.getStart() + "' is not a state");
        }
        for (String state : automaton.getAcceptingStates()) {
            if (!states.contains(state)) {
                errors.add("accepting state '" + state + "' is not a state");
            }
        }
        if (automaton.getAlphabet().isEmpty()) {
            warnings.add("alphabet is empty");
        }

        if (automaton instanceof DA dfa) {
            checkTransitions(dfa, errors);
            checkCompleteness(dfa, warnings);
        } else if (automaton instanceof NA nfa) {
            checkTransitions(nfa, errors);
            checkDeterminism(nfa, warnings);
        }

        final Set<String> unreachable = new LinkedHashSet<>();
        if (startKnown) {
            unreachable.addAll(states);
            unreachable.removeAll(automaton.reachableStates());
            if (!unreachable.isEmpty()) {
                warnings.add("unreachable states: " + unreachable);
            }
        }

        return new ValidationReport(automaton.kind(), errors, warnings, automaton.statistics(), unreachable);
    }

    /**
     * Fail fast on a structurally invalid automaton.
     * @throws InvalidAutomatonException listing every error found by {@link #validate(FiniteAutomaton)}
     */
    public static <A extends FiniteAutomaton> A requireValid(A automaton) {
        final ValidationReport report = validate(automaton);
        if (!report.isValid()) {
            throw new InvalidAutomatonException(report.errors());
        }
        return automaton;
    }

    private static void checkTransitions(DA dfa, List<String> errors) {
        for (String origin : transitionOrigins(dfa)) {
            for (Map.Entry<String, String> entry : dfa.getTransitions(origin).entrySet()) {
                checkTransition(dfa, origin, entry.getKey(), entry.getValue(), errors);
            }
        }
    }

    private static void checkTransitions(NA nfa, List<String> errors) {
        // records spell epsilon with any of these tokens, so none of them can be a symbol
        for (String symbol : nfa.getAlphabet()) {
            if (NA.isEpsilonToken(symbol)) {
                errors.add("alphabet contains the reserved epsilon token '" + symbol + "'");
            }
        }
        for (String origin : transitionOrigins(nfa)) {
            for (Map.Entry<String, Set<String>> entry : nfa.getTransitions(origin).entrySet()) {
                for (String destination : entry.getValue()) {
                    checkTransition(nfa, origin, entry.getKey(), destination, errors);
                }
            }
            for (String destination : nfa.getEpsilonSuccessors(origin)) {
                checkTransition(nfa, origin, null, destination, errors);
            }
        }
    }

    private static void checkTransition(FiniteAutomaton automaton, String origin, String symbol, String destination,
                                        List<String> errors) {
        final String label = "(" + origin + ", " + (symbol == null ? NA.EPSILON : symbol) + ") -> " + destination;
        if (!automaton.getStates().contains(origin)) {
            errors.add("transition " + label + ": origin is not a state");
        }
        if (symbol != null && !automaton.getAlphabet().contains(symbol)) {
            errors.add("transition " + label + ": symbol is not in the alphabet");
        }
        if (!automaton.getStates().contains(destination)) {
            errors.add("transition " + label + ": destination is not a state");
        }
    }

    private static void checkCompleteness(DA dfa, List<String> warnings) {
        final List<String> missing = new ArrayList<>();
        int total = 0;
        for (String state : dfa.getStates()) {
            for (String symbol : dfa.getAlphabet()) {
                if (dfa.getSuccessor(state, symbol) == null) {
                    if (missing.size() < MAX_LISTED_PAIRS) {
                        missing.add("(" + state + ", " + symbol + ")");
                    }
                    total++;
                }
            }
        }
        if (total > 0) {
            warnings.add("incomplete: no transition for " + String.join(", ", missing)
                + (total > missing.size() ? " and " + (total - missing.size()) + " more" : ""));
        }
    }

    private static void checkDeterminism(NA nfa, List<String> warnings) {
        if (nfa.hasEpsilonTransitions()) {
            warnings.add("automaton has epsilon moves");
        }
        final List<String> branching = new ArrayList<>();
        for (String origin : transitionOrigins(nfa)) {
            for (Map.Entry<String, Set<String>> entry : nfa.getTransitions(origin).entrySet()) {
                if (entry.getValue().size() > 1) {
                    branching.add("(" + origin + ", " + entry.getKey() + ") -> " + entry.getValue());
                }
            }
        }
        if (!branching.isEmpty()) {
            warnings.add("nondeterministic transitions: " + String.join(", ", branching));
        }
    }

    // States with outgoing transitions may lie outside the state set of a malformed automaton.
    private static Set<String> transitionOrigins(FiniteAutomaton automaton) {
        final Set<String> origins = new LinkedHashSet<>(automaton.getStates());
        if (automaton instanceof DA dfa) {
            origins.addAll(dfa.transitionOrigins());
        } else if (automaton instanceof NA nfa) {
            origins.addAll(nfa.transitionOrigins());
        }
        return origins;
    }
}
