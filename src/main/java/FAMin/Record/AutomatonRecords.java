package FAMin.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FAMin.AutomatonValidator;
import FAMin.Model.AutomatonKind;
import FAMin.Model.DA;
import FAMin.Model.FiniteAutomaton;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.NA;

/**
 * Conversion between automata and their structural records.
 */
public final class AutomatonRecords {

    private AutomatonRecords() {
    }

    /**
     * Export an automaton. Every NA destination becomes its own transition record, epsilon moves are
     * written with the symbol {@link NA#EPSILON}.
     */
    public static AutomatonRecord toRecord(FiniteAutomaton automaton) {
        final List<TransitionRecord> transitions = new ArrayList<>();
        if (automaton instanceof DA dfa) {
            for (String origin : dfa.transitionOrigins()) {
                for (Map.Entry<String, String> t : dfa.getTransitions(origin).entrySet()) {
                    transitions.add(new TransitionRecord(origin, t.getKey(), t.getValue()));
                }
            }
        } else if (automaton instanceof NA nfa) {
            for (String origin : nfa.transitionOrigins()) {
                for (Map.Entry<String, Set<String>> t : nfa.getTransitions(origin).entrySet()) {
                    for (String destination : t.getValue()) {
                        transitions.add(new TransitionRecord(origin, t.getKey(), destination));
                    }
                }
                for (String destination : nfa.getEpsilonSuccessors(origin)) {
                    transitions.add(new TransitionRecord(origin, NA.EPSILON, destination));
                }
            }
        }
        return new AutomatonRecord(automaton.kind(),
            new ArrayList<>(automaton.getStates()),
            new ArrayList<>(automaton.getAlphabet()),
            transitions,
            automaton.getStart(),
            new ArrayList<>(automaton.getAcceptingStates()));
    }

    /**
     * Import and validate a record.
     * @throws MalformedRecordException if a required field is missing
     * @throws InvalidAutomatonException if the automaton described is structurally invalid
     */
    public static FiniteAutomaton fromRecord(AutomatonRecord record) throws MalformedRecordException {
        return AutomatonValidator.requireValid(build(record));
    }

    /**
     * Build the automaton a record describes without validating it, so that the result can be inspected
     * with {@link AutomatonValidator#validate(FiniteAutomaton)}.
     * A missing type means DA. For an NA, the symbols "lambda", "λ" and "" are read as epsilon moves.
     * @throws MalformedRecordException if a required field is missing
     * @throws InvalidAutomatonException if a DA record maps one (origin, symbol) pair to two destinations
     */
    public static FiniteAutomaton build(AutomatonRecord record) throws MalformedRecordException {
        final List<String> states = require(record.states(), "states");
        final List<String> alphabet = require(record.alphabet(), "alphabet");
        final List<TransitionRecord> transitions = require(record.transitions(), "transitions");
        final String start = require(record.start(), "start");
        final List<String> accepting = require(record.accepting(), "accepting");
        for (TransitionRecord t : transitions) {
            require(t.origin(), "transitions[].origin");
            require(t.symbol(), "transitions[].symbol");
            require(t.destination(), "transitions[].destination");
        }

        final AutomatonKind type = record.type() == null ? AutomatonKind.DA : record.type();
        if (type == AutomatonKind.DA) {
            final DA.Builder builder = DA.builder()
                .addStates(states)
                .addSymbols(alphabet)
                .setStart(start)
                .addAccepting(accepting);
            for (TransitionRecord t : transitions) {
                builder.addTransition(t.origin(), t.symbol(), t.destination());
            }
            return builder.build();
        }

        final NA.Builder builder = NA.builder()
            .addStates(states)
            .addSymbols(alphabet)
            .setStart(start)
            .addAccepting(accepting);
        for (TransitionRecord t : transitions) {
            if (NA.isEpsilonToken(t.symbol())) {
                builder.addEpsilonTransition(t.origin(), t.destination());
            } else {
                builder.addTransition(t.origin(), t.symbol(), t.destination());
            }
        }
        return builder.build();
    }

    private static <T> T require(T value, String field) throws MalformedRecordException {
        if (value == null) {
            throw new MalformedRecordException("missing field '" + field + "'");
        }
        return value;
    }
}
