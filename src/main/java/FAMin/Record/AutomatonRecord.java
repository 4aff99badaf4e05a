package FAMin.Record;

import java.util.List;

import FAMin.Model.AutomatonKind;

/**
 * Plain structural description of an automaton, independent of any file format.
 * Lists keep their order; they are copied and may not contain null.
 */
public record AutomatonRecord(AutomatonKind type,
                              List<String> states,
                              List<String> alphabet,
                              List<TransitionRecord> transitions,
                              String start,
                              List<String> accepting) {

    public AutomatonRecord {
        states = states == null ? null : List.copyOf(states);
        alphabet = alphabet == null ? null : List.copyOf(alphabet);
        transitions = transitions == null ? null : List.copyOf(transitions);
        accepting = accepting == null ? null : List.copyOf(accepting);
    }
}
