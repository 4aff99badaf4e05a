package FAMin.Model;

import java.util.List;

/**
 * Structural violation of an automaton: start state outside the state set, dangling destination,
 * symbol outside the alphabet, missing required field.
 */
public class InvalidAutomatonException extends RuntimeException {
    private final List<String> problems;

    public InvalidAutomatonException(String problem) {
        this(List.of(problem));
    }

    public InvalidAutomatonException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
