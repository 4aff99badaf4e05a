package FAMin.Model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every structural problem found in an automaton.
 * Errors break an invariant of the data model; warnings are legal but worth reporting
 * (incompleteness, nondeterminism, unreachable states).
 */
public record ValidationReport(AutomatonKind kind,
                               List<String> errors,
                               List<String> warnings,
                               AutomatonStatistics statistics,
                               Set<String> unreachableStates) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        unreachableStates = Collections.unmodifiableSet(new LinkedHashSet<>(unreachableStates));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
