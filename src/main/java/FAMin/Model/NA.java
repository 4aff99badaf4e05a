package FAMin.Model;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Nondeterministic automaton with optional epsilon moves.
 * Epsilon moves are kept apart from the symbol transitions; the epsilon marker is never part of the
 * alphabet. Structural records spell it {@link #EPSILON}.
 * <p>
 * Instances are immutable.
 */
public final class NA implements FiniteAutomaton {
    public static final String EPSILON = "lambda";

    private final Set<String> states;
    private final Set<String> alphabet;
    private final Map<String, Map<String, Set<String>>> transitions;
    private final Map<String, Set<String>> epsilonTransitions;
    private final String start;
    private final Set<String> accepting;
    private final int transitionCount;

    private NA(Builder builder) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(builder.alphabet));
        this.accepting = Collections.unmodifiableSet(new LinkedHashSet<>(builder.accepting));
        this.start = builder.start;

        int count = 0;
        final Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Set<String>>> entry : builder.transitions.entrySet()) {
            final Map<String, Set<String>> out = new LinkedHashMap<>();
            for (Map.Entry<String, Set<String>> bySymbol : entry.getValue().entrySet()) {
                out.put(bySymbol.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(bySymbol.getValue())));
                count += bySymbol.getValue().size();
            }
            copy.put(entry.getKey(), Collections.unmodifiableMap(out));
        }
        this.transitions = Collections.unmodifiableMap(copy);

        final Map<String, Set<String>> epsilonCopy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : builder.epsilonTransitions.entrySet()) {
            epsilonCopy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
            count += entry.getValue().size();
        }
        this.epsilonTransitions = Collections.unmodifiableMap(epsilonCopy);
        this.transitionCount = count;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tokens read as an epsilon move in structural records.
     */
    public static boolean isEpsilonToken(String symbol) {
        return EPSILON.equals(symbol) || "λ".equals(symbol) || "".equals(symbol);
    }

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.NA;
    }

    @Override
    public Set<String> getStates() {
        return states;
    }

    @Override
    public Set<String> getAlphabet() {
        return alphabet;
    }

    @Override
    public String getStart() {
        return start;
    }

    @Override
    public Set<String> getAcceptingStates() {
        return accepting;
    }

    /**
     * @return destinations of (state, symbol), possibly empty.
     */
    public Set<String> getSuccessors(String state, String symbol) {
        final Map<String, Set<String>> out = transitions.get(state);
        if (out == null) {
            return Set.of();
        }
        return out.getOrDefault(symbol, Set.of());
    }

    /**
     * @return symbol to destinations map of all symbol transitions leaving the state.
     */
    public Map<String, Set<String>> getTransitions(String state) {
        return transitions.getOrDefault(state, Map.of());
    }

    /**
     * @return destinations of the epsilon moves leaving the state, possibly empty.
     */
    public Set<String> getEpsilonSuccessors(String state) {
        return epsilonTransitions.getOrDefault(state, Set.of());
    }

    /**
     * @return states with at least one outgoing move, including any that are not in the state set.
     */
    public Set<String> transitionOrigins() {
        final Set<String> origins = new LinkedHashSet<>(transitions.keySet());
        origins.addAll(epsilonTransitions.keySet());
        return Collections.unmodifiableSet(origins);
    }

    public boolean hasEpsilonTransitions() {
        for (Set<String> destinations : epsilonTransitions.values()) {
            if (!destinations.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int transitionCount() {
        return transitionCount;
    }

    /**
     * Smallest superset of the given states closed under epsilon moves.
     * Every state enters the worklist at most once.
     */
    public Set<String> epsilonClosure(Collection<String> from) {
        final Set<String> closure = new LinkedHashSet<>(from);
        final Deque<String> worklist = new ArrayDeque<>(closure);
        while (!worklist.isEmpty()) {
            final String state = worklist.poll();
            for (String succ : getEpsilonSuccessors(state)) {
                if (closure.add(succ)) {
                    worklist.add(succ);
                }
            }
        }
        return closure;
    }

    /**
     * Epsilon closure of the union of (s, symbol) destinations over all s in the given set.
     */
    public Set<String> successorClosure(Collection<String> current, String symbol) {
        final Set<String> moved = new LinkedHashSet<>();
        for (String state : current) {
            moved.addAll(getSuccessors(state, symbol));
        }
        return epsilonClosure(moved);
    }

    @Override
    public boolean accepts(Iterable<String> input) {
        Set<String> current = epsilonClosure(Set.of(start));
        for (String symbol : input) {
            if (!alphabet.contains(symbol)) {
                return false;
            }
            current = successorClosure(current, symbol);
            if (current.isEmpty()) {
                return false;
            }
        }
        for (String state : current) {
            if (accepting.contains(state)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<String> reachableStates() {
        final Set<String> reached = new LinkedHashSet<>(epsilonClosure(Set.of(start)));
        final Deque<String> queue = new ArrayDeque<>(reached);
        while (!queue.isEmpty()) {
            final String state = queue.poll();
            for (String symbol : alphabet) {
                for (String succ : epsilonClosure(getSuccessors(state, symbol))) {
                    if (reached.add(succ)) {
                        queue.add(succ);
                    }
                }
            }
        }
        return reached;
    }

    /**
     * @return true iff there are no epsilon moves and no (state, symbol) pair has two destinations.
     */
    public boolean isDeterministic() {
        if (hasEpsilonTransitions()) {
            return false;
        }
        for (Map<String, Set<String>> out : transitions.values()) {
            for (Set<String> destinations : out.values()) {
                if (destinations.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean hasSuccessorForAllPairs() {
        for (String state : states) {
            for (String symbol : alphabet) {
                if (getSuccessors(state, symbol).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public AutomatonStatistics statistics() {
        return new AutomatonStatistics(AutomatonKind.NA, states.size(), alphabet.size(), accepting.size(),
            transitionCount, hasSuccessorForAllPairs(), isDeterministic());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NA other)) {
            return false;
        }
        return states.equals(other.states) && alphabet.equals(other.alphabet)
            && transitions.equals(other.transitions) && epsilonTransitions.equals(other.epsilonTransitions)
            && Objects.equals(start, other.start) && accepting.equals(other.accepting);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, epsilonTransitions, start, accepting);
    }

    @Override
    public String toString() {
        return "NA(states=" + states + ", alphabet=" + alphabet + ", start=" + start + ", accepting=" + accepting
            + ", transitions=" + transitions + ", epsilon=" + epsilonTransitions + ")";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
        private final Map<String, Set<String>> epsilonTransitions = new LinkedHashMap<>();
        private final Set<String> accepting = new LinkedHashSet<>();
        private String start;

        private Builder() {
        }

        public Builder addState(String state) {
            states.add(Objects.requireNonNull(state, "state"));
            return this;
        }

        public Builder addStates(String... newStates) {
            for (String state : newStates) {
                addState(state);
            }
            return this;
        }

        public Builder addStates(Collection<String> newStates) {
            newStates.forEach(this::addState);
            return this;
        }

        public Builder addSymbol(String symbol) {
            alphabet.add(Objects.requireNonNull(symbol, "symbol"));
            return this;
        }

        public Builder addSymbols(String... symbols) {
            for (String symbol : symbols) {
                addSymbol(symbol);
            }
            return this;
        }

        public Builder addSymbols(Collection<String> symbols) {
            symbols.forEach(this::addSymbol);
            return this;
        }

        public Builder addTransition(String origin, String symbol, String destination) {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(destination, "destination");
            transitions.computeIfAbsent(origin, k -> new LinkedHashMap<>())
                .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                .add(destination);
            return this;
        }

        public Builder addTransitions(String origin, String symbol, Collection<String> destinations) {
            for (String destination : destinations) {
                addTransition(origin, symbol, destination);
            }
            return this;
        }

        public Builder addEpsilonTransition(String origin, String destination) {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(destination, "destination");
            epsilonTransitions.computeIfAbsent(origin, k -> new LinkedHashSet<>()).add(destination);
            return this;
        }

        public Builder setStart(String state) {
            this.start = Objects.requireNonNull(state, "start");
            return this;
        }

        public Builder addAccepting(String state) {
            accepting.add(Objects.requireNonNull(state, "accepting state"));
            return this;
        }

        public Builder addAccepting(String... states) {
            for (String state : states) {
                addAccepting(state);
            }
            return this;
        }

        public Builder addAccepting(Collection<String> states) {
            states.forEach(this::addAccepting);
            return this;
        }

        /**
         * @throws InvalidAutomatonException if no start state was set
         */
        public NA build() {
            if (start == null) {
                throw new InvalidAutomatonException("missing start state");
            }
            return new NA(this);
        }
    }
}
