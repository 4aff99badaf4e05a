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
 * Deterministic automaton with a partial transition function.
 * A missing transition means rejection; no sink state is implied.
 * <p>
 * Instances are immutable. The builder does not check that transitions reference known states or
 * symbols, so that malformed automata can still be represented and reported by
 * {@link FAMin.AutomatonValidator}.
 */
public final class DA implements FiniteAutomaton {
    private final Set<String> states;
    private final Set<String> alphabet;
    private final Map<String, Map<String, String>> transitions;
    private final String start;
    private final Set<String> accepting;
    private final int transitionCount;

    private DA(Builder builder) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(builder.alphabet));
        this.accepting = Collections.unmodifiableSet(new LinkedHashSet<>(builder.accepting));
        this.start = builder.start;

        final Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<String, Map<String, String>> entry : builder.transitions.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
            count += entry.getValue().size();
        }
        this.transitions = Collections.unmodifiableMap(copy);
        this.transitionCount = count;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.DA;
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
     * @return the destination of (state, symbol), or null if the transition is undefined.
     */
    public String getSuccessor(String state, String symbol) {
        final Map<String, String> out = transitions.get(state);
        return out == null ? null : out.get(symbol);
    }

    /**
     * @return symbol to destination map of all transitions leaving the state.
     */
    public Map<String, String> getTransitions(String state) {
        return transitions.getOrDefault(state, Map.of());
    }

    /**
     * @return states with at least one outgoing transition, including any that are not in the state set.
     */
    public Set<String> transitionOrigins() {
        return transitions.keySet();
    }

    @Override
    public int transitionCount() {
        return transitionCount;
    }

    @Override
    public boolean accepts(Iterable<String> input) {
        String current = start;
        for (String symbol : input) {
            if (!alphabet.contains(symbol)) {
                return false;
            }
            current = getSuccessor(current, symbol);
            if (current == null) {
                return false;
            }
        }
        return accepting.contains(current);
    }

    @Override
    public Set<String> reachableStates() {
        final Set<String> reached = new LinkedHashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        reached.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            final String state = queue.poll();
            for (String symbol : alphabet) {
                final String succ = getSuccessor(state, symbol);
                if (succ != null && reached.add(succ)) {
                    queue.add(succ);
                }
            }
        }
        return reached;
    }

    /**
     * @return true iff a transition is defined for every pair in states x alphabet.
     */
    public boolean isComplete() {
        for (String state : states) {
            for (String symbol : alphabet) {
                if (getSuccessor(state, symbol) == null) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public AutomatonStatistics statistics() {
        return new AutomatonStatistics(AutomatonKind.DA, states.size(), alphabet.size(), accepting.size(),
            transitionCount, isComplete(), true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DA other)) {
            return false;
        }
        return states.equals(other.states) && alphabet.equals(other.alphabet)
            && transitions.equals(other.transitions) && Objects.equals(start, other.start)
            && accepting.equals(other.accepting);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, start, accepting);
    }

    @Override
    public String toString() {
        return "DA(states=" + states + ", alphabet=" + alphabet + ", start=" + start + ", accepting=" + accepting
            + ", transitions=" + transitions + ")";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
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

        /**
         * Define (origin, symbol) -> destination. Repeating an identical transition is a no-op.
         * @throws InvalidAutomatonException if (origin, symbol) already leads elsewhere
         */
        public Builder addTransition(String origin, String symbol, String destination) {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(destination, "destination");
            final Map<String, String> out = transitions.computeIfAbsent(origin, k -> new LinkedHashMap<>());
            final String previous = out.putIfAbsent(symbol, destination);
            if (previous != null && !previous.equals(destination)) {
                throw new InvalidAutomatonException("transition (" + origin + ", " + symbol + ") is not deterministic: "
                    + previous + " and " + destination);
            }
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
        public DA build() {
            if (start == null) {
                throw new InvalidAutomatonException("missing start state");
            }
            return new DA(this);
        }
    }
}
