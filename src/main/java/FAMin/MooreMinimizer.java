package FAMin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FAMin.Model.DA;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.MinimizationResult;
import FAMin.Model.Partition;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moore's partition refinement.
 * <p>
 * Missing transitions are kept as they are: in a signature they show up as {@link #NO_TRANSITION},
 * a value distinct from every block index, so an incomplete DA is never completed with a sink state.
 */
public class MooreMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(MooreMinimizer.class);

    public static final int NO_TRANSITION = -1;
    public static final String STATE_PREFIX = "q";

    private MooreMinimizer() {
    }

    public static DA minimize(DA dfa) {
        return minimizeWithSummary(dfa).minimized();
    }

    /**
     * Minimize the DA and report what was removed.
     * The result's states are named q0, q1, ... in breadth-first order from the start block,
     * following symbols in natural string order, so the start state is always q0 and two complete minimal DAs
     * for the same language over the same alphabet are equal. Partial inputs give equal results only when
     * they also agree on which transitions are defined.
     * @param dfa - DA to minimize; not modified
     * @return minimal DA with state counts, final partition and equivalence table
     * @throws InvalidAutomatonException if the DA has no states or an unknown start state
     */
    public static MinimizationResult minimizeWithSummary(DA dfa) {
        final DA reachable = pruneUnreachable(dfa);
        final Partition partition = refine(reachable, initialPartition(reachable));

        final Map<String, String> table = new LinkedHashMap<>();
        final DA minimized = quotient(reachable, partition, table);

        LOG.debug("Minimization: {} states, {} reachable, {} after refinement",
            dfa.size(), reachable.size(), minimized.size());
        return new MinimizationResult(minimized, dfa.size(), reachable.size(), partition,
            Collections.unmodifiableMap(table));
    }

    /**
     * Copy of the DA restricted to the states reachable from its start state.
     * @throws InvalidAutomatonException if the DA has no states or an unknown start state
     */
    public static DA pruneUnreachable(DA dfa) {
        checkPreconditions(dfa);
        final Set<String> reachable = dfa.reachableStates();
        for (String state : reachable) {
            if (!dfa.getStates().contains(state)) {
                throw new InvalidAutomatonException("transition destination '" + state + "' is not a state");
            }
        }

        final DA.Builder out = DA.builder()
            .addSymbols(dfa.getAlphabet())
            .setStart(dfa.getStart());
        for (String state : dfa.getStates()) {
            if (!reachable.contains(state)) {
                continue;
            }
            out.addState(state);
            if (dfa.isAccepting(state)) {
                out.addAccepting(state);
            }
            for (Map.Entry<String, String> transition : dfa.getTransitions(state).entrySet()) {
                out.addTransition(state, transition.getKey(), transition.getValue());
            }
        }
        return out.build();
    }

    /**
     * Accepting and non-accepting states of the DA, in that order; an empty block is left out.
     */
    public static Partition initialPartition(DA dfa) {
        final List<String> accepting = new ArrayList<>();
        final List<String> rejecting = new ArrayList<>();
        for (String state : dfa.getStates()) {
            if (dfa.isAccepting(state)) {
                accepting.add(state);
            } else {
                rejecting.add(state);
            }
        }
        final List<List<String>> blocks = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            blocks.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            blocks.add(rejecting);
        }
        return new Partition(blocks);
    }

    /**
     * Split blocks by signature until a round splits nothing.
     * The number of blocks grows on every round that is not the last one and is bounded by the number of
     * states, so this terminates.
     * @param dfa - DA whose states the partition covers
     * @param initial - starting partition, usually {@link #initialPartition(DA)}
     * @return the coarsest refinement of {@code initial} that is stable under all transitions
     * @throws IllegalArgumentException if a transition leads to a state outside {@code initial}
     */
    public static Partition refine(DA dfa, Partition initial) {
        final List<String> symbols = sortedSymbols(dfa);
        Partition partition = initial;
        int round = 0;
        while (true) {
            final Partition next = refineOnce(dfa, symbols, partition);
            round++;
            if (next.size() == partition.size()) {
                LOG.debug("Refinement stable after {} rounds with {} blocks", round, partition.size());
                return partition;
            }
            partition = next;
        }
    }

    private static Partition refineOnce(DA dfa, List<String> symbols, Partition partition) {
        final List<List<String>> blocks = new ArrayList<>();
        for (Set<String> block : partition.getBlocks()) {
            // sub-blocks in order of their first member
            final Map<IntList, List<String>> bySignature = new LinkedHashMap<>();
            for (String state : block) {
                bySignature.computeIfAbsent(signature(dfa, symbols, partition, state), k -> new ArrayList<>())
                    .add(state);
            }
            blocks.addAll(bySignature.values());
        }
        return new Partition(blocks);
    }

    /**
     * Block index reached from the state under each symbol, NO_TRANSITION where there is none.
     * @throws IllegalArgumentException if a successor is in no block of the partition
     */
    static IntList signature(DA dfa, List<String> symbols, Partition partition, String state) {
        final IntList signature = new IntArrayList(symbols.size());
        for (String sym : symbols) {
            final String succ = dfa.getSuccessor(state, sym);
            if (succ == null) {
                signature.add(NO_TRANSITION);
                continue;
            }
            final int block = partition.blockOf(succ);
            if (block == Partition.NO_BLOCK) {
                throw new IllegalArgumentException("successor '" + succ + "' of (" + state + ", " + sym
                    + ") is not covered by the partition");
            }
            signature.add(block);
        }
        return signature;
    }

    /**
     * Two states are equivalent relative to a partition iff, for every symbol, their successors lie in the
     * same block or are both undefined.
     * @throws IllegalArgumentException if a successor is in no block of the partition
     */
    public static boolean areEquivalent(String s1, String s2, DA dfa, Partition partition) {
        final List<String> symbols = sortedSymbols(dfa);
        return signature(dfa, symbols, partition, s1).equals(signature(dfa, symbols, partition, s2));
    }

    private static DA quotient(DA dfa, Partition partition, Map<String, String> table) {
        final List<String> symbols = sortedSymbols(dfa);
        final String[] blockNames = new String[partition.size()];
        final List<Integer> order = new ArrayList<>(partition.size());

        // name blocks breadth-first from the start block
        final Deque<Integer> queue = new ArrayDeque<>();
        final int startBlock = partition.blockOf(dfa.getStart());
        blockNames[startBlock] = STATE_PREFIX + 0;
        order.add(startBlock);
        queue.add(startBlock);
        while (!queue.isEmpty()) {
            final int block = queue.poll();
            final String representative = partition.getBlock(block).iterator().next();
            for (String sym : symbols) {
                final String succ = dfa.getSuccessor(representative, sym);
                if (succ == null) {
                    continue;
                }
                final int succBlock = partition.blockOf(succ);
                if (blockNames[succBlock] == null) {
                    blockNames[succBlock] = STATE_PREFIX + order.size();
                    order.add(succBlock);
                    queue.add(succBlock);
                }
            }
        }

        final DA.Builder out = DA.builder()
            .addSymbols(dfa.getAlphabet())
            .setStart(blockNames[startBlock]);
        for (int block : order) {
            final Set<String> members = partition.getBlock(block);
            final String name = blockNames[block];
            out.addState(name);
            // members of a stable block agree on acceptance and on every successor block
            final String representative = members.iterator().next();
            if (dfa.isAccepting(representative)) {
                out.addAccepting(name);
            }
            for (String sym : symbols) {
                final String succ = dfa.getSuccessor(representative, sym);
                if (succ != null) {
                    out.addTransition(name, sym, blockNames[partition.blockOf(succ)]);
                }
            }
            for (String member : members) {
                table.put(member, name);
            }
        }
        return out.build();
    }

    private static void checkPreconditions(DA dfa) {
        if (dfa.getStates().isEmpty()) {
            throw new InvalidAutomatonException("cannot minimize an automaton without states");
        }
        if (!dfa.getStates().contains(dfa.getStart())) {
            throw new InvalidAutomatonException("start state '" + dfa.getStart() + "' is not a state");
        }
    }

    private static List<String> sortedSymbols(DA dfa) {
        final List<String> symbols = new ArrayList<>(dfa.getAlphabet());
        symbols.sort(null);
        return symbols;
    }
}
