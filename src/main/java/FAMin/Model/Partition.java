package FAMin.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Partition of a set of states into disjoint, non-empty blocks, addressed by block index.
 */
public final class Partition {
    public static final int NO_BLOCK = -1;

    private final List<Set<String>> blocks;
    private final Object2IntMap<String> state2Block;

    public Partition(Collection<? extends Collection<String>> blocks) {
        final List<Set<String>> copy = new ArrayList<>(blocks.size());
        this.state2Block = new Object2IntOpenHashMap<>();
        this.state2Block.defaultReturnValue(NO_BLOCK);
        for (Collection<String> block : blocks) {
            if (block.isEmpty()) {
                throw new IllegalArgumentException("Partition blocks must not be empty");
            }
            final int index = copy.size();
            for (String state : block) {
                if (state2Block.containsKey(state)) {
                    throw new IllegalArgumentException("State " + state + " appears in two blocks");
                }
                state2Block.put(state, index);
            }
            copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(block)));
        }
        this.blocks = Collections.unmodifiableList(copy);
    }

    /**
     * @return index of the block containing the state, or {@link #NO_BLOCK}.
     */
    public int blockOf(String state) {
        return state2Block.getInt(state);
    }

    public Set<String> getBlock(int index) {
        return blocks.get(index);
    }

    public List<Set<String>> getBlocks() {
        return blocks;
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Partition other && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
