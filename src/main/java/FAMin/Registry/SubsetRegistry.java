package FAMin.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Arena of NA-state subsets discovered by the subset construction.
 * Each subset is registered once and keeps the index it was given first; indices are dense, starting at 0.
 */
public class SubsetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> subset2Index;
    private final List<BitSet> subsets;

    public SubsetRegistry() {
        this.subset2Index = new Object2IntOpenHashMap<>();
        this.subset2Index.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.subsets = new ArrayList<>();
    }

    /**
     * @param subset NA-state subset
     * @return index of the subset, or MISSING_ELEMENT if it was never registered.
     */
    public int get(BitSet subset) {
        return subset2Index.getInt(subset);
    }

    /**
     * Register a new subset under the next free index.
     * @param subset NA-state subset; a copy is stored, so the caller may keep mutating its own
     * @return index assigned to the subset
     * @throws IllegalStateException if the subset is already registered
     */
    public int put(BitSet subset) {
        if (subset2Index.containsKey(subset)) {
            throw new IllegalStateException("Subset " + subset + " already registered");
        }
        final BitSet key = (BitSet) subset.clone();
        final int index = subsets.size();
        subset2Index.put(key, index);
        subsets.add(key);
        return index;
    }

    /**
     * @return a copy of the subset registered under the index.
     */
    public BitSet getSubset(int index) {
        return (BitSet) subsets.get(index).clone();
    }

    public int size() {
        return subsets.size();
    }

    @Override
    public String toString() {
        return "SubsetRegistry" + subsets;
    }
}
