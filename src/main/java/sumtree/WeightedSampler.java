package sumtree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Draws keys from a {@link WeightedIndex} with probability proportional to their weight.
 *
 * A draw picks a uniform point in [0, total) and returns the key whose range contains it.
 * With a seeded generator the sequence of draws is reproducible, which gives deterministic
 * selection for a given index state.
 */
public class WeightedSampler<K extends Comparable<? super K>> {

    private final WeightedIndex<K> index;
    private final Random random;

    public WeightedSampler(final WeightedIndex<K> index, final Random random) {
        if (index == null || random == null) throw new NullPointerException();
        this.index = index;
        this.random = random;
    }

    public WeightedSampler(final WeightedIndex<K> index, final long seed) {
        this(index, new Random(seed));
    }

    /**
     * Draws one key.
     *
     * @return the selected key, or null if the point fell outside every range
     *         (only possible when some weights are negative)
     * @throws IllegalStateException if the total weight is not positive
     */
    public K next() {
        final long total = index.total();
        if (total <= 0) throw new IllegalStateException("cannot sample, total weight is " + total);
        return index.find(random.nextLong(total));
    }

    // count independent draws, with replacement
    public List<K> next(final int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);
        List<K> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) picked.add(next());
        return picked;
    }

    /**
     * Draws up to {@code count} distinct keys without replacement, in draw order.
     * Fewer keys are returned when the index runs out of positive weight first.
     *
     * Chosen entries are taken out of the index between draws and put back before
     * returning, so the index must not be shared with other threads during the call.
     */
    public List<K> distinct(final int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);
        final Map<K, Long> taken = new LinkedHashMap<>();
        try {
            while (taken.size() < count && index.total() > 0) {
                K key = next();
                if (key == null) break;
                taken.put(key, index.get(key).weight());
                index.remove(key);
            }
            return new ArrayList<>(taken.keySet());
        } finally {
            for (Map.Entry<K, Long> e : taken.entrySet()) {
                index.put(e.getKey(), e.getValue());
            }
        }
    }

    public WeightedIndex<K> index() {
        return index;
    }
}
