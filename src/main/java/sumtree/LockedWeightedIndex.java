package sumtree;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link WeightedIndex} guarded by a read/write lock.
 *
 * Updates take the write lock, lookups share the read lock. Compound operations
 * ({@link #putAll(Map)}, {@link #draw(Random)}) run under a single lock acquisition
 * so no writer can interleave between their steps.
 */
public class LockedWeightedIndex<K extends Comparable<? super K>> {

    private final WeightedIndex<K> index;
    private final ReentrantReadWriteLock lock;

    public LockedWeightedIndex() {
        this(new WeightedIndex<K>());
    }

    // wraps an existing index; callers must not touch it directly afterwards
    public LockedWeightedIndex(final WeightedIndex<K> index) {
        if (index == null) throw new NullPointerException();
        this.index = index;
        this.lock = new ReentrantReadWriteLock();
    }

    //--------------------------------------------------------------------------------
    // UPDATES (write lock)
    //--------------------------------------------------------------------------------

    public boolean put(final K key, final long weight) {
        lock.writeLock().lock();
        try {
            return index.put(key, weight);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Returns the number of entries created, the others were updated in place
    public int putAll(final Map<? extends K, Long> weights) {
        lock.writeLock().lock();
        try {
            int created = 0;
            for (Map.Entry<? extends K, Long> e : weights.entrySet()) {
                if (index.put(e.getKey(), e.getValue())) created++;
            }
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(final K key) {
        lock.writeLock().lock();
        try {
            return index.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            index.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    //--------------------------------------------------------------------------------
    // LOOKUPS (read lock)
    //--------------------------------------------------------------------------------

    public Placement get(final K key) {
        lock.readLock().lock();
        try {
            return index.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(final K key) {
        lock.readLock().lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public K find(final long point) {
        lock.readLock().lock();
        try {
            return index.find(point);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Picks a uniform point in [0, total) and returns the key whose range contains it.
     *
     * @return the drawn key, or null if the total weight is not positive
     */
    public K draw(final Random random) {
        lock.readLock().lock();
        try {
            final long total = index.total();
            if (total <= 0) return null;
            return index.find(random.nextLong(total));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long total() {
        lock.readLock().lock();
        try {
            return index.total();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return index.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String dump() {
        lock.readLock().lock();
        try {
            return index.dump();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Runs the structural self-check while holding the read lock
    public boolean isConsistent() {
        lock.readLock().lock();
        try {
            return index.isConsistent() && index.totalStructural() == index.total();
        } finally {
            lock.readLock().unlock();
        }
    }
}
