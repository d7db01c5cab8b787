package bench;

import sumtree.WeightedIndex;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded benchmark: weighted draws through the sum tree versus a linear
 * cumulative scan, and re-weighting throughput.
 *
 * Usage: SamplingBenchmark [entries] [seconds]
 */
public class SamplingBenchmark {

    interface Picker {
        void put(int k, long w);
        Integer pick(long point);
        long total();
    }

    static class TreePicker implements Picker {
        private final WeightedIndex<Integer> index = new WeightedIndex<>();
        public void put(int k, long w) { index.put(k, w); }
        public Integer pick(long point) { return index.find(point); }
        public long total() { return index.total(); }
    }

    // keys are 0..n-1, so the weights array is already in key order
    static class ScanPicker implements Picker {
        private final long[] weights;
        private long total;
        ScanPicker(int n) { weights = new long[n]; }
        public void put(int k, long w) { total += w - weights[k]; weights[k] = w; }
        public Integer pick(long point) {
            long cumulative = 0;
            for (int i = 0; i < weights.length; i++) {
                cumulative += weights[i];
                if (point < cumulative) return i;
            }
            return null;
        }
        public long total() { return total; }
    }

    static void preload(Picker p, int entries, long seed) {
        Random rnd = new Random(seed);
        // shuffled insertion order keeps the unbalanced tree shallow on average
        int[] order = new int[entries];
        for (int i = 0; i < entries; i++) order[i] = i;
        for (int i = entries - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = order[i]; order[i] = order[j]; order[j] = t;
        }
        for (int k : order) p.put(k, 1 + rnd.nextInt(1_000));
    }

    static long runDraws(Picker p, int seconds) {
        Random rnd = new Random(42);
        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        final long total = p.total();
        long ops = 0;
        long sink = 0;
        while (System.nanoTime() < endAt) {
            Integer k = p.pick(rnd.nextLong(total));
            if (k != null) sink += k;
            ops++;
        }
        if (sink == 42) System.out.println("(sink)");
        return ops;
    }

    static long runUpdates(Picker p, int entries, int seconds) {
        Random rnd = new Random(7);
        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        long ops = 0;
        while (System.nanoTime() < endAt) {
            p.put(rnd.nextInt(entries), 1 + rnd.nextInt(1_000));
            ops++;
        }
        return ops;
    }

    public static void main(String[] args) {
        int entries = (args.length >= 1) ? Integer.parseInt(args[0]) : 100_000;
        int seconds = (args.length >= 2) ? Integer.parseInt(args[1]) : 3;

        TreePicker tree = new TreePicker();
        ScanPicker scan = new ScanPicker(entries);
        preload(tree, entries, 1);
        preload(scan, entries, 1);

        System.out.printf("Entries=%d, Total=%d, TreeHeight=%d%n", entries, tree.total(), tree.index.height());
        if (tree.total() != scan.total()) {
            System.out.println("WARNING: totals differ, preload is broken");
        }

        // Warmup
        runDraws(tree, 1);
        runDraws(scan, 1);

        long treeDraws = runDraws(tree, seconds);
        long scanDraws = runDraws(scan, seconds);
        long treeUpdates = runUpdates(tree, entries, seconds);

        System.out.printf("SumTree draws:  %.3f Mops/s%n", treeDraws / (double) seconds / 1_000_000.0);
        System.out.printf("Linear draws:   %.3f Mops/s%n", scanDraws / (double) seconds / 1_000_000.0);
        System.out.printf("Speedup:        %.1fx%n", treeDraws / (double) Math.max(1, scanDraws));
        System.out.printf("SumTree puts:   %.3f Mops/s%n", treeUpdates / (double) seconds / 1_000_000.0);
    }
}
