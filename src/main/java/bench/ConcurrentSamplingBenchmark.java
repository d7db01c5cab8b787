package bench;

import sumtree.LockedWeightedIndex;
import java.util.Random;
import java.util.concurrent.*;

/**
 * Mixed workload on the lock-guarded index: most threads draw, a share of the
 * operations re-weight or remove/insert entries.
 *
 * Usage: ConcurrentSamplingBenchmark [threads] [seconds] [writePercent]
 */
public class ConcurrentSamplingBenchmark {

    static long runTest(LockedWeightedIndex<Integer> ds, int threads, int seconds, int writePercent) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch stop = new CountDownLatch(threads);

        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        final ConcurrentLinkedQueue<Long> counts = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    Random rnd = new Random(Thread.currentThread().getId());
                    long ops = 0;
                    start.await();
                    while (System.nanoTime() < endAt) {
                        int r = rnd.nextInt(100);
                        int k = rnd.nextInt(200_000);
                        if (r >= writePercent) ds.draw(rnd);
                        else if (r < writePercent / 2) ds.put(k, 1 + rnd.nextInt(1_000));
                        else ds.remove(k);
                        ops++;
                    }
                    counts.add(ops);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                finally { stop.countDown(); }
            });
        }

        start.countDown();
        stop.await();
        pool.shutdown();

        return counts.stream().mapToLong(Long::longValue).sum();
    }

    public static void main(String[] args) throws Exception {
        int threads = (args.length >= 1) ? Integer.parseInt(args[0]) : Runtime.getRuntime().availableProcessors();
        int seconds = (args.length >= 2) ? Integer.parseInt(args[1]) : 3;
        int writePercent = (args.length >= 3) ? Integer.parseInt(args[2]) : 10;

        LockedWeightedIndex<Integer> ds = new LockedWeightedIndex<>();
        Random rnd = new Random(1);
        // Preload a bit
        for (int i = 0; i < 50_000; i++) ds.put(rnd.nextInt(200_000), 1 + rnd.nextInt(1_000));

        long totalOps = runTest(ds, threads, seconds, writePercent);
        double mopsPerSec = totalOps / (double) seconds / 1_000_000.0;

        System.out.printf("Threads=%d, Time=%ds, Writes=%d%%, TotalOps=%d, Throughput=%.2f Mops/s%n",
                threads, seconds, writePercent, totalOps, mopsPerSec);
        System.out.printf("Final size=%d, total=%d, consistent=%b%n", ds.size(), ds.total(), ds.isConsistent());
    }
}
