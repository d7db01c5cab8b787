package sumtree;

import org.junit.jupiter.api.Test;
import java.util.concurrent.*;
import static org.junit.jupiter.api.Assertions.*;

class SizeCorrectnessTest {

    @Test
    void testBasicSizeComputation() {
        WeightedIndex<Integer> tree = new WeightedIndex<>();

        assertEquals(0, tree.size(), "Empty tree should have size 0");

        for (int i = 0; i < 100; i++) {
            tree.put(i, i * 10);
        }

        assertEquals(100, tree.size(), "Should have 100 elements");
        assertEquals(100, tree.sizeStructural(), "Structural size should match");

        // updates do not change the size
        for (int i = 0; i < 100; i++) {
            tree.put(i, 1);
        }
        assertEquals(100, tree.size(), "Updates must not add entries");
        assertEquals(100, tree.total());

        for (int i = 0; i < 20; i++) {
            tree.remove(i);
        }
        // removing absent keys is a no-op
        for (int i = 0; i < 20; i++) {
            assertFalse(tree.remove(i));
        }

        assertEquals(80, tree.size(), "Should have 80 elements after removals");
        assertEquals(80, tree.sizeStructural(), "Structural size should match");
        assertEquals(80, tree.total());

        System.out.println("✓ Basic size computation is correct");
    }

    @Test
    void testSizeWithConcurrentInserts() throws Exception {
        LockedWeightedIndex<Integer> tree = new LockedWeightedIndex<>();

        int numThreads = 4;
        int insertsPerThread = 100;
        CyclicBarrier barrier = new CyclicBarrier(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < numThreads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    barrier.await();
                    for (int i = 0; i < insertsPerThread; i++) {
                        int key = threadId * insertsPerThread + i;
                        tree.put(key, 2);
                    }
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Inserters should finish");
        executor.shutdown();
        assertTrue(errors.isEmpty(), "Unexpected errors: " + errors);

        int expectedSize = numThreads * insertsPerThread;
        assertEquals(expectedSize, tree.size(),
            "Size should be " + expectedSize + " after concurrent inserts");
        assertEquals(2L * expectedSize, tree.total());
        assertTrue(tree.isConsistent(), "Structure should be intact");

        System.out.println("✓ Size computation correct with concurrent inserts");
    }

    @Test
    void testSizeWithConcurrentInsertsAndDeletes() throws Exception {
        LockedWeightedIndex<Integer> tree = new LockedWeightedIndex<>();

        // Preload
        for (int i = 0; i < 1000; i++) {
            tree.put(i, 1);
        }

        int numThreads = 6;
        CyclicBarrier barrier = new CyclicBarrier(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        // 3 inserters, 3 deleters
        for (int t = 0; t < numThreads; t++) {
            final int threadId = t;
            final boolean isInserter = threadId < 3;

            executor.submit(() -> {
                try {
                    barrier.await();
                    if (isInserter) {
                        for (int i = 0; i < 100; i++) {
                            int key = 1000 + threadId * 100 + i;
                            tree.put(key, 1);
                        }
                    } else {
                        for (int i = 0; i < 100; i++) {
                            int key = (threadId - 3) * 100 + i;
                            tree.remove(key);
                        }
                    }
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Workers should finish");
        executor.shutdown();
        assertTrue(errors.isEmpty(), "Unexpected errors: " + errors);

        // Expected: 1000 initial + 300 inserts - 300 deletes = 1000
        assertEquals(1000, tree.size(), "Size should be 1000 after balanced inserts/deletes");
        assertEquals(1000, tree.total(), "Total should follow the size with unit weights");
        assertTrue(tree.isConsistent());

        System.out.println("✓ Size computation correct with mixed operations");
    }
}
