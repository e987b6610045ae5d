package tb.java.storage;

import org.junit.jupiter.api.Test;
import tb.core.bucket.BucketConfig;
import tb.core.clock.ManualClock;
import tb.core.clock.SystemClock;
import tb.core.model.BucketKey;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for InMemoryStorage.
 *
 * Focus:
 * - No over-grant and no lost update under same-key contention
 * - Keys do not interfere with each other
 * - First-contact provisioning races create one bucket per key
 */
class InMemoryStorageConcurrencyTest {

    @Test
    void testConcurrent_sameKeyGrantsExactlyCapacity() throws InterruptedException {
        ManualClock clock = new ManualClock(0L); // frozen: no refill during the test
        int capacity = 500;
        InMemoryStorage storage = new InMemoryStorage(BucketConfig.of(capacity, 1.0));
        BucketKey key = BucketKey.of("hot-key");

        int numThreads = 16;
        int requestsPerThread = 200; // 3200 requests > 500 capacity
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger granted = new AtomicInteger(0);
        AtomicInteger denied = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < requestsPerThread; j++) {
                        if (storage.tryAcquire(key, 1, clock.nowNanos()).isGranted()) {
                            granted.incrementAndGet();
                        } else {
                            denied.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    fail(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(capacity, granted.get());
        assertEquals(numThreads * requestsPerThread - capacity, denied.get());
    }

    @Test
    void testConcurrent_keysDoNotInterfere() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        InMemoryStorage storage = new InMemoryStorage(BucketConfig.of(50, 1.0));

        int numKeys = 4;
        int threadsPerKey = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numKeys * threadsPerKey);
        AtomicInteger[] grantedPerKey = new AtomicInteger[numKeys];
        for (int k = 0; k < numKeys; k++) {
            grantedPerKey[k] = new AtomicInteger(0);
        }

        ExecutorService executor = Executors.newFixedThreadPool(numKeys * threadsPerKey);
        for (int k = 0; k < numKeys; k++) {
            final int keyIndex = k;
            BucketKey key = BucketKey.of("key-" + k);
            for (int t = 0; t < threadsPerKey; t++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        for (int j = 0; j < 30; j++) {
                            if (storage.tryAcquire(key, 1, clock.nowNanos()).isGranted()) {
                                grantedPerKey[keyIndex].incrementAndGet();
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        fail(e);
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // 150 requests per key, 50 capacity each
        for (AtomicInteger count : grantedPerKey) {
            assertEquals(50, count.get());
        }
        assertEquals(numKeys, storage.size());
    }

    @Test
    void testConcurrent_withRealClockRespectsRefillBound() throws InterruptedException {
        SystemClock clock = SystemClock.instance();
        int capacity = 100;
        double rate = 1000.0;
        InMemoryStorage storage = new InMemoryStorage(BucketConfig.of(capacity, rate));
        BucketKey key = BucketKey.of("shared");

        int numThreads = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicLong granted = new AtomicLong(0);

        // Provision before measuring so the bucket's start time is inside the window
        long start = clock.nowNanos();
        storage.register(key, BucketConfig.of(capacity, rate), start);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    long deadline = System.nanoTime() + 300_000_000L;
                    while (System.nanoTime() < deadline) {
                        if (storage.tryAcquire(key, 1, clock.nowNanos()).isGranted()) {
                            granted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    fail(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        long end = clock.nowNanos();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        double bound = capacity + rate * (end - start) / 1e9;
        assertTrue(granted.get() <= bound,
            String.format("granted %d exceeds bound %.1f", granted.get(), bound));
        assertTrue(granted.get() >= capacity, "Expected at least the initial burst");
    }

    @Test
    void testConcurrent_firstContactCreatesSingleBucket() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        InMemoryStorage storage = new InMemoryStorage(BucketConfig.of(10, 1.0));
        BucketKey key = BucketKey.of("fresh");

        int numThreads = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger granted = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (storage.tryAcquire(key, 1, clock.nowNanos()).isGranted()) {
                        granted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    fail(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(10, granted.get());
        assertEquals(1, storage.size());
    }
}
