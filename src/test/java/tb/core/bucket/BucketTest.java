package tb.core.bucket;

import org.junit.jupiter.api.Test;
import tb.core.clock.ManualClock;
import tb.core.error.InvalidAmountException;
import tb.core.model.AcquireResult;
import tb.core.model.Decision;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class BucketTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void allowsUpToCapacity_thenDenies() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(5, 1.0), clock.nowNanos());

        for (int i = 0; i < 5; i++) {
            assertEquals(Decision.GRANTED, bucket.tryAcquire(clock.nowNanos(), 1).decision());
        }
        assertEquals(Decision.DENIED, bucket.tryAcquire(clock.nowNanos(), 1).decision());
    }

    @Test
    void partialDrain_thenDeniedWithExactRetryAfter() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), clock.nowNanos());

        assertTrue(bucket.tryAcquire(clock.nowNanos(), 5).isGranted());
        assertEquals(5.0, bucket.availableTokens(clock.nowNanos()));

        AcquireResult denied = bucket.tryAcquire(clock.nowNanos(), 6);
        assertEquals(Decision.DENIED, denied.decision());
        assertEquals(SECOND, denied.retryAfterNanos());
    }

    @Test
    void refillOverSimulatedTime_grantsFromRefilledTokens() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), clock.nowNanos());
        bucket.tryAcquire(clock.nowNanos(), 5);

        clock.advanceSeconds(3);

        assertTrue(bucket.tryAcquire(clock.nowNanos(), 7).isGranted()); // 5 + 3 = 8 >= 7
        assertEquals(1.0, bucket.availableTokens(clock.nowNanos()));
    }

    @Test
    void refillIsContinuous_notStepped() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(2, 2.0), clock.nowNanos());
        bucket.tryAcquire(clock.nowNanos(), 2);

        clock.advanceNanos(250_000_000L); // +0.5 token
        assertEquals(0.5, bucket.availableTokens(clock.nowNanos()), 1e-9);
        assertFalse(bucket.tryAcquire(clock.nowNanos(), 1).isGranted());

        clock.advanceNanos(250_000_000L); // +0.5 token
        assertTrue(bucket.tryAcquire(clock.nowNanos(), 1).isGranted());
    }

    @Test
    void refillNeverExceedsCapacity() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(10, 100.0), clock.nowNanos());

        clock.advanceSeconds(3600);

        assertEquals(10.0, bucket.availableTokens(clock.nowNanos()));
        assertTrue(bucket.tryAcquire(clock.nowNanos(), 10).isGranted());
        assertFalse(bucket.tryAcquire(clock.nowNanos(), 1).isGranted());
    }

    @Test
    void deniedAcquire_leavesStateUntouched() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), 2.0, clock.nowNanos());

        clock.advanceSeconds(1);
        double before = bucket.availableTokens(clock.nowNanos());
        assertFalse(bucket.tryAcquire(clock.nowNanos(), 5).isGranted());
        assertEquals(before, bucket.availableTokens(clock.nowNanos()));

        clock.advanceSeconds(2);
        assertTrue(bucket.tryAcquire(clock.nowNanos(), 5).isGranted());
    }

    @Test
    void retryAfter_isEnoughToSucceed() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(3, 3.0), clock.nowNanos());
        bucket.tryAcquire(clock.nowNanos(), 3);

        AcquireResult denied = bucket.tryAcquire(clock.nowNanos(), 1);
        assertEquals(333_333_334L, denied.retryAfterNanos());

        clock.advanceNanos(denied.retryAfterNanos() - 1);
        assertFalse(bucket.tryAcquire(clock.nowNanos(), 1).isGranted());
        clock.advanceNanos(1);
        assertTrue(bucket.tryAcquire(clock.nowNanos(), 1).isGranted());
    }

    @Test
    void clockRegression_neverMintsOrDrainsTokens() throws Exception {
        ManualClock clock = new ManualClock(10 * SECOND);
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), clock.nowNanos());
        bucket.tryAcquire(clock.nowNanos(), 10);

        clock.setNanos(5 * SECOND); // five seconds into the past
        assertEquals(0.0, bucket.availableTokens(clock.nowNanos()));
        assertFalse(bucket.tryAcquire(clock.nowNanos(), 1).isGranted());

        // Refill resumes from the last refill mark, not from the regressed reading
        clock.setNanos(12 * SECOND);
        assertEquals(2.0, bucket.availableTokens(clock.nowNanos()));
    }

    @Test
    void grantDuringRegression_doesNotMoveRefillMarkBackwards() throws Exception {
        ManualClock clock = new ManualClock(10 * SECOND);
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), clock.nowNanos());

        clock.setNanos(4 * SECOND);
        assertTrue(bucket.tryAcquire(clock.nowNanos(), 10).isGranted());

        clock.setNanos(10 * SECOND);
        assertEquals(0.0, bucket.availableTokens(clock.nowNanos()));
    }

    @Test
    void availableTokens_isIdempotentAtSameTimestamp() throws Exception {
        ManualClock clock = new ManualClock(0);
        Bucket bucket = new Bucket(BucketConfig.of(10, 0.7), clock.nowNanos());
        bucket.tryAcquire(clock.nowNanos(), 9);

        clock.advanceNanos(1_234_567_891L);
        double first = bucket.availableTokens(clock.nowNanos());
        double second = bucket.availableTokens(clock.nowNanos());

        assertEquals(first, second);
    }

    @Test
    void invalidAmount_zeroOrAboveCapacity() {
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), 0L);

        assertThrows(InvalidAmountException.class, () -> bucket.tryAcquire(0L, 0));
        assertThrows(InvalidAmountException.class, () -> bucket.tryAcquire(0L, -1));
        InvalidAmountException e = assertThrows(InvalidAmountException.class, () -> bucket.tryAcquire(0L, 11));
        assertTrue(e.getMessage().contains("[1, 10]"));
    }

    @Test
    void amountEqualToCapacity_isAccepted() throws Exception {
        Bucket bucket = new Bucket(BucketConfig.of(10, 1.0), 0L);
        assertTrue(bucket.tryAcquire(0L, 10).isGranted());
        assertEquals(10 * SECOND, bucket.tryAcquire(0L, 10).retryAfterNanos());
    }

    @Test
    void initialTokens_mustFitCapacity() {
        BucketConfig config = BucketConfig.of(10, 1.0);
        assertThrows(IllegalArgumentException.class, () -> new Bucket(config, -1.0, 0L));
        assertThrows(IllegalArgumentException.class, () -> new Bucket(config, 10.5, 0L));
        assertThrows(IllegalArgumentException.class, () -> new Bucket(config, Double.NaN, 0L));
        assertEquals(0.0, new Bucket(config, 0.0, 0L).availableTokens(0L));
    }

    @Test
    void config_rejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> BucketConfig.of(0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> BucketConfig.of(-5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> BucketConfig.of(10, 0.0));
        assertThrows(IllegalArgumentException.class, () -> BucketConfig.of(10, -1.0));
        assertThrows(IllegalArgumentException.class, () -> BucketConfig.of(10, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> BucketConfig.of(10, Double.POSITIVE_INFINITY));
    }

    @Test
    void cumulativeGrants_neverExceedCapacityPlusRefill() throws Exception {
        Random random = new Random(42);

        for (int run = 0; run < 200; run++) {
            long capacity = 1 + random.nextInt(50);
            double rate = 0.1 + random.nextDouble() * 20;
            ManualClock clock = new ManualClock(random.nextInt(1_000_000));
            Bucket bucket = new Bucket(BucketConfig.of(capacity, rate), clock.nowNanos());

            long start = clock.nowNanos();
            long granted = 0;
            for (int i = 0; i < 500; i++) {
                clock.advanceNanos(random.nextInt(50_000_000));
                long amount = 1 + random.nextInt((int) capacity);
                if (bucket.tryAcquire(clock.nowNanos(), amount).isGranted()) {
                    granted += amount;
                }
            }

            double bound = capacity + rate * (clock.nowNanos() - start) / 1e9;
            assertTrue(granted <= bound + 1e-6,
                String.format("run %d: granted %d > bound %.6f", run, granted, bound));
        }
    }
}
