package tb.java.storage;

import tb.core.clock.Clock;
import tb.core.error.StorageException;
import tb.core.model.AcquireResult;
import tb.core.model.BucketKey;

/**
 * Caller-facing limiter: a {@link Storage} paired with the clock that stamps
 * each request.
 *
 * <p>Usage example:
 * <pre>
 * TokenBucketLimiter limiter = new TokenBucketLimiter(
 *     new InMemoryStorage(BucketConfig.of(100, 10.0)), SystemClock.instance());
 *
 * AcquireResult result = limiter.tryAcquire("user:123", 1);
 * if (result.isGranted()) {
 *     // Process request
 * } else {
 *     // Reject with retry-after: result.retryAfterNanos()
 * }
 * </pre>
 */
public final class TokenBucketLimiter {

    private final Storage storage;
    private final Clock clock;

    public TokenBucketLimiter(Storage storage, Clock clock) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.storage = storage;
        this.clock = clock;
    }

    public AcquireResult tryAcquire(BucketKey key, long amount) throws StorageException {
        return storage.tryAcquire(key, amount, clock.nowNanos());
    }

    public AcquireResult tryAcquire(String key, long amount) throws StorageException {
        return tryAcquire(BucketKey.of(key), amount);
    }

    public AcquireResult tryAcquireOne(String key) throws StorageException {
        return tryAcquire(key, 1);
    }

    public Storage storage() {
        return storage;
    }
}
