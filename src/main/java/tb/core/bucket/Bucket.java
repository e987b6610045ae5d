package tb.core.bucket;

import tb.core.error.InvalidAmountException;
import tb.core.model.AcquireResult;

/**
 * Token bucket state and refill math.
 *
 * <p>Refill is continuous: tokens are kept as a double and topped up by
 * {@code elapsed * rate} on every acquire, capped at capacity. A denied
 * acquire leaves the state untouched; a granted one commits refill and debit
 * together.
 *
 * <p>Time may go backwards between calls. Elapsed time is clamped to zero in
 * that case and the refill mark never moves back, so a regressed reading can
 * neither drain nor mint tokens.
 *
 * <p>Thread-safety: none. The owner serializes access (see InMemoryStorage).
 */
public final class Bucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final long capacity;
    private final double refillTokensPerSecond;

    private double tokens;
    private long lastRefillNanos;

    /**
     * Creates a full bucket.
     */
    public Bucket(BucketConfig config, long nowNanos) {
        this(config, config.capacity(), nowNanos);
    }

    /**
     * Creates a bucket holding {@code initialTokens}.
     *
     * @throws IllegalArgumentException if initialTokens is outside [0, capacity]
     */
    public Bucket(BucketConfig config, double initialTokens, long nowNanos) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (!(initialTokens >= 0) || initialTokens > config.capacity()) {
            throw new IllegalArgumentException(
                "initialTokens must be in [0, " + config.capacity() + "], got: " + initialTokens);
        }
        this.capacity = config.capacity();
        this.refillTokensPerSecond = config.refillTokensPerSecond();
        this.tokens = initialTokens;
        this.lastRefillNanos = nowNanos;
    }

    /**
     * Refills up to {@code nowNanos} and takes {@code amount} tokens if enough are available.
     *
     * @return GRANTED, or DENIED with the wait until {@code amount} tokens would be available
     * @throws InvalidAmountException if amount is not in [1, capacity]
     */
    public AcquireResult tryAcquire(long nowNanos, long amount) throws InvalidAmountException {
        if (amount <= 0 || amount > capacity) {
            throw InvalidAmountException.of(amount, capacity);
        }

        double available = refilled(nowNanos);
        if (available >= amount) {
            tokens = available - amount;
            lastRefillNanos = Math.max(lastRefillNanos, nowNanos);
            return AcquireResult.granted();
        }

        double missing = amount - available;
        long retryAfter = (long) Math.ceil(missing * NANOS_PER_SECOND / refillTokensPerSecond);
        return AcquireResult.denied(retryAfter);
    }

    /**
     * Tokens that would be available at {@code nowNanos}. Does not mutate.
     */
    public double availableTokens(long nowNanos) {
        return refilled(nowNanos);
    }

    public long capacity() {
        return capacity;
    }

    public double refillTokensPerSecond() {
        return refillTokensPerSecond;
    }

    private double refilled(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return tokens;
        }
        return Math.min(capacity, tokens + elapsed * refillTokensPerSecond / NANOS_PER_SECOND);
    }
}
