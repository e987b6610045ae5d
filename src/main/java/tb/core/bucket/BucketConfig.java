package tb.core.bucket;

/**
 * Shape of a token bucket.
 *
 * @param capacity Maximum tokens held (must be > 0)
 * @param refillTokensPerSecond Tokens added per second, continuously (must be > 0)
 */
public record BucketConfig(
    long capacity,
    double refillTokensPerSecond
) {
    public BucketConfig {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (!(refillTokensPerSecond > 0) || Double.isInfinite(refillTokensPerSecond)) {
            throw new IllegalArgumentException("refillTokensPerSecond must be > 0 and finite");
        }
    }

    public static BucketConfig of(long capacity, double refillTokensPerSecond) {
        return new BucketConfig(capacity, refillTokensPerSecond);
    }
}
