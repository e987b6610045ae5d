package tb.java.client;

import tb.java.wire.ProtocolException;

/**
 * Up to {@code maxAttempts} attempts in total, waiting
 * {@code baseMillis * 2^(attempt-1)} (capped at {@code maxMillis}) between them.
 *
 * <p>Failures caused by a {@link ProtocolException} raised on this side, such
 * as a request too large for the frame limit, are not retried: resending the
 * same request fails the same way.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private static final int MAX_SHIFT = 20;

    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (baseMillis < 0) throw new IllegalArgumentException("baseMillis must be >= 0");
        this.maxAttempts = maxAttempts;
        this.baseMillis = baseMillis;
        this.maxMillis = Math.max(baseMillis, maxMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable cause) {
        return attempt < maxAttempts && !isPermanent(cause);
    }

    @Override
    public long backoffMillis(int attempt) {
        int shift = Math.min(MAX_SHIFT, Math.max(0, attempt - 1));
        // base << shift would pass maxMillis (or overflow)
        if (baseMillis > (maxMillis >> shift)) {
            return maxMillis;
        }
        return baseMillis << shift;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private static boolean isPermanent(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof ProtocolException) {
                return true;
            }
        }
        return false;
    }
}
