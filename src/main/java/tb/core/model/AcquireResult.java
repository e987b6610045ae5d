package tb.core.model;

/**
 * Outcome of a single acquire. A denial is a normal result, not an error:
 * it carries the minimum wait after which the same request could succeed.
 */
public record AcquireResult(
    Decision decision,
    long retryAfterNanos
) {
    private static final AcquireResult GRANTED = new AcquireResult(Decision.GRANTED, 0L);

    public static AcquireResult granted() {
        return GRANTED;
    }

    public static AcquireResult denied(long retryAfterNanos) {
        return new AcquireResult(Decision.DENIED, Math.max(0L, retryAfterNanos));
    }

    public boolean isGranted() {
        return decision == Decision.GRANTED;
    }
}
