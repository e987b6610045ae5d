package tb.core.clock;

/**
 * Real monotonic clock backed by System.nanoTime().
 * Use this in production and in tests where determinism isn't required.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
