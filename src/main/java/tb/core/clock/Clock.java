package tb.core.clock;

/**
 * Monotonic time source, in nanoseconds.
 * Only differences between two readings are meaningful.
 */
public interface Clock {
    long nowNanos();
}
