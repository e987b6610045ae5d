package tb.core.clock;

/**
 * Clock moved only by hand. Reads and writes are volatile so a test thread
 * can advance time while server event loops observe it.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceSeconds(long seconds) {
        advanceNanos(seconds * 1_000_000_000L);
    }

    /**
     * Sets an absolute reading. Unlike {@link #advanceNanos(long)} this may
     * move time backwards, which is how clock regression is simulated.
     */
    public void setNanos(long value) {
        now = value;
    }
}
