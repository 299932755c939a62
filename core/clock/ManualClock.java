package qg.core.clock;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic clock for tests. Sleeping advances virtual time instead of blocking.
 * Thread-safe so it can back concurrent admissions.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;
    private final AtomicLong sleptMillis = new AtomicLong();

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    @Override
    public void sleepMillis(long millis) {
        if (millis <= 0) return;
        sleptMillis.addAndGet(millis);
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(delta));
    }

    public void setNanos(long value) {
        now.set(value);
    }

    /**
     * Total virtual time spent in {@link #sleepMillis(long)} so far.
     */
    public long sleptMillis() {
        return sleptMillis.get();
    }
}
