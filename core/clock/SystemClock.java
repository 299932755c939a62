package qg.core.clock;

import com.google.common.util.concurrent.Uninterruptibles;

import java.util.concurrent.TimeUnit;

/**
 * Real system clock - uses System.nanoTime().
 * Sleeps are uninterruptible: an interrupt received while sleeping is re-asserted on return.
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

    @Override
    public void sleepMillis(long millis) {
        if (millis <= 0) return;
        Uninterruptibles.sleepUninterruptibly(millis, TimeUnit.MILLISECONDS);
    }
}
