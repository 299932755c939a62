package qg.core.clock;

/**
 * Time source for the governor.
 * Injected everywhere so tests can drive time deterministically.
 */
public interface Clock {

    /**
     * Monotonic reading in nanoseconds. Only differences between readings are meaningful.
     */
    long nowNanos();

    /**
     * Blocks the calling thread for the given duration. Implementations must not throw on interrupt.
     */
    void sleepMillis(long millis);
}
