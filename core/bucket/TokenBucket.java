package qg.core.bucket;

import qg.core.clock.Clock;
import qg.core.model.AdmissionResult;
import qg.core.model.QuotaStatus;

/**
 * Token Bucket sized for an hourly quota:
 * - capacity: requests per hour, also the burst size
 * - refill: continuous, capacity tokens per hour, recomputed lazily on every access
 *
 * Tokens are kept as a double so many short refill intervals don't accumulate rounding error;
 * every externally visible count is floored.
 *
 * Thread-safety: all arithmetic runs under the bucket monitor. {@link #decrement()} sleeps outside
 * the monitor, so it must be called by a single caller at a time (see AdmissionGate); reads may run
 * concurrently with it.
 */
public final class TokenBucket {
    public static final long MILLIS_PER_HOUR = 3_600_000L;
    private static final double NANOS_PER_HOUR = MILLIS_PER_HOUR * 1_000_000d;

    private final Clock clock;
    private final double capacity;
    private final double refillPerMillis;

    private double tokens;
    private long lastRefillNanos;

    /**
     * @param clock time source
     * @param requestsPerHour bucket capacity; must be positive and finite
     * @throws IllegalArgumentException if the rate is not positive and finite, or clock is null
     */
    public TokenBucket(Clock clock, double requestsPerHour) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (!Double.isFinite(requestsPerHour) || requestsPerHour <= 0) {
            throw new IllegalArgumentException(
                "requestsPerHour must be a positive finite number, got " + requestsPerHour);
        }
        this.clock = clock;
        this.capacity = requestsPerHour;
        this.refillPerMillis = requestsPerHour / MILLIS_PER_HOUR;
        this.tokens = requestsPerHour;
        this.lastRefillNanos = clock.nowNanos();
    }

    public double capacity() {
        return capacity;
    }

    /**
     * Tokens regained per millisecond, {@code capacity / 3_600_000}.
     */
    public double refillRatePerMillis() {
        return refillPerMillis;
    }

    /**
     * Brings the token count up to date with the clock.
     */
    public synchronized void refill() {
        long now = clock.nowNanos();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) return;

        // elapsedMs * refillRate, multiplied first to keep a single rounding step
        tokens = Math.min(capacity, tokens + (elapsed * capacity) / NANOS_PER_HOUR);
        lastRefillNanos = now;
    }

    public synchronized long availableTokens() {
        refill();
        return (long) Math.floor(tokens);
    }

    public synchronized boolean canAdmit() {
        refill();
        return tokens >= 1d;
    }

    /**
     * @return milliseconds until one whole token is available, 0 if one already is
     */
    public synchronized long requiredWaitMs() {
        refill();
        return waitMillis();
    }

    /**
     * Consumes one token, sleeping on the clock first if none is available.
     *
     * Callers must be serialized: two concurrent decrements could both compute a wait for the same
     * token. The loop only repeats if the clock woke early or a rounding shortfall left the count a
     * hair under one.
     */
    public void decrement() {
        while (true) {
            long waitMs;
            synchronized (this) {
                refill();
                if (tokens >= 1d) {
                    tokens -= 1d;
                    return;
                }
                waitMs = waitMillis();
            }
            clock.sleepMillis(waitMs);
        }
    }

    /**
     * Non-blocking variant of {@link #decrement()}.
     */
    public synchronized AdmissionResult tryConsume() {
        refill();

        if (tokens >= 1d) {
            tokens -= 1d;
            return AdmissionResult.allow();
        }
        return AdmissionResult.reject(waitMillis());
    }

    public synchronized QuotaStatus status() {
        refill();
        long available = (long) Math.floor(tokens);
        double used = capacity - available;
        long percentUsed = Math.round(used / capacity * 100d);
        double missing = capacity - tokens;
        long resetTimeMs = missing > 0 ? (long) Math.ceil(missing * MILLIS_PER_HOUR / capacity) : 0L;

        return new QuotaStatus(
            available,
            capacity,
            used,
            percentUsed,
            available >= 1,
            waitMillis(),
            resetTimeMs
        );
    }

    // caller holds the monitor and has just refilled
    private long waitMillis() {
        if (tokens >= 1d) return 0L;
        return (long) Math.ceil((1d - tokens) * MILLIS_PER_HOUR / capacity);
    }
}
