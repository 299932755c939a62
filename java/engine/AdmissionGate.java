package qg.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qg.core.bucket.TokenBucket;
import qg.core.clock.Clock;
import qg.core.model.AdmissionResult;
import qg.core.model.QuotaStatus;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes admissions against a single hourly {@link TokenBucket}.
 *
 * Features:
 * - Fair ReentrantLock: admissions are granted in the order they were requested
 * - The wait for an empty bucket happens while holding the lock, so each waiter's wait is
 *   computed against a bucket that already reflects every caller ahead of it
 * - Status reads never queue behind admissions
 *
 * One gate is built per governed resource by whoever owns the outbound calls and handed to
 * every call site. The gate creates its bucket and never exposes it, so nothing else can consume
 * tokens behind the queue.
 *
 * Usage example:
 * <pre>
 * AdmissionGate gate = new AdmissionGate(SystemClock.instance(), 180);
 *
 * gate.admit();
 * // perform one remote call
 *
 * QuotaStatus status = gate.status();
 * </pre>
 *
 * Thread-safety: safe for any number of concurrent callers.
 */
public final class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final TokenBucket bucket;
    private final ReentrantLock turn;
    private final AtomicLong admitted = new AtomicLong();

    /**
     * Creates a gate over a fresh, full bucket.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param requestsPerHour hourly quota; must be positive and finite
     * @throws IllegalArgumentException if the rate is invalid or clock is null
     */
    public AdmissionGate(Clock clock, double requestsPerHour) {
        this.bucket = new TokenBucket(clock, requestsPerHour);
        this.turn = new ReentrantLock(true);
    }

    /**
     * Blocks until the caller may perform one unit of remote work.
     *
     * The caller first waits for every admission requested before it, then, if the bucket is
     * empty, for the next token. There is no timeout and no way to abandon the wait; an interrupt
     * does not cut it short but stays set on the thread.
     */
    public void admit() {
        turn.lock();
        try {
            long waitMs = bucket.requiredWaitMs();
            if (waitMs > 0) {
                log.info("Hourly quota exhausted, holding admission for {} ms ({} queued behind)",
                    waitMs, turn.getQueueLength());
            }
            bucket.decrement();
            long total = admitted.incrementAndGet();
            log.debug("Admission #{} granted", total);
        } finally {
            turn.unlock();
        }
    }

    /**
     * Admits only if nobody is ahead in the queue and a token is available right now.
     *
     * @return ALLOW if a token was taken; otherwise REJECT with the advisory wait in milliseconds
     */
    public AdmissionResult tryAdmit() {
        // untimed tryLock barges on a fair lock, so check the queue first; it ignores the interrupt flag
        if (turn.hasQueuedThreads() || !turn.tryLock()) {
            return AdmissionResult.reject(bucket.requiredWaitMs());
        }
        try {
            AdmissionResult result = bucket.tryConsume();
            if (result.allowed()) {
                admitted.incrementAndGet();
            }
            return result;
        } finally {
            turn.unlock();
        }
    }

    /**
     * Advisory snapshot; does not wait for pending admissions.
     */
    public QuotaStatus status() {
        return bucket.status();
    }

    public long availableTokens() {
        return bucket.availableTokens();
    }

    /**
     * Estimated number of callers waiting for their turn, not counting the one holding it.
     */
    public int pendingAdmissions() {
        return turn.getQueueLength();
    }

    /**
     * Admissions granted since construction, by either {@link #admit()} or {@link #tryAdmit()}.
     */
    public long admittedCount() {
        return admitted.get();
    }

    public double requestsPerHour() {
        return bucket.capacity();
    }
}
