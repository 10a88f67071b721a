package de.bsommerfeld.mtgbuilder.scryfall.transport;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide throttle for outbound API requests.
 *
 * <p>
 * Two limits apply at once:
 * <ul>
 * <li>at most {@code maxConcurrent} requests hold a {@link Permit} at any
 * instant</li>
 * <li>consecutive request starts are at least {@code minDelay} apart,
 * globally, no matter which task issues them</li>
 * </ul>
 *
 * <p>
 * {@link #acquire()} first takes a concurrency slot, then enters the ordering
 * lock, sleeps for whatever is left of the minimum interval since the last
 * start, records the new start and leaves the lock. The slot stays taken
 * until the returned permit is closed, which callers do with
 * try-with-resources once their request has completed.
 *
 * <p>
 * One instance is shared by every fetch task; it is bound as a singleton in
 * the Guice module and never held in a static field.
 */
public class RateLimiter {

    /** Blocking wait, replaceable in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Semaphore slots;
    private final int maxConcurrent;
    private final long minDelayNanos;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final ReentrantLock orderLock = new ReentrantLock(true);

    private long lastStartNanos;
    private boolean anyStarted;

    public RateLimiter(int maxConcurrent, Duration minDelay) {
        this(maxConcurrent, minDelay, Ticker.systemTicker(),
                duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos()));
    }

    RateLimiter(int maxConcurrent, Duration minDelay, Ticker ticker, Sleeper sleeper) {
        if (maxConcurrent < 1)
            throw new IllegalArgumentException("maxConcurrent must be >= 1, was " + maxConcurrent);
        if (minDelay.isNegative())
            throw new IllegalArgumentException("minDelay must not be negative");
        this.slots = new Semaphore(maxConcurrent, true);
        this.maxConcurrent = maxConcurrent;
        this.minDelayNanos = minDelay.toNanos();
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a request may start.
     *
     * @return the concurrency slot; close it when the request is done
     * @throws InterruptedException if interrupted while waiting; no slot is
     *                              held in that case
     */
    public Permit acquire() throws InterruptedException {
        slots.acquire();
        try {
            orderLock.lockInterruptibly();
            try {
                if (anyStarted) {
                    long remaining = minDelayNanos - (ticker.read() - lastStartNanos);
                    if (remaining > 0)
                        sleeper.sleep(Duration.ofNanos(remaining));
                }
                lastStartNanos = ticker.read();
                anyStarted = true;
            } finally {
                orderLock.unlock();
            }
        } catch (InterruptedException | RuntimeException e) {
            slots.release();
            throw e;
        }
        return new Permit();
    }

    /** Slots not currently held. */
    public int availablePermits() {
        return slots.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getMinDelay() {
        return Duration.ofNanos(minDelayNanos);
    }

    /** A held concurrency slot. Closing releases it exactly once. */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true))
                slots.release();
        }
    }
}
