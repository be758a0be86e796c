package io.holdings.budget;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gate in front of one upstream source: caps concurrent requests with a semaphore and spaces
 * request starts by at least {@code minInterval}, reserving start slots with a CAS on the next
 * free timestamp so callers never share a slot.
 */
public class RequestGate implements Budget {
    private final long intervalNanos;
    private final Semaphore slots;
    private final AtomicLong nextAvailableNanos;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public RequestGate(int maxConcurrency, Duration minInterval) {
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0: " + minInterval);
        }
        this.intervalNanos = minInterval.toNanos();
        this.slots = new Semaphore(maxConcurrency, true);
        this.nextAvailableNanos = new AtomicLong(System.nanoTime());
    }

    @Override
    public Permit acquireExternalOp() throws InterruptedException {
        slots.acquire();
        try {
            awaitStartSlot();
        } catch (InterruptedException ie) {
            slots.release();
            throw ie;
        }
        int now = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(now, Math::max);
        return new GatePermit();
    }

    private void awaitStartSlot() throws InterruptedException {
        if (intervalNanos == 0) return;
        long now = System.nanoTime();
        while (true) {
            long current = nextAvailableNanos.get();
            long earliest = current - now > 0 ? current : now;
            if (nextAvailableNanos.compareAndSet(current, earliest + intervalNanos)) {
                long delay = earliest - now;
                if (delay > 0) TimeUnit.NANOSECONDS.sleep(delay);
                return;
            }
        }
    }

    @Override
    public int inFlight() { return inFlight.get(); }

    /** Highest number of simultaneously held permits since construction. */
    public int peakInFlight() { return peakInFlight.get(); }

    private final class GatePermit implements Permit {
        private final AtomicBoolean released = new AtomicBoolean(false);

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.decrementAndGet();
                slots.release();
            }
        }
    }
}
