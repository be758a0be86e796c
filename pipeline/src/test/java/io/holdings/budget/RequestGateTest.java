package io.holdings.budget;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class RequestGateTest {
    @Test
    void spaces_request_starts() throws Exception {
        RequestGate gate = new RequestGate(4, Duration.ofMillis(100));
        try (Budget.Permit p = gate.acquireExternalOp()) {
            assertEquals(1, gate.inFlight());
        }
        long t1 = System.nanoTime();
        try (Budget.Permit p = gate.acquireExternalOp()) {
            long dt = (System.nanoTime() - t1) / 1_000_000;
            // Allow some slack in CI; expect at least ~60ms spacing
            assertTrue(dt >= 60, "expected spacing >= 60ms but was " + dt + "ms");
        }
        assertEquals(0, gate.inFlight());
    }

    @Test
    void caps_concurrent_permits() throws Exception {
        RequestGate gate = new RequestGate(2, Duration.ZERO);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try (Budget.Permit p = gate.acquireExternalOp()) {
                        assertTrue(gate.inFlight() <= 2);
                        Thread.sleep(5);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2, gate.peakInFlight());
        assertEquals(0, gate.inFlight());
    }

    @Test
    void closing_a_permit_twice_releases_once() throws Exception {
        RequestGate gate = new RequestGate(1, Duration.ZERO);
        Budget.Permit p = gate.acquireExternalOp();
        p.close();
        p.close();
        assertEquals(0, gate.inFlight());
        try (Budget.Permit again = gate.acquireExternalOp()) {
            assertEquals(1, gate.inFlight());
        }
    }

    @Test
    void interrupted_waiter_gives_its_slot_back() throws Exception {
        RequestGate gate = new RequestGate(1, Duration.ofSeconds(30));
        gate.acquireExternalOp().close(); // reserve the next start 30s out
        Thread waiter = new Thread(() -> {
            try {
                gate.acquireExternalOp().close();
                fail("should have been interrupted");
            } catch (InterruptedException expected) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        Thread.sleep(50);
        waiter.interrupt();
        waiter.join(2000);
        assertFalse(waiter.isAlive());
        assertEquals(0, gate.inFlight());
    }

    @Test
    void rejects_bad_settings() {
        assertThrows(IllegalArgumentException.class, () -> new RequestGate(0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RequestGate(1, Duration.ofMillis(-1)));
    }
}
