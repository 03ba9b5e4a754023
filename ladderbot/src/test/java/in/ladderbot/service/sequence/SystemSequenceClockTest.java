package in.ladderbot.service.sequence;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SystemSequenceClock.
 *
 * Tests:
 * - Past deadlines return immediately
 * - Short waits reach their deadline
 * - A raised stop signal wakes a parked wait
 * - Interrupts propagate
 */
class SystemSequenceClockTest {

    private final SystemSequenceClock clock = new SystemSequenceClock(Clock.systemUTC());

    @Test
    void testPastDeadlineReturnsImmediately() throws InterruptedException {
        long start = System.nanoTime();
        assertTrue(clock.sleepUntil(Instant.now().minusSeconds(5), new StopSignal()));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 100, "Should not wait");
    }

    @Test
    void testShortWaitReachesDeadline() throws InterruptedException {
        Instant deadline = clock.now().plusMillis(150);
        assertTrue(clock.sleepUntil(deadline, new StopSignal()));
        assertFalse(clock.now().isBefore(deadline), "Should wake at or after the deadline");
    }

    @Test
    void testRaisedSignalReturnsFalseWithoutWaiting() throws InterruptedException {
        StopSignal stop = new StopSignal();
        stop.raise();

        assertFalse(clock.sleepUntil(clock.now().plusSeconds(60), stop));
    }

    @Test
    void testStopWakesParkedWait() throws InterruptedException {
        StopSignal stop = new StopSignal();
        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean reached = new AtomicBoolean(true);

        Thread waiter = new Thread(() -> {
            try {
                reached.set(clock.sleepUntil(clock.now().plusSeconds(60), stop));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        }, "clock-test-waiter");
        waiter.start();

        Thread.sleep(100);
        stop.raise();

        assertTrue(done.await(2, TimeUnit.SECONDS), "Stop should wake the waiter promptly");
        assertFalse(reached.get(), "Wait should report that it was stopped");
    }

    @Test
    void testInterruptPropagates() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class,
                () -> clock.sleepUntil(clock.now().plusSeconds(60), new StopSignal()));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testUsesSuppliedClock() {
        Instant fixed = Instant.parse("2026-10-17T02:02:00Z");
        SystemSequenceClock fixedClock = new SystemSequenceClock(Clock.fixed(fixed, ZoneOffset.UTC));

        assertEquals(fixed, fixedClock.now());
    }
}
