package in.ladderbot.service.sequence;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot external stop request for a running sequence.
 *
 * Raising wakes every thread parked in {@link #await(Duration)}.
 */
public final class StopSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Raise the signal. Idempotent.
     */
    public void raise() {
        latch.countDown();
    }

    public boolean isRaised() {
        return latch.getCount() == 0;
    }

    /**
     * Park until the signal is raised or the timeout elapses.
     *
     * @return true if the signal was raised
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            return isRaised();
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
