package in.ladderbot.service.sequence;

import java.time.Clock;
import java.time.Instant;

/**
 * Time source and timed wait used by the sequence controller.
 *
 * Every wait is interruptible by a {@link StopSignal}.
 */
public interface SequenceClock {

    /**
     * Current wall-clock time.
     */
    Instant now();

    /**
     * Suspend the calling thread until the deadline, or until the stop signal
     * is raised. Returns immediately when the deadline has already passed.
     *
     * @param deadline Moment to wake up
     * @param stop Stop signal checked before and during the wait
     * @return true if the deadline was reached, false if stopped
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean sleepUntil(Instant deadline, StopSignal stop) throws InterruptedException;

    /**
     * Clock backed by the system UTC clock.
     */
    static SequenceClock system() {
        return new SystemSequenceClock(Clock.systemUTC());
    }
}
