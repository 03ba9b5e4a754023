package in.ladderbot.service.sequence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * SequenceClock backed by a {@link Clock}. Waits park on the stop signal's
 * latch, so a raised signal wakes the sequence immediately.
 */
public final class SystemSequenceClock implements SequenceClock {

    private final Clock clock;

    public SystemSequenceClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public boolean sleepUntil(Instant deadline, StopSignal stop) throws InterruptedException {
        while (true) {
            if (stop.isRaised()) {
                return false;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return true;
            }
            if (stop.await(remaining)) {
                return false;
            }
            // Timed out: re-check against the clock, it may have been adjusted meanwhile
        }
    }
}
