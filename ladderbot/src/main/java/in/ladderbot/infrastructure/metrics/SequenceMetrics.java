package in.ladderbot.infrastructure.metrics;

import in.ladderbot.domain.sequence.AttemptOutcome;
import in.ladderbot.domain.sequence.TerminalReason;

import java.time.Duration;

/**
 * Sequence metrics interface for monitoring.
 *
 * Implementations can publish to Prometheus or any other backend.
 */
public interface SequenceMetrics {

    /**
     * Record a submission attempt at a level.
     *
     * @param asset Asset identifier
     * @param level Level being submitted
     * @param accepted Whether the venue accepted the action
     * @param latency Time spent in the submitter
     */
    void recordSubmission(String asset, int level, boolean accepted, Duration latency);

    /**
     * Record the resolved outcome of a level.
     */
    void recordOutcome(String asset, int level, AttemptOutcome outcome);

    /**
     * Record a transient outcome poll failure.
     */
    void recordPollError(String asset);

    /**
     * Record the current level of a running sequence.
     */
    void recordLevel(String asset, int level);

    /**
     * Record the end of a sequence.
     */
    void recordSequenceEnd(String asset, TerminalReason reason, int levelsAttempted);

    /**
     * Metrics sink that discards everything.
     */
    static SequenceMetrics noop() {
        return NoOpSequenceMetrics.INSTANCE;
    }

    final class NoOpSequenceMetrics implements SequenceMetrics {
        private static final NoOpSequenceMetrics INSTANCE = new NoOpSequenceMetrics();

        private NoOpSequenceMetrics() {}

        @Override
        public void recordSubmission(String asset, int level, boolean accepted, Duration latency) {}

        @Override
        public void recordOutcome(String asset, int level, AttemptOutcome outcome) {}

        @Override
        public void recordPollError(String asset) {}

        @Override
        public void recordLevel(String asset, int level) {}

        @Override
        public void recordSequenceEnd(String asset, TerminalReason reason, int levelsAttempted) {}
    }
}
