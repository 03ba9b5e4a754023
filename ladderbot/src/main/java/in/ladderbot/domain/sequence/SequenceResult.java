package in.ladderbot.domain.sequence;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Terminal summary of one sequence run.
 *
 * @param levelsAttempted Number of levels whose submission was attempted
 * @param terminalReason Why the sequence ended
 * @param finalOutcome WIN, LOSS or ABORTED
 * @param detail Reported error text for failed runs, null otherwise
 * @param attempts Attempt records in level order
 * @param startedAt When the controller started
 * @param finishedAt When the terminal state was reached
 */
public record SequenceResult(
    int levelsAttempted,
    TerminalReason terminalReason,
    FinalOutcome finalOutcome,
    String detail,
    List<AttemptRecord> attempts,
    Instant startedAt,
    Instant finishedAt
) {
    public SequenceResult {
        if (levelsAttempted < 0) {
            throw new IllegalArgumentException("Levels attempted cannot be negative");
        }
        if (terminalReason == null) {
            throw new IllegalArgumentException("Terminal reason cannot be null");
        }
        if (finalOutcome == null) {
            throw new IllegalArgumentException("Final outcome cannot be null");
        }
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public boolean isWin() {
        return finalOutcome == FinalOutcome.WIN;
    }

    public Duration elapsed() {
        return startedAt == null || finishedAt == null
            ? Duration.ZERO
            : Duration.between(startedAt, finishedAt);
    }
}
