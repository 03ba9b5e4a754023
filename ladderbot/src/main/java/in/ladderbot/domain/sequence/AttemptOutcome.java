package in.ladderbot.domain.sequence;

/**
 * Resolved outcome of one attempt.
 */
public enum AttemptOutcome {
    WIN,
    LOSS,
    UNKNOWN     // Timed out, cancelled, or never resolved
}
