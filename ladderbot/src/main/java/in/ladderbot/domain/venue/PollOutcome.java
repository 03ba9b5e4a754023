package in.ladderbot.domain.venue;

/**
 * Outcome reported by the venue for a submitted action.
 */
public enum PollOutcome {
    WIN,
    LOSS,
    PENDING     // Not resolved yet, poll again
}
