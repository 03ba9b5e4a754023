package in.ladderbot.domain.sequence;

/**
 * Overall result of a finished sequence.
 */
public enum FinalOutcome {
    WIN,
    LOSS,
    ABORTED
}
