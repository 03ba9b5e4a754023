package in.ladderbot.domain.sequence;

/**
 * Why a sequence ended.
 */
public enum TerminalReason {
    WON,
    MAX_LEVELS_REACHED,
    OUTCOME_TIMEOUT,
    SUBMISSION_FAILED,
    CANCELLED
}
