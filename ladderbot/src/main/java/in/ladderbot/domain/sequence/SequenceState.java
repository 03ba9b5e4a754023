package in.ladderbot.domain.sequence;

/**
 * Controller state machine states.
 */
public enum SequenceState {
    PENDING_ENTRY,      // Waiting for the level's submission moment
    ACTION_SUBMITTED,   // Venue accepted the action
    AWAITING_OUTCOME,   // Polling for WIN/LOSS
    ESCALATE,           // Lost below the cap, moving to the next level
    SUCCEED,            // Terminal: won
    ABORT;              // Terminal: cap reached, timeout, failure or cancellation

    public boolean isTerminal() {
        return this == SUCCEED || this == ABORT;
    }
}
