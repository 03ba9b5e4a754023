package in.ladderbot.infrastructure.venue;

import in.ladderbot.domain.venue.ActionHandle;
import in.ladderbot.domain.venue.PollOutcome;

/**
 * Fetches the outcome of a submitted action.
 *
 * Called repeatedly by the controller until WIN/LOSS or the outcome timeout.
 */
public interface OutcomePoller {

    /**
     * Check the current outcome of an action.
     *
     * @param handle Handle returned by {@link ActionSubmitter#submit}
     * @return WIN, LOSS, or PENDING if not resolved yet
     * @throws PollException on a transient failure; the caller polls again
     */
    PollOutcome poll(ActionHandle handle) throws PollException;
}
