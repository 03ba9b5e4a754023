package in.ladderbot.infrastructure.venue;

import in.ladderbot.domain.sequence.Direction;
import in.ladderbot.domain.venue.SubmissionResult;

import java.math.BigDecimal;

/**
 * Submits a timed action to the venue.
 *
 * Implementations own authentication, session management and the wire
 * protocol. The sequence controller calls {@link #submit} at most once per
 * level and never retries a rejected or failed submission.
 */
public interface ActionSubmitter {

    /**
     * Submit one action.
     *
     * @param asset Venue asset identifier
     * @param direction UP or DOWN
     * @param stake Positive stake amount
     * @param durationMinutes Action duration in minutes
     * @return Accepted handle or rejection reason, never null
     * @throws SubmissionException if the submission could not be delivered
     */
    SubmissionResult submit(String asset, Direction direction, BigDecimal stake, int durationMinutes);
}
