package in.ladderbot.infrastructure.venue;

import in.ladderbot.domain.venue.ActionHandle;

/**
 * Transient failure while checking an action's outcome.
 * Retried by the controller until the outcome timeout elapses.
 */
public class PollException extends Exception {

    private final ActionHandle handle;

    public PollException(ActionHandle handle, String message) {
        super(String.format("Outcome poll failed for %s: %s", handle, message));
        this.handle = handle;
    }

    public PollException(ActionHandle handle, String message, Throwable cause) {
        super(String.format("Outcome poll failed for %s: %s", handle, message), cause);
        this.handle = handle;
    }

    public ActionHandle getHandle() {
        return handle;
    }
}
