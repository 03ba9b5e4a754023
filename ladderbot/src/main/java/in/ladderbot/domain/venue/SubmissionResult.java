package in.ladderbot.domain.venue;

import java.util.Optional;

/**
 * Result of submitting an action: either an accepted handle or the venue's
 * rejection reason.
 */
public record SubmissionResult(
    boolean accepted,
    ActionHandle handle,
    String rejectionReason
) {
    public SubmissionResult {
        if (accepted && handle == null) {
            throw new IllegalArgumentException("Accepted submission requires a handle");
        }
        if (!accepted && (rejectionReason == null || rejectionReason.isBlank())) {
            throw new IllegalArgumentException("Rejected submission requires a reason");
        }
    }

    /**
     * Create an accepted result.
     */
    public static SubmissionResult accepted(ActionHandle handle) {
        return new SubmissionResult(true, handle, null);
    }

    /**
     * Create a rejected result.
     */
    public static SubmissionResult rejected(String reason) {
        return new SubmissionResult(false, null, reason);
    }

    public Optional<ActionHandle> handleIfAccepted() {
        return accepted ? Optional.of(handle) : Optional.empty();
    }
}
