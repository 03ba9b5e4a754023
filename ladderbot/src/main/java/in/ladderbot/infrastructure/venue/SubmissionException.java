package in.ladderbot.infrastructure.venue;

/**
 * Exception thrown when an action could not be delivered to the venue.
 * Fatal for the current sequence; never retried.
 */
public class SubmissionException extends RuntimeException {

    private final String asset;
    private final int level;
    private final String reason;

    public SubmissionException(String asset, int level, String message) {
        super(String.format("[%s:L%d] Submission failed: %s", asset, level, message));
        this.asset = asset;
        this.level = level;
        this.reason = message;
    }

    public SubmissionException(String asset, int level, String message, Throwable cause) {
        super(String.format("[%s:L%d] Submission failed: %s", asset, level, message), cause);
        this.asset = asset;
        this.level = level;
        this.reason = message;
    }

    public String getAsset() {
        return asset;
    }

    /**
     * Level being submitted, or 0 when unknown to the submitter.
     */
    public int getLevel() {
        return level;
    }

    /**
     * Failure description without the asset/level prefix.
     */
    public String getReason() {
        return reason;
    }
}
