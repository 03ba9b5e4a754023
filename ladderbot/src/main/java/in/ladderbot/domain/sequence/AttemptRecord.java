package in.ladderbot.domain.sequence;

import in.ladderbot.domain.venue.ActionHandle;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * State of a single attempt at one level.
 *
 * Created when the action is submitted; the handle is attached once the venue
 * accepts it and the outcome is resolved exactly once. Not thread-safe: owned
 * by the controller running the sequence.
 */
public final class AttemptRecord {

    private final int level;
    private final BigDecimal stake;
    private final Instant submittedAt;

    private ActionHandle actionId;
    private AttemptOutcome outcome = AttemptOutcome.UNKNOWN;
    private Instant resolvedAt;

    public AttemptRecord(int level, BigDecimal stake, Instant submittedAt) {
        if (level < 1) {
            throw new IllegalArgumentException("Level must be >= 1, got " + level);
        }
        if (stake == null || stake.signum() <= 0) {
            throw new IllegalArgumentException("Stake must be positive");
        }
        this.level = level;
        this.stake = stake;
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
    }

    /**
     * Attach the handle returned by the venue.
     *
     * @throws IllegalStateException if a handle is already attached
     */
    public void accepted(ActionHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (actionId != null) {
            throw new IllegalStateException("Level " + level + " already has action " + actionId);
        }
        this.actionId = handle;
    }

    /**
     * Record the outcome of this attempt.
     *
     * @throws IllegalStateException if the attempt was already resolved
     */
    public void resolve(AttemptOutcome outcome, Instant at) {
        Objects.requireNonNull(outcome, "outcome");
        if (resolvedAt != null) {
            throw new IllegalStateException(
                "Level " + level + " already resolved as " + this.outcome);
        }
        this.outcome = outcome;
        this.resolvedAt = Objects.requireNonNull(at, "at");
    }

    public int getLevel() {
        return level;
    }

    public BigDecimal getStake() {
        return stake;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Optional<ActionHandle> getActionId() {
        return Optional.ofNullable(actionId);
    }

    public AttemptOutcome getOutcome() {
        return outcome;
    }

    public Optional<Instant> getResolvedAt() {
        return Optional.ofNullable(resolvedAt);
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    @Override
    public String toString() {
        return "AttemptRecord{level=" + level
            + ", stake=" + stake.toPlainString()
            + ", submittedAt=" + submittedAt
            + ", actionId=" + (actionId == null ? "-" : actionId.id())
            + ", outcome=" + outcome + "}";
    }
}
