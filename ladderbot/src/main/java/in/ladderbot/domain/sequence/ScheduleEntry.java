package in.ladderbot.domain.sequence;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One level of a computed escalation schedule.
 *
 * dueAt is the level's resolved expiry: the moment its outcome becomes
 * determinable, and the moment the next level is entered after a loss.
 */
public record ScheduleEntry(
    int sequenceLevel,
    Instant dueAt,
    BigDecimal stakeMultiplier
) {
    public ScheduleEntry {
        if (sequenceLevel < 1) {
            throw new IllegalArgumentException("Sequence level must be >= 1, got " + sequenceLevel);
        }
        if (dueAt == null) {
            throw new IllegalArgumentException("Due time cannot be null");
        }
        if (stakeMultiplier == null || stakeMultiplier.signum() <= 0) {
            throw new IllegalArgumentException("Stake multiplier must be positive");
        }
    }

    /**
     * Stake for this level given the sequence's base stake.
     */
    public BigDecimal stakeFor(BigDecimal baseStake) {
        return baseStake.multiply(stakeMultiplier);
    }
}
