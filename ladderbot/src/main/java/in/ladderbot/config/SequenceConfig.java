package in.ladderbot.config;

import in.ladderbot.domain.sequence.Direction;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable configuration of one escalation sequence.
 *
 * Invariant: expiryTimes has exactly maxLevels entries, one per level.
 * Violations raise {@link ScheduleException}.
 */
public record SequenceConfig(
    String asset,
    Direction direction,
    BigDecimal baseStake,
    BigDecimal escalationMultiplier,
    int maxLevels,
    LocalTime entryTime,
    List<LocalTime> expiryTimes,
    ZoneId zone,
    Duration pollInterval,
    Duration outcomeTimeout
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_OUTCOME_TIMEOUT = Duration.ofSeconds(70);

    public SequenceConfig {
        if (asset == null || asset.isBlank()) {
            throw new ScheduleException("asset", "must not be empty");
        }
        if (direction == null) {
            throw new ScheduleException("direction", "must be UP or DOWN");
        }
        if (baseStake == null || baseStake.signum() <= 0) {
            throw new ScheduleException("baseStake", "must be > 0, got " + baseStake);
        }
        if (escalationMultiplier == null || escalationMultiplier.signum() <= 0) {
            throw new ScheduleException("escalationMultiplier", "must be > 0, got " + escalationMultiplier);
        }
        if (maxLevels < 1) {
            throw new ScheduleException("maxLevels", "must be >= 1, got " + maxLevels);
        }
        if (entryTime == null) {
            throw new ScheduleException("entryTime", "must be set");
        }
        if (expiryTimes == null) {
            throw new ScheduleException("expiryTimes", "must be set");
        }
        for (int i = 0; i < expiryTimes.size(); i++) {
            if (expiryTimes.get(i) == null) {
                throw new ScheduleException("expiryTimes", "missing expiry for level " + (i + 1));
            }
        }
        if (expiryTimes.size() != maxLevels) {
            throw new ScheduleException("expiryTimes",
                "expected " + maxLevels + " entries (one per level), got " + expiryTimes.size());
        }
        if (zone == null) {
            throw new ScheduleException("timezone", "must be set");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new ScheduleException("pollIntervalSeconds", "must be > 0");
        }
        if (outcomeTimeout == null || outcomeTimeout.isNegative() || outcomeTimeout.isZero()) {
            throw new ScheduleException("outcomeTimeoutSeconds", "must be > 0");
        }
        expiryTimes = List.copyOf(expiryTimes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SequenceConfig. Poll interval and timeout default to 0.5s / 70s,
     * multiplier to 2.
     */
    public static class Builder {
        private String asset;
        private Direction direction = Direction.UP;
        private BigDecimal baseStake;
        private BigDecimal escalationMultiplier = BigDecimal.valueOf(2);
        private Integer maxLevels;
        private LocalTime entryTime;
        private final List<LocalTime> expiryTimes = new ArrayList<>();
        private ZoneId zone = ZoneId.of("UTC");
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration outcomeTimeout = DEFAULT_OUTCOME_TIMEOUT;

        public Builder asset(String asset) { this.asset = asset; return this; }
        public Builder direction(Direction direction) { this.direction = direction; return this; }
        public Builder baseStake(BigDecimal baseStake) { this.baseStake = baseStake; return this; }
        public Builder baseStake(String baseStake) { this.baseStake = new BigDecimal(baseStake); return this; }
        public Builder escalationMultiplier(BigDecimal multiplier) { this.escalationMultiplier = multiplier; return this; }
        public Builder escalationMultiplier(String multiplier) { this.escalationMultiplier = new BigDecimal(multiplier); return this; }
        public Builder maxLevels(int maxLevels) { this.maxLevels = maxLevels; return this; }
        public Builder entryTime(LocalTime entryTime) { this.entryTime = entryTime; return this; }
        public Builder zone(ZoneId zone) { this.zone = zone; return this; }
        public Builder pollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
        public Builder outcomeTimeout(Duration outcomeTimeout) { this.outcomeTimeout = outcomeTimeout; return this; }

        public Builder expiryTimes(List<LocalTime> expiryTimes) {
            this.expiryTimes.clear();
            this.expiryTimes.addAll(expiryTimes);
            return this;
        }

        public Builder addExpiryTime(LocalTime expiryTime) {
            this.expiryTimes.add(expiryTime);
            return this;
        }

        /**
         * Build the config. When maxLevels was not set it follows the number of
         * expiry times.
         */
        public SequenceConfig build() {
            int levels = maxLevels != null ? maxLevels : expiryTimes.size();
            return new SequenceConfig(asset, direction, baseStake, escalationMultiplier, levels,
                entryTime, expiryTimes, zone, pollInterval, outcomeTimeout);
        }
    }
}
