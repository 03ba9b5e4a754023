package in.ladderbot.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * JSON shape of a sequence configuration file.
 *
 * Times are "HH:mm" strings in the configured timezone; durations are seconds.
 * Converted to {@link SequenceConfig} by {@link SequenceConfigLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SequenceConfigDocument(
    @JsonProperty("asset")
    String asset,                   // e.g. "EURUSD_otc"

    @JsonProperty("direction")
    String direction,               // UP | DOWN (CALL/PUT accepted)

    @JsonProperty("baseStake")
    BigDecimal baseStake,           // Stake at level 1

    @JsonProperty("escalationMultiplier")
    BigDecimal escalationMultiplier, // Stake ratio between levels (usually 2)

    @JsonProperty("maxLevels")
    Integer maxLevels,              // Attempt cap; defaults to expiryTimes size

    @JsonProperty("entryTime")
    String entryTime,               // Level 1 submission time-of-day

    @JsonProperty("expiryTimes")
    List<String> expiryTimes,       // One expiry time-of-day per level

    @JsonProperty("timezone")
    String timezone,                // IANA zone id

    @JsonProperty("pollIntervalSeconds")
    Double pollIntervalSeconds,     // Outcome poll cadence (default 0.5)

    @JsonProperty("outcomeTimeoutSeconds")
    Double outcomeTimeoutSeconds    // Max wait for an outcome (default 70)
) {}
