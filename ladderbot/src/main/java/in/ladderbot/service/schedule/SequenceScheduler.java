package in.ladderbot.service.schedule;

import in.ladderbot.config.ScheduleException;
import in.ladderbot.config.SequenceConfig;
import in.ladderbot.domain.sequence.ScheduleEntry;
import in.ladderbot.domain.sequence.SequenceSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the absolute timestamps of an escalation sequence.
 *
 * Entry: the configured time-of-day in the configured zone, rolled to the next
 * day when it is at or before "now".
 * Expiries: each configured time-of-day resolved against the entry date, rolled
 * to the next day when at or before the entry. Each expiry is resolved
 * independently; out-of-order expiries are logged, not rejected.
 * Stake multiplier for level i: escalationMultiplier^(i-1).
 */
public final class SequenceScheduler {
    private static final Logger log = LoggerFactory.getLogger(SequenceScheduler.class);

    /**
     * Compute the schedule for a config relative to a reference time.
     *
     * @param config Sequence configuration
     * @param now Reference time
     * @return Entry timestamp plus one entry per level
     * @throws ScheduleException if the config does not describe one expiry per level
     */
    public SequenceSchedule schedule(SequenceConfig config, Instant now) {
        if (config.expiryTimes().size() != config.maxLevels()) {
            throw new ScheduleException("expiryTimes",
                "expected " + config.maxLevels() + " entries, got " + config.expiryTimes().size());
        }

        ZoneId zone = config.zone();
        ZonedDateTime entry = resolveEntry(config.entryTime(), now.atZone(zone));
        LocalDate entryDate = entry.toLocalDate();

        List<ScheduleEntry> entries = new ArrayList<>(config.maxLevels());
        BigDecimal multiplier = BigDecimal.ONE;
        Instant previousExpiry = entry.toInstant();

        for (int i = 0; i < config.maxLevels(); i++) {
            int level = i + 1;
            ZonedDateTime expiry = resolveExpiry(config.expiryTimes().get(i), entryDate, entry);

            if (!expiry.toInstant().isAfter(previousExpiry)) {
                log.warn("[{}:L{}] Expiry {} is not after previous level's {}; levels run back-to-back from actual outcomes",
                    config.asset(), level, expiry, previousExpiry.atZone(zone));
            }

            entries.add(new ScheduleEntry(level, expiry.toInstant(), multiplier));
            previousExpiry = expiry.toInstant();
            multiplier = multiplier.multiply(config.escalationMultiplier());
        }

        return new SequenceSchedule(zone, entry.toInstant(), entries);
    }

    /**
     * Nearest future instance of the entry time-of-day.
     */
    static ZonedDateTime resolveEntry(LocalTime entryTime, ZonedDateTime now) {
        ZonedDateTime entry = ZonedDateTime.of(now.toLocalDate(), entryTime, now.getZone());
        if (!entry.isAfter(now)) {
            entry = entry.plusDays(1);
        }
        return entry;
    }

    /**
     * Expiry time-of-day on the entry date, pushed one day when not after entry.
     */
    static ZonedDateTime resolveExpiry(LocalTime expiryTime, LocalDate entryDate, ZonedDateTime entry) {
        ZonedDateTime expiry = ZonedDateTime.of(entryDate, expiryTime, entry.getZone());
        if (!expiry.isAfter(entry)) {
            expiry = expiry.plusDays(1);
        }
        return expiry;
    }
}
