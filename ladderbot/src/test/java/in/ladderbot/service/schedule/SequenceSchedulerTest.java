package in.ladderbot.service.schedule;

import in.ladderbot.config.SequenceConfig;
import in.ladderbot.domain.sequence.Direction;
import in.ladderbot.domain.sequence.ScheduleEntry;
import in.ladderbot.domain.sequence.SequenceSchedule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SequenceScheduler.
 *
 * Tests:
 * - Entry resolution and next-day rollover
 * - Expiry resolution against the entry date
 * - Stake multipliers per level
 */
class SequenceSchedulerTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    private final SequenceScheduler scheduler = new SequenceScheduler();

    private static SequenceConfig.Builder config(String entry, String... expiries) {
        SequenceConfig.Builder builder = SequenceConfig.builder()
            .asset("EURUSD_otc")
            .direction(Direction.UP)
            .baseStake("1")
            .escalationMultiplier("2")
            .entryTime(LocalTime.parse(entry))
            .zone(UTC);
        for (String expiry : expiries) {
            builder.addExpiryTime(LocalTime.parse(expiry));
        }
        return builder;
    }

    private static Instant utc(String dateTime) {
        return Instant.parse(dateTime + "Z");
    }

    @Test
    void testProducesOneEntryPerLevel() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03", "02:04", "02:05", "02:06", "02:07").build(),
            utc("2026-10-17T01:00:00"));

        assertEquals(5, schedule.levelCount());
        for (int level = 1; level <= 5; level++) {
            assertEquals(level, schedule.level(level).sequenceLevel());
        }
    }

    @Test
    void testStakeMultiplierIsPowerOfEscalation() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03", "02:04", "02:05", "02:06").build(),
            utc("2026-10-17T01:00:00"));

        assertThat(schedule.entries())
            .extracting(ScheduleEntry::stakeMultiplier)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("1"), new BigDecimal("2"), new BigDecimal("4"), new BigDecimal("8"));

        for (int i = 1; i < schedule.levelCount(); i++) {
            assertTrue(schedule.entries().get(i).stakeMultiplier()
                    .compareTo(schedule.entries().get(i - 1).stakeMultiplier()) > 0,
                "Multiplier should strictly increase at level " + (i + 1));
        }
    }

    @Test
    void testFractionalMultiplierIsExact() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03", "02:04", "02:05").escalationMultiplier("2.5").build(),
            utc("2026-10-17T01:00:00"));

        assertEquals(0, new BigDecimal("6.25").compareTo(schedule.level(3).stakeMultiplier()));
        assertEquals(0, new BigDecimal("3.75").compareTo(schedule.level(2).stakeFor(new BigDecimal("1.5"))));
    }

    @Test
    void testEntryLaterTodayStaysToday() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03").build(),
            utc("2026-10-17T01:00:00"));

        assertEquals(utc("2026-10-17T02:02:00"), schedule.entryAt());
        assertEquals(utc("2026-10-17T02:03:00"), schedule.level(1).dueAt());
    }

    @Test
    void testElapsedEntryRollsExactlyOneDay() {
        Instant now = utc("2026-10-17T03:00:00");
        SequenceSchedule schedule = scheduler.schedule(config("02:02", "02:03").build(), now);

        Instant naive = utc("2026-10-17T02:02:00");
        assertEquals(Duration.ofHours(24), Duration.between(naive, schedule.entryAt()));
        assertEquals(utc("2026-10-18T02:03:00"), schedule.level(1).dueAt());
    }

    @Test
    void testEntryEqualToNowRollsToTomorrow() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03").build(),
            utc("2026-10-17T02:02:00"));

        assertEquals(utc("2026-10-18T02:02:00"), schedule.entryAt());
    }

    @Test
    void testExpiryAcrossMidnightRollsToNextDay() {
        SequenceSchedule schedule = scheduler.schedule(
            config("23:58", "23:59", "00:00", "00:01").build(),
            utc("2026-10-17T12:00:00"));

        assertEquals(utc("2026-10-17T23:58:00"), schedule.entryAt());
        assertEquals(utc("2026-10-17T23:59:00"), schedule.level(1).dueAt());
        assertEquals(utc("2026-10-18T00:00:00"), schedule.level(2).dueAt());
        assertEquals(utc("2026-10-18T00:01:00"), schedule.level(3).dueAt());
    }

    @Test
    void testExpiryEqualToEntryRollsToNextDay() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:02").build(),
            utc("2026-10-17T01:00:00"));

        assertEquals(utc("2026-10-18T02:02:00"), schedule.level(1).dueAt());
    }

    @Test
    void testNonMonotonicExpiriesResolvedIndependently() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:00", "02:10", "02:05", "02:20").build(),
            utc("2026-10-17T01:00:00"));

        assertEquals(utc("2026-10-17T02:10:00"), schedule.level(1).dueAt());
        assertEquals(utc("2026-10-17T02:05:00"), schedule.level(2).dueAt());
        assertEquals(utc("2026-10-17T02:20:00"), schedule.level(3).dueAt());
        for (ScheduleEntry entry : schedule.entries()) {
            assertTrue(entry.dueAt().isAfter(schedule.entryAt()), "Every expiry should fall after entry");
        }
    }

    @Test
    void testResolvesInConfiguredZone() {
        ZoneId kolkata = ZoneId.of("Asia/Kolkata");
        SequenceSchedule schedule = scheduler.schedule(
            config("09:15", "09:16").zone(kolkata).build(),
            ZonedDateTime.of(2026, 10, 17, 9, 0, 0, 0, kolkata).toInstant());

        assertEquals(kolkata, schedule.zone());
        assertEquals(ZonedDateTime.of(2026, 10, 17, 9, 15, 0, 0, kolkata).toInstant(), schedule.entryAt());
    }

    @Test
    void testRolloverKeepsWallClockTimeAcrossDst() {
        // Europe/London leaves summer time on 2026-10-25
        ZoneId london = ZoneId.of("Europe/London");
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03").zone(london).build(),
            ZonedDateTime.of(2026, 10, 24, 12, 0, 0, 0, london).toInstant());

        assertEquals(ZonedDateTime.of(2026, 10, 25, 2, 2, 0, 0, london).toInstant(), schedule.entryAt());
        assertEquals(LocalTime.of(2, 2), schedule.entryAt().atZone(london).toLocalTime());
    }

    @Test
    void testSubmissionDueAtChainsFromPreviousExpiry() {
        SequenceSchedule schedule = scheduler.schedule(
            config("02:02", "02:03", "02:04", "02:05").build(),
            utc("2026-10-17T01:00:00"));

        assertEquals(schedule.entryAt(), schedule.submissionDueAt(1));
        assertEquals(schedule.level(1).dueAt(), schedule.submissionDueAt(2));
        assertEquals(schedule.level(2).dueAt(), schedule.submissionDueAt(3));
        assertNotEquals(schedule.level(3).dueAt(), schedule.submissionDueAt(3));
    }
}
