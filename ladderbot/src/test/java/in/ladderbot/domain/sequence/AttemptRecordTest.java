package in.ladderbot.domain.sequence;

import in.ladderbot.domain.venue.ActionHandle;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AttemptRecordTest {

    private static final Instant SUBMITTED = Instant.parse("2026-10-17T02:02:00Z");

    @Test
    void testStartsUnresolved() {
        AttemptRecord attempt = new AttemptRecord(1, BigDecimal.ONE, SUBMITTED);

        assertEquals(AttemptOutcome.UNKNOWN, attempt.getOutcome());
        assertFalse(attempt.isResolved());
        assertTrue(attempt.getActionId().isEmpty());
        assertTrue(attempt.getResolvedAt().isEmpty());
    }

    @Test
    void testResolvesOnce() {
        AttemptRecord attempt = new AttemptRecord(2, new BigDecimal("2"), SUBMITTED);
        attempt.accepted(new ActionHandle("paper-1"));

        attempt.resolve(AttemptOutcome.LOSS, SUBMITTED.plusSeconds(61));

        assertEquals(AttemptOutcome.LOSS, attempt.getOutcome());
        assertEquals(SUBMITTED.plusSeconds(61), attempt.getResolvedAt().orElseThrow());
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> attempt.resolve(AttemptOutcome.WIN, SUBMITTED.plusSeconds(62)));
        assertThat(e.getMessage()).contains("LOSS");
        assertEquals(AttemptOutcome.LOSS, attempt.getOutcome());
    }

    @Test
    void testHandleAttachedOnce() {
        AttemptRecord attempt = new AttemptRecord(1, BigDecimal.ONE, SUBMITTED);
        attempt.accepted(new ActionHandle("paper-1"));

        assertThrows(IllegalStateException.class, () -> attempt.accepted(new ActionHandle("paper-2")));
        assertEquals("paper-1", attempt.getActionId().orElseThrow().id());
        assertThat(attempt.toString()).contains("paper-1");
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new AttemptRecord(0, BigDecimal.ONE, SUBMITTED));
        assertThrows(IllegalArgumentException.class, () -> new AttemptRecord(1, BigDecimal.ZERO, SUBMITTED));
        assertThrows(NullPointerException.class, () -> new AttemptRecord(1, BigDecimal.ONE, null));
    }
}
