package in.ladderbot.bootstrap;

import in.ladderbot.config.ScheduleException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("PAPER_WIN_PROBABILITY");
    }

    @Test
    void testWinProbabilityDefaultsToEvenOdds() {
        assertEquals(0.5, App.paperWinProbability());
    }

    @Test
    void testWinProbabilityFromProperty() {
        System.setProperty("PAPER_WIN_PROBABILITY", "0.8");

        assertEquals(0.8, App.paperWinProbability());
    }

    @Test
    void testMalformedWinProbabilityRejected() {
        System.setProperty("PAPER_WIN_PROBABILITY", "O.8");

        ScheduleException e = assertThrows(ScheduleException.class, App::paperWinProbability);

        assertEquals("PAPER_WIN_PROBABILITY", e.getField());
        assertThat(e.getMessage()).contains("O.8");
    }

    @Test
    void testOutOfRangeWinProbabilityRejected() {
        System.setProperty("PAPER_WIN_PROBABILITY", "1.5");

        ScheduleException e = assertThrows(ScheduleException.class, App::paperWinProbability);

        assertEquals("PAPER_WIN_PROBABILITY", e.getField());
    }
}
