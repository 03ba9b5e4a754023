package in.ladderbot.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "LADDERBOT_ENV_TEST_KEY";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void testDefaultsWhenUnset() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertEquals(7, Env.getInt(KEY, 7));
        assertTrue(Env.getBool(KEY, true));
    }

    @Test
    void testReadsSystemProperty() {
        System.setProperty(KEY, "12");

        assertEquals("12", Env.get(KEY, null));
        assertEquals(12, Env.getInt(KEY, 0));
        assertFalse(Env.getBool(KEY, true));
    }

    @Test
    void testMalformedNumbersFallBack() {
        System.setProperty(KEY, "twelve");

        assertEquals(3, Env.getInt(KEY, 3));
    }

    @Test
    void testBooleanForms() {
        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));
        System.setProperty(KEY, "TRUE");
        assertTrue(Env.getBool(KEY, false));
    }
}
