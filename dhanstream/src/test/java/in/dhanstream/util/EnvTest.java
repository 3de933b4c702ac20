package in.dhanstream.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "DHANSTREAM_ENV_TEST_VALUE";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void testFallbacks() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        System.setProperty(KEY, "  42 ");
        assertEquals("42", Env.get(KEY, "fallback"), "Trimmed property value");
        assertEquals(42, Env.getInt(KEY, 7));
        assertEquals(42L, Env.getLong(KEY, 7L));

        System.setProperty(KEY, "forty-two");
        assertEquals(7, Env.getInt(KEY, 7));
    }

    @Test
    void testMask() {
        assertEquals("<none>", Env.mask(null));
        assertEquals("****", Env.mask("abcd"));
        assertEquals("abcd****", Env.mask("abcdefgh"));
    }
}
