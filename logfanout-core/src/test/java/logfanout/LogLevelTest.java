package logfanout;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogLevelTest {

    @Test
    void debugAdmitsEverything() {
        for (LogLevel level : LogLevel.values()) {
            assertTrue(LogLevel.DEBUG.admits(level), level::value);
        }
    }

    @Test
    void errorAdmitsOnlyErrorAndAbove() {
        assertFalse(LogLevel.ERROR.admits(LogLevel.DEBUG));
        assertFalse(LogLevel.ERROR.admits(LogLevel.INFO));
        assertFalse(LogLevel.ERROR.admits(LogLevel.WARN));
        assertTrue(LogLevel.ERROR.admits(LogLevel.ERROR));
        assertTrue(LogLevel.ERROR.admits(LogLevel.FATAL));
        assertTrue(LogLevel.ERROR.admits(LogLevel.PANIC));
    }

    @Test
    void parseAcceptsWarningAlias() {
        assertEquals(LogLevel.WARN, LogLevel.parse("warning"));
        assertEquals(LogLevel.WARN, LogLevel.parse("WARN"));
    }

    @Test
    void parseFallsBackToInfo() {
        assertEquals(LogLevel.INFO, LogLevel.parse("verbose"));
        assertEquals(LogLevel.INFO, LogLevel.parse(null));
        assertEquals(LogLevel.INFO, LogLevel.parse(""));
    }

    @Test
    void mapsJulLevels() {
        assertEquals(LogLevel.ERROR, LogLevel.fromJul(Level.SEVERE));
        assertEquals(LogLevel.WARN, LogLevel.fromJul(Level.WARNING));
        assertEquals(LogLevel.INFO, LogLevel.fromJul(Level.INFO));
        assertEquals(LogLevel.DEBUG, LogLevel.fromJul(Level.CONFIG));
        assertEquals(LogLevel.DEBUG, LogLevel.fromJul(Level.FINEST));
    }

    @Test
    void mapsBackToJul() {
        assertEquals(Level.FINE, LogLevel.DEBUG.toJul());
        assertEquals(Level.WARNING, LogLevel.WARN.toJul());
        assertEquals(Level.SEVERE, LogLevel.PANIC.toJul());
    }
}
