package org.compacttz.app;

import org.compacttz.tz.TzDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args, TzDatabase.embedded(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("offset prints minutes and +HH:MM for the canonical zone")
    void testOffsetCommand() {
        assertEquals(Main.EXIT_OK, run("offset", "US/Eastern", "1704067200"));
        assertEquals("America/New_York -300 -05:00", out.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    @DisplayName("list prints every canonical zone, one per line")
    void testListCommand() {
        assertEquals(Main.EXIT_OK, run("list"));
        String output = out.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("UTC" + System.lineSeparator()));
        assertTrue(output.contains("Europe/London"));
    }

    @Test
    @DisplayName("Unknown zones exit with status 2, bad arguments with 1")
    void testErrors() {
        assertEquals(Main.EXIT_UNKNOWN_ZONE, run("offset", "Not/AZone", "0"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Not/AZone"));
        assertEquals(Main.EXIT_USAGE, run("offset", "UTC", "soon"));
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("bogus"));
    }
}
