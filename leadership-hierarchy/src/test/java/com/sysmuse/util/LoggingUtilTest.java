package com.sysmuse.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingUtilTest {

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    public void setUp() {
        System.setOut(new PrintStream(out, true));
        System.setErr(new PrintStream(err, true));
        LoggingUtil.reset();
    }

    @AfterEach
    public void tearDown() {
        LoggingUtil.reset();
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR);
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testSplitModeSendsSevereToErr() {
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR);
        LoggingUtil.initialize("INFO", true, false, null);

        LoggingUtil.info("roster loaded");
        LoggingUtil.error("roster broken");

        assertTrue(out().contains("roster loaded"));
        assertFalse(out().contains("roster broken"));
        assertTrue(err().contains("roster broken"));
        assertFalse(err().contains("roster loaded"));
    }

    @Test
    public void testAllToOutMode() {
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.ALL_TO_OUT);
        LoggingUtil.initialize("INFO", true, false, null);

        LoggingUtil.warn("seat replaced");
        LoggingUtil.error("roster broken");

        assertTrue(out().contains("seat replaced"));
        assertTrue(out().contains("roster broken"));
        assertEquals("", err());
    }

    @Test
    public void testAllToErrModeAndLevelFilter() {
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR);
        LoggingUtil.initialize("WARNING", true, false, null);

        LoggingUtil.info("hidden");
        LoggingUtil.warn("seat replaced");

        assertEquals("", out());
        assertTrue(err().contains("seat replaced"));
        assertFalse(err().contains("hidden"));
    }

    @Test
    public void testParseConsoleOutputMode() {
        assertEquals(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR, LoggingUtil.parseConsoleOutputMode("all_to_err"));
        assertEquals(LoggingUtil.ConsoleOutputMode.ALL_TO_OUT, LoggingUtil.parseConsoleOutputMode(" ALL_TO_OUT "));
        assertEquals(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR, LoggingUtil.parseConsoleOutputMode("loud"));
        assertEquals(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR, LoggingUtil.parseConsoleOutputMode(null));
    }
}
