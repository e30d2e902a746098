package com.vrecdat.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    @DisplayName("Defaults apply when only input and URLs are given")
    void testDefaults() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"in.dat", "-u", "https://a/wiki/X"});

        assertEquals(Path.of("in.dat"), options.input());
        assertNull(options.output());
        assertEquals(List.of("https://a/wiki/X"), options.urls());
        assertEquals(90, options.threshold());
        assertFalse(options.interactiveReview());
        assertFalse(options.checkHomebrew());
        assertFalse(options.checkJapan());
        assertEquals("INFO", options.logLevel());
        assertNull(options.logFile());
        assertNull(options.summaryJson());
        assertEquals(Utils.defaultOutputPath(Path.of("in.dat")), options.resolvedOutput());
    }

    @Test
    @DisplayName("All options are recognized")
    void testAllOptions() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{
            "in.dat", "out/filtered.dat", "-t", "85", "-ir", "-hb", "-j", "--log-level", "warning",
            "--log-file", "logs/run.log", "--summary-json", "summary.json", "--urls", "https://a/1", "https://a/2"});

        assertEquals(Path.of("out/filtered.dat"), options.output());
        assertEquals(List.of("https://a/1", "https://a/2"), options.urls());
        assertEquals(85, options.threshold());
        assertTrue(options.interactiveReview());
        assertTrue(options.checkHomebrew());
        assertTrue(options.checkJapan());
        assertEquals("WARN", options.logLevel());
        assertEquals(Path.of("logs/run.log"), options.logFile());
        assertEquals(Path.of("summary.json"), options.summaryJson());
        assertEquals(Path.of("out/filtered.dat").toAbsolutePath(), options.resolvedOutput());
    }

    @Test
    @DisplayName("The URL list ends at the next option or at --")
    void testUrlListBoundaries() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"-u", "https://a/1", "-t", "70", "--", "in.dat"});

        assertEquals(List.of("https://a/1"), options.urls());
        assertEquals(70, options.threshold());
        assertEquals(Path.of("in.dat"), options.input());
    }

    @ParameterizedTest
    @DisplayName("Log level names map to logback levels")
    @CsvSource({"DEBUG,DEBUG", "info,INFO", "WARNING,WARN", "ERROR,ERROR", "CRITICAL,ERROR"})
    void testLogLevels(String given, String expected) {
        assertEquals(expected, CommandLineOptions.parseLogLevel(given));
    }

    @Test
    @DisplayName("Usage errors are reported")
    void testUsageErrors() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"in.dat"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"-u", "https://a"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"in.dat", "-u"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"in.dat", "-u", "x", "-t", "101"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"in.dat", "-u", "x", "-t", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"in.dat", "-u", "x", "--log-level", "LOUD"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"in.dat", "-u", "x", "--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"a", "b", "c", "-u", "x"}));
    }

    @Test
    @DisplayName("Help and version skip the required argument checks")
    void testHelpAndVersion() {
        assertTrue(CommandLineOptions.parse(new String[]{"-h"}).help());
        assertTrue(CommandLineOptions.parse(new String[]{"--version"}).version());
    }
}
