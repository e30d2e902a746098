package com.vrecdat.filter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LoggingConfiguratorTest {
    private static final Logger logger = LoggerFactory.getLogger(LoggingConfiguratorTest.class);

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        LoggingConfigurator.removeFileLog();
        LoggingConfigurator.applyConsoleLevel(CommandLineOptions.DEFAULT_LOG_LEVEL);
    }

    @Test
    void testFileLogReceivesDebug() throws IOException {
        Path log = tempDir.resolve("a").resolve("b").resolve("debug.log");
        LoggingConfigurator.applyConsoleLevel("ERROR");

        assertTrue(LoggingConfigurator.addFileLog(log));
        logger.debug("debug line for the file");
        LoggingConfigurator.removeFileLog();
        logger.debug("after removal");

        String content = Files.readString(log, StandardCharsets.UTF_8);
        assertTrue(content.contains("DEBUG - debug line for the file"));
        assertFalse(content.contains("after removal"));
    }
}
