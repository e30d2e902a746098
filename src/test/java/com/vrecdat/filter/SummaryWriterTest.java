package com.vrecdat.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SummaryWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteSummary() throws IOException {
        FilterSummary summary = new FilterSummary("/in.dat", "/out.dat", 10, Map.of("https://a/wiki/X", 4), 4, 90,
            false, null, 3, 7, 3, 1, 3, List.of("X_unmatched.csv"));
        Path file = tempDir.resolve("nested").resolve("summary.json");

        new SummaryWriter().write(summary, file);

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals(10, root.get("originalGameCount").asInt());
        assertEquals(4, root.get("titlesPerSource").get("https://a/wiki/X").asInt());
        assertTrue(root.get("lowThreshold").isNull());
        assertEquals("X_unmatched.csv", root.get("unmatchedReports").get(0).asText());
    }
}
