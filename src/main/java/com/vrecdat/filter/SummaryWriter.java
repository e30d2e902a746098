package com.vrecdat.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link FilterSummary} as pretty-printed JSON using Jackson.
 */
public class SummaryWriter {
    private static final Logger logger = LoggerFactory.getLogger(SummaryWriter.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * @param summary Run summary
     * @param path Target file; parent directories are created
     * @throws IOException if the file cannot be written
     */
    public void write(FilterSummary summary, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(path.toFile(), summary);
        logger.info("Wrote JSON run summary to: {}", path);
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
