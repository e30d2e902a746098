package com.vrecdat.filter;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Service for exporting unmatched reference titles to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>One file per web source, named after the source URL path ({@link Utils#reportBaseName(String, int)}) with an
 *       {@code _unmatched.csv} suffix.</li>
 *   <li>A single column: a header row naming the source, then the titles in sorted order.</li>
 * </ul>
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String FILE_SUFFIX = "_unmatched.csv";

    @Override
    public Path writeUnmatchedReport(String sourceUrl, Collection<String> unmatchedTitles, Path outputDir, int sourceNumber) throws IOException {
        if (unmatchedTitles == null) {
            logger.warn("Attempted to write null title list to CSV for: {}", sourceUrl);
            throw new IllegalArgumentException("Title list cannot be null");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("Output directory cannot be null");
        }
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(Utils.reportBaseName(sourceUrl, sourceNumber) + FILE_SUFFIX);
        List<String> sorted = new ArrayList<>(unmatchedTitles);
        sorted.sort(null);
        logger.info("Writing CSV for final unmatched titles from {} -> '{}' ({} titles)...", sourceUrl, file.getFileName(), sorted.size());
        try (Writer fileWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(fileWriter)) {
            writer.writeNext(new String[]{"Unmatched Recommended Title from " + sourceUrl + " (After Review/No Match Kept)"});
            for (String title : sorted) {
                writer.writeNext(new String[]{title});
            }
        }
        return file;
    }
}
