package com.vrecdat.filter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Interface for CSV reports of reference titles that ended without a kept catalog entry.
 */
public interface CsvServiceInterface {
    /**
     * Writes the unmatched titles of one web source to a CSV file in {@code outputDir}.
     * @param sourceUrl Web source the titles came from
     * @param unmatchedTitles Titles of that source still unmatched after all stages
     * @param outputDir Directory receiving the report
     * @param sourceNumber 1-based position of the source, used when the URL yields no usable file name
     * @return Path of the written report
     * @throws IOException if file writing fails
     */
    Path writeUnmatchedReport(String sourceUrl, Collection<String> unmatchedTitles, Path outputDir, int sourceNumber) throws IOException;
}
