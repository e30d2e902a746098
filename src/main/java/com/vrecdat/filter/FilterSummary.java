package com.vrecdat.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one filtering run, as logged at the end and optionally written as JSON.
 *
 * @param inputFile Input DAT path
 * @param outputFile Output DAT path
 * @param originalGameCount Entries in the input catalog
 * @param titlesPerSource Titles found per successfully fetched source
 * @param totalReferenceTitles Distinct reference titles over all sources
 * @param threshold Automatic matching threshold
 * @param interactiveReview Whether the review stage ran
 * @param lowThreshold Review candidate threshold, null without review
 * @param keptGames Entries written to the output
 * @param removedGames Entries not selected
 * @param matchedTitles Reference titles that produced a kept entry
 * @param unmatchedTitles Reference titles without a kept entry
 * @param confirmedGameCount Entries counted when re-reading the output, -1 if that failed
 * @param unmatchedReports File names of the CSV reports written
 */
public record FilterSummary(String inputFile, String outputFile, int originalGameCount,
                            Map<String, Integer> titlesPerSource, int totalReferenceTitles, int threshold,
                            boolean interactiveReview, Integer lowThreshold, int keptGames, int removedGames,
                            int matchedTitles, int unmatchedTitles, int confirmedGameCount,
                            List<String> unmatchedReports) {
    public FilterSummary {
        titlesPerSource = Collections.unmodifiableMap(new LinkedHashMap<>(titlesPerSource));
        unmatchedReports = List.copyOf(unmatchedReports);
    }
}
