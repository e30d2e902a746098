package com.vrecdat.filter;

import java.nio.file.Path;

/**
 * Settings of one filtering run.
 *
 * @param input Input DAT file
 * @param output Output DAT file; CSV reports are written next to it
 * @param threshold Automatic matching threshold, 0-100
 * @param interactiveReview Run the review stage over titles left unmatched
 * @param summaryJson Optional JSON summary file, may be null
 */
public record FilterOptions(Path input, Path output, int threshold, boolean interactiveReview, Path summaryJson) {
    public FilterOptions {
        if (input == null || output == null) throw new IllegalArgumentException("Input and output paths are required");
        MatchSelector.checkThreshold(threshold);
    }
}
