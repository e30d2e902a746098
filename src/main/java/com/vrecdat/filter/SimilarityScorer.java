package com.vrecdat.filter;

/**
 * Interface for comparing a normalized catalog name with a normalized reference title.
 * <p>
 * Implementations must be symmetric in their primary score, return 100/100 for identical non-empty
 * strings and never throw for string input: internal failures are reported as {@link ScoreResult#failure(String)}.
 */
public interface SimilarityScorer {
    /**
     * Scores two normalized strings.
     * @param a First string
     * @param b Second string
     * @return Primary and tie-break score, or a failure
     */
    ScoreResult score(String a, String b);
}
