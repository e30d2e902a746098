package com.vrecdat.filter;

/**
 * Pair of similarity scores for one catalog name against one reference title.
 * <p>
 * {@code primary} decides acceptance against a threshold; {@code tieBreak} only orders candidates whose
 * primary scores are equal. Both are in the range 0-100.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public record MatchScore(int primary, int tieBreak) {
    public MatchScore {
        if (primary < 0 || primary > 100 || tieBreak < 0 || tieBreak > 100) {
            throw new IllegalArgumentException("Scores must be within 0-100: " + primary + "/" + tieBreak);
        }
    }
}
