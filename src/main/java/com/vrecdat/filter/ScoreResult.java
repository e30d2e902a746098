package com.vrecdat.filter;

/**
 * Outcome of scoring one pair of strings: either a {@link MatchScore} or the reason scoring failed.
 * <p>
 * Callers skip a failed pair: it never becomes a candidate, so it cannot be selected or offered for review.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public record ScoreResult(MatchScore score, String error) {

    public static ScoreResult success(MatchScore score) {
        return new ScoreResult(score, null);
    }

    public static ScoreResult failure(String error) {
        return new ScoreResult(null, error == null ? "unknown scoring error" : error);
    }

    public boolean isSuccess() {
        return score != null;
    }
}
