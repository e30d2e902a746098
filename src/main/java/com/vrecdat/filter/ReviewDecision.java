package com.vrecdat.filter;

/**
 * Decision returned by an {@link InteractionPort} for one reference title.
 * <p>
 * {@code SELECT} carries the zero-based index into the candidate list that was presented. {@code ABORT} means the
 * interaction channel is gone (e.g. end of input) and no further titles should be reviewed.
 */
public record ReviewDecision(Kind kind, int index) {

    public enum Kind { SELECT, SKIP, ABORT }

    private static final ReviewDecision SKIP = new ReviewDecision(Kind.SKIP, -1);
    private static final ReviewDecision ABORT = new ReviewDecision(Kind.ABORT, -1);

    public static ReviewDecision select(int index) {
        if (index < 0) throw new IllegalArgumentException("Candidate index must not be negative: " + index);
        return new ReviewDecision(Kind.SELECT, index);
    }

    public static ReviewDecision skip() {
        return SKIP;
    }

    public static ReviewDecision abort() {
        return ABORT;
    }
}
