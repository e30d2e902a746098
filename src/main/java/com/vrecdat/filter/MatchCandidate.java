package com.vrecdat.filter;

import java.util.Comparator;

/**
 * A catalog entry scored against one reference title.
 * <p>
 * {@link #BEST_FIRST} orders candidates by primary score, then tie-break score, both descending. Remaining ties
 * put a first part ahead of other entries, so a multi-part bundle can form, and then fall back to catalog order.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public record MatchCandidate(int primaryScore, int tieBreakScore, CatalogEntry entry, int catalogPosition) {

    public static final Comparator<MatchCandidate> BEST_FIRST = Comparator
        .comparingInt(MatchCandidate::primaryScore).reversed()
        .thenComparing(Comparator.comparingInt(MatchCandidate::tieBreakScore).reversed())
        .thenComparingInt(c -> MultiPartGrouper.isFirstPart(c.displayName()) ? 0 : 1)
        .thenComparingInt(MatchCandidate::catalogPosition);

    public static final Comparator<MatchCandidate> BY_PRIMARY = Comparator
        .comparingInt(MatchCandidate::primaryScore).reversed()
        .thenComparingInt(MatchCandidate::catalogPosition);

    public MatchCandidate(MatchScore score, CatalogIndex.IndexedEntry indexed) {
        this(score.primary(), score.tieBreak(), indexed.entry(), indexed.position());
    }

    public String displayName() {
        return entry.displayName();
    }
}
