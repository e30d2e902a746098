package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Automatic best-match selection of catalog entries for reference titles.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Stage 1: scores every indexed catalog entry against every reference title and keeps the pairs whose
 *       primary score reaches the threshold, grouped per reference title.</li>
 *   <li>Stage 2: per reference title, sorts its candidates best-first (primary, then tie-break score) and keeps
 *       only the best one, plus its sibling parts when the best one is part 1 of a multi-part release.</li>
 * </ul>
 * Reference titles are processed in lexicographic order, so results do not depend on set iteration order.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class MatchSelector {
    private static final Logger logger = LoggerFactory.getLogger(MatchSelector.class);

    private final SimilarityScorer scorer;

    public MatchSelector(SimilarityScorer scorer) {
        this.scorer = scorer == null ? new FuzzySimilarityScorer() : scorer;
    }

    public MatchSelector() {
        this(new FuzzySimilarityScorer());
    }

    /**
     * Selects the best catalog entry for every reference title, starting from an empty selection.
     * @param index Normalized catalog
     * @param referenceTitles Normalized reference titles
     * @param threshold Inclusive primary score threshold, 0-100
     * @return Selection and the reference titles that produced at least one selected entry
     */
    public SelectionResult selectBestMatches(CatalogIndex index, Collection<String> referenceTitles, int threshold) {
        return selectBestMatches(index, referenceTitles, threshold, SelectionSet.empty());
    }

    /**
     * Selects the best catalog entry for every reference title, extending {@code existing}.
     */
    public SelectionResult selectBestMatches(CatalogIndex index, Collection<String> referenceTitles, int threshold, SelectionSet existing) {
        checkThreshold(threshold);
        Map<String, List<MatchCandidate>> candidatesPerTitle = findCandidates(index, referenceTitles, threshold);

        logger.info("--- Selecting Best Matches (Stage 2) ---");
        SelectionSet.Builder selection = existing.toBuilder();
        Set<String> matched = new HashSet<>();
        for (Map.Entry<String, List<MatchCandidate>> e : candidatesPerTitle.entrySet()) {
            String title = e.getKey();
            List<MatchCandidate> sorted = new ArrayList<>(e.getValue());
            if (sorted.isEmpty()) continue;
            sorted.sort(MatchCandidate.BEST_FIRST);
            MatchCandidate best = sorted.get(0);
            logger.debug(" -> Best match for Web '{}' is DAT '{}' (WR Score: {}%, TSR Score: {}%)",
                title, best.displayName(), best.primaryScore(), best.tieBreakScore());

            List<CatalogEntry> others = new ArrayList<>();
            for (MatchCandidate other : sorted.subList(1, sorted.size())) {
                if (other.primaryScore() >= threshold) others.add(other.entry());
            }
            List<CatalogEntry> bundle = new ArrayList<>();
            bundle.add(best.entry());
            bundle.addAll(MultiPartGrouper.siblingsOf(best.entry(), others));

            int added = selection.addAll(bundle);
            logger.debug(" -> Added {} new DAT game(s) for Web '{}' ({} already selected).", added, title, bundle.size() - added);
            matched.add(title);
        }
        SelectionSet result = selection.build();
        logger.info("Completed initial best match selection. Found {} preliminary games.", result.size());
        return new SelectionResult(result, matched);
    }

    /**
     * Scores the catalog against the reference titles and keeps pairs at or above the threshold.
     * Pairs whose scoring failed are treated as no match.
     * @return Candidate lists per reference title, titles in lexicographic order, candidates in catalog order
     */
    Map<String, List<MatchCandidate>> findCandidates(CatalogIndex index, Collection<String> referenceTitles, int threshold) {
        logger.info("--- Finding Matches (Stage 1) ---");
        logger.info("Finding potential matches >= {}% (Algorithm: WRatio + TokenSortRatio)...", threshold);
        TreeSet<String> titles = new TreeSet<>(referenceTitles);
        titles.remove("");
        Map<String, List<MatchCandidate>> candidates = new TreeMap<>();
        for (CatalogIndex.IndexedEntry indexed : index.indexedEntries()) {
            for (String title : titles) {
                ScoreResult result = scorer.score(indexed.normalizedName(), title);
                if (!result.isSuccess()) continue;
                MatchScore score = result.score();
                if (score.primary() >= threshold) {
                    logger.debug("  Storing potential match for Web '{}': DAT '{}' (WR: {}%, TSR: {}%)",
                        title, indexed.entry().displayName(), score.primary(), score.tieBreak());
                    candidates.computeIfAbsent(title, t -> new ArrayList<>()).add(new MatchCandidate(score, indexed));
                }
            }
        }
        logger.info("Found high-scoring potential matches for {} unique web titles.", candidates.size());
        return candidates;
    }

    static void checkThreshold(int threshold) {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Threshold must be within 0-100, got " + threshold);
        }
    }
}
