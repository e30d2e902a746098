package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Human-in-the-loop review of reference titles left without an automatic match.
 * <p>
 * Workflow:
 * <ul>
 *   <li>The discard pool is every indexed catalog entry whose name is not in the selection yet.</li>
 *   <li>Unmatched titles are reviewed one at a time, in lexicographic order.</li>
 *   <li>A discarded entry becomes a candidate only if both its primary and its tie-break score reach the low
 *       threshold; titles without candidates are skipped silently.</li>
 *   <li>Candidates are ranked by primary score and handed to the {@link InteractionPort}.</li>
 *   <li>An accepted entry is added together with its sibling parts from the displayed list, and the whole bundle
 *       leaves the discard pool before the next title is reviewed.</li>
 *   <li>An abort from the port ends the review; decisions already taken are kept.</li>
 * </ul>
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class InteractiveReviewService {
    private static final Logger logger = LoggerFactory.getLogger(InteractiveReviewService.class);

    public static final int LOW_THRESHOLD = 51;

    private final SimilarityScorer scorer;
    private final int lowThreshold;

    public InteractiveReviewService(SimilarityScorer scorer, int lowThreshold) {
        MatchSelector.checkThreshold(lowThreshold);
        this.scorer = scorer == null ? new FuzzySimilarityScorer() : scorer;
        this.lowThreshold = lowThreshold;
    }

    public InteractiveReviewService(SimilarityScorer scorer) {
        this(scorer, LOW_THRESHOLD);
    }

    public int getLowThreshold() {
        return lowThreshold;
    }

    /**
     * Reviews unmatched reference titles against the entries that were not selected.
     * @param unmatchedTitles Reference titles without an automatic match
     * @param selection Selection after automatic matching
     * @param index Normalized catalog
     * @param port Decision source
     * @return Extended selection and the titles matched during review
     */
    public SelectionResult review(Collection<String> unmatchedTitles, SelectionSet selection, CatalogIndex index, InteractionPort port) {
        logger.info("--- Starting Interactive Review Stage ---");
        TreeSet<String> titles = new TreeSet<>(unmatchedTitles);
        logger.info("Found {} web titles without an automatic match to potentially review.", titles.size());
        if (titles.isEmpty()) {
            logger.info("No web titles require interactive review.");
            return new SelectionResult(selection, Set.of());
        }

        List<CatalogIndex.IndexedEntry> discarded = new ArrayList<>();
        for (CatalogIndex.IndexedEntry indexed : index.indexedEntries()) {
            if (!selection.contains(indexed.entry().displayName())) discarded.add(indexed);
        }
        logger.info("Will compare against {} discarded DAT games.", discarded.size());

        SelectionSet.Builder builder = selection.toBuilder();
        Set<String> matched = new HashSet<>();
        int reviewed = 0;
        for (String title : titles) {
            List<MatchCandidate> candidates = findCandidates(title, discarded);
            if (candidates.isEmpty()) {
                logger.info("No suitable candidates found for '{}' passing BOTH thresholds >= {}%. Skipping review.", title, lowThreshold);
                continue;
            }
            reviewed++;
            ReviewDecision decision = port.presentCandidates(title, List.copyOf(candidates));
            if (decision == null || decision.kind() == ReviewDecision.Kind.SKIP) {
                logger.info("User skipped selection for Web Title '{}'.", title);
                continue;
            }
            if (decision.kind() == ReviewDecision.Kind.ABORT) {
                logger.warn("Interactive input ended; remaining {} web titles stay unmatched.", titles.tailSet(title, false).size());
                break;
            }
            if (decision.index() >= candidates.size()) {
                logger.warn("Selection {} is out of range for '{}' ({} candidates). Treating as skip.", decision.index() + 1, title, candidates.size());
                continue;
            }

            MatchCandidate chosen = candidates.get(decision.index());
            logger.info("User selected: '{}' (Score: {}%) for Web Title '{}'.", chosen.displayName(), chosen.primaryScore(), title);
            List<CatalogEntry> shown = new ArrayList<>();
            for (MatchCandidate c : candidates) shown.add(c.entry());
            List<CatalogEntry> bundle = new ArrayList<>();
            bundle.add(chosen.entry());
            for (CatalogEntry sibling : MultiPartGrouper.siblingsOf(chosen.entry(), shown)) {
                logger.info("    -> Automatically adding multi-part match: '{}'", sibling.displayName());
                bundle.add(sibling);
            }
            builder.addAll(bundle);
            Set<String> bundleNames = new HashSet<>();
            for (CatalogEntry e : bundle) bundleNames.add(e.displayName());
            discarded.removeIf(d -> bundleNames.contains(d.entry().displayName()));
            matched.add(title);
        }
        logger.info("--- Interactive Review Complete ({} reviewed, {} manually matched) ---", reviewed, matched.size());
        return new SelectionResult(builder.build(), matched);
    }

    private List<MatchCandidate> findCandidates(String title, List<CatalogIndex.IndexedEntry> pool) {
        logger.debug("  Comparing '{}' against {} discarded games...", title, pool.size());
        List<MatchCandidate> candidates = new ArrayList<>();
        for (CatalogIndex.IndexedEntry indexed : pool) {
            ScoreResult result = scorer.score(indexed.normalizedName(), title);
            if (!result.isSuccess()) continue;
            MatchScore score = result.score();
            if (score.primary() >= lowThreshold && score.tieBreak() >= lowThreshold) {
                logger.debug("    Candidate: DAT='{}', WRatio={}%, TokenSortRatio={}%", indexed.entry().displayName(), score.primary(), score.tieBreak());
                candidates.add(new MatchCandidate(score, indexed));
            }
        }
        candidates.sort(MatchCandidate.BY_PRIMARY);
        return candidates;
    }
}
