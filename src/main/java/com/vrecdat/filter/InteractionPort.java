package com.vrecdat.filter;

import java.util.List;

/**
 * Interface for the human decision step of the interactive review.
 * <p>
 * The review calls it once per reference title and waits for the answer before moving on; implementations
 * are never called concurrently.
 */
public interface InteractionPort {
    /**
     * Shows ranked candidates for a reference title and obtains a decision.
     * @param referenceTitle Normalized reference title without an automatic match
     * @param rankedCandidates Candidates, best first; never empty
     * @return Selection of one candidate, skip, or abort
     */
    ReviewDecision presentCandidates(String referenceTitle, List<MatchCandidate> rankedCandidates);
}
