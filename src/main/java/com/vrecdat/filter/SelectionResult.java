package com.vrecdat.filter;

import java.util.Set;

/**
 * Output of a selection stage: the selection after the stage and the reference titles the stage matched.
 */
public record SelectionResult(SelectionSet selection, Set<String> matchedTitles) {
    public SelectionResult {
        matchedTitles = Set.copyOf(matchedTitles);
    }
}
