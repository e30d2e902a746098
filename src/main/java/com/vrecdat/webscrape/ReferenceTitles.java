package com.vrecdat.webscrape;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reference titles of one run: the global set and the titles of every source that was fetched successfully.
 * Sources that failed are absent from {@code bySource}; sources that yielded nothing map to an empty set.
 */
public record ReferenceTitles(Set<String> all, Map<String, Set<String>> bySource) {
    public ReferenceTitles {
        all = Set.copyOf(all);
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        bySource.forEach((url, titles) -> copy.put(url, Set.copyOf(titles)));
        bySource = Collections.unmodifiableMap(copy);
    }

    public static ReferenceTitles empty() {
        return new ReferenceTitles(Set.of(), Map.of());
    }
}
