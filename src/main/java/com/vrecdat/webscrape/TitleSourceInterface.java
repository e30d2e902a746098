package com.vrecdat.webscrape;

import java.util.Optional;
import java.util.Set;

/**
 * Interface for web sources of recommended titles.
 */
public interface TitleSourceInterface {
    /**
     * Fetches one source and extracts its normalized titles.
     * @param url Source URL
     * @return Titles found; an empty set for a successful fetch without titles; empty Optional when the fetch or
     *         parsing failed
     */
    Optional<Set<String>> fetchTitles(String url);
}
