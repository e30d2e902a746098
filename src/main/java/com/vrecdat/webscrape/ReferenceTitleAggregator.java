package com.vrecdat.webscrape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects reference titles from several web sources.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #expandUrls(List, boolean, boolean)} adds the optional {@code /Homebrew} and {@code /Japan} pages
 *       of every given URL and sorts the result.</li>
 *   <li>{@link #fetchAll(List)} fetches every distinct URL once, in order, and unions the titles.</li>
 * </ul>
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class ReferenceTitleAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceTitleAggregator.class);

    static final String HOMEBREW_SUFFIX = "/Homebrew";
    static final String JAPAN_SUFFIX = "/Japan";

    private final TitleSourceInterface source;

    public ReferenceTitleAggregator(TitleSourceInterface source) {
        this.source = source;
    }

    /**
     * Fetches titles from all URLs.
     * @param urls Source URLs; duplicates are fetched once
     * @return Union of all titles plus per-source titles of the successful fetches
     */
    public ReferenceTitles fetchAll(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            logger.error("No URLs provided for fetching.");
            return ReferenceTitles.empty();
        }
        logger.info("--- Starting Web Scrape ---");
        Set<String> all = new HashSet<>();
        Map<String, Set<String>> bySource = new LinkedHashMap<>();
        Set<String> processed = new HashSet<>();
        for (String url : urls) {
            if (!processed.add(url)) {
                logger.debug("Skipping already processed URL: {}", url);
                continue;
            }
            Optional<Set<String>> titles = source.fetchTitles(url);
            if (titles.isPresent()) {
                bySource.put(url, titles.get());
                if (titles.get().isEmpty()) {
                    logger.info("No titles extracted from {} (but fetch was successful).", url);
                } else {
                    all.addAll(titles.get());
                }
            } else {
                logger.warn("Fetch or parsing failed for {}. No titles added.", url);
            }
        }
        logger.info("--- Web Scrape Complete ---");
        if (all.isEmpty()) {
            logger.warn("No valid recommended titles found in any accessible URLs.");
        } else {
            logger.info("Total: Found {} unique cleaned recommended titles from all accessible URLs.", all.size());
        }
        return new ReferenceTitles(all, bySource);
    }

    /**
     * Adds the regional and homebrew variants of the given pages.
     * A URL already ending in the suffix (case-insensitive, trailing slashes ignored) gets no variant.
     * @param urls URLs given by the user
     * @param homebrew Add {@code <url>/Homebrew}
     * @param japan Add {@code <url>/Japan}
     * @return Distinct URLs in sorted order
     */
    public static List<String> expandUrls(List<String> urls, boolean homebrew, boolean japan) {
        TreeSet<String> expanded = new TreeSet<>(urls);
        if (homebrew) {
            logger.info("Checking for '{}' URL variants...", HOMEBREW_SUFFIX);
            addVariants(urls, HOMEBREW_SUFFIX, expanded);
        }
        if (japan) {
            logger.info("Checking for '{}' URL variants...", JAPAN_SUFFIX);
            addVariants(urls, JAPAN_SUFFIX, expanded);
        }
        List<String> result = new ArrayList<>(expanded);
        if (result.size() > urls.size()) {
            logger.info("Final list includes expanded URLs ({} total):", result.size());
            for (String u : result) logger.debug("  - {}", u);
        } else {
            logger.info("Processing only the provided URLs ({} total).", result.size());
        }
        return result;
    }

    private static void addVariants(List<String> urls, String suffix, Set<String> target) {
        String lowerSuffix = suffix.toLowerCase(Locale.ROOT);
        for (String base : urls) {
            String trimmed = stripTrailingSlashes(base);
            if (trimmed.toLowerCase(Locale.ROOT).endsWith(lowerSuffix)) continue;
            String variant = trimmed + suffix;
            logger.debug(" Adding variant: {}", variant);
            target.add(variant);
        }
    }

    static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') end--;
        return url.substring(0, end);
    }
}
