package com.vrecdat.webscrape;

import com.vrecdat.filter.TitleNormalizer;
import com.vrecdat.filter.Utils;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Title source reading recommendation pages built from {@code wikitable} HTML tables.
 * <p>
 * Extraction workflow:
 * <ul>
 *   <li>Downloads the page once with jsoup; no retries.</li>
 *   <li>Visits every {@code table.wikitable}, skipping each table's header row.</li>
 *   <li>Takes the text of the second cell of every row, drops {@code [...]} footnote markers and splits it into
 *       lines (a {@code <br>} starts a new line).</li>
 *   <li>Normalizes every line with {@link TitleNormalizer} and keeps the non-empty results.</li>
 * </ul>
 * Error handling: a 404 is logged as a warning, other HTTP and network errors as errors; both return an empty
 * Optional. A row that cannot be read is logged and skipped.
 * <p>
 * Configuration: {@code VREC_HTTP_TIMEOUT_MS} (default 30000) and {@code VREC_USER_AGENT}, read from the environment
 * or system properties.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class WikiTableTitleSource implements TitleSourceInterface {
    private static final Logger logger = LoggerFactory.getLogger(WikiTableTitleSource.class);

    static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";
    static final int DEFAULT_TIMEOUT_MS = 30_000;

    private static final Pattern FOOTNOTE = Pattern.compile("\\[.*?\\]");

    private final String userAgent;
    private final int timeoutMs;

    public WikiTableTitleSource(String userAgent, int timeoutMs) {
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
    }

    public WikiTableTitleSource() {
        this(Utils.envOrProp("VREC_USER_AGENT", DEFAULT_USER_AGENT), Utils.envOrPropInt("VREC_HTTP_TIMEOUT_MS", DEFAULT_TIMEOUT_MS));
    }

    @Override
    public Optional<Set<String>> fetchTitles(String url) {
        Document doc;
        try {
            logger.debug("Attempting to fetch URL: {}", url);
            doc = Jsoup.connect(url).userAgent(userAgent).timeout(timeoutMs).get();
        } catch (HttpStatusException e) {
            if (e.getStatusCode() == 404) {
                logger.warn("URL not found (404), skipping: {}", url);
            } else {
                logger.error("HTTP Error {} fetching {}: {}", e.getStatusCode(), url, e.getMessage());
            }
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Network/Request Error fetching {}: {}", url, e.getMessage());
            return Optional.empty();
        }
        logger.info("Processing successful fetch from: {}", url);
        try {
            return Optional.of(extractTitles(doc, url));
        } catch (RuntimeException e) {
            logger.error("Error during HTML parsing of URL {}: {}", url, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Extracts normalized titles from the wikitables of a parsed page.
     * @param doc Parsed page
     * @param url Page URL, for logging
     * @return Normalized titles, possibly empty
     */
    public Set<String> extractTitles(Document doc, String url) {
        Set<String> titles = new HashSet<>();
        Elements tables = doc.select("table.wikitable");
        if (tables.isEmpty()) {
            logger.warn("No 'wikitable' table found on {}.", url);
            return titles;
        }
        int tableIndex = 0;
        for (Element table : tables) {
            tableIndex++;
            logger.debug("Processing table {} on {}", tableIndex, url);
            Elements rows = table.select("tr");
            for (int i = 1; i < rows.size(); i++) {
                try {
                    List<Element> cells = cellsOf(rows.get(i));
                    if (cells.size() < 2) continue;
                    for (String line : cellLines(cells.get(1))) {
                        String cleaned = TitleNormalizer.normalize(line);
                        if (!cleaned.isEmpty()) {
                            logger.debug(" Found raw='{}', cleaned='{}'", line, cleaned);
                            titles.add(cleaned);
                        }
                    }
                } catch (RuntimeException e) {
                    logger.error("Error parsing row {} in table {} of URL {}: {}", i + 1, tableIndex, url, e.getMessage());
                }
            }
        }
        logger.info("Found {} unique cleaned titles on {}.", titles.size(), url);
        return titles;
    }

    private static List<Element> cellsOf(Element row) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if (child.tagName().equals("td") || child.tagName().equals("th")) cells.add(child);
        }
        return cells;
    }

    private static String[] cellLines(Element cell) {
        Element copy = cell.clone();
        copy.select("br").after("\n");
        String text = FOOTNOTE.matcher(copy.wholeText()).replaceAll("").trim();
        String[] lines = text.split("\n");
        for (int i = 0; i < lines.length; i++) lines[i] = lines[i].trim();
        return lines;
    }
}
