package com.vrecdat.filter;

import com.vrecdat.webscrape.ReferenceTitles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filters a DAT catalog down to the entries matching a set of reference titles.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Parses the input catalog and pre-normalizes its entry names.</li>
 *   <li>Selects the best automatic match per reference title, then optionally reviews the titles left over.</li>
 *   <li>Writes the kept entries, in catalog order, under a rewritten header and confirms the count by re-reading
 *       the output.</li>
 *   <li>Writes one CSV report per source with titles that still have no kept entry.</li>
 *   <li>Logs the run summary and optionally writes it as JSON.</li>
 * </ul>
 * Missing or unparseable input and a failed catalog write are fatal and surface as {@link IOException}. A failed
 * re-read, CSV report or JSON summary is logged and the run continues.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class DatFilterService {
    private static final Logger logger = LoggerFactory.getLogger(DatFilterService.class);

    private final DatFileServiceInterface datFileService;
    private final CsvServiceInterface csvService;
    private final MatchSelector matchSelector;
    private final InteractiveReviewService reviewService;
    private final InteractionPort interactionPort;
    private final SummaryWriter summaryWriter;
    private final Clock clock;

    public DatFilterService(DatFileServiceInterface datFileService, CsvServiceInterface csvService, MatchSelector matchSelector,
                            InteractiveReviewService reviewService, InteractionPort interactionPort, SummaryWriter summaryWriter,
                            Clock clock) {
        this.datFileService = datFileService;
        this.csvService = csvService;
        this.matchSelector = matchSelector;
        this.reviewService = reviewService;
        this.interactionPort = interactionPort;
        this.summaryWriter = summaryWriter;
        this.clock = clock;
    }

    /**
     * Runs the whole filtering pipeline.
     * @param options Paths, threshold and review switch
     * @param references Reference titles from the web sources
     * @return Summary of the run
     * @throws IOException if the input cannot be read or parsed, or the output catalog cannot be written
     */
    public FilterSummary filter(FilterOptions options, ReferenceTitles references) throws IOException {
        Path input = options.input();
        if (!Files.isRegularFile(input)) {
            throw new DatFileException("Input file '" + input + "' does not exist.");
        }
        if (references.all().isEmpty()) {
            logger.warn("No valid web titles found for comparison...");
        }
        logger.info("Reading and parsing DAT file: {}", input);
        DatCatalog catalog = datFileService.parse(input);
        int originalCount = catalog.entries().size();

        logger.info("--- Pre-cleaning DAT Titles ---");
        CatalogIndex index = CatalogIndex.build(catalog.entries());

        logger.info("--- Processing Header ---");
        DatHeader header = DatHeader.rewrite(catalog.header(), LocalDate.now(clock));

        SelectionResult automatic = matchSelector.selectBestMatches(index, references.all(), options.threshold());
        SelectionSet selection = automatic.selection();
        Set<String> matchedTitles = new HashSet<>(automatic.matchedTitles());
        if (options.interactiveReview()) {
            Set<String> unmatched = difference(references.all(), matchedTitles);
            SelectionResult reviewed = reviewService.review(unmatched, selection, index, interactionPort);
            selection = reviewed.selection();
            matchedTitles.addAll(reviewed.matchedTitles());
        }

        List<CatalogEntry> kept = keptInCatalogOrder(catalog.entries(), selection);
        Set<String> unmatchedTitles = difference(references.all(), matchedTitles);
        logger.info("Final selected game count: {}", kept.size());

        logger.info("--- Writing Output Files ---");
        logger.info("Writing filtered DAT file to: {}", options.output());
        int confirmed;
        try {
            datFileService.write(options.output(), header, kept);
            confirmed = confirmCount(options.output());
        } catch (IOException e) {
            logger.error("Error writing filtered DAT file '{}': {}", options.output(), e.getMessage());
            logSummary(buildSummary(options, references, originalCount, kept.size(), matchedTitles, unmatchedTitles, -1, List.of()));
            throw e;
        }

        List<String> reports = writeReports(references, unmatchedTitles, options.output());
        FilterSummary summary = buildSummary(options, references, originalCount, kept.size(), matchedTitles, unmatchedTitles, confirmed, reports);
        logSummary(summary);
        if (options.summaryJson() != null) {
            try {
                summaryWriter.write(summary, options.summaryJson());
            } catch (IOException e) {
                logger.error("Failed to write JSON summary '{}': {}", options.summaryJson(), e.getMessage());
            }
        }
        logger.info("Operation completed.");
        return summary;
    }

    /**
     * Keeps, in catalog order, the entries whose selected instance is the catalog entry itself.
     * Catalogs repeating a name therefore contribute that name once.
     */
    static List<CatalogEntry> keptInCatalogOrder(List<CatalogEntry> catalog, SelectionSet selection) {
        List<CatalogEntry> kept = new ArrayList<>(selection.size());
        for (CatalogEntry entry : catalog) {
            if (selection.get(entry.displayName()) == entry) kept.add(entry);
        }
        return kept;
    }

    private int confirmCount(Path output) {
        logger.info("Confirming entry count in output file...");
        try {
            int count = datFileService.countEntries(output);
            logger.debug("Re-read successful. Found {} <game> elements.", count);
            return count;
        } catch (IOException e) {
            logger.error("Failed to re-read output file '{}': {}", output, e.getMessage());
            return -1;
        }
    }

    private List<String> writeReports(ReferenceTitles references, Set<String> unmatchedTitles, Path output) {
        logger.info("Checking for web titles still unmatched after review to generate CSV reports...");
        Path outputDir = output.toAbsolutePath().getParent();
        List<String> reports = new ArrayList<>();
        int sourceNumber = 0;
        for (Map.Entry<String, Set<String>> source : references.bySource().entrySet()) {
            sourceNumber++;
            Set<String> unmatchedHere = new HashSet<>(source.getValue());
            unmatchedHere.retainAll(unmatchedTitles);
            logger.debug("URL: {} - Found {} titles, {} are still unmatched.", source.getKey(), source.getValue().size(), unmatchedHere.size());
            if (unmatchedHere.isEmpty()) continue;
            try {
                Path report = csvService.writeUnmatchedReport(source.getKey(), unmatchedHere, outputDir, sourceNumber);
                reports.add(report.getFileName().toString());
            } catch (IOException | RuntimeException e) {
                logger.error("Error creating/writing CSV for {}: {}", source.getKey(), e.getMessage());
            }
        }
        if (references.all().isEmpty()) {
            logger.warn("No valid web titles found initially, no CSV files created.");
        } else if (reports.isEmpty()) {
            if (unmatchedTitles.isEmpty()) {
                logger.info("All valid web titles found resulted in a kept game match (automatically or via review), no CSV files needed or created.");
            } else {
                logger.warn("Some web titles remain unmatched, but no CSV files were created (check logs for writing errors).");
            }
        } else {
            logger.info("Created {} CSV file(s) with final unmatched titles in '{}'.", reports.size(), outputDir);
        }
        return reports;
    }

    private FilterSummary buildSummary(FilterOptions options, ReferenceTitles references, int originalCount, int keptCount,
                                       Set<String> matchedTitles, Set<String> unmatchedTitles, int confirmed, List<String> reports) {
        Map<String, Integer> perSource = new LinkedHashMap<>();
        references.bySource().forEach((url, titles) -> perSource.put(url, titles.size()));
        return new FilterSummary(
            options.input().toAbsolutePath().toString(),
            options.output().toAbsolutePath().toString(),
            originalCount,
            perSource,
            references.all().size(),
            options.threshold(),
            options.interactiveReview(),
            options.interactiveReview() ? reviewService.getLowThreshold() : null,
            keptCount,
            originalCount - keptCount,
            matchedTitles.size(),
            unmatchedTitles.size(),
            confirmed,
            reports
        );
    }

    private void logSummary(FilterSummary s) {
        logger.info("--- Final Operation Summary ---");
        logger.info(String.format("%-30s %s", "Input DAT File:", s.inputFile()));
        logger.info(String.format("%-30s %s", "Output DAT File:", s.outputFile()));
        logger.info(String.format("%-30s %7d", "Total Games in Original DAT:", s.originalGameCount()));
        logger.info("Recommended Titles (Web Sources):");
        int urlWidth = 0;
        for (String url : s.titlesPerSource().keySet()) urlWidth = Math.max(urlWidth, url.length());
        for (Map.Entry<String, Integer> source : s.titlesPerSource().entrySet()) {
            logger.info(String.format("- URL: %-" + Math.max(urlWidth, 1) + "s -> %d cleaned titles found", source.getKey(), source.getValue()));
        }
        logger.info(String.format("%-30s %7d", "Total Unique Web Titles (cleaned):", s.totalReferenceTitles()));
        logger.info(String.format("%-30s %d%% (Stage 1&2 WRatio+TSR)", "Similarity Threshold Used:", s.threshold()));
        logger.info(String.format("%-30s %s", "Primary Algorithm:", "WRatio (with TSR Tie-breaker)"));
        if (s.interactiveReview()) {
            logger.info(String.format("%-30s %d%% (WRatio & TokenSortRatio Filter)", "Interactive Low Threshold:", s.lowThreshold()));
        }
        logger.info("DAT Filtering Results:");
        logger.info(String.format("%-30s %7d (After selection & review)", "- Matching Games Kept:", s.keptGames()));
        logger.info(String.format("%-30s %7d", "- Games Removed/Not Selected:", s.removedGames()));
        logger.info("Web Titles vs DAT Comparison:");
        logger.info(String.format("%-30s %7d", "- Web Titles Matched (Game Kept):", s.matchedTitles()));
        logger.info(String.format("%-30s %7d", "- Web Titles NOT Matched (No Game Kept):", s.unmatchedTitles()));
        logger.info("--------------------------------");
        if (s.confirmedGameCount() < 0) {
            logger.warn("Could not confirm final game count due to an error during file writing or re-parsing.");
        } else if (s.confirmedGameCount() == s.keptGames()) {
            logger.info("Confirmation: Counted {} <game> entries in '{}'.", s.confirmedGameCount(), Path.of(s.outputFile()).getFileName());
        } else {
            logger.warn("Confirmation: Counted {} <game> entries in '{}'.", s.confirmedGameCount(), Path.of(s.outputFile()).getFileName());
            logger.warn("Re-read count ({}) differs from final filtered count ({}).", s.confirmedGameCount(), s.keptGames());
        }
    }

    private static Set<String> difference(Set<String> all, Set<String> minus) {
        Set<String> result = new HashSet<>(all);
        result.removeAll(minus);
        return result;
    }
}
