package com.vrecdat.filter;

import com.vrecdat.webscrape.ReferenceTitleAggregator;
import com.vrecdat.webscrape.ReferenceTitles;
import com.vrecdat.webscrape.TitleSourceInterface;
import com.vrecdat.webscrape.WikiTableTitleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for the VREC DAT filter.
 * Scrapes recommended titles from web pages and filters a DAT catalog down to the matching games.
 * <p>
 * Exit codes: 0 on success, 1 on fatal errors, 2 on usage errors.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the tool against the real web sources and the terminal.
     * @param args Command-line arguments
     * @return Process exit code
     */
    public static int run(String[] args) {
        return run(args, new WikiTableTitleSource(), null);
    }

    /**
     * Runs the tool with the given collaborators.
     * @param args Command-line arguments
     * @param source Title source used for every URL
     * @param port Review decisions; null reads them from the terminal
     * @return Process exit code
     */
    static int run(String[] args, TitleSourceInterface source, InteractionPort port) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args == null ? new String[0] : args);
        } catch (IllegalArgumentException e) {
            System.err.println(CommandLineOptions.usage());
            System.err.println("vrec-dat-filter: error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (options.help()) {
            System.out.println(CommandLineOptions.usage());
            return EXIT_OK;
        }
        if (options.version()) {
            System.out.println(ToolInfo.NAME + " " + ToolInfo.VERSION);
            return EXIT_OK;
        }

        LoggingConfigurator.applyConsoleLevel(options.logLevel());
        if (options.logFile() != null) LoggingConfigurator.addFileLog(options.logFile());
        try {
            return filter(options, source, port);
        } finally {
            LoggingConfigurator.removeFileLog();
        }
    }

    private static int filter(CommandLineOptions options, TitleSourceInterface source, InteractionPort port) {
        logger.debug("Initial URLs provided: {}", options.urls());
        List<String> urls = ReferenceTitleAggregator.expandUrls(options.urls(), options.checkHomebrew(), options.checkJapan());

        Path input = options.input();
        if (!Files.isRegularFile(input)) {
            logger.error("Specified input path is not a file or does not exist: {}", input);
            return EXIT_FAILURE;
        }
        Path output = options.resolvedOutput();
        Path outputDir = output.getParent();
        if (outputDir != null && !Files.isDirectory(outputDir)) {
            try {
                Files.createDirectories(outputDir);
                logger.info("Created output directory: {}", outputDir);
            } catch (IOException e) {
                logger.error("Could not create output directory '{}': {}", outputDir, e.getMessage());
                return EXIT_FAILURE;
            }
        }

        logger.info("--- Initial Configuration ---");
        logger.info("Input File:                {}", input.toAbsolutePath());
        logger.info("Output DAT File (planned): {}", output);
        logger.info("Similarity Threshold:      {}% (WRatio+TSR)", options.threshold());
        if (options.interactiveReview()) {
            logger.info("Interactive Review:        Enabled (Low Threshold: {}% for WRatio & TokenSortRatio)", InteractiveReviewService.LOW_THRESHOLD);
        }

        ReferenceTitles references = new ReferenceTitleAggregator(source).fetchAll(urls);
        if (references.bySource().isEmpty()) {
            logger.warn("None of the {} source URL(s) could be fetched; every game will be filtered out.", urls.size());
        }

        SimilarityScorer scorer = new FuzzySimilarityScorer();
        InteractiveReviewService reviewService = new InteractiveReviewService(scorer);
        InteractionPort interactionPort = port != null ? port
            : new ConsoleInteractionPort(options.threshold(), reviewService.getLowThreshold());
        DatFilterService service = new DatFilterService(new DatFileService(), new CsvService(), new MatchSelector(scorer),
            reviewService, interactionPort, new SummaryWriter(), Clock.systemDefaultZone());
        FilterOptions filterOptions = new FilterOptions(input, output, options.threshold(), options.interactiveReview(), options.summaryJson());
        try {
            service.filter(filterOptions, references);
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Filtering process reported an error: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("CRITICAL ERROR during filtering", e);
            return EXIT_FAILURE;
        }
    }
}
