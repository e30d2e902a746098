package com.vrecdat.filter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed command line of the filter.
 * <p>
 * {@code -u/--urls} takes every following argument up to the next option, so positional paths go before it or
 * after {@code --}. Usage errors are reported as {@link IllegalArgumentException}.
 *
 * @param input Input DAT file
 * @param output Output DAT file, null for the default next to the input
 * @param urls Source URLs as given
 * @param threshold Automatic matching threshold
 * @param interactiveReview Review titles without an automatic match
 * @param checkHomebrew Add {@code /Homebrew} page variants
 * @param checkJapan Add {@code /Japan} page variants
 * @param logLevel Console log level, as a logback level name
 * @param logFile Optional DEBUG log file
 * @param summaryJson Optional JSON summary file
 * @param help {@code --help} was given
 * @param version {@code --version} was given
 */
public record CommandLineOptions(Path input, Path output, List<String> urls, int threshold, boolean interactiveReview,
                                 boolean checkHomebrew, boolean checkJapan, String logLevel, Path logFile,
                                 Path summaryJson, boolean help, boolean version) {
    public static final int DEFAULT_THRESHOLD = 90;
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    private static final Map<String, String> LOG_LEVELS = Map.of(
        "DEBUG", "DEBUG",
        "INFO", "INFO",
        "WARNING", "WARN",
        "ERROR", "ERROR",
        "CRITICAL", "ERROR"
    );

    public CommandLineOptions {
        urls = List.copyOf(urls);
    }

    /**
     * Parses the arguments. {@code --help} and {@code --version} short-circuit the required-argument checks.
     * @param args Command line arguments
     * @return Parsed options
     * @throws IllegalArgumentException on unknown options, missing values or missing required arguments
     */
    public static CommandLineOptions parse(String[] args) {
        List<String> positionals = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        int threshold = DEFAULT_THRESHOLD;
        boolean interactive = false;
        boolean homebrew = false;
        boolean japan = false;
        String logLevel = DEFAULT_LOG_LEVEL;
        Path logFile = null;
        Path summaryJson = null;
        boolean help = false;
        boolean version = false;

        int i = 0;
        while (i < args.length) {
            String arg = args[i++];
            switch (arg) {
                case "-u", "--urls" -> {
                    int before = urls.size();
                    while (i < args.length && !isOption(args[i])) urls.add(args[i++]);
                    if (urls.size() == before) throw new IllegalArgumentException("argument -u/--urls: expected at least one argument");
                }
                case "-t", "--threshold" -> threshold = parseThreshold(requireValue(args, i++, arg));
                case "-ir", "--interactive-review" -> interactive = true;
                case "-hb", "--check-homebrew" -> homebrew = true;
                case "-j", "--check-japan" -> japan = true;
                case "--log-level" -> logLevel = parseLogLevel(requireValue(args, i++, arg));
                case "--log-file" -> logFile = Path.of(requireValue(args, i++, arg));
                case "--summary-json" -> summaryJson = Path.of(requireValue(args, i++, arg));
                case "-h", "--help" -> help = true;
                case "-v", "--version" -> version = true;
                case "--" -> {
                    while (i < args.length) positionals.add(args[i++]);
                }
                default -> {
                    if (isOption(arg)) throw new IllegalArgumentException("unrecognized argument: " + arg);
                    positionals.add(arg);
                }
            }
        }

        if (help || version) {
            return new CommandLineOptions(null, null, urls, threshold, interactive, homebrew, japan, logLevel, logFile, summaryJson, help, version);
        }
        if (positionals.isEmpty()) throw new IllegalArgumentException("the following arguments are required: input_file");
        if (positionals.size() > 2) throw new IllegalArgumentException("unrecognized arguments: " + String.join(" ", positionals.subList(2, positionals.size())));
        if (urls.isEmpty()) throw new IllegalArgumentException("the following arguments are required: -u/--urls");
        Path input = Path.of(positionals.get(0));
        Path output = positionals.size() > 1 ? Path.of(positionals.get(1)) : null;
        return new CommandLineOptions(input, output, urls, threshold, interactive, homebrew, japan, logLevel, logFile, summaryJson, false, false);
    }

    /**
     * @return The output path given, or {@code <input base>_filtered<ext>} next to the input
     */
    public Path resolvedOutput() {
        return output != null ? output.toAbsolutePath() : Utils.defaultOutputPath(input);
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
            "usage: vrec-dat-filter [-h] [-v] input_file [output_file] -u URL [URL ...] [-t THRESHOLD] [-ir] [-hb] [-j]",
            "                       [--log-level {DEBUG,INFO,WARNING,ERROR,CRITICAL}] [--log-file LOG_FILE]",
            "                       [--summary-json SUMMARY_JSON]",
            "",
            "Filters a DAT file based on recommended titles scraped from web pages.",
            "",
            "positional arguments:",
            "  input_file            Path to the input DAT file.",
            "  output_file           Optional path for the filtered DAT (default: <input>_filtered<ext> next to the input).",
            "",
            "options:",
            "  -h, --help            Show this help message and exit.",
            "  -v, --version         Show the version and exit.",
            "  -u, --urls URL ...    One or more source URLs with 'wikitable' tables (required).",
            "  -t, --threshold N     Similarity threshold 0-100 for automatic matches (default: " + DEFAULT_THRESHOLD + ").",
            "  -ir, --interactive-review",
            "                        Review unmatched titles against discarded games (low threshold " + InteractiveReviewService.LOW_THRESHOLD + "%).",
            "  -hb, --check-homebrew Also fetch '<url>/Homebrew' for every URL.",
            "  -j, --check-japan     Also fetch '<url>/Japan' for every URL.",
            "  --log-level LEVEL     Console log level (default: INFO).",
            "  --log-file LOG_FILE   Write DEBUG and above to this file.",
            "  --summary-json FILE   Write the run summary as JSON to this file.");
    }

    private static boolean isOption(String arg) {
        return arg.startsWith("-") && arg.length() > 1;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || isOption(args[index])) {
            throw new IllegalArgumentException("argument " + option + ": expected one argument");
        }
        return args[index];
    }

    static int parseThreshold(String raw) {
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("argument -t/--threshold: invalid int value: '" + raw + "'");
        }
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("argument -t/--threshold: must be between 0 and 100, got " + value);
        }
        return value;
    }

    static String parseLogLevel(String raw) {
        String level = LOG_LEVELS.get(raw.trim().toUpperCase(Locale.ROOT));
        if (level == null) {
            throw new IllegalArgumentException("argument --log-level: invalid choice: '" + raw + "' (choose from DEBUG, INFO, WARNING, ERROR, CRITICAL)");
        }
        return level;
    }
}
