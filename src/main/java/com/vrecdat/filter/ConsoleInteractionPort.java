package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Terminal implementation of {@link InteractionPort}.
 * <p>
 * Prints the numbered candidates and reads one line per attempt: {@code n}, {@code 0} or an empty line skip the
 * title, a number from 1 to the candidate count selects, anything else is reported and asked again. End of input
 * (or an unreadable input stream) aborts the review.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class ConsoleInteractionPort implements InteractionPort {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleInteractionPort.class);

    private static final String SEPARATOR = "-".repeat(70);

    private final BufferedReader in;
    private final PrintStream out;
    private final int automaticThreshold;
    private final int lowThreshold;

    public ConsoleInteractionPort(BufferedReader in, PrintStream out, int automaticThreshold, int lowThreshold) {
        this.in = in;
        this.out = out;
        this.automaticThreshold = automaticThreshold;
        this.lowThreshold = lowThreshold;
    }

    public ConsoleInteractionPort(int automaticThreshold, int lowThreshold) {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out, automaticThreshold, lowThreshold);
    }

    @Override
    public ReviewDecision presentCandidates(String referenceTitle, List<MatchCandidate> rankedCandidates) {
        out.println(SEPARATOR);
        out.println();
        out.println("Reviewing Web Title: " + referenceTitle);
        out.println("(No automatic match >= " + automaticThreshold + "% was selected)");
        out.println("Potential Filtered DAT candidates (WRatio & TokenSortRatio >= " + lowThreshold + "%):");
        for (int i = 0; i < rankedCandidates.size(); i++) {
            MatchCandidate c = rankedCandidates.get(i);
            out.println("  [" + (i + 1) + "] " + c.displayName() + " (Score: " + c.primaryScore() + "%)");
        }
        out.println("  [0 or N] None of these - Keep '" + referenceTitle + "' as unmatched.");
        try {
            return readDecision(rankedCandidates.size());
        } finally {
            out.println(SEPARATOR);
        }
    }

    private ReviewDecision readDecision(int candidateCount) {
        while (true) {
            out.print("Select candidate number to keep, or 0/N to skip: ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                logger.warn("Failed to read review input: {}", e.getMessage());
                return ReviewDecision.abort();
            }
            if (line == null) {
                logger.warn("EOF detected, ending interactive review.");
                return ReviewDecision.abort();
            }
            String choice = line.trim().toLowerCase(Locale.ROOT);
            if (choice.isEmpty() || choice.equals("n") || choice.equals("0")) {
                return ReviewDecision.skip();
            }
            try {
                int selected = Integer.parseInt(choice);
                if (selected >= 1 && selected <= candidateCount) {
                    return ReviewDecision.select(selected - 1);
                }
                out.println("  Invalid choice. Please enter a number between 1 and " + candidateCount + ", or 0/N.");
            } catch (NumberFormatException e) {
                out.println("  Invalid input. Please enter a number or 'N'.");
            }
        }
    }
}
