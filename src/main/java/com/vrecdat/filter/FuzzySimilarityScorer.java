package com.vrecdat.filter;

import org.apache.commons.text.similarity.LongestCommonSubsequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Fuzzy similarity scorer combining several ratio flavours into a weighted ratio.
 * <p>
 * Scoring workflow:
 * <ul>
 *   <li>Both inputs are pre-processed: lowercased, non-alphanumerics replaced by spaces, trimmed.</li>
 *   <li>The basic ratio is {@code 2 * LCS / (|a| + |b|)} scaled to 0-100 (indel similarity).</li>
 *   <li>The primary score is the weighted ratio: the best of the straight, partial, token-sort and token-set
 *       ratios, with partial comparisons scaled down as the length difference grows.</li>
 *   <li>The tie-break score is the token-sort ratio, which ignores word order.</li>
 * </ul>
 * Runtime failures for a pair are logged and returned as {@link ScoreResult#failure(String)} so the caller's
 * scanning loop continues.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class FuzzySimilarityScorer implements SimilarityScorer {
    private static final Logger logger = LoggerFactory.getLogger(FuzzySimilarityScorer.class);

    private static final double UNBASE_SCALE = 0.95;
    private static final double PARTIAL_SCALE = 0.9;
    private static final double LONG_PARTIAL_SCALE = 0.6;
    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    @Override
    public ScoreResult score(String a, String b) {
        try {
            String left = preprocess(a);
            String right = preprocess(b);
            return ScoreResult.success(new MatchScore(weightedRatio(left, right), tokenSortRatio(left, right)));
        } catch (RuntimeException e) {
            logger.error("Error during fuzzy comparison between '{}' and '{}': {}", a, b, e.getMessage());
            return ScoreResult.failure(e.getMessage());
        }
    }

    static String preprocess(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append(Character.isLetterOrDigit(c) ? c : ' ');
        }
        return sb.toString().toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Weighted ratio of two pre-processed strings, 0 when either is empty.
     */
    static int weightedRatio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0;
        double lenRatio = (double) Math.max(a.length(), b.length()) / Math.min(a.length(), b.length());
        double end = rawRatio(a, b);
        if (lenRatio < 1.5) {
            if (end >= 100.0 * UNBASE_SCALE) return toScore(end);
            double tokenRatio = Math.max(rawTokenSortRatio(a, b), rawTokenSetRatio(a, b));
            return toScore(Math.max(end, tokenRatio * UNBASE_SCALE));
        }
        double partialScale = lenRatio < 8 ? PARTIAL_SCALE : LONG_PARTIAL_SCALE;
        end = Math.max(end, rawPartialRatio(a, b) * partialScale);
        // Token variants are capped below this, so they cannot raise the score
        if (end >= 100.0 * UNBASE_SCALE * partialScale) return toScore(end);
        double partialTokenRatio = Math.max(rawPartialTokenSortRatio(a, b), rawPartialTokenSetRatio(a, b));
        return toScore(Math.max(end, partialTokenRatio * UNBASE_SCALE * partialScale));
    }

    static int ratio(String a, String b) {
        return toScore(rawRatio(a, b));
    }

    static int partialRatio(String a, String b) {
        return toScore(rawPartialRatio(a, b));
    }

    static int tokenSortRatio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0;
        return toScore(rawTokenSortRatio(a, b));
    }

    static int tokenSetRatio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0;
        return toScore(rawTokenSetRatio(a, b));
    }

    private static double rawRatio(String a, String b) {
        int lenSum = a.length() + b.length();
        if (lenSum == 0) return 100.0;
        int common = LCS.apply(a, b);
        return 200.0 * common / lenSum;
    }

    // Best ratio of the shorter string against every same-length window of the longer one, edges included
    private static double rawPartialRatio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        if (a.length() == b.length()) {
            return Math.max(alignedRatio(a, b), alignedRatio(b, a));
        }
        return a.length() < b.length() ? alignedRatio(a, b) : alignedRatio(b, a);
    }

    /**
     * Only windows whose outer character occurs in {@code shorter} are scored. Dropping an outer character that
     * cannot be matched keeps the common subsequence and shortens the window, so a neighbouring window always
     * scores at least as high.
     */
    private static double alignedRatio(String shorter, String longer) {
        if (longer.contains(shorter)) return 100.0;
        int len = shorter.length();
        double best = 0.0;
        for (int end = 1; end < len; end++) {
            if (!occursIn(longer.charAt(end - 1), shorter)) continue;
            best = Math.max(best, rawRatio(shorter, longer.substring(0, end)));
        }
        for (int start = 0; start + len <= longer.length(); start++) {
            if (!occursIn(longer.charAt(start + len - 1), shorter)) continue;
            best = Math.max(best, rawRatio(shorter, longer.substring(start, start + len)));
            if (best >= 100.0) return best;
        }
        for (int start = longer.length() - len + 1; start < longer.length(); start++) {
            if (!occursIn(longer.charAt(start), shorter)) continue;
            best = Math.max(best, rawRatio(shorter, longer.substring(start)));
        }
        return best;
    }

    private static boolean occursIn(char c, String s) {
        return s.indexOf(c) >= 0;
    }

    private static double rawTokenSortRatio(String a, String b) {
        return rawRatio(sortedTokens(a), sortedTokens(b));
    }

    private static double rawPartialTokenSortRatio(String a, String b) {
        return rawPartialRatio(sortedTokens(a), sortedTokens(b));
    }

    private static double rawTokenSetRatio(String a, String b) {
        TokenSplit split = TokenSplit.of(a, b);
        if (!split.intersection.isEmpty() && (split.onlyA.isEmpty() || split.onlyB.isEmpty())) return 100.0;
        String sect = String.join(" ", split.intersection);
        String combinedA = join(sect, String.join(" ", split.onlyA));
        String combinedB = join(sect, String.join(" ", split.onlyB));
        double best = rawRatio(combinedA, combinedB);
        if (!sect.isEmpty()) {
            best = Math.max(best, Math.max(rawRatio(sect, combinedA), rawRatio(sect, combinedB)));
        }
        return best;
    }

    private static double rawPartialTokenSetRatio(String a, String b) {
        TokenSplit split = TokenSplit.of(a, b);
        if (!split.intersection.isEmpty()) return 100.0;
        return rawPartialRatio(String.join(" ", split.onlyA), String.join(" ", split.onlyB));
    }

    private static String sortedTokens(String s) {
        List<String> tokens = new ArrayList<>(Arrays.asList(s.trim().split("\\s+")));
        tokens.removeIf(String::isEmpty);
        tokens.sort(null);
        return String.join(" ", tokens);
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) return tail;
        if (tail.isEmpty()) return head;
        return head + " " + tail;
    }

    // Halves round to even
    static int toScore(double raw) {
        return (int) Math.max(0, Math.min(100, Math.rint(raw)));
    }

    private record TokenSplit(List<String> intersection, List<String> onlyA, List<String> onlyB) {
        static TokenSplit of(String a, String b) {
            TreeSet<String> left = tokenSet(a);
            TreeSet<String> right = tokenSet(b);
            List<String> common = new ArrayList<>();
            List<String> onlyLeft = new ArrayList<>();
            for (String t : left) {
                if (right.contains(t)) common.add(t);
                else onlyLeft.add(t);
            }
            List<String> onlyRight = new ArrayList<>();
            for (String t : right) {
                if (!left.contains(t)) onlyRight.add(t);
            }
            return new TokenSplit(common, onlyLeft, onlyRight);
        }

        private static TreeSet<String> tokenSet(String s) {
            TreeSet<String> tokens = new TreeSet<>(Arrays.asList(s.trim().split("\\s+")));
            tokens.remove("");
            return tokens;
        }
    }
}
