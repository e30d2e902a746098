package com.vrecdat.filter;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes display titles into comparison keys.
 * <p>
 * Normalization workflow:
 * <ul>
 *   <li>Lowercases the whole title.</li>
 *   <li>Removes every bracketed group {@code [...]} and parenthesized group {@code (...)}, together with the whitespace before it.</li>
 *   <li>Strips ASCII punctuation except the hyphen, then turns hyphens into spaces.</li>
 *   <li>Collapses whitespace runs and trims.</li>
 * </ul>
 * The result is lossy on purpose: region tags, dump flags and stylistic punctuation all disappear,
 * so {@code "Foo (USA) [!]"} and {@code "foo"} produce the same key. Applying it twice changes nothing.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public final class TitleNormalizer {
    private TitleNormalizer() {}

    private static final Pattern BRACKET_GROUP = Pattern.compile("\\s*\\[[^\\]]*\\]");
    private static final Pattern PAREN_GROUP = Pattern.compile("\\s*\\([^)]*\\)");
    private static final Pattern PUNCTUATION_EXCEPT_HYPHEN = Pattern.compile("[\\p{Punct}&&[^-]]");
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    /**
     * Normalizes a display title for fuzzy comparison.
     * @param title Display title (may be null)
     * @return Normalized title, empty for null or empty input
     */
    public static String normalize(String title) {
        if (title == null || title.isEmpty()) return "";
        String text = title.toLowerCase(Locale.ROOT);
        text = BRACKET_GROUP.matcher(text).replaceAll("");
        text = PAREN_GROUP.matcher(text).replaceAll("");
        text = PUNCTUATION_EXCEPT_HYPHEN.matcher(text).replaceAll("");
        text = text.replace('-', ' ');
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
