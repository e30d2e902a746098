package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects multi-part releases ({@code (Disc N)}, {@code (Disk N)}, {@code (Side N)}, {@code (Tape N)})
 * and bundles the sibling parts of a chosen first part.
 * <p>
 * Once part 1 of a title is chosen, parts 2..N of the same release travel with it: a sibling is any other
 * candidate carrying a part marker whose base name (name minus trailing marker) equals the base name of the
 * chosen part 1.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public final class MultiPartGrouper {
    private static final Logger logger = LoggerFactory.getLogger(MultiPartGrouper.class);

    private MultiPartGrouper() {}

    private static final Pattern FIRST_PART = Pattern.compile("\\((?:Disc|Disk|Side|Tape)\\s+1\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_PART = Pattern.compile("\\((?:Disc|Disk|Side|Tape)\\s+\\d+\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PART = Pattern.compile("\\s*\\((?:Disc|Disk|Side|Tape)\\s+\\d+\\)\\s*$", Pattern.CASE_INSENSITIVE);

    public static boolean isFirstPart(String name) {
        return name != null && FIRST_PART.matcher(name).find();
    }

    public static boolean isAnyPart(String name) {
        return name != null && ANY_PART.matcher(name).find();
    }

    /**
     * Removes a trailing part marker, e.g. {@code "Game (USA) (Disc 2)"} becomes {@code "Game (USA)"}.
     * @param name Display name (may be null)
     * @return Name without trailing marker, trimmed; the name itself when no trailing marker exists
     */
    public static String baseName(String name) {
        if (name == null || name.isEmpty()) return "";
        if (!TRAILING_PART.matcher(name).find()) return name;
        return TRAILING_PART.matcher(name).replaceAll("").trim();
    }

    /**
     * Collects the sibling parts of {@code primary} among {@code candidates}.
     * Returns an empty list when {@code primary} is not a first part. The primary itself is never included.
     * @param primary Chosen entry
     * @param candidates Other entries shown or scored for the same reference title
     * @return Sibling parts, in candidate order
     */
    public static List<CatalogEntry> siblingsOf(CatalogEntry primary, List<CatalogEntry> candidates) {
        List<CatalogEntry> siblings = new ArrayList<>();
        String primaryName = primary.displayName();
        if (!isFirstPart(primaryName)) return siblings;
        String primaryBase = baseName(primaryName);
        logger.debug(" -> '{}' looks like part 1. Base name for multi-part check: '{}'", primaryName, primaryBase);
        for (CatalogEntry other : candidates) {
            if (other == primary || other.displayName().equals(primaryName)) continue;
            if (isAnyPart(other.displayName()) && primaryBase.equals(baseName(other.displayName()))) {
                logger.debug("    -> Also selecting multi-part match: '{}'", other.displayName());
                siblings.add(other);
            }
        }
        return siblings;
    }
}
