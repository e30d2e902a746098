package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Catalog entries together with their pre-computed normalized names.
 * <p>
 * Entries whose name normalizes to an empty string are kept in {@link #entries()} (they still count towards
 * the catalog size) but are left out of {@link #indexedEntries()}, so they can never be matched.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public final class CatalogIndex {
    private static final Logger logger = LoggerFactory.getLogger(CatalogIndex.class);

    /**
     * A catalog entry, its normalized name and its position in the catalog.
     */
    public record IndexedEntry(CatalogEntry entry, String normalizedName, int position) {}

    private final List<CatalogEntry> entries;
    private final List<IndexedEntry> indexed;

    private CatalogIndex(List<CatalogEntry> entries, List<IndexedEntry> indexed) {
        this.entries = entries;
        this.indexed = indexed;
    }

    /**
     * Normalizes every entry name once.
     * @param entries Catalog entries in catalog order
     * @return Index over the entries
     */
    public static CatalogIndex build(List<CatalogEntry> entries) {
        List<CatalogEntry> all = List.copyOf(entries);
        List<IndexedEntry> indexed = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) {
            CatalogEntry entry = all.get(i);
            String normalized = TitleNormalizer.normalize(entry.displayName());
            if (!normalized.isEmpty()) indexed.add(new IndexedEntry(entry, normalized, i));
        }
        logger.info("Pre-cleaned {} non-empty DAT titles.", indexed.size());
        return new CatalogIndex(all, Collections.unmodifiableList(indexed));
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    public List<IndexedEntry> indexedEntries() {
        return indexed;
    }

    public int size() {
        return entries.size();
    }
}
