package com.vrecdat.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of catalog entries chosen for the output catalog, keyed by display name.
 * <p>
 * A selection only ever grows: each stage takes the previous selection, extends it through a {@link Builder}
 * and hands the new value on. Adding a name that is already present is a no-op, so the output can never
 * contain two entries with the same display name.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public final class SelectionSet {
    private static final SelectionSet EMPTY = new SelectionSet(new LinkedHashMap<>());

    private final Map<String, CatalogEntry> entries;

    private SelectionSet(LinkedHashMap<String, CatalogEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static SelectionSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder(new LinkedHashMap<>());
    }

    public Builder toBuilder() {
        return new Builder(new LinkedHashMap<>(entries));
    }

    public boolean contains(String displayName) {
        return entries.containsKey(displayName);
    }

    /**
     * @return The kept entry for the name, or null
     */
    public CatalogEntry get(String displayName) {
        return entries.get(displayName);
    }

    public Set<String> names() {
        return entries.keySet();
    }

    /**
     * @return Entries in the order they were selected
     */
    public List<CatalogEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Accumulates entries for a new {@link SelectionSet}.
     */
    public static final class Builder {
        private final LinkedHashMap<String, CatalogEntry> entries;

        private Builder(LinkedHashMap<String, CatalogEntry> entries) {
            this.entries = entries;
        }

        /**
         * @return true if the entry was not selected before
         */
        public boolean add(CatalogEntry entry) {
            return entries.putIfAbsent(entry.displayName(), entry) == null;
        }

        /**
         * Adds a whole bundle.
         * @return Number of entries that were not selected before
         */
        public int addAll(Collection<CatalogEntry> bundle) {
            int added = 0;
            for (CatalogEntry entry : bundle) {
                if (add(entry)) added++;
            }
            return added;
        }

        public boolean contains(String displayName) {
            return entries.containsKey(displayName);
        }

        public SelectionSet build() {
            return new SelectionSet(new LinkedHashMap<>(entries));
        }
    }
}
