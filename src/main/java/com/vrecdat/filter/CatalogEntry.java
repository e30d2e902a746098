package com.vrecdat.filter;

import org.w3c.dom.Element;

/**
 * Immutable record representing one entry ({@code <game>}) of a DAT catalog.
 * <p>
 * Only {@code displayName} is read by the matching workflow. {@code element} is the original DOM element with
 * all of its children and attributes; it is carried through untouched and written back verbatim.
 * Two entries with the same display name are the same entry as far as selection is concerned.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public record CatalogEntry(String displayName, Element element) {
    public CatalogEntry {
        displayName = displayName == null ? "" : displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
