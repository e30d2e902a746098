package com.vrecdat.filter;

import org.w3c.dom.Element;

import java.util.List;

/**
 * Parsed DAT catalog: the original {@code <header>} element (null when the file has none) and every
 * {@code <game>} entry in document order.
 */
public record DatCatalog(Element header, List<CatalogEntry> entries) {
    public DatCatalog {
        entries = List.copyOf(entries);
    }
}
