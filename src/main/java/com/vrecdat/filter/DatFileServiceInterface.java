package com.vrecdat.filter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for reading and writing DAT catalog files (XML, root {@code <datafile>}).
 */
public interface DatFileServiceInterface {
    /**
     * Parses a DAT file.
     * @param path Input file
     * @return Header element and entries
     * @throws DatFileException if the file is not well-formed XML or its root is not {@code <datafile>}
     * @throws IOException if the file cannot be read
     */
    DatCatalog parse(Path path) throws IOException;

    /**
     * Writes a DAT file with the given header and entries, in the given order.
     * @param path Output file
     * @param header Header to write
     * @param entries Entries to write; their original elements are copied verbatim
     * @throws IOException if the file cannot be written
     */
    void write(Path path, DatHeader header, List<CatalogEntry> entries) throws IOException;

    /**
     * Counts the {@code <game>} entries of an existing DAT file.
     * @param path DAT file
     * @return Number of entries
     * @throws IOException if the file cannot be read or parsed
     */
    int countEntries(Path path) throws IOException;
}
