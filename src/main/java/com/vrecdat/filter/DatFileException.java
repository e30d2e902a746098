package com.vrecdat.filter;

import java.io.IOException;

/**
 * Thrown when a DAT file cannot be read as a {@code <datafile>} catalog.
 */
public class DatFileException extends IOException {
    public DatFileException(String message) {
        super(message);
    }

    public DatFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
