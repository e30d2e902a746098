package com.vrecdat.filter;

/**
 * Identity of this tool, written into rewritten DAT headers and shown by {@code --version}.
 */
public final class ToolInfo {
    private ToolInfo() {}

    public static final String NAME = "VREC DAT Filter";
    public static final String VERSION = "1.0.0";
    public static final String AUTHOR = "f3rs3n";
    public static final String HOMEPAGE = "https://github.com/f3rs3n/VREC-dat-filter";
    public static final String HEADER_SUFFIX = " (" + NAME + ")";
}
