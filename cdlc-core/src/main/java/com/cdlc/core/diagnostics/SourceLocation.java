package com.cdlc.core.diagnostics;

/**
 * Position of a construct in a CDL source file.
 *
 * @param file source file path as given to the parser (may be {@code null} for in-memory sources)
 * @param line 1-based line number, or 0 if unknown
 * @param column 0-based column, or 0 if unknown
 */
public record SourceLocation(
    String file,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        if (line < 0) {
            line = 0;
        }
        if (column < 0) {
            column = 0;
        }
    }

    /**
     * Creates a location pointing at a whole file.
     *
     * @param file source file path
     * @return location with no line information
     */
    public static SourceLocation ofFile(String file) {
        return new SourceLocation(file, 0, 0);
    }

    @Override
    public String toString() {
        String prefix = file != null ? file : "<source>";
        return line > 0 ? prefix + ":" + line + ":" + column : prefix;
    }
}
