package com.cdlc.core.resolver;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File-per-class storage convention of CDL libraries.
 *
 * <p>Block {@code A.B.C} is stored in {@code A/B/C.mo}: each package segment is a directory
 * and the class name is the file name.
 */
public final class StoragePaths {

    public static final String EXTENSION = ".mo";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private StoragePaths() {
        // Utility class
    }

    /**
     * Returns the expected relative path of a block.
     *
     * @param qualifiedName dotted block name
     * @return relative path with {@code /} separators, e.g. {@code A/B/C.mo}
     */
    public static String expectedPath(String qualifiedName) {
        return qualifiedName.replace('.', '/') + EXTENSION;
    }

    /**
     * Normalizes a relative path to {@code /} separators without a leading {@code ./}.
     *
     * @param path relative path in platform or portable notation
     * @return normalized path
     */
    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    public static String normalize(Path path) {
        return normalize(path.toString());
    }

    /**
     * Tells whether a block is stored where the convention expects it.
     *
     * @param qualifiedName declared block name
     * @param relativePath path of the file relative to its library root
     * @return {@code true} if {@code relativePath} is {@code expectedPath(qualifiedName)}
     */
    public static boolean matches(String qualifiedName, String relativePath) {
        return expectedPath(qualifiedName).equals(normalize(relativePath));
    }

    /**
     * Derives the qualified name a file must declare from its relative path.
     *
     * @param relativePath path relative to the library root
     * @return the qualified name, or empty if the path is not a valid storage path
     */
    public static Optional<String> qualifiedNameOf(String relativePath) {
        String normalized = normalize(relativePath);
        if (!normalized.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String[] segments = normalized.substring(0, normalized.length() - EXTENSION.length()).split("/");
        for (String segment : segments) {
            if (!IDENTIFIER.matcher(segment).matches()) {
                return Optional.empty();
            }
        }
        return Optional.of(String.join(".", segments));
    }
}
