package com.cdlc.core.resolver;

import java.util.Optional;

/**
 * Supplies the source text of composite blocks by qualified name.
 *
 * <p>Implemented by package loaders outside the core; the core never walks directories.
 */
@FunctionalInterface
public interface SourceProvider {

    /**
     * Finds the source of a block.
     *
     * @param qualifiedName dotted block name
     * @return the source, or empty if the provider has no file for this name
     * @throws java.io.UncheckedIOException if the file exists but cannot be read
     */
    Optional<SourceFile> find(String qualifiedName);

    static SourceProvider none() {
        return qualifiedName -> Optional.empty();
    }
}
