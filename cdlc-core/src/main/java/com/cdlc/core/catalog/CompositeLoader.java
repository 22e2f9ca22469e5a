package com.cdlc.core.catalog;

import com.cdlc.core.model.BlockType;

import java.util.Optional;

/**
 * Callback that compiles a composite block on first use.
 *
 * <p>Attached to a {@link SymbolTable} by the composite block resolver.
 */
@FunctionalInterface
public interface CompositeLoader {

    /**
     * Compiles and registers the composite block {@code qualifiedName}.
     *
     * @param qualifiedName block to load
     * @param chain resolution chain that already contains {@code qualifiedName}
     * @return the registered block type, or empty if no source exists for the name
     * @throws com.cdlc.core.diagnostics.CdlException if the source exists but does not compile
     */
    Optional<BlockType> load(String qualifiedName, ResolutionChain chain);
}
