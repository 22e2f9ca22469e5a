package com.cdlc.core.catalog;

import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry mapping qualified block names to block interfaces.
 *
 * <p>Elementary blocks come from an immutable {@link BlockCatalog}. Composite blocks are
 * added as they are compiled; the composite cache is the only mutable state and uses
 * insert-if-absent semantics, so independent resolutions can share one table.
 *
 * <p><b>Resolution order:</b>
 * <ol>
 *   <li>{@code CYCLIC_IMPORT} if the name is already on the resolution chain</li>
 *   <li>elementary catalog</li>
 *   <li>composite cache</li>
 *   <li>attached {@link CompositeLoader}</li>
 *   <li>{@code UNKNOWN_BLOCK}</li>
 * </ol>
 */
public class SymbolTable {

    private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

    private final BlockCatalog catalog;
    private final Map<String, BlockType> composites = new ConcurrentHashMap<>();
    private final Map<String, CompositeBlock> bodies = new ConcurrentHashMap<>();
    private volatile CompositeLoader loader;

    public SymbolTable(BlockCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    public BlockCatalog catalog() {
        return catalog;
    }

    /**
     * Attaches the loader used for names that are not yet registered.
     *
     * @param compositeLoader loader, or {@code null} to detach
     */
    public void attachLoader(CompositeLoader compositeLoader) {
        this.loader = compositeLoader;
    }

    /**
     * Registers a composite block interface.
     *
     * @param blockType composite block type
     * @return the registered type (the existing one if an identical type was registered before)
     * @throws CdlException with {@code DUPLICATE_DECLARATION} if the name is taken by a
     *                      different signature or by an elementary block
     */
    public BlockType register(BlockType blockType) {
        Objects.requireNonNull(blockType, "blockType must not be null");
        String name = blockType.qualifiedName();
        if (catalog.contains(name)) {
            throw duplicate(name, "conflicts with an elementary block of the catalog");
        }
        BlockType existing = composites.putIfAbsent(name, blockType);
        if (existing == null) {
            log.debug("Registered composite block {}", name);
            return blockType;
        }
        if (!existing.hasSameSignature(blockType)) {
            throw duplicate(name, "is already registered with a different signature");
        }
        return existing;
    }

    /**
     * Registers a composite block together with its validated body.
     *
     * @param blockType composite block type
     * @param body validated composite body
     * @return the registered type
     */
    public BlockType register(BlockType blockType, CompositeBlock body) {
        BlockType registered = register(blockType);
        bodies.putIfAbsent(blockType.qualifiedName(), body);
        return registered;
    }

    /**
     * Resolves a block by name, starting a new resolution chain.
     *
     * @param qualifiedName block name
     * @return the block type
     * @throws CdlException with {@code UNKNOWN_BLOCK} or {@code CYCLIC_IMPORT}
     */
    public BlockType resolve(String qualifiedName) {
        return resolve(qualifiedName, ResolutionChain.empty());
    }

    /**
     * Resolves a block by name within an ongoing resolution.
     *
     * @param qualifiedName block name
     * @param chain composites currently being resolved
     * @return the block type
     * @throws CdlException with {@code UNKNOWN_BLOCK} or {@code CYCLIC_IMPORT}
     */
    public BlockType resolve(String qualifiedName, ResolutionChain chain) {
        if (chain.contains(qualifiedName)) {
            List<String> cycle = new ArrayList<>(chain.path());
            cycle.add(qualifiedName);
            throw CdlException.of(ErrorKind.CYCLIC_IMPORT, chain.head(), null,
                "Block " + qualifiedName + " requires itself: " + String.join(" -> ", cycle),
                cycle.toArray(new String[0]));
        }

        Optional<BlockType> found = lookup(qualifiedName);
        if (found.isPresent()) {
            return found.get();
        }

        CompositeLoader currentLoader = loader;
        if (currentLoader != null) {
            log.debug("Loading composite block {}", qualifiedName);
            Optional<BlockType> loaded = currentLoader.load(qualifiedName, chain.push(qualifiedName));
            if (loaded.isPresent()) {
                return loaded.get();
            }
        }

        throw CdlException.of(ErrorKind.UNKNOWN_BLOCK, chain.head(), null,
            "Unknown block: " + qualifiedName, qualifiedName);
    }

    /**
     * Looks up an already known block without loading.
     *
     * @param qualifiedName block name
     * @return the block type, or empty
     */
    public Optional<BlockType> lookup(String qualifiedName) {
        Optional<BlockType> elementary = catalog.find(qualifiedName);
        if (elementary.isPresent()) {
            return elementary;
        }
        return Optional.ofNullable(composites.get(qualifiedName));
    }

    /**
     * Returns the validated body of a registered composite block.
     *
     * @param qualifiedName composite block name
     * @return the body, or empty if the block is not a registered composite
     */
    public Optional<CompositeBlock> compositeBlock(String qualifiedName) {
        return Optional.ofNullable(bodies.get(qualifiedName));
    }

    /**
     * Returns the names of all registered composite blocks.
     *
     * @return unmodifiable view
     */
    public Set<String> compositeNames() {
        return Collections.unmodifiableSet(composites.keySet());
    }

    private static CdlException duplicate(String name, String reason) {
        return CdlException.of(ErrorKind.DUPLICATE_DECLARATION, name, null,
            "Block " + name + " " + reason, name);
    }
}
