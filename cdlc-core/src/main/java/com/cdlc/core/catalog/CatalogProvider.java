package com.cdlc.core.catalog;

/**
 * Supplier of elementary block declarations.
 *
 * <p>Providers are discovered via Java Service Provider Interface (SPI) and merged into one
 * {@link BlockCatalog} at startup. The core never inspects elementary block internals; a
 * provider only declares interfaces and direct dependencies.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.cdlc.core.catalog.CatalogProvider}
 *
 * @see BundledCatalogProvider
 */
public interface CatalogProvider {

    /**
     * Returns unique identifier for this provider.
     *
     * @return provider identifier, kebab-case (e.g., "cdl-elementary-blocks")
     */
    String getId();

    /**
     * Loads the declarations of this provider.
     *
     * @return catalog declarations
     * @throws java.io.UncheckedIOException if the declarations cannot be read
     */
    CatalogDefinition load();
}
