package com.cdlc.core.catalog;

/**
 * Provides the elementary blocks of the CDL standard library bundled with CDLC.
 *
 * <p>Reads {@code cdl-elementary-blocks.yaml} from the classpath. The bundled set covers
 * the blocks of {@code Buildings.Controls.OBC.CDL} used by typical sequences: arithmetic,
 * logic, conversions, sources, timers and the state-holding integrator and delay blocks.
 */
public class BundledCatalogProvider implements CatalogProvider {

    public static final String ID = "cdl-elementary-blocks";
    static final String RESOURCE = "/cdl-elementary-blocks.yaml";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public CatalogDefinition load() {
        return CatalogLoader.loadResource(BundledCatalogProvider.class, RESOURCE);
    }
}
