package com.cdlc.core.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

/**
 * Utility for reading elementary block catalogs.
 *
 * <p>Uses Jackson to deserialize YAML (or JSON, which is valid YAML) into
 * {@link CatalogDefinition} records.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BlockCatalog catalog = BlockCatalog.builder()
 *     .addAll(CatalogLoader.loadProviders())
 *     .add(CatalogLoader.load(Paths.get("extra-blocks.yaml")))
 *     .build();
 * }</pre>
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    /**
     * Loads a catalog file.
     *
     * @param path path to a {@code .yaml}, {@code .yml} or {@code .json} catalog
     * @return catalog declarations
     * @throws UncheckedIOException if the file is empty or cannot be read or parsed
     */
    public static CatalogDefinition load(Path path) {
        ObjectMapper mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
            ? JSON_MAPPER
            : YAML_MAPPER;
        try {
            log.debug("Loading block catalog from: {}", path);
            CatalogDefinition definition = mapper.readValue(path.toFile(), CatalogDefinition.class);
            if (definition == null) {
                throw new UncheckedIOException(new IOException("Block catalog is empty: " + path));
            }
            log.info("Loaded {} block(s) and {} enumeration(s) from: {}",
                definition.blocks().size(), definition.enumerations().size(), path);
            return definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read block catalog: " + path, e);
        }
    }

    /**
     * Loads a catalog bundled as a classpath resource.
     *
     * @param anchor class whose class loader resolves the resource
     * @param resource absolute resource name
     * @return catalog declarations
     * @throws UncheckedIOException if the resource is missing or cannot be parsed
     */
    public static CatalogDefinition loadResource(Class<?> anchor, String resource) {
        try (InputStream in = anchor.getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Catalog resource not found: " + resource));
            }
            CatalogDefinition definition = YAML_MAPPER.readValue(in, CatalogDefinition.class);
            if (definition == null) {
                throw new UncheckedIOException(new IOException("Catalog resource is empty: " + resource));
            }
            return definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read block catalog resource: " + resource, e);
        }
    }

    /**
     * Loads the declarations of all providers registered through {@link ServiceLoader}.
     *
     * @return declarations in provider discovery order
     */
    public static List<CatalogDefinition> loadProviders() {
        List<CatalogDefinition> definitions = new ArrayList<>();
        for (CatalogProvider provider : ServiceLoader.load(CatalogProvider.class)) {
            log.debug("Loading block catalog provider: {}", provider.getId());
            definitions.add(provider.load());
        }
        return definitions;
    }
}
