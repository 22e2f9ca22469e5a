package com.cdlc.core.catalog;

import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.Direction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CatalogLoader}.
 */
class CatalogLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_yamlCatalog_readsBlocksAndEnumerations() throws IOException {
        // Given
        Path file = tempDir.resolve("vendor-blocks.yaml");
        Files.writeString(file, """
            enumerations:
              - name: Vendor.Types.Mode
                literals: [Heating, Cooling]
            blocks:
              - name: Vendor.Blocks.Deadband
                documentation: "Vendor deadband"
                parameters:
                  - { name: mode, type: Vendor.Types.Mode, default: "Vendor.Types.Mode.Heating" }
                  - { name: width, type: Real, default: "0.5", unit: K }
                connectors:
                  - { name: u, direction: input, type: Real, unit: K }
                  - { name: y, direction: output, type: Boolean }
                directDependencies:
                  - { output: y, input: u }
            """);

        // When
        BlockCatalog catalog = BlockCatalog.builder().add(CatalogLoader.load(file)).build();

        // Then
        BlockType deadband = catalog.find("Vendor.Blocks.Deadband").orElseThrow();
        assertThat(deadband.documentation()).isEqualTo("Vendor deadband");
        assertThat(deadband.parameter("mode").orElseThrow().enumerationType()).isEqualTo("Vendor.Types.Mode");
        assertThat(deadband.parameter("width").orElseThrow().unit()).isEqualTo("K");
        assertThat(deadband.connector("u").orElseThrow().direction()).isEqualTo(Direction.INPUT);
        assertThat(catalog.enumeration("Types.Mode")).isPresent();
    }

    @Test
    void load_jsonCatalog_readsBlocks() throws IOException {
        Path file = tempDir.resolve("blocks.json");
        Files.writeString(file, """
            {
              "blocks": [
                {
                  "name": "Vendor.Blocks.Hold",
                  "connectors": [
                    { "name": "u", "direction": "input", "type": "Real" },
                    { "name": "y", "direction": "output", "type": "Real" }
                  ],
                  "comment": "ignored"
                }
              ]
            }
            """);

        CatalogDefinition definition = CatalogLoader.load(file);

        assertThat(definition.blocks()).singleElement()
            .satisfies(b -> {
                assertThat(b.name()).isEqualTo("Vendor.Blocks.Hold");
                assertThat(b.directDependencies()).isEmpty();
            });
        assertThat(definition.enumerations()).isEmpty();
    }

    @Test
    void load_missingFile_throwsUncheckedIOException() {
        assertThatThrownBy(() -> CatalogLoader.load(tempDir.resolve("missing.yaml")))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("missing.yaml");
    }

    @Test
    void load_emptyYamlFile_throwsUncheckedIOExceptionNamingFile() throws IOException {
        Path empty = tempDir.resolve("empty-blocks.yaml");
        Files.writeString(empty, "");
        Path commentsOnly = tempDir.resolve("comments-only.yml");
        Files.writeString(commentsOnly, "# no blocks yet\n");

        assertThatThrownBy(() -> CatalogLoader.load(empty))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("empty-blocks.yaml");
        assertThatThrownBy(() -> CatalogLoader.load(commentsOnly))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("comments-only.yml");
    }

    @Test
    void loadResource_missingResource_throwsUncheckedIOException() {
        assertThatThrownBy(() -> CatalogLoader.loadResource(CatalogLoaderTest.class, "/no-such-catalog.yaml"))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void serviceLoader_discoversBundledProvider() {
        ServiceLoader<CatalogProvider> loader = ServiceLoader.load(CatalogProvider.class);

        assertThat(StreamSupport.stream(loader.spliterator(), false))
            .extracting(CatalogProvider::getId)
            .contains(BundledCatalogProvider.ID);
    }

    @Test
    void loadProviders_bundledProvider_declaresCdlBlocks() {
        assertThat(CatalogLoader.loadProviders())
            .flatExtracting(CatalogDefinition::blocks)
            .extracting(CatalogDefinition.BlockEntry::name)
            .contains("Buildings.Controls.OBC.CDL.Reals.PID", "Buildings.Controls.OBC.CDL.Logical.Timer");
    }
}
