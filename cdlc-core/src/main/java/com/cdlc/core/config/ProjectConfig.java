package com.cdlc.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a CDL project.
 *
 * <p>Loaded from {@code cdlc.yaml} in the project root. Defines where composite blocks
 * are looked up, which block catalogs are loaded and how results are reported.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Chiller plant sequences"
 *   version: "1.0.0"
 *
 * library:
 *   roots:
 *     - "./library"
 *
 * catalogs:
 *   bundled: true
 *   files:
 *     - "extra-blocks.yaml"
 *
 * validation:
 *   checkUnits: true
 *
 * output:
 *   format: text
 * }</pre>
 *
 * @param project project metadata
 * @param library composite library configuration
 * @param catalogs elementary block catalog configuration
 * @param validation validation switches
 * @param output output configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("library") LibraryConfig library,
    @JsonProperty("catalogs") CatalogConfig catalogs,
    @JsonProperty("validation") ValidationConfig validation,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Creates the default configuration: library in {@code ./library}, bundled catalog only,
     * unit checks on, text output.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ProjectInfo("project", "1.0.0", null),
            new LibraryConfig(List.of("./library")),
            new CatalogConfig(true, List.of()),
            new ValidationConfig(true),
            new OutputConfig(OutputFormat.TEXT)
        );
    }

    /**
     * Returns the library roots, falling back to the default when the section is absent.
     *
     * @return configured roots, relative to the project directory
     */
    public List<String> libraryRoots() {
        if (library == null || library.roots() == null || library.roots().isEmpty()) {
            return defaults().library().roots();
        }
        return library.roots();
    }

    public boolean bundledCatalog() {
        return catalogs == null || catalogs.bundled() == null || catalogs.bundled();
    }

    public List<String> catalogFiles() {
        return catalogs == null || catalogs.files() == null ? List.of() : catalogs.files();
    }

    public boolean checkUnits() {
        return validation == null || validation.checkUnits() == null || validation.checkUnits();
    }

    public OutputFormat outputFormat() {
        return output == null || output.format() == null ? OutputFormat.TEXT : output.format();
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Composite library configuration.
     *
     * @param roots library root directories searched in order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LibraryConfig(
        @JsonProperty("roots") List<String> roots
    ) {}

    /**
     * Elementary block catalog configuration.
     *
     * @param bundled whether catalogs registered through {@code CatalogProvider} are loaded
     * @param files additional YAML or JSON catalog files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CatalogConfig(
        @JsonProperty("bundled") Boolean bundled,
        @JsonProperty("files") List<String> files
    ) {}

    /**
     * Validation switches.
     *
     * @param checkUnits whether connected connectors must agree on their units
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("checkUnits") Boolean checkUnits
    ) {}

    /**
     * Report format of the command line.
     */
    public enum OutputFormat {
        @JsonProperty("text") TEXT,
        @JsonProperty("json") JSON
    }

    /**
     * Output configuration.
     *
     * @param format report format
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") OutputFormat format
    ) {}
}
