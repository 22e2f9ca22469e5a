package com.cdlc.core.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Serialized form of an elementary block catalog.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * blocks:
 *   - name: Buildings.Controls.OBC.CDL.Reals.MultiplyByParameter
 *     documentation: "Output the product of a gain value with the input signal"
 *     parameters:
 *       - { name: k, type: Real, default: "1" }
 *     connectors:
 *       - { name: u, direction: input, type: Real }
 *       - { name: y, direction: output, type: Real }
 *     directDependencies:
 *       - { output: y, input: u }
 *
 * enumerations:
 *   - name: Buildings.Controls.OBC.CDL.Types.SimpleController
 *     literals: [P, PI, PD, PID]
 * }</pre>
 *
 * <p>Dimensions and defaults are CDL expressions, written as strings.
 *
 * @param blocks elementary block declarations
 * @param enumerations enumeration types
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDefinition(
    @JsonProperty("blocks") List<BlockEntry> blocks,
    @JsonProperty("enumerations") List<EnumerationEntry> enumerations
) {
    public CatalogDefinition {
        blocks = blocks != null ? List.copyOf(blocks) : List.of();
        enumerations = enumerations != null ? List.copyOf(enumerations) : List.of();
    }

    /**
     * Elementary block declaration.
     *
     * @param name qualified block name
     * @param documentation description
     * @param parameters parameter declarations
     * @param connectors connector declarations
     * @param directDependencies outputs that depend on inputs within the same instant
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlockEntry(
        @JsonProperty("name") String name,
        @JsonProperty("documentation") String documentation,
        @JsonProperty("parameters") List<ParameterEntry> parameters,
        @JsonProperty("connectors") List<ConnectorEntry> connectors,
        @JsonProperty("directDependencies") List<DependencyEntry> directDependencies
    ) {
        public BlockEntry {
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            connectors = connectors != null ? List.copyOf(connectors) : List.of();
            directDependencies = directDependencies != null ? List.copyOf(directDependencies) : List.of();
        }
    }

    /**
     * Parameter declaration.
     *
     * @param name parameter name
     * @param type {@code Real}, {@code Integer}, {@code Boolean}, {@code String} or a qualified enumeration name
     * @param dimension array size expression, or {@code null}
     * @param defaultValue default expression, or {@code null}
     * @param unit unit attribute
     * @param quantity quantity attribute
     * @param documentation description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParameterEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("dimension") String dimension,
        @JsonProperty("default") String defaultValue,
        @JsonProperty("unit") String unit,
        @JsonProperty("quantity") String quantity,
        @JsonProperty("documentation") String documentation
    ) {}

    /**
     * Connector declaration.
     *
     * @param name connector name
     * @param direction {@code input} or {@code output}
     * @param type {@code Real}, {@code Integer} or {@code Boolean}
     * @param dimension array size expression, or {@code null}
     * @param unit unit attribute
     * @param quantity quantity attribute
     * @param documentation description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConnectorEntry(
        @JsonProperty("name") String name,
        @JsonProperty("direction") String direction,
        @JsonProperty("type") String type,
        @JsonProperty("dimension") String dimension,
        @JsonProperty("unit") String unit,
        @JsonProperty("quantity") String quantity,
        @JsonProperty("documentation") String documentation
    ) {}

    /**
     * Direct feedthrough from an input to an output.
     *
     * @param output output connector name
     * @param input input connector name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DependencyEntry(
        @JsonProperty("output") String output,
        @JsonProperty("input") String input
    ) {}

    /**
     * Enumeration type.
     *
     * @param name qualified enumeration name
     * @param literals literals in declaration order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EnumerationEntry(
        @JsonProperty("name") String name,
        @JsonProperty("literals") List<String> literals
    ) {}
}
