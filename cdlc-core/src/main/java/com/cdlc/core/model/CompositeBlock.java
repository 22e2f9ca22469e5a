package com.cdlc.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Block built from instances and connections, loaded from one CDL source file.
 *
 * <p>Owns its instances and connections exclusively. Immutable; once it passes
 * validation it is registered in the symbol table and never rebuilt.
 *
 * @param qualifiedName qualified name, matching the storage path
 * @param documentation description string
 * @param parameters parameters of the block itself
 * @param parameterBindings values of the block's own parameters (defaults)
 * @param connectors exposed connectors
 * @param connectorSizes element counts of exposed array connectors
 * @param instances instances in declaration order
 * @param connections connections in source order
 * @param tags block-level vendor tags
 * @param sourcePath path the block was loaded from
 */
public record CompositeBlock(
    String qualifiedName,
    String documentation,
    List<ParameterDecl> parameters,
    List<ParameterBinding> parameterBindings,
    List<ConnectorDecl> connectors,
    Map<String, Integer> connectorSizes,
    List<Instance> instances,
    List<Connection> connections,
    List<TagPayload> tags,
    String sourcePath
) {
    /**
     * Compact constructor with validation.
     */
    public CompositeBlock {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        parameterBindings = parameterBindings != null ? List.copyOf(parameterBindings) : List.of();
        connectors = connectors != null ? List.copyOf(connectors) : List.of();
        connectorSizes = connectorSizes != null ? Map.copyOf(connectorSizes) : Map.of();
        instances = instances != null ? List.copyOf(instances) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public Optional<Instance> instance(String name) {
        return instances.stream().filter(i -> i.name().equals(name)).findFirst();
    }

    public Optional<ConnectorDecl> connector(String name) {
        return connectors.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<ConnectorDecl> inputs() {
        return connectors.stream().filter(ConnectorDecl::isInput).toList();
    }

    public List<ConnectorDecl> outputs() {
        return connectors.stream().filter(c -> !c.isInput()).toList();
    }

    /**
     * Returns the element count of an exposed array connector.
     *
     * @param connector connector name
     * @return element count, or empty for scalar connectors
     */
    public Optional<Integer> arraySize(String connector) {
        return Optional.ofNullable(connectorSizes.get(connector));
    }
}
