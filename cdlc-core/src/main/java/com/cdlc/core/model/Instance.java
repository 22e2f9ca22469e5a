package com.cdlc.core.model;

import com.cdlc.core.diagnostics.SourceLocation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Instance of a block inside a composite block.
 *
 * @param name instance name, unique in its enclosing scope
 * @param type shared block type
 * @param bindings one binding per declared parameter, in declaration order
 * @param connectorSizes resolved element counts of array connectors, keyed by connector name
 * @param documentation description string
 * @param tags vendor tags
 * @param protectedInstance whether declared in a {@code protected} section
 * @param location declaration position
 */
public record Instance(
    String name,
    BlockType type,
    List<ParameterBinding> bindings,
    Map<String, Integer> connectorSizes,
    String documentation,
    List<TagPayload> tags,
    boolean protectedInstance,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public Instance {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        bindings = bindings != null ? List.copyOf(bindings) : List.of();
        connectorSizes = connectorSizes != null ? Map.copyOf(connectorSizes) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public Optional<ParameterBinding> binding(String parameter) {
        return bindings.stream().filter(b -> b.name().equals(parameter)).findFirst();
    }

    /**
     * Returns the element count of an array connector.
     *
     * @param connector connector name
     * @return element count, or empty for scalar connectors
     */
    public Optional<Integer> arraySize(String connector) {
        return Optional.ofNullable(connectorSizes.get(connector));
    }
}
