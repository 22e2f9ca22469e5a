package com.cdlc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Block diagram with all composite instances expanded down to elementary instances.
 *
 * <p>Connections are element-wise and go from an elementary output (or an input of the
 * root block) to an elementary input (or an output of the root block).
 *
 * @param qualifiedName root block name
 * @param connectors exposed connectors of the root block
 * @param instances elementary instances in depth-first declaration order
 * @param connections element-wise connections
 */
public record FlatModel(
    String qualifiedName,
    List<ConnectorDecl> connectors,
    List<FlatInstance> instances,
    List<Connection> connections
) {
    /**
     * Compact constructor with validation.
     */
    public FlatModel {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        connectors = connectors != null ? List.copyOf(connectors) : List.of();
        instances = instances != null ? List.copyOf(instances) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
    }
}
