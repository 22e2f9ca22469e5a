package com.cdlc.core.validation;

import com.cdlc.core.model.ConnectorRef;

import java.util.Objects;

/**
 * Node of the dependency graph: one connector of one instance, or of the block itself.
 *
 * @param instance instance name, or {@code null} for a connector of the enclosing block
 * @param connector connector name
 */
public record ConnectorNode(
    String instance,
    String connector
) {
    public ConnectorNode {
        Objects.requireNonNull(connector, "connector must not be null");
    }

    public static ConnectorNode of(ConnectorRef ref) {
        return new ConnectorNode(ref.instance(), ref.connector());
    }

    public boolean isOwn() {
        return instance == null;
    }

    @Override
    public String toString() {
        return instance == null ? connector : instance + "." + connector;
    }
}
