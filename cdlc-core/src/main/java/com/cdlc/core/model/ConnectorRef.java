package com.cdlc.core.model;

import java.util.Objects;

/**
 * One end of a connection.
 *
 * @param instance instance name (or dotted path in a flattened model); {@code null} for a
 *                 connector of the enclosing block itself
 * @param connector connector name
 * @param index 1-based array element, or {@code null} for a scalar or a whole array
 */
public record ConnectorRef(
    String instance,
    String connector,
    Integer index
) {
    /**
     * Compact constructor with validation.
     */
    public ConnectorRef {
        Objects.requireNonNull(connector, "connector must not be null");
    }

    /**
     * Creates a reference to an instance connector.
     *
     * @param instance instance name
     * @param connector connector name
     * @return reference without index
     */
    public static ConnectorRef of(String instance, String connector) {
        return new ConnectorRef(instance, connector, null);
    }

    /**
     * Creates a reference to a connector of the enclosing block.
     *
     * @param connector connector name
     * @return reference without instance
     */
    public static ConnectorRef own(String connector) {
        return new ConnectorRef(null, connector, null);
    }

    public boolean isOwn() {
        return instance == null;
    }

    /**
     * Returns a copy addressing a single array element.
     *
     * @param elementIndex 1-based index
     * @return element reference
     */
    public ConnectorRef element(Integer elementIndex) {
        return new ConnectorRef(instance, connector, elementIndex);
    }

    /**
     * Returns this reference without its index.
     *
     * @return whole-connector reference
     */
    public ConnectorRef withoutIndex() {
        return index == null ? this : new ConnectorRef(instance, connector, null);
    }

    @Override
    public String toString() {
        String base = instance == null ? connector : instance + "." + connector;
        return index == null ? base : base + "[" + index + "]";
    }
}
