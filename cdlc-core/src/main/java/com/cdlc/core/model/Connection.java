package com.cdlc.core.model;

import com.cdlc.core.diagnostics.SourceLocation;

import java.util.Objects;

/**
 * Directed connection from an output-role connector to an input-role connector.
 *
 * <p>Inside a composite block, the block's own inputs act as sources and its own outputs
 * as sinks. {@code connect(a, b)} is unordered in source; the builder normalizes it.
 *
 * @param source source end
 * @param sink sink end
 * @param documentation description string of the connect statement
 * @param location position of the connect statement
 */
public record Connection(
    ConnectorRef source,
    ConnectorRef sink,
    String documentation,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public Connection {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Creates a connection without documentation or location.
     *
     * @param source source end
     * @param sink sink end
     * @return connection
     */
    public static Connection of(ConnectorRef source, ConnectorRef sink) {
        return new Connection(source, sink, null, null);
    }

    @Override
    public String toString() {
        return source + " -> " + sink;
    }
}
