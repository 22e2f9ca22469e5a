package com.cdlc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Elementary instance of a flattened model.
 *
 * @param path dotted instance path from the root block, e.g. {@code con.gain}
 * @param type qualified elementary block name
 * @param bindings parameter values re-evaluated through the enclosing composites
 * @param tags vendor tags of the instance
 */
public record FlatInstance(
    String path,
    String type,
    List<ParameterBinding> bindings,
    List<TagPayload> tags
) {
    /**
     * Compact constructor with validation.
     */
    public FlatInstance {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
        bindings = bindings != null ? List.copyOf(bindings) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
