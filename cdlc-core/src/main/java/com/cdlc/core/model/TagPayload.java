package com.cdlc.core.model;

import java.util.Objects;

/**
 * Opaque Brick or Haystack payload attached to a block, instance, parameter or connector.
 *
 * <p>The payload is never parsed; validation and dependency analysis ignore it.
 *
 * @param kind tag vocabulary
 * @param raw payload text exactly as written in the source
 */
public record TagPayload(
    TagKind kind,
    String raw
) {
    /**
     * Compact constructor with validation.
     */
    public TagPayload {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }
}
