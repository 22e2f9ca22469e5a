package com.cdlc.core.model;

import java.util.Objects;

/**
 * Declares that an output's value depends on an input within the same evaluation instant.
 *
 * <p>State-holding blocks (delays, integrators) declare no such pairs, which is what
 * makes feedback through them legal.
 *
 * @param output output connector name
 * @param input input connector name
 */
public record DirectDependency(
    String output,
    String input
) {
    /**
     * Compact constructor with validation.
     */
    public DirectDependency {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(input, "input must not be null");
    }
}
