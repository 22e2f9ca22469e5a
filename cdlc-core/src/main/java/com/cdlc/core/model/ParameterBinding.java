package com.cdlc.core.model;

import com.cdlc.core.expr.Expression;

import java.util.Objects;

/**
 * Resolved value of one parameter of an instance (or of a composite block itself).
 *
 * @param name parameter name
 * @param expression binding expression as written (or the declared default), {@code null} if unbound
 * @param value eagerly evaluated value, {@code null} if it depends on an unbound parameter
 * @param origin where the binding came from
 */
public record ParameterBinding(
    String name,
    Expression expression,
    Object value,
    BindingOrigin origin
) {
    /**
     * Compact constructor with validation.
     */
    public ParameterBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }

    public boolean hasValue() {
        return value != null;
    }
}
