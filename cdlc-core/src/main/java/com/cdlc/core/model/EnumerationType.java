package com.cdlc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Enumeration type usable for parameters, e.g.
 * {@code Buildings.Controls.OBC.CDL.Types.SimpleController}.
 *
 * @param qualifiedName qualified type name
 * @param literals literal names in declaration order
 */
public record EnumerationType(
    String qualifiedName,
    List<String> literals
) {
    /**
     * Compact constructor with validation.
     */
    public EnumerationType {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        literals = literals != null ? List.copyOf(literals) : List.of();
    }

    /**
     * Checks whether a literal belongs to this enumeration.
     *
     * @param literal literal name
     * @return true if declared
     */
    public boolean hasLiteral(String literal) {
        return literals.contains(literal);
    }
}
