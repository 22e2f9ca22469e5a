package com.cdlc.core.expr;

import java.util.Objects;

/**
 * Value of an enumeration-typed parameter.
 *
 * @param type qualified enumeration type name
 * @param literal literal name
 */
public record EnumValue(String type, String literal) {

    public EnumValue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(literal, "literal must not be null");
    }

    @Override
    public String toString() {
        return type + "." + literal;
    }
}
