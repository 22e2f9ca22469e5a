package com.cdlc.core.model;

import java.util.Optional;

/**
 * Primitive data types of CDL parameters and connectors.
 */
public enum PrimitiveType {
    REAL("Real"),
    INTEGER("Integer"),
    BOOLEAN("Boolean"),
    STRING("String"),
    ENUMERATION("Enumeration");

    private final String cdlName;

    PrimitiveType(String cdlName) {
        this.cdlName = cdlName;
    }

    /**
     * Returns the type name as written in CDL source.
     *
     * @return e.g. {@code Real}
     */
    public String getCdlName() {
        return cdlName;
    }

    /**
     * Maps a built-in CDL type name to a primitive type.
     *
     * <p>Enumeration types are named by their qualified enumeration name and are not
     * matched here.
     *
     * @param typeName type name as written
     * @return the primitive type, or empty if {@code typeName} is not a built-in type
     */
    public static Optional<PrimitiveType> fromCdlName(String typeName) {
        for (PrimitiveType type : values()) {
            if (type != ENUMERATION && type.cdlName.equals(typeName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
