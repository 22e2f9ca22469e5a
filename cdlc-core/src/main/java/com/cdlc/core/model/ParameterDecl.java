package com.cdlc.core.model;

import com.cdlc.core.expr.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Parameter declared by a block.
 *
 * @param name parameter name
 * @param type primitive type
 * @param enumerationType qualified enumeration name when {@code type} is ENUMERATION, else {@code null}
 * @param dimension array size expression, or {@code null} for scalars
 * @param defaultValue default binding, or {@code null} if the parameter must be bound
 * @param unit unit attribute, opaque
 * @param quantity quantity attribute, opaque
 * @param documentation description string
 * @param tags vendor tags
 */
public record ParameterDecl(
    String name,
    PrimitiveType type,
    String enumerationType,
    Expression dimension,
    Expression defaultValue,
    String unit,
    String quantity,
    String documentation,
    List<TagPayload> tags
) {
    /**
     * Compact constructor with validation.
     */
    public ParameterDecl {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (type == PrimitiveType.ENUMERATION) {
            Objects.requireNonNull(enumerationType, "enumerationType must be set for enumeration parameters");
        }
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /**
     * Creates an untagged scalar parameter.
     *
     * @param name parameter name
     * @param type primitive type
     * @param defaultValue default binding, may be {@code null}
     * @return declaration
     */
    public static ParameterDecl scalar(String name, PrimitiveType type, Expression defaultValue) {
        return new ParameterDecl(name, type, null, null, defaultValue, null, null, null, List.of());
    }

    public boolean isArray() {
        return dimension != null;
    }

    /**
     * Returns the type name as written in CDL.
     *
     * @return {@code Real}, {@code Integer}, ... or the enumeration name
     */
    public String typeName() {
        return type == PrimitiveType.ENUMERATION ? enumerationType : type.getCdlName();
    }
}
