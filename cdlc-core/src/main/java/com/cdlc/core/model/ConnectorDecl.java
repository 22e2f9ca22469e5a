package com.cdlc.core.model;

import com.cdlc.core.expr.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Input or output connector declared by a block.
 *
 * @param name connector name
 * @param direction input or output
 * @param type primitive type (Real, Integer or Boolean)
 * @param dimension array size expression, or {@code null} for scalars
 * @param unit unit attribute, opaque
 * @param quantity quantity attribute, opaque
 * @param documentation description string
 * @param tags vendor tags (Haystack only)
 */
public record ConnectorDecl(
    String name,
    Direction direction,
    PrimitiveType type,
    Expression dimension,
    String unit,
    String quantity,
    String documentation,
    List<TagPayload> tags
) {
    /**
     * Compact constructor with validation.
     */
    public ConnectorDecl {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(type, "type must not be null");
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /**
     * Creates an untagged scalar connector without unit metadata.
     *
     * @param name connector name
     * @param direction direction
     * @param type primitive type
     * @return declaration
     */
    public static ConnectorDecl scalar(String name, Direction direction, PrimitiveType type) {
        return new ConnectorDecl(name, direction, type, null, null, null, null, List.of());
    }

    public boolean isArray() {
        return dimension != null;
    }

    public boolean isInput() {
        return direction == Direction.INPUT;
    }

    /**
     * Returns a copy with the given unit and quantity.
     *
     * @param newUnit unit, may be {@code null}
     * @param newQuantity quantity, may be {@code null}
     * @return updated declaration
     */
    public ConnectorDecl withUnits(String newUnit, String newQuantity) {
        return new ConnectorDecl(name, direction, type, dimension, newUnit, newQuantity, documentation, tags);
    }
}
