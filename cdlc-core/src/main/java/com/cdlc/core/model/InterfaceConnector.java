package com.cdlc.core.model;

import java.util.Optional;

/**
 * The fixed set of connector types a CDL block may declare.
 *
 * <p>Connector type names must be qualified with an {@code Interfaces} package, e.g.
 * {@code Buildings.Controls.OBC.CDL.Interfaces.RealInput} or {@code CDL.Interfaces.BooleanOutput}.
 */
public enum InterfaceConnector {
    REAL_INPUT("RealInput", PrimitiveType.REAL, Direction.INPUT),
    REAL_OUTPUT("RealOutput", PrimitiveType.REAL, Direction.OUTPUT),
    INTEGER_INPUT("IntegerInput", PrimitiveType.INTEGER, Direction.INPUT),
    INTEGER_OUTPUT("IntegerOutput", PrimitiveType.INTEGER, Direction.OUTPUT),
    BOOLEAN_INPUT("BooleanInput", PrimitiveType.BOOLEAN, Direction.INPUT),
    BOOLEAN_OUTPUT("BooleanOutput", PrimitiveType.BOOLEAN, Direction.OUTPUT);

    private static final String INTERFACES_PACKAGE = "Interfaces";

    private final String simpleName;
    private final PrimitiveType type;
    private final Direction direction;

    InterfaceConnector(String simpleName, PrimitiveType type, Direction direction) {
        this.simpleName = simpleName;
        this.type = type;
        this.direction = direction;
    }

    public String getSimpleName() {
        return simpleName;
    }

    public PrimitiveType getType() {
        return type;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Recognizes a connector type name.
     *
     * @param typeName dotted type name as written in a declaration
     * @return the connector kind, or empty if {@code typeName} is not an Interfaces connector
     */
    public static Optional<InterfaceConnector> fromTypeName(String typeName) {
        String[] segments = typeName.split("\\.");
        if (segments.length < 2 || !INTERFACES_PACKAGE.equals(segments[segments.length - 2])) {
            return Optional.empty();
        }
        String last = segments[segments.length - 1];
        for (InterfaceConnector connector : values()) {
            if (connector.simpleName.equals(last)) {
                return Optional.of(connector);
            }
        }
        return Optional.empty();
    }
}
