package com.cdlc.core.diagnostics;

/**
 * Kinds of errors reported while compiling and validating CDL.
 *
 * <p>Each kind carries the display name used in diagnostics output
 * (e.g., {@code UnconnectedInputError}).
 */
public enum ErrorKind {
    SYNTAX_ERROR("SyntaxError"),
    DUPLICATE_DECLARATION("DuplicateDeclarationError"),
    UNKNOWN_BLOCK("UnknownBlockError"),
    CYCLIC_IMPORT("CyclicImportError"),
    DUPLICATE_INSTANCE_NAME("DuplicateInstanceNameError"),
    UNKNOWN_PARAMETER("UnknownParameterError"),
    UNKNOWN_CONNECTOR("UnknownConnectorError"),
    INVALID_CONNECTION_DIRECTION("InvalidConnectionDirectionError"),
    ARRAY_DIMENSION_MISMATCH("ArrayDimensionMismatchError"),
    UNRESOLVED_DIMENSION("UnresolvedDimensionError"),
    TYPE_MISMATCH("TypeMismatchError"),
    UNCONNECTED_INPUT("UnconnectedInputError"),
    MULTIPLE_ASSIGNMENT("MultipleAssignmentError"),
    ALGEBRAIC_LOOP("AlgebraicLoopError"),
    STORAGE_CONVENTION("StorageConventionError"),
    TAG_PLACEMENT("TagPlacementError"),
    UNSUPPORTED_CONSTRUCT("UnsupportedConstructError");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name shown to users.
     *
     * @return display name, e.g. {@code AlgebraicLoopError}
     */
    public String getDisplayName() {
        return displayName;
    }
}
