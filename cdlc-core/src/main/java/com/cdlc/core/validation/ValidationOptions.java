package com.cdlc.core.validation;

/**
 * Switches for optional validation rules.
 *
 * @param checkUnits report connections between connectors with different declared units
 */
public record ValidationOptions(
    boolean checkUnits
) {
    public static ValidationOptions defaults() {
        return new ValidationOptions(true);
    }
}
