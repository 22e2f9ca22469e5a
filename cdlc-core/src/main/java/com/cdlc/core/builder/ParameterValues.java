package com.cdlc.core.builder;

import com.cdlc.core.expr.EnumValue;
import com.cdlc.core.expr.EvaluationException;
import com.cdlc.core.expr.EvaluationException.Reason;
import com.cdlc.core.model.ParameterDecl;
import com.cdlc.core.model.PrimitiveType;

import java.util.ArrayList;
import java.util.List;

/**
 * Type checks evaluated parameter values against their declarations.
 *
 * <p>An Integer value widens to Real; no other conversion is applied.
 */
final class ParameterValues {

    private ParameterValues() {
        // Utility class
    }

    /**
     * Checks and converts a value for a parameter.
     *
     * @param decl parameter declaration
     * @param value evaluated value
     * @param expectedSize evaluated array dimension, or {@code null} if unknown or scalar
     * @return the value converted to the declared type
     * @throws EvaluationException with {@link Reason#TYPE} or {@link Reason#DIMENSION}
     */
    static Object conform(ParameterDecl decl, Object value, Integer expectedSize) {
        if (!decl.isArray()) {
            if (value instanceof List<?>) {
                throw mismatch(decl, "an array");
            }
            return conformScalar(decl, value);
        }
        if (!(value instanceof List<?> list)) {
            throw mismatch(decl, describe(value));
        }
        if (expectedSize != null && list.size() != expectedSize) {
            throw new EvaluationException(Reason.DIMENSION, decl.name(),
                "Parameter " + decl.name() + " has dimension " + expectedSize + " but is bound to "
                    + list.size() + " element(s)");
        }
        List<Object> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof List<?>) {
                throw mismatch(decl, "a nested array");
            }
            result.add(conformScalar(decl, element));
        }
        return List.copyOf(result);
    }

    private static Object conformScalar(ParameterDecl decl, Object value) {
        PrimitiveType type = decl.type();
        switch (type) {
            case REAL:
                if (value instanceof Double) {
                    return value;
                }
                if (value instanceof Integer i) {
                    return i.doubleValue();
                }
                break;
            case INTEGER:
                if (value instanceof Integer) {
                    return value;
                }
                break;
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
            case STRING:
                if (value instanceof String) {
                    return value;
                }
                break;
            case ENUMERATION:
                if (value instanceof EnumValue e && e.type().equals(decl.enumerationType())) {
                    return value;
                }
                break;
            default:
                break;
        }
        throw mismatch(decl, describe(value));
    }

    private static EvaluationException mismatch(ParameterDecl decl, String actual) {
        String expected = decl.typeName() + (decl.isArray() ? "[]" : "");
        return new EvaluationException(Reason.TYPE, decl.name(),
            "Parameter " + decl.name() + " of type " + expected + " cannot be bound to " + actual);
    }

    static String describe(Object value) {
        if (value instanceof Double) {
            return "a Real value";
        }
        if (value instanceof Integer) {
            return "an Integer value";
        }
        if (value instanceof Boolean) {
            return "a Boolean value";
        }
        if (value instanceof String) {
            return "a String value";
        }
        if (value instanceof EnumValue e) {
            return "enumeration literal " + e;
        }
        if (value instanceof List<?>) {
            return "an array";
        }
        return String.valueOf(value);
    }
}
