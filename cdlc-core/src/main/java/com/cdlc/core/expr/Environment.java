package com.cdlc.core.expr;

/**
 * Name lookup used by {@link ExpressionEvaluator}.
 */
@FunctionalInterface
public interface Environment {

    /**
     * Resolves a dotted name to a value.
     *
     * @param name name as written in the expression
     * @return the value, never {@code null}
     * @throws EvaluationException with {@link EvaluationException.Reason#UNKNOWN_NAME} if the
     *         name is not declared, or {@link EvaluationException.Reason#UNBOUND} if it has no value
     */
    Object lookup(String name);

    /**
     * Environment in which every name is unknown.
     *
     * @return empty environment
     */
    static Environment empty() {
        return name -> {
            throw new EvaluationException(EvaluationException.Reason.UNKNOWN_NAME, name, "Unknown name: " + name);
        };
    }
}
