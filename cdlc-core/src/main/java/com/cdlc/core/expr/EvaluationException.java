package com.cdlc.core.expr;

/**
 * Raised when an expression cannot be evaluated to a constant.
 */
public class EvaluationException extends RuntimeException {

    /**
     * Why evaluation failed.
     */
    public enum Reason {
        /** A referenced name is not declared in scope. */
        UNKNOWN_NAME,
        /** A referenced parameter is declared but has no value. */
        UNBOUND,
        /** Operand types do not fit the operator. */
        TYPE,
        /** The construct is outside the restricted expression grammar. */
        UNSUPPORTED,
        /** Out-of-range subscript or array of the wrong length. */
        DIMENSION,
        /** Arithmetic error or circular definition. */
        INVALID
    }

    private final Reason reason;
    private final String subject;

    public EvaluationException(Reason reason, String subject, String message) {
        super(message);
        this.reason = reason;
        this.subject = subject;
    }

    public EvaluationException(Reason reason, String subject, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.subject = subject;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the name or sub-expression the failure is about.
     *
     * @return subject text
     */
    public String getSubject() {
        return subject;
    }
}
