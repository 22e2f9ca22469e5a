package com.cdlc.core.diagnostics;

import java.util.List;
import java.util.Objects;

/**
 * A single user-actionable compilation or validation error.
 *
 * @param kind error kind
 * @param scope qualified name of the block being compiled when the error was found
 * @param location source position, or {@code null} if not tied to a position
 * @param message human-readable message
 * @param subjects identities involved, e.g. {@code maxValue.u} or the nodes of a cycle
 */
public record Diagnostic(
    ErrorKind kind,
    String scope,
    SourceLocation location,
    String message,
    List<String> subjects
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        subjects = subjects != null ? List.copyOf(subjects) : List.of();
    }

    /**
     * Returns a copy positioned at {@code fallback} when this diagnostic has no location.
     *
     * @param fallback location to use
     * @return diagnostic with a location
     */
    public Diagnostic withLocationIfMissing(SourceLocation fallback) {
        if (location != null || fallback == null) {
            return this;
        }
        return new Diagnostic(kind, scope, fallback, message, subjects);
    }

    /**
     * Returns a copy attributed to {@code newScope} when this diagnostic has no scope.
     *
     * @param newScope qualified block name
     * @return diagnostic with a scope
     */
    public Diagnostic withScopeIfMissing(String newScope) {
        if (scope != null) {
            return this;
        }
        return new Diagnostic(kind, newScope, location, message, subjects);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.getDisplayName());
        if (location != null) {
            sb.append(" at ").append(location);
        }
        if (scope != null) {
            sb.append(" in ").append(scope);
        }
        return sb.append(": ").append(message).toString();
    }
}
