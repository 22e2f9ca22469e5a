package com.cdlc.core.diagnostics;

import java.util.List;

/**
 * Unchecked exception carrying one or more {@link Diagnostic}s.
 *
 * <p>Thrown by the parser, the symbol table, the model builder and the resolver when a
 * block cannot be compiled. The first diagnostic determines {@link #kind()}.
 */
public class CdlException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    /**
     * Creates an exception for a list of diagnostics.
     *
     * @param diagnostics diagnostics, must not be empty
     */
    public CdlException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Creates an exception for a single diagnostic.
     *
     * @param diagnostic the diagnostic
     */
    public CdlException(Diagnostic diagnostic) {
        this(List.of(diagnostic));
    }

    /**
     * Convenience factory for a single diagnostic.
     *
     * @param kind error kind
     * @param scope qualified block name, may be {@code null}
     * @param location source position, may be {@code null}
     * @param message message
     * @param subjects identities involved
     * @return new exception
     */
    public static CdlException of(ErrorKind kind, String scope, SourceLocation location,
                                  String message, String... subjects) {
        return new CdlException(new Diagnostic(kind, scope, location, message, List.of(subjects)));
    }

    /**
     * Returns all diagnostics carried by this exception.
     *
     * @return immutable list, never empty
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Returns the kind of the first diagnostic.
     *
     * @return error kind
     */
    public ErrorKind kind() {
        return diagnostics.get(0).kind();
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            throw new IllegalArgumentException("diagnostics must not be empty");
        }
        String first = diagnostics.get(0).toString();
        return diagnostics.size() == 1 ? first : first + " (and " + (diagnostics.size() - 1) + " more)";
    }
}
