package com.cdlc.core.validation;

import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating one composite block.
 *
 * @param qualifiedName validated block
 * @param diagnostics all errors found, empty if the block is valid
 * @param dependencyGraph dependency graph the acyclicity check ran on
 */
public record ValidationReport(
    String qualifiedName,
    List<Diagnostic> diagnostics,
    DependencyGraph dependencyGraph
) {
    public ValidationReport {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics(ErrorKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
