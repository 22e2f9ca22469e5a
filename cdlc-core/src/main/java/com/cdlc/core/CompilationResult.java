package com.cdlc.core;

import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of compiling one composite block.
 *
 * @param qualifiedName requested block name
 * @param block validated body, or {@code null} if compilation failed
 * @param type derived block interface, or {@code null} if compilation failed
 * @param diagnostics all errors found, empty on success
 */
public record CompilationResult(
    String qualifiedName,
    CompositeBlock block,
    BlockType type,
    List<Diagnostic> diagnostics
) {
    public CompilationResult {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    static CompilationResult success(CompositeBlock block, BlockType type) {
        return new CompilationResult(block.qualifiedName(), block, type, List.of());
    }

    static CompilationResult failure(String qualifiedName, List<Diagnostic> diagnostics) {
        return new CompilationResult(qualifiedName, null, null, diagnostics);
    }

    public boolean success() {
        return block != null && diagnostics.isEmpty();
    }
}
