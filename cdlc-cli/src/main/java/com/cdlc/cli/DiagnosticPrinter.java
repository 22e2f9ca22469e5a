package com.cdlc.cli;

import com.cdlc.core.diagnostics.Diagnostic;

import java.io.PrintWriter;
import java.util.List;

/**
 * Writes diagnostics in the compiler's text format.
 *
 * <p>One line per diagnostic: {@code <location>: <Kind> in <scope>: <message>}.
 */
final class DiagnosticPrinter {

    private DiagnosticPrinter() {
        // Utility class
    }

    static void print(PrintWriter out, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            out.println(format(diagnostic));
        }
    }

    static String format(Diagnostic diagnostic) {
        StringBuilder line = new StringBuilder();
        if (diagnostic.location() != null) {
            line.append(diagnostic.location()).append(": ");
        }
        line.append(diagnostic.kind().getDisplayName());
        if (diagnostic.scope() != null) {
            line.append(" in ").append(diagnostic.scope());
        }
        line.append(": ").append(diagnostic.message());
        return line.toString();
    }
}
