package com.cdlc.cli;

import com.cdlc.core.CdlCompiler;
import com.cdlc.core.CompilationResult;
import com.cdlc.core.config.ProjectConfig;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.export.GraphJsonExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compile and validate composite blocks.
 *
 * <p>Exit code 0 when every block is valid, 1 when diagnostics were reported and 2 when a
 * source or catalog file could not be read.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * cdlc validate MyLib.Controls.Sequence MyLib.Controls.Reset
 * cdlc validate library/MyLib/Controls/Sequence.mo --format json
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Compile and validate composite blocks",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProjectOptions project;

    @Parameters(
        arity = "1..*",
        description = "Qualified block names or .mo files"
    )
    List<String> targets;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: ${COMPLETION-CANDIDATES} (overrides config)"
    )
    ProjectConfig.OutputFormat format;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ProjectConfig config = project.loadConfiguration();
            CdlCompiler compiler = CdlCompiler.create(config, project.projectDir);
            ProjectConfig.OutputFormat effective = format != null ? format : config.outputFormat();

            List<Diagnostic> diagnostics = new ArrayList<>();
            for (String target : targets) {
                log.info("Validating {}", target);
                CompilationResult result = project.compile(compiler, config, target);
                diagnostics.addAll(result.diagnostics());
                if (effective == ProjectConfig.OutputFormat.TEXT) {
                    if (result.success()) {
                        out.println("✓ " + result.qualifiedName() + " is valid");
                    } else {
                        out.println("✗ " + result.qualifiedName() + ": "
                            + result.diagnostics().size() + " error(s)");
                        DiagnosticPrinter.print(out, result.diagnostics());
                    }
                }
            }

            if (effective == ProjectConfig.OutputFormat.JSON) {
                GraphJsonExporter exporter = new GraphJsonExporter();
                out.println(exporter.write(exporter.toJson(diagnostics)));
            }
            out.flush();
            return diagnostics.isEmpty() ? 0 : 1;

        } catch (UncheckedIOException e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            err.flush();
            return 2;
        }
    }
}
