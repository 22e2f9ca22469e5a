package com.cdlc.cli;

import com.cdlc.core.CdlCompiler;
import com.cdlc.core.CompilationResult;
import com.cdlc.core.config.ProjectConfig;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.export.GraphJsonExporter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to write a compiled composite block as JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Block diagram as written
 * cdlc export MyLib.Controls.Sequence
 *
 * # Elementary instances only, connections resolved through composites
 * cdlc export MyLib.Controls.Sequence --flat -o sequence.json
 * }</pre>
 */
@Command(
    name = "export",
    description = "Write a compiled block diagram as JSON",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProjectOptions project;

    @Parameters(index = "0", description = "Qualified block name or .mo file")
    String target;

    @Option(names = {"--flat"}, description = "Export the flattened model")
    boolean flat;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    Path output;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ProjectConfig config = project.loadConfiguration();
            CdlCompiler compiler = CdlCompiler.create(config, project.projectDir);
            CompilationResult result = project.compile(compiler, config, target);
            if (!result.success()) {
                err.println("✗ " + result.qualifiedName() + " is invalid:");
                DiagnosticPrinter.print(err, result.diagnostics());
                err.flush();
                return 1;
            }

            GraphJsonExporter exporter = new GraphJsonExporter();
            ObjectNode document = flat
                ? exporter.toJson(compiler.flatten(result.block()))
                : exporter.toJson(result.block());
            String json = exporter.write(document);

            if (output == null) {
                out.println(json);
                out.flush();
            } else {
                Path file = project.projectDir.resolve(output);
                if (file.getParent() != null) {
                    Files.createDirectories(file.getParent());
                }
                Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8);
                log.info("Wrote {} to {}", result.qualifiedName(), file);
            }
            return 0;

        } catch (CdlException e) {
            err.println("✗ Export failed:");
            DiagnosticPrinter.print(err, e.getDiagnostics());
            err.flush();
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.error("Export failed", e);
            err.println("✗ Export failed: " + e.getMessage());
            err.flush();
            return 2;
        }
    }
}
