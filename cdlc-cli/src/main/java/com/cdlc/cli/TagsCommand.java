package com.cdlc.cli;

import com.cdlc.core.CdlCompiler;
import com.cdlc.core.CompilationResult;
import com.cdlc.core.config.ProjectConfig;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.Instance;
import com.cdlc.core.model.ParameterDecl;
import com.cdlc.core.model.TagPayload;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to show the semantic tags attached to a composite block and its elements.
 *
 * <p>Payloads are printed exactly as written in the source.
 */
@Command(
    name = "tags",
    description = "Show the Brick and Haystack tags of a block",
    mixinStandardHelpOptions = true
)
public class TagsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ProjectOptions project;

    @Parameters(index = "0", description = "Qualified block name or .mo file")
    String target;

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

            CompositeBlock block = result.block();
            int count = print(out, block.qualifiedName(), block.tags());
            for (ParameterDecl parameter : block.parameters()) {
                count += print(out, parameter.name(), parameter.tags());
            }
            for (ConnectorDecl connector : block.connectors()) {
                count += print(out, connector.name(), connector.tags());
            }
            for (Instance instance : block.instances()) {
                count += print(out, instance.name(), instance.tags());
            }
            if (count == 0) {
                out.println("No tags in " + block.qualifiedName());
            }
            out.flush();
            return 0;

        } catch (UncheckedIOException e) {
            err.println("✗ Reading tags failed: " + e.getMessage());
            err.flush();
            return 2;
        }
    }

    private static int print(PrintWriter out, String element, List<TagPayload> tags) {
        for (TagPayload tag : tags) {
            out.printf("%s  %s  %s%n", element, tag.kind().getKeyword(), tag.raw());
        }
        return tags.size();
    }
}
