package com.cdlc.cli;

import com.cdlc.core.CdlCompiler;
import com.cdlc.core.config.ProjectConfig;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.EnumerationType;
import com.cdlc.core.resolver.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command to list elementary blocks, enumerations or the composite blocks of the library.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * cdlc list blocks
 * cdlc list enumerations
 * cdlc list composites
 * }</pre>
 */
@Command(
    name = "list",
    description = "List elementary blocks, enumerations or library composites",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ProjectOptions project;

    @Parameters(
        index = "0",
        description = "Type to list: blocks, enumerations, or composites"
    )
    String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            ProjectConfig config = project.loadConfiguration();
            int status = switch (type.toLowerCase()) {
                case "blocks", "block" -> listBlocks(out, CdlCompiler.create(config, project.projectDir));
                case "enumerations", "enumeration" -> listEnumerations(out,
                    CdlCompiler.create(config, project.projectDir));
                case "composites", "composite" -> listComposites(out, config);
                default -> {
                    log.error("Unknown type: {}. Use: blocks, enumerations, or composites", type);
                    yield 1;
                }
            };
            out.flush();
            return status;
        } catch (UncheckedIOException e) {
            log.error("Listing failed", e);
            spec.commandLine().getErr().println("✗ Listing failed: " + e.getMessage());
            return 2;
        }
    }

    private int listBlocks(PrintWriter out, CdlCompiler compiler) {
        out.println("Elementary Blocks:");
        out.println();
        List<BlockType> blocks = compiler.catalog().blocks().stream()
            .sorted(Comparator.comparing(BlockType::qualifiedName))
            .toList();
        for (BlockType block : blocks) {
            out.printf("  • %s%n", block.qualifiedName());
            out.printf("    Inputs: %s%n", names(block.inputs()));
            out.printf("    Outputs: %s%n", names(block.outputs()));
        }
        if (blocks.isEmpty()) {
            out.println("  No blocks found.");
        }
        return 0;
    }

    private int listEnumerations(PrintWriter out, CdlCompiler compiler) {
        out.println("Enumerations:");
        out.println();
        List<EnumerationType> enumerations = compiler.catalog().enumerations().stream()
            .sorted(Comparator.comparing(EnumerationType::qualifiedName))
            .toList();
        for (EnumerationType enumeration : enumerations) {
            out.printf("  • %s %s%n", enumeration.qualifiedName(), enumeration.literals());
        }
        if (enumerations.isEmpty()) {
            out.println("  No enumerations found.");
        }
        return 0;
    }

    private int listComposites(PrintWriter out, ProjectConfig config) {
        out.println("Library Composites:");
        out.println();
        boolean found = false;
        for (String configured : config.libraryRoots()) {
            Path root = project.projectDir.resolve(configured).normalize();
            if (!Files.isDirectory(root)) {
                log.warn("Library root not found: {}", root);
                continue;
            }
            for (String name : composites(root)) {
                found = true;
                out.printf("  • %s%n", name);
            }
        }
        if (!found) {
            out.println("  No composites found.");
        }
        return 0;
    }

    private static List<String> composites(Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .map(file -> StoragePaths.qualifiedNameOf(StoragePaths.normalize(root.relativize(file))))
                .flatMap(Optional::stream)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list library root " + root, e);
        }
    }

    private static String names(List<ConnectorDecl> connectors) {
        return connectors.isEmpty()
            ? "-"
            : connectors.stream().map(ConnectorDecl::name).collect(Collectors.joining(", "));
    }
}
