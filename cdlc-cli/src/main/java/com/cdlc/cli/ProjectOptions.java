package com.cdlc.cli;

import com.cdlc.core.CdlCompiler;
import com.cdlc.core.CompilationResult;
import com.cdlc.core.config.ConfigLoader;
import com.cdlc.core.config.ProjectConfig;
import com.cdlc.core.resolver.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Options shared by the commands that compile blocks.
 */
public class ProjectOptions {

    private static final Logger log = LoggerFactory.getLogger(ProjectOptions.class);

    @Option(
        names = {"-p", "--project"},
        description = "Project directory (default: current directory)"
    )
    Path projectDir = Paths.get(".");

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: cdlc.yaml in the project directory)"
    )
    Path configPath;

    @Option(
        names = {"--no-unit-check"},
        description = "Do not require connected connectors to have the same unit"
    )
    boolean noUnitCheck;

    /**
     * Loads the project configuration.
     *
     * @return configuration, or defaults if the file is missing or invalid
     */
    ProjectConfig loadConfiguration() {
        Path path = configPath == null
            ? projectDir.resolve(ConfigLoader.DEFAULT_FILE_NAME)
            : projectDir.resolve(configPath);
        ProjectConfig config = ConfigLoader.load(path);
        if (noUnitCheck) {
            config = new ProjectConfig(config.project(), config.library(), config.catalogs(),
                new ProjectConfig.ValidationConfig(false), config.output());
        }
        return config;
    }

    /**
     * Compiles a block given by qualified name or by file path.
     *
     * <p>Arguments ending in {@code .mo} are files; they are compiled against the configured
     * library root that contains them.
     *
     * @param compiler compiler created from {@link #loadConfiguration()}
     * @param config the configuration
     * @param target qualified name or file path
     * @return compilation result
     */
    CompilationResult compile(CdlCompiler compiler, ProjectConfig config, String target) {
        if (!target.endsWith(StoragePaths.EXTENSION)) {
            return compiler.compile(target);
        }
        Path file = projectDir.resolve(target).toAbsolutePath().normalize();
        List<Path> roots = config.libraryRoots().stream()
            .map(projectDir::resolve)
            .map(p -> p.toAbsolutePath().normalize())
            .toList();
        Path root = roots.stream()
            .filter(file::startsWith)
            .findFirst()
            .orElse(roots.get(0));
        log.debug("Compiling {} against library root {}", file, root);
        return compiler.compileFile(root, file);
    }
}
