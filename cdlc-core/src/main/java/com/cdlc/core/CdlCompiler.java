package com.cdlc.core;

import com.cdlc.core.catalog.BlockCatalog;
import com.cdlc.core.catalog.CatalogLoader;
import com.cdlc.core.catalog.SymbolTable;
import com.cdlc.core.config.ProjectConfig;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.FlatModel;
import com.cdlc.core.resolver.CompositeBlockResolver;
import com.cdlc.core.resolver.FileSystemSourceProvider;
import com.cdlc.core.resolver.Flattener;
import com.cdlc.core.resolver.SourceProvider;
import com.cdlc.core.validation.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for compiling CDL composite blocks.
 *
 * <p>Combines a block catalog, a symbol table and a composite resolver. Compiled composites
 * are kept in the symbol table, so compiling a block that uses already compiled blocks only
 * builds the new one.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CdlCompiler compiler = CdlCompiler.create(ConfigLoader.loadOrDefaults(projectDir), projectDir);
 * CompilationResult result = compiler.compile("MyLib.Controls.Sequence");
 * result.diagnostics().forEach(System.out::println);
 * }</pre>
 */
public class CdlCompiler {

    private static final Logger log = LoggerFactory.getLogger(CdlCompiler.class);

    private final SymbolTable symbols;
    private final CompositeBlockResolver resolver;
    private final Flattener flattener;

    /**
     * Creates a compiler.
     *
     * @param catalog elementary blocks
     * @param sources where composite sources are looked up
     * @param options validation options
     */
    public CdlCompiler(BlockCatalog catalog, SourceProvider sources, ValidationOptions options) {
        this.symbols = new SymbolTable(catalog);
        this.resolver = new CompositeBlockResolver(symbols, sources, options);
        this.flattener = new Flattener(symbols);
    }

    /**
     * Creates a compiler from a project configuration.
     *
     * @param config project configuration
     * @param baseDir directory that relative paths in the configuration refer to
     * @return the compiler
     * @throws java.io.UncheckedIOException if a configured catalog file cannot be read
     * @throws CdlException if catalogs declare the same block differently
     */
    public static CdlCompiler create(ProjectConfig config, Path baseDir) {
        BlockCatalog.Builder catalog = BlockCatalog.builder();
        if (config.bundledCatalog()) {
            catalog.addAll(CatalogLoader.loadProviders());
        }
        for (String file : config.catalogFiles()) {
            catalog.add(CatalogLoader.load(baseDir.resolve(file)));
        }
        List<Path> roots = config.libraryRoots().stream()
            .map(baseDir::resolve)
            .map(Path::normalize)
            .toList();
        log.debug("Library roots: {}", roots);
        return new CdlCompiler(catalog.build(), new FileSystemSourceProvider(roots),
            new ValidationOptions(config.checkUnits()));
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public BlockCatalog catalog() {
        return symbols.catalog();
    }

    /**
     * Compiles a composite block and every composite it instantiates.
     *
     * @param qualifiedName composite block name
     * @return the result, with diagnostics if the block or one it uses is invalid
     * @throws java.io.UncheckedIOException if a source file cannot be read
     */
    public CompilationResult compile(String qualifiedName) {
        try {
            CompositeBlock block = resolver.resolveComposite(qualifiedName);
            return CompilationResult.success(block, typeOf(block));
        } catch (CdlException e) {
            log.debug("Compilation of {} failed: {}", qualifiedName, e.getMessage());
            return CompilationResult.failure(qualifiedName, e.getDiagnostics());
        }
    }

    /**
     * Compiles a library file given by path.
     *
     * @param root library root the file belongs to
     * @param file CDL file below {@code root}
     * @return the result, with diagnostics if the file is misplaced or the block is invalid
     * @throws java.io.UncheckedIOException if a source file cannot be read
     */
    public CompilationResult compileFile(Path root, Path file) {
        try {
            CompositeBlock block = resolver.loadFile(root, file);
            return CompilationResult.success(block, typeOf(block));
        } catch (CdlException e) {
            log.debug("Compilation of {} failed: {}", file, e.getMessage());
            return CompilationResult.failure(file.toString(), e.getDiagnostics());
        }
    }

    /**
     * Flattens a compiled composite block.
     *
     * @param block block returned in a successful {@link CompilationResult}
     * @return the flat model
     * @throws CdlException if a nested parameter cannot be evaluated
     */
    public FlatModel flatten(CompositeBlock block) {
        return flattener.flatten(block);
    }

    private BlockType typeOf(CompositeBlock block) {
        return symbols.lookup(block.qualifiedName()).orElseThrow();
    }
}
