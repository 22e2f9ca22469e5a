package com.cdlc.core.resolver;

import com.cdlc.core.ast.CdlAst;
import com.cdlc.core.builder.ModelBuilder;
import com.cdlc.core.catalog.CompositeLoader;
import com.cdlc.core.catalog.ResolutionChain;
import com.cdlc.core.catalog.SymbolTable;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.parser.CdlSourceParser;
import com.cdlc.core.validation.SemanticValidator;
import com.cdlc.core.validation.ValidationOptions;
import com.cdlc.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads composite blocks on demand while other blocks are being built.
 *
 * <p>A composite is parsed, checked against the storage convention, built, validated and
 * only then registered in the symbol table. A composite that fails any step is never
 * registered, so the next request for it compiles the source again. Registered composites
 * are returned from the symbol table without recompiling.
 */
public class CompositeBlockResolver implements CompositeLoader {

    private static final Logger log = LoggerFactory.getLogger(CompositeBlockResolver.class);

    private final SymbolTable symbols;
    private final SourceProvider sources;
    private final ModelBuilder builder;
    private final SemanticValidator validator;

    /**
     * Creates a resolver and attaches it to the symbol table as its composite loader.
     *
     * @param symbols symbol table to register composites in
     * @param sources where composite sources are looked up
     * @param options validation options applied to every composite
     */
    public CompositeBlockResolver(SymbolTable symbols, SourceProvider sources, ValidationOptions options) {
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
        this.sources = Objects.requireNonNull(sources, "sources must not be null");
        this.builder = new ModelBuilder(symbols);
        this.validator = new SemanticValidator(options);
        symbols.attachLoader(this);
    }

    public SymbolTable symbols() {
        return symbols;
    }

    @Override
    public Optional<BlockType> load(String qualifiedName, ResolutionChain chain) {
        Optional<SourceFile> source = sources.find(qualifiedName);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(compile(source.get(), chain));
    }

    /**
     * Resolves a composite block by name and returns its validated body.
     *
     * @param qualifiedName composite block name
     * @return the body
     * @throws CdlException if the block is unknown, elementary or invalid
     */
    public CompositeBlock resolveComposite(String qualifiedName) {
        BlockType type = symbols.resolve(qualifiedName);
        return symbols.compositeBlock(type.qualifiedName())
            .orElseThrow(() -> CdlException.of(ErrorKind.UNKNOWN_BLOCK, null, null,
                qualifiedName + " is an elementary block, not a composite", qualifiedName));
    }

    /**
     * Compiles one file of a library.
     *
     * <p>The file must declare the block its path names under the storage convention.
     *
     * @param root library root directory
     * @param file CDL file inside {@code root}
     * @return the validated body
     * @throws CdlException if the file is misplaced or the block is invalid
     * @throws java.io.UncheckedIOException if the file cannot be read
     */
    public CompositeBlock loadFile(Path root, Path file) {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path absoluteFile = file.toAbsolutePath().normalize();
        String relative = StoragePaths.normalize(absoluteRoot.relativize(absoluteFile));
        String qualifiedName = StoragePaths.qualifiedNameOf(relative)
            .filter(name -> absoluteFile.startsWith(absoluteRoot))
            .orElseThrow(() -> CdlException.of(ErrorKind.STORAGE_CONVENTION, null, SourceLocation.ofFile(relative),
                "File " + file + " is not a CDL class file below " + root, relative));

        Optional<CompositeBlock> known = symbols.compositeBlock(qualifiedName);
        if (known.isPresent()) {
            return known.get();
        }
        SourceFile source = new SourceFile(qualifiedName, relative, FileSystemSourceProvider.read(absoluteFile));
        compile(source, ResolutionChain.empty().push(qualifiedName));
        return symbols.compositeBlock(qualifiedName).orElseThrow();
    }

    private BlockType compile(SourceFile source, ResolutionChain chain) {
        String qualifiedName = source.qualifiedName();
        SourceLocation fileLocation = SourceLocation.ofFile(source.path());
        log.debug("Compiling {} from {}", qualifiedName, source.path());
        try {
            CdlAst.StoredDefinition stored = CdlSourceParser.parse(source.content(), source.path());
            checkStorage(stored, source);

            CompositeBlock block = builder.build(stored.classDefinition(), qualifiedName, source.path(), chain);
            ValidationReport report = validator.validate(block);
            if (!report.isValid()) {
                throw new CdlException(report.diagnostics());
            }

            BlockType type = CompositeTypes.derive(block, report.dependencyGraph());
            BlockType registered = symbols.register(type, block);
            log.info("Compiled composite block {} ({} instance(s), {} connection(s))",
                qualifiedName, block.instances().size(), block.connections().size());
            return registered;
        } catch (CdlException e) {
            log.debug("Composite block {} failed with {} diagnostic(s)", qualifiedName, e.getDiagnostics().size());
            throw new CdlException(e.getDiagnostics().stream()
                .map(d -> d.withScopeIfMissing(qualifiedName).withLocationIfMissing(fileLocation))
                .toList());
        }
    }

    private static void checkStorage(CdlAst.StoredDefinition stored, SourceFile source) {
        String declared = stored.qualifiedName();
        SourceLocation location = stored.classDefinition().location();
        if (!declared.equals(source.qualifiedName())) {
            throw new CdlException(new Diagnostic(ErrorKind.STORAGE_CONVENTION, source.qualifiedName(), location,
                "File " + source.path() + " declares " + declared + " but must declare " + source.qualifiedName(),
                List.of(declared, source.qualifiedName())));
        }
        if (!StoragePaths.matches(declared, source.path())) {
            throw new CdlException(new Diagnostic(ErrorKind.STORAGE_CONVENTION, declared, location,
                "Block " + declared + " must be stored in " + StoragePaths.expectedPath(declared)
                    + ", found in " + source.path(),
                List.of(declared)));
        }
    }
}
