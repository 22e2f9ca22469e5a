package com.cdlc.core.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Looks up CDL sources in library root directories.
 *
 * <p>Block {@code A.B.C} is read from {@code <root>/A/B/C.mo}; roots are searched in order.
 */
public class FileSystemSourceProvider implements SourceProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSourceProvider.class);

    private final List<Path> roots;

    public FileSystemSourceProvider(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    public List<Path> roots() {
        return roots;
    }

    @Override
    public Optional<SourceFile> find(String qualifiedName) {
        String relative = StoragePaths.expectedPath(qualifiedName);
        for (Path root : roots) {
            Path file = root.resolve(relative);
            if (Files.isRegularFile(file)) {
                log.debug("Found {} at {}", qualifiedName, file);
                return Optional.of(new SourceFile(qualifiedName, relative, read(file)));
            }
        }
        return Optional.empty();
    }

    static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
