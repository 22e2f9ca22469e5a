package com.cdlc.core.resolver;

import java.util.Objects;

/**
 * Source text of one CDL class, as supplied by a {@link SourceProvider}.
 *
 * @param qualifiedName name the file was looked up for
 * @param path path relative to its library root
 * @param content UTF-8 decoded file contents
 */
public record SourceFile(
    String qualifiedName,
    String path,
    String content
) {
    public SourceFile {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
