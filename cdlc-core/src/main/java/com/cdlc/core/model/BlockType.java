package com.cdlc.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared interface of a block: parameters, connectors and direct dependencies.
 *
 * <p>Elementary block types come from the catalog. Composite block types are derived from
 * a validated {@link CompositeBlock}. A block type is shared read-only by all its instances.
 *
 * @param qualifiedName qualified name, e.g. {@code Buildings.Controls.OBC.CDL.Reals.Add}
 * @param kind elementary or composite
 * @param parameters parameters in declaration order
 * @param connectors connectors in declaration order
 * @param directDependencies output/input pairs with same-instant dependency
 * @param documentation description string
 * @param tags block-level vendor tags
 */
public record BlockType(
    String qualifiedName,
    BlockKind kind,
    List<ParameterDecl> parameters,
    List<ConnectorDecl> connectors,
    List<DirectDependency> directDependencies,
    String documentation,
    List<TagPayload> tags
) {
    /**
     * Compact constructor with validation.
     */
    public BlockType {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        connectors = connectors != null ? List.copyOf(connectors) : List.of();
        directDependencies = directDependencies != null ? List.copyOf(directDependencies) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public Optional<ParameterDecl> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public Optional<ConnectorDecl> connector(String name) {
        return connectors.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<ConnectorDecl> inputs() {
        return connectors.stream().filter(ConnectorDecl::isInput).toList();
    }

    public List<ConnectorDecl> outputs() {
        return connectors.stream().filter(c -> !c.isInput()).toList();
    }

    public boolean isComposite() {
        return kind == BlockKind.COMPOSITE;
    }

    /**
     * Returns the last segment of the qualified name.
     *
     * @return simple name, e.g. {@code Add}
     */
    public String simpleName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }

    /**
     * Compares the parts of two block types that instances depend on.
     *
     * <p>Documentation and tags are not part of the signature.
     *
     * @param other other block type
     * @return true if kind, parameters, connectors and direct dependencies are equal
     */
    public boolean hasSameSignature(BlockType other) {
        return other != null
            && qualifiedName.equals(other.qualifiedName)
            && kind == other.kind
            && parameters.equals(other.parameters)
            && connectors.equals(other.connectors)
            && directDependencies.equals(other.directDependencies);
    }
}
