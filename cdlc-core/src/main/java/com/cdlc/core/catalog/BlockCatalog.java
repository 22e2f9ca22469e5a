package com.cdlc.core.catalog;

import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.expr.EnumValue;
import com.cdlc.core.expr.Expression;
import com.cdlc.core.model.BlockKind;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.DirectDependency;
import com.cdlc.core.model.Direction;
import com.cdlc.core.model.EnumerationType;
import com.cdlc.core.model.ParameterDecl;
import com.cdlc.core.model.PrimitiveType;
import com.cdlc.core.parser.CdlSourceParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of elementary blocks and enumeration types.
 *
 * <p>Built once at startup from one or more {@link CatalogDefinition}s and shared,
 * read-only, by every compilation. Elementary blocks are terminal: the core never parses
 * their implementation, only the declared interface.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BlockCatalog catalog = BlockCatalog.bundled();
 * BlockType gain = catalog.find("Buildings.Controls.OBC.CDL.Reals.MultiplyByParameter").orElseThrow();
 * }</pre>
 */
public final class BlockCatalog {

    private final Map<String, BlockType> blocks;
    private final Map<String, EnumerationType> enumerations;

    private BlockCatalog(Map<String, BlockType> blocks, Map<String, EnumerationType> enumerations) {
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        this.enumerations = Collections.unmodifiableMap(new LinkedHashMap<>(enumerations));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BlockCatalog empty() {
        return builder().build();
    }

    /**
     * Builds a catalog from all {@link CatalogProvider}s registered on the classpath.
     *
     * @return catalog with the bundled elementary blocks
     */
    public static BlockCatalog bundled() {
        return builder().addAll(CatalogLoader.loadProviders()).build();
    }

    public Optional<BlockType> find(String qualifiedName) {
        return Optional.ofNullable(blocks.get(qualifiedName));
    }

    public boolean contains(String qualifiedName) {
        return blocks.containsKey(qualifiedName);
    }

    public Collection<BlockType> blocks() {
        return blocks.values();
    }

    public Collection<EnumerationType> enumerations() {
        return enumerations.values();
    }

    /**
     * Finds an enumeration type by its qualified name or by a trailing part of it.
     *
     * <p>{@code Types.SimpleController} matches
     * {@code Buildings.Controls.OBC.CDL.Types.SimpleController}.
     *
     * @param name qualified or partially qualified name
     * @return the enumeration type, or empty if none matches
     */
    public Optional<EnumerationType> enumeration(String name) {
        EnumerationType exact = enumerations.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        String suffix = "." + name;
        return enumerations.values().stream()
            .filter(e -> e.qualifiedName().endsWith(suffix))
            .findFirst();
    }

    /**
     * Resolves a reference such as {@code Types.SimpleController.PI} to an enumeration literal.
     *
     * @param reference dotted reference
     * @return the literal, or empty if the reference does not name one
     */
    public Optional<EnumValue> enumerationLiteral(String reference) {
        int dot = reference.lastIndexOf('.');
        if (dot <= 0) {
            return Optional.empty();
        }
        String literal = reference.substring(dot + 1);
        return enumeration(reference.substring(0, dot))
            .filter(e -> e.hasLiteral(literal))
            .map(e -> new EnumValue(e.qualifiedName(), literal));
    }

    /**
     * Collects catalog declarations and converts them to {@link BlockType}s.
     */
    public static final class Builder {

        private final List<CatalogDefinition> definitions = new ArrayList<>();
        private final List<BlockType> prebuilt = new ArrayList<>();

        private Builder() {
        }

        public Builder add(CatalogDefinition definition) {
            definitions.add(definition);
            return this;
        }

        public Builder addAll(Collection<CatalogDefinition> all) {
            definitions.addAll(all);
            return this;
        }

        /**
         * Adds an already constructed elementary block.
         *
         * @param blockType elementary block
         * @return this builder
         */
        public Builder add(BlockType blockType) {
            if (blockType.kind() != BlockKind.ELEMENTARY) {
                throw new IllegalArgumentException("Only elementary blocks can be added to a catalog: "
                    + blockType.qualifiedName());
            }
            prebuilt.add(blockType);
            return this;
        }

        /**
         * Builds the catalog.
         *
         * @return immutable catalog
         * @throws IllegalArgumentException if a declaration is malformed
         * @throws CdlException with {@code DUPLICATE_DECLARATION} if a block is declared twice
         *                      with different signatures
         */
        public BlockCatalog build() {
            Map<String, EnumerationType> enumerations = new LinkedHashMap<>();
            for (CatalogDefinition definition : definitions) {
                for (CatalogDefinition.EnumerationEntry entry : definition.enumerations()) {
                    require(entry.name(), "enumeration name");
                    enumerations.put(entry.name(), new EnumerationType(entry.name(), entry.literals()));
                }
            }

            Map<String, BlockType> blocks = new LinkedHashMap<>();
            for (CatalogDefinition definition : definitions) {
                for (CatalogDefinition.BlockEntry entry : definition.blocks()) {
                    put(blocks, toBlockType(entry, enumerations));
                }
            }
            for (BlockType blockType : prebuilt) {
                put(blocks, blockType);
            }
            return new BlockCatalog(blocks, enumerations);
        }

        private static void put(Map<String, BlockType> blocks, BlockType blockType) {
            BlockType existing = blocks.putIfAbsent(blockType.qualifiedName(), blockType);
            if (existing != null && !existing.hasSameSignature(blockType)) {
                throw CdlException.of(ErrorKind.DUPLICATE_DECLARATION, blockType.qualifiedName(), null,
                    "Elementary block " + blockType.qualifiedName() + " is declared twice with different signatures",
                    blockType.qualifiedName());
            }
        }

        private static BlockType toBlockType(CatalogDefinition.BlockEntry entry,
                                             Map<String, EnumerationType> enumerations) {
            String name = require(entry.name(), "block name");

            List<ParameterDecl> parameters = new ArrayList<>();
            for (CatalogDefinition.ParameterEntry p : entry.parameters()) {
                String typeName = require(p.type(), name + ": parameter type");
                PrimitiveType type = PrimitiveType.fromCdlName(typeName).orElse(null);
                String enumerationType = null;
                if (type == null) {
                    if (!enumerations.containsKey(typeName)) {
                        throw new IllegalArgumentException(name + ": unknown type '" + typeName
                            + "' of parameter " + p.name());
                    }
                    type = PrimitiveType.ENUMERATION;
                    enumerationType = typeName;
                }
                parameters.add(new ParameterDecl(
                    require(p.name(), name + ": parameter name"),
                    type,
                    enumerationType,
                    expression(p.dimension()),
                    expression(p.defaultValue()),
                    p.unit(),
                    p.quantity(),
                    p.documentation(),
                    List.of()
                ));
            }

            List<ConnectorDecl> connectors = new ArrayList<>();
            for (CatalogDefinition.ConnectorEntry c : entry.connectors()) {
                String connectorName = require(c.name(), name + ": connector name");
                PrimitiveType type = PrimitiveType.fromCdlName(require(c.type(), name + ": connector type"))
                    .filter(t -> t == PrimitiveType.REAL || t == PrimitiveType.INTEGER || t == PrimitiveType.BOOLEAN)
                    .orElseThrow(() -> new IllegalArgumentException(name + ": connector " + connectorName
                        + " must be Real, Integer or Boolean"));
                connectors.add(new ConnectorDecl(
                    connectorName,
                    direction(c.direction(), name, connectorName),
                    type,
                    expression(c.dimension()),
                    c.unit(),
                    c.quantity(),
                    c.documentation(),
                    List.of()
                ));
            }

            List<DirectDependency> dependencies = new ArrayList<>();
            for (CatalogDefinition.DependencyEntry d : entry.directDependencies()) {
                requireConnector(connectors, d.output(), Direction.OUTPUT, name);
                requireConnector(connectors, d.input(), Direction.INPUT, name);
                dependencies.add(new DirectDependency(d.output(), d.input()));
            }

            return new BlockType(name, BlockKind.ELEMENTARY, parameters, connectors, dependencies,
                entry.documentation(), List.of());
        }

        private static Direction direction(String value, String block, String connector) {
            String normalized = require(value, block + ": direction of " + connector).toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "input" -> Direction.INPUT;
                case "output" -> Direction.OUTPUT;
                default -> throw new IllegalArgumentException(block + ": direction of " + connector
                    + " must be input or output, was '" + value + "'");
            };
        }

        private static void requireConnector(List<ConnectorDecl> connectors, String name, Direction direction,
                                             String block) {
            boolean found = connectors.stream()
                .anyMatch(c -> c.name().equals(name) && c.direction() == direction);
            if (!found) {
                throw new IllegalArgumentException(block + ": direct dependency refers to unknown "
                    + direction.name().toLowerCase(Locale.ROOT) + " '" + name + "'");
            }
        }

        private static Expression expression(String text) {
            return text == null || text.isBlank() ? null : CdlSourceParser.parseExpression(text);
        }

        private static String require(String value, String what) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Missing " + what + " in block catalog");
            }
            return value;
        }
    }
}
