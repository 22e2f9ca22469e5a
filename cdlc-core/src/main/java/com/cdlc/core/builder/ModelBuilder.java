package com.cdlc.core.builder;

import com.cdlc.core.ast.CdlAst;
import com.cdlc.core.catalog.BlockCatalog;
import com.cdlc.core.catalog.ResolutionChain;
import com.cdlc.core.catalog.SymbolTable;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.expr.EvaluationException;
import com.cdlc.core.expr.Expression;
import com.cdlc.core.expr.ExpressionEvaluator;
import com.cdlc.core.model.BindingOrigin;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.EnumerationType;
import com.cdlc.core.model.Instance;
import com.cdlc.core.model.InterfaceConnector;
import com.cdlc.core.model.ParameterDecl;
import com.cdlc.core.model.PrimitiveType;
import com.cdlc.core.tags.AnnotationTagExtractor;
import com.cdlc.core.tags.TagIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the block diagram of one composite block from its syntax tree.
 *
 * <p>For every declaration the builder creates a parameter, an exposed connector or a
 * block instance. Instance types are resolved through the {@link SymbolTable}, which
 * compiles referenced composite blocks on first use. Parameter bindings are evaluated
 * eagerly; connector array sizes are computed per instance. Every {@code connect}
 * statement is resolved to a directed {@link Connection} from a source-role connector
 * (an instance output or an input of the block itself) to a sink-role connector (an
 * instance input or an output of the block itself).
 *
 * <p>Errors are collected over the whole block and reported together in one
 * {@link CdlException}. Connections touching an instance that failed to build are skipped.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelBuilder builder = new ModelBuilder(symbolTable);
 * CompositeBlock block = builder.build(file.classDefinition(), file.qualifiedName(), "A/B/C.mo");
 * }</pre>
 *
 * <p>The semantic rules on connections (types, single assignment, algebraic loops) are
 * checked afterwards by {@link com.cdlc.core.validation.SemanticValidator}.
 */
public class ModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    private static final Set<String> PARAMETER_ATTRIBUTES = Set.of(
        "unit", "quantity", "displayUnit", "min", "max", "start", "fixed", "nominal"
    );
    private static final Set<String> CONNECTOR_ATTRIBUTES = Set.of(
        "unit", "quantity", "displayUnit", "min", "max", "start", "nominal"
    );
    private static final Set<String> STRING_ATTRIBUTES = Set.of("unit", "quantity", "displayUnit");

    private final SymbolTable symbols;

    public ModelBuilder(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
    }

    /**
     * Builds a composite block that is not part of an ongoing resolution.
     *
     * @param definition parsed class
     * @param qualifiedName qualified name of the block
     * @param sourcePath path of the source file, for information
     * @return the block diagram
     * @throws CdlException with all structural errors found
     */
    public CompositeBlock build(CdlAst.ClassDefinition definition, String qualifiedName, String sourcePath) {
        return build(definition, qualifiedName, sourcePath, ResolutionChain.empty());
    }

    /**
     * Builds a composite block within an ongoing resolution.
     *
     * @param definition parsed class
     * @param qualifiedName qualified name of the block
     * @param sourcePath path of the source file, for information
     * @param chain composites currently being resolved
     * @return the block diagram
     * @throws CdlException with all structural errors found
     */
    public CompositeBlock build(CdlAst.ClassDefinition definition, String qualifiedName, String sourcePath,
                                ResolutionChain chain) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        ResolutionChain effective = chain.contains(qualifiedName) ? chain : chain.push(qualifiedName);
        log.debug("Building composite block {}", qualifiedName);
        CompositeBlock block = new Build(definition, qualifiedName, sourcePath, effective).run();
        log.debug("Built {} with {} instance(s) and {} connection(s)",
            qualifiedName, block.instances().size(), block.connections().size());
        return block;
    }

    /**
     * Maps an evaluation failure to the error kind reported for it.
     *
     * @param e the failure
     * @param dimensionContext whether an array dimension or subscript was being evaluated
     * @return error kind
     */
    public static ErrorKind errorKind(EvaluationException e, boolean dimensionContext) {
        return switch (e.getReason()) {
            case UNKNOWN_NAME -> dimensionContext ? ErrorKind.UNRESOLVED_DIMENSION : ErrorKind.UNKNOWN_PARAMETER;
            case UNBOUND -> ErrorKind.UNRESOLVED_DIMENSION;
            case TYPE -> ErrorKind.TYPE_MISMATCH;
            case DIMENSION -> ErrorKind.ARRAY_DIMENSION_MISMATCH;
            case UNSUPPORTED, INVALID -> ErrorKind.UNSUPPORTED_CONSTRUCT;
        };
    }

    private enum Role {
        SOURCE,
        SINK
    }

    /**
     * Resolved endpoint of a connect statement.
     *
     * @param ref connector reference, with index if one was written
     * @param role whether the endpoint provides or receives a value
     * @param size array size of the whole connector, or {@code null} for scalars
     */
    private record Endpoint(ConnectorRef ref, Role role, Integer size) {

        boolean isWholeArray() {
            return size != null && ref.index() == null;
        }
    }

    /**
     * Evaluated subscript of an endpoint.
     *
     * @param value 1-based index, or {@code null} if none was written
     * @param valid whether the subscript could be resolved
     */
    private record Index(Integer value, boolean valid) {
    }

    /**
     * State of one build.
     */
    private final class Build {

        private final CdlAst.ClassDefinition definition;
        private final String qualifiedName;
        private final String sourcePath;
        private final ResolutionChain chain;
        private final BlockCatalog catalog;

        private final List<Diagnostic> errors = new ArrayList<>();
        private final Set<String> declaredNames = new HashSet<>();
        private final ParameterScope scope;

        private final List<ParameterDecl> parameters = new ArrayList<>();
        private final Map<String, SourceLocation> parameterLocations = new LinkedHashMap<>();
        private final Map<String, ConnectorDecl> connectors = new LinkedHashMap<>();
        private final Map<String, Integer> connectorSizes = new LinkedHashMap<>();
        private final Set<String> failedConnectors = new HashSet<>();
        private final Map<String, Instance> instances = new LinkedHashMap<>();
        private final Set<String> failedInstances = new HashSet<>();
        private final List<Connection> connections = new ArrayList<>();

        private TagIndex tags = TagIndex.empty();

        Build(CdlAst.ClassDefinition definition, String qualifiedName, String sourcePath, ResolutionChain chain) {
            this.definition = definition;
            this.qualifiedName = qualifiedName;
            this.sourcePath = sourcePath;
            this.chain = chain;
            this.catalog = symbols.catalog();
            this.scope = new ParameterScope(catalog);
        }

        CompositeBlock run() {
            try {
                tags = AnnotationTagExtractor.extract(definition);
            } catch (CdlException e) {
                e.getDiagnostics().forEach(d -> errors.add(d.withScopeIfMissing(qualifiedName)));
            }

            List<CdlAst.ComponentClause> parameterClauses = new ArrayList<>();
            List<CdlAst.ComponentClause> connectorClauses = new ArrayList<>();
            List<CdlAst.ComponentClause> instanceClauses = new ArrayList<>();
            for (CdlAst.ComponentClause clause : definition.components()) {
                if (!declaredNames.add(clause.name())) {
                    error(ErrorKind.DUPLICATE_INSTANCE_NAME, clause.location(),
                        "Name '" + clause.name() + "' is declared more than once in " + qualifiedName,
                        clause.name());
                    continue;
                }
                if (clause.condition() != null) {
                    error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                        "Conditional declaration of '" + clause.name() + "' (if " + clause.condition().toSource()
                            + ") is not supported", clause.name());
                    continue;
                }
                if (clause.parameter()) {
                    parameterClauses.add(clause);
                } else if (InterfaceConnector.fromTypeName(clause.typeName()).isPresent()) {
                    connectorClauses.add(clause);
                } else if (PrimitiveType.fromCdlName(clause.typeName()).isPresent()) {
                    error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                        "Variable '" + clause.name() + "' is not permitted in CDL; declare it as a parameter",
                        clause.name());
                } else {
                    instanceClauses.add(clause);
                }
            }

            parameterClauses.forEach(this::declareParameter);
            for (ParameterDecl parameter : parameters) {
                evaluate(scope, parameter.name(), parameterLocations.get(parameter.name()), parameter.name());
            }
            connectorClauses.forEach(this::declareConnector);
            instanceClauses.forEach(this::instantiate);
            definition.connections().forEach(this::connect);

            if (!errors.isEmpty()) {
                throw new CdlException(errors);
            }

            return new CompositeBlock(
                qualifiedName,
                definition.description(),
                parameters,
                scope.bindings(),
                List.copyOf(connectors.values()),
                connectorSizes,
                List.copyOf(instances.values()),
                connections,
                tags.blockTags(),
                sourcePath
            );
        }

        // --- parameters and connectors ------------------------------------------------

        private void declareParameter(CdlAst.ComponentClause clause) {
            PrimitiveType type;
            String enumerationType = null;
            Optional<PrimitiveType> primitive = PrimitiveType.fromCdlName(clause.typeName());
            if (primitive.isPresent()) {
                type = primitive.get();
            } else {
                Optional<EnumerationType> enumeration = catalog.enumeration(clause.typeName());
                if (enumeration.isEmpty()) {
                    error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                        "Parameter '" + clause.name() + "' has unsupported type " + clause.typeName(),
                        clause.name());
                    return;
                }
                type = PrimitiveType.ENUMERATION;
                enumerationType = enumeration.get().qualifiedName();
            }

            if (!isOneDimensional(clause)) {
                return;
            }

            Map<String, String> attributes = attributes(clause, PARAMETER_ATTRIBUTES, "parameter");
            ParameterDecl decl = new ParameterDecl(
                clause.name(),
                type,
                enumerationType,
                dimension(clause),
                clause.binding(),
                attributes.get("unit"),
                attributes.get("quantity"),
                clause.description(),
                tags.forElement(clause.name())
            );
            parameters.add(decl);
            parameterLocations.put(decl.name(), clause.location());
            scope.declare(decl, clause.binding(),
                clause.binding() != null ? BindingOrigin.DEFAULT : BindingOrigin.UNBOUND, null);
        }

        private void declareConnector(CdlAst.ComponentClause clause) {
            InterfaceConnector kind = InterfaceConnector.fromTypeName(clause.typeName()).orElseThrow();
            if (clause.binding() != null) {
                error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                    "Connector '" + clause.name() + "' cannot have a binding equation", clause.name());
            }

            if (!isOneDimensional(clause)) {
                failedConnectors.add(clause.name());
                return;
            }

            Map<String, String> attributes = attributes(clause, CONNECTOR_ATTRIBUTES, "connector");
            ConnectorDecl decl = new ConnectorDecl(
                clause.name(),
                kind.getDirection(),
                kind.getType(),
                dimension(clause),
                attributes.get("unit"),
                attributes.get("quantity"),
                clause.description(),
                tags.forElement(clause.name())
            );
            connectors.put(decl.name(), decl);

            if (decl.isArray()) {
                Integer size = size(scope, decl.dimension(), clause.location(), decl.name());
                if (size == null) {
                    failedConnectors.add(decl.name());
                } else {
                    connectorSizes.put(decl.name(), size);
                }
            }
        }

        private boolean isOneDimensional(CdlAst.ComponentClause clause) {
            if (clause.dimensions().size() > 1) {
                error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                    "'" + clause.name() + "' has " + clause.dimensions().size()
                        + " dimensions; only one-dimensional arrays are supported", clause.name());
                return false;
            }
            return true;
        }

        private Expression dimension(CdlAst.ComponentClause clause) {
            return clause.dimensions().isEmpty() ? null : clause.dimensions().get(0);
        }

        private Map<String, String> attributes(CdlAst.ComponentClause clause, Set<String> allowed, String what) {
            Map<String, String> result = new LinkedHashMap<>();
            for (CdlAst.Modification modification : clause.modifications()) {
                String subject = clause.name() + "." + modification.name();
                if (!allowed.contains(modification.name())) {
                    error(ErrorKind.UNKNOWN_PARAMETER, modification.location(),
                        "Unknown attribute '" + modification.name() + "' of " + what + " '" + clause.name() + "'",
                        subject);
                    continue;
                }
                if (!STRING_ATTRIBUTES.contains(modification.name())) {
                    continue;
                }
                if (modification.value() instanceof Expression.StringLiteral literal) {
                    result.put(modification.name(), literal.value());
                } else {
                    error(ErrorKind.TYPE_MISMATCH, modification.location(),
                        "Attribute '" + modification.name() + "' of '" + clause.name() + "' must be a String literal",
                        subject);
                }
            }
            return result;
        }

        // --- instances ----------------------------------------------------------------

        private void instantiate(CdlAst.ComponentClause clause) {
            String name = clause.name();
            BlockType type;
            try {
                type = symbols.resolve(clause.typeName(), chain);
            } catch (CdlException e) {
                for (Diagnostic diagnostic : e.getDiagnostics()) {
                    errors.add(diagnostic.withScopeIfMissing(qualifiedName).withLocationIfMissing(clause.location()));
                }
                failedInstances.add(name);
                return;
            }

            boolean ok = true;
            if (!clause.dimensions().isEmpty()) {
                error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                    "Arrays of block instances are not supported: " + name, name);
                ok = false;
            }
            if (clause.binding() != null) {
                error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                    "Block instance '" + name + "' cannot have a binding equation", name);
                ok = false;
            }

            Map<String, CdlAst.Modification> explicit = new LinkedHashMap<>();
            for (CdlAst.Modification modification : clause.modifications()) {
                String subject = name + "." + modification.name();
                if (type.parameter(modification.name()).isEmpty()) {
                    error(ErrorKind.UNKNOWN_PARAMETER, modification.location(),
                        "Block " + type.qualifiedName() + " has no parameter '" + modification.name() + "'", subject);
                    ok = false;
                } else if (explicit.containsKey(modification.name())) {
                    error(ErrorKind.DUPLICATE_DECLARATION, modification.location(),
                        "Parameter '" + modification.name() + "' of '" + name + "' is modified more than once", subject);
                    ok = false;
                } else if (modification.value() == null || !modification.arguments().isEmpty()) {
                    error(ErrorKind.UNSUPPORTED_CONSTRUCT, modification.location(),
                        "Parameter '" + modification.name() + "' of '" + name + "' must be bound as name=value", subject);
                    ok = false;
                } else {
                    explicit.put(modification.name(), modification);
                }
            }

            ParameterScope instanceScope = new ParameterScope(catalog);
            for (ParameterDecl parameter : type.parameters()) {
                CdlAst.Modification modification = explicit.get(parameter.name());
                if (modification != null) {
                    instanceScope.declare(parameter, modification.value(), BindingOrigin.EXPLICIT, scope);
                } else {
                    instanceScope.declare(parameter, parameter.defaultValue(),
                        parameter.defaultValue() != null ? BindingOrigin.DEFAULT : BindingOrigin.UNBOUND, null);
                }
            }
            for (ParameterDecl parameter : type.parameters()) {
                CdlAst.Modification modification = explicit.get(parameter.name());
                SourceLocation location = modification != null ? modification.location() : clause.location();
                ok &= evaluate(instanceScope, parameter.name(), location, name + "." + parameter.name());
            }

            Map<String, Integer> sizes = new LinkedHashMap<>();
            for (ConnectorDecl connector : type.connectors()) {
                if (!connector.isArray()) {
                    continue;
                }
                Integer size = size(instanceScope, connector.dimension(), clause.location(), name + "." + connector.name());
                if (size == null) {
                    ok = false;
                } else {
                    sizes.put(connector.name(), size);
                }
            }
            if (type.isComposite()) {
                Map<String, Integer> compiled = symbols.compositeBlock(type.qualifiedName())
                    .map(CompositeBlock::connectorSizes)
                    .orElse(sizes);
                if (!compiled.equals(sizes)) {
                    error(ErrorKind.UNSUPPORTED_CONSTRUCT, clause.location(),
                        "Instance '" + name + "' changes the connector sizes of composite block "
                            + type.qualifiedName() + " from " + compiled + " to " + sizes, name);
                    ok = false;
                }
            }

            if (!ok) {
                failedInstances.add(name);
                return;
            }
            instances.put(name, new Instance(
                name,
                type,
                instanceScope.bindings(),
                sizes,
                clause.description(),
                tags.forElement(name),
                clause.protectedElement(),
                clause.location()
            ));
        }

        // --- connections --------------------------------------------------------------

        private void connect(CdlAst.ConnectClause clause) {
            Endpoint left = endpoint(clause.left());
            Endpoint right = endpoint(clause.right());
            if (left == null || right == null) {
                return;
            }

            if (left.role() == right.role()) {
                String what = left.role() == Role.SOURCE ? "outputs" : "inputs";
                error(ErrorKind.INVALID_CONNECTION_DIRECTION, clause.location(),
                    "connect(" + clause.left() + ", " + clause.right() + ") joins two " + what
                        + "; exactly one side must be an output",
                    left.ref().toString(), right.ref().toString());
                return;
            }

            Endpoint source = left.role() == Role.SOURCE ? left : right;
            Endpoint sink = left.role() == Role.SOURCE ? right : left;
            if (source.isWholeArray() || sink.isWholeArray()) {
                int sourceWidth = source.isWholeArray() ? source.size() : 1;
                int sinkWidth = sink.isWholeArray() ? sink.size() : 1;
                if (source.isWholeArray() != sink.isWholeArray() || sourceWidth != sinkWidth) {
                    error(ErrorKind.ARRAY_DIMENSION_MISMATCH, clause.location(),
                        "connect(" + clause.left() + ", " + clause.right() + ") joins " + width(source)
                            + " to " + width(sink),
                        source.ref().toString(), sink.ref().toString());
                    return;
                }
            }

            connections.add(new Connection(source.ref(), sink.ref(), clause.description(), clause.location()));
        }

        private String width(Endpoint endpoint) {
            return endpoint.isWholeArray()
                ? "array " + endpoint.ref() + " of size " + endpoint.size()
                : "scalar " + endpoint.ref();
        }

        private Endpoint endpoint(CdlAst.ComponentRef reference) {
            List<CdlAst.RefPart> parts = reference.parts();
            SourceLocation location = reference.location();

            if (parts.size() == 1) {
                CdlAst.RefPart part = parts.get(0);
                if (instances.containsKey(part.name()) || failedInstances.contains(part.name())) {
                    error(ErrorKind.UNKNOWN_CONNECTOR, location,
                        "'" + part.name() + "' is a block instance, not a connector", part.name());
                    return null;
                }
                if (failedConnectors.contains(part.name())) {
                    return null;
                }
                ConnectorDecl decl = connectors.get(part.name());
                if (decl == null) {
                    error(ErrorKind.UNKNOWN_CONNECTOR, location,
                        "Block " + qualifiedName + " has no connector '" + part.name() + "'", part.name());
                    return null;
                }
                Integer size = connectorSizes.get(part.name());
                Index index = index(part, decl, size, part.name(), location);
                if (!index.valid()) {
                    return null;
                }
                Role role = decl.isInput() ? Role.SOURCE : Role.SINK;
                return new Endpoint(new ConnectorRef(null, part.name(), index.value()), role, size);
            }

            if (parts.size() == 2) {
                CdlAst.RefPart instancePart = parts.get(0);
                CdlAst.RefPart connectorPart = parts.get(1);
                if (failedInstances.contains(instancePart.name())) {
                    return null;
                }
                Instance instance = instances.get(instancePart.name());
                if (instance == null) {
                    error(ErrorKind.UNKNOWN_CONNECTOR, location,
                        "Unknown block instance '" + instancePart.name() + "' in " + reference,
                        reference.toString());
                    return null;
                }
                if (!instancePart.subscripts().isEmpty()) {
                    error(ErrorKind.ARRAY_DIMENSION_MISMATCH, location,
                        "Block instance '" + instancePart.name() + "' is not an array", reference.toString());
                    return null;
                }
                String subject = instancePart.name() + "." + connectorPart.name();
                Optional<ConnectorDecl> decl = instance.type().connector(connectorPart.name());
                if (decl.isEmpty()) {
                    error(ErrorKind.UNKNOWN_CONNECTOR, location,
                        "Block " + instance.type().qualifiedName() + " has no connector '" + connectorPart.name() + "'",
                        subject);
                    return null;
                }
                Integer size = instance.arraySize(connectorPart.name()).orElse(null);
                Index index = index(connectorPart, decl.get(), size, subject, location);
                if (!index.valid()) {
                    return null;
                }
                Role role = decl.get().isInput() ? Role.SINK : Role.SOURCE;
                return new Endpoint(new ConnectorRef(instancePart.name(), connectorPart.name(), index.value()), role, size);
            }

            error(ErrorKind.UNKNOWN_CONNECTOR, location,
                "'" + reference + "' does not name a connector of " + qualifiedName + " or of one of its instances",
                reference.toString());
            return null;
        }

        private Index index(CdlAst.RefPart part, ConnectorDecl decl, Integer size, String subject,
                            SourceLocation location) {
            if (part.subscripts().isEmpty()) {
                return new Index(null, true);
            }
            if (!decl.isArray()) {
                error(ErrorKind.ARRAY_DIMENSION_MISMATCH, location,
                    "Connector '" + subject + "' is a scalar and cannot be indexed", subject);
                return new Index(null, false);
            }
            if (part.subscripts().size() > 1) {
                error(ErrorKind.ARRAY_DIMENSION_MISMATCH, location,
                    "Connector '" + subject + "' has one dimension but " + part.subscripts().size()
                        + " subscripts", subject);
                return new Index(null, false);
            }
            Object value;
            try {
                value = ExpressionEvaluator.evaluate(part.subscripts().get(0), scope);
            } catch (EvaluationException e) {
                evaluationError(e, location, subject, "Subscript of '" + subject + "'", true);
                return new Index(null, false);
            }
            if (!(value instanceof Integer position)) {
                error(ErrorKind.ARRAY_DIMENSION_MISMATCH, location,
                    "Subscript of '" + subject + "' must be an Integer", subject);
                return new Index(null, false);
            }
            if (position < 1 || position > size) {
                error(ErrorKind.ARRAY_DIMENSION_MISMATCH, location,
                    "Index " + position + " is out of range 1.." + size + " for '" + subject + "'",
                    subject + "[" + position + "]");
                return new Index(null, false);
            }
            return new Index(position, true);
        }

        // --- evaluation helpers -------------------------------------------------------

        private boolean evaluate(ParameterScope target, String parameter, SourceLocation location, String subject) {
            try {
                target.valueOf(parameter);
                return true;
            } catch (EvaluationException e) {
                evaluationError(e, location, subject, "Binding of '" + subject + "'", false);
                return false;
            }
        }

        private Integer size(ParameterScope target, Expression dimension, SourceLocation location, String subject) {
            try {
                return target.evaluateSize(dimension);
            } catch (EvaluationException e) {
                evaluationError(e, location, subject, "Dimension of '" + subject + "'", true);
                return null;
            }
        }

        private void evaluationError(EvaluationException e, SourceLocation location, String subject, String context,
                                     boolean dimensionContext) {
            error(errorKind(e, dimensionContext), location, context + ": " + e.getMessage(), subject);
        }

        private void error(ErrorKind kind, SourceLocation location, String message, String... subjects) {
            errors.add(new Diagnostic(kind, qualifiedName, location, message, List.of(subjects)));
        }
    }
}
