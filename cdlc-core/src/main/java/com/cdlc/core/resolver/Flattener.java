package com.cdlc.core.resolver;

import com.cdlc.core.builder.ModelBuilder;
import com.cdlc.core.builder.ParameterScope;
import com.cdlc.core.catalog.SymbolTable;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.expr.EvaluationException;
import com.cdlc.core.model.BindingOrigin;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.FlatInstance;
import com.cdlc.core.model.FlatModel;
import com.cdlc.core.model.Instance;
import com.cdlc.core.model.ParameterBinding;
import com.cdlc.core.model.ParameterDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands a composite block into elementary instances wired directly to each other.
 *
 * <p>Nested composite instances are replaced by their bodies with dotted instance paths
 * ({@code outer.inner}). Parameter values are evaluated again with the bindings the
 * enclosing levels supply. Connections through composite boundaries are followed element by
 * element until they reach an elementary output or an input of the root block.
 */
public class Flattener {

    private static final Logger log = LoggerFactory.getLogger(Flattener.class);

    private final SymbolTable symbols;

    public Flattener(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
    }

    /**
     * Flattens a validated composite block.
     *
     * @param root the composite to flatten
     * @return the flat model
     * @throws CdlException if a parameter cannot be evaluated with the supplied bindings
     */
    public FlatModel flatten(CompositeBlock root) {
        Expansion expansion = new Expansion(root);
        ParameterScope rootScope = new ParameterScope(symbols.catalog());
        for (ParameterBinding binding : root.parameterBindings()) {
            root.parameters().stream()
                .filter(p -> p.name().equals(binding.name()))
                .findFirst()
                .ifPresent(decl -> rootScope.declare(decl, binding.expression(), binding.origin(), null));
        }
        expansion.expand(root, "", rootScope);
        List<Connection> connections = expansion.resolveConnections();
        log.debug("Flattened {} into {} instance(s) and {} connection(s)",
            root.qualifiedName(), expansion.instances.size(), connections.size());
        return new FlatModel(root.qualifiedName(), root.connectors(), expansion.instances, connections);
    }

    /**
     * One element of a connector somewhere in the hierarchy.
     *
     * @param path instance path, empty for the root block
     * @param connector connector name
     * @param index 1-based element index, or {@code null} for scalars
     */
    private record Point(String path, String connector, Integer index) {

        ConnectorRef toRef() {
            return new ConnectorRef(path.isEmpty() ? null : path, connector, index);
        }
    }

    private static List<Point> elements(String path, ConnectorDecl connector, Integer size) {
        if (!connector.isArray() || size == null) {
            return List.of(new Point(path, connector.name(), null));
        }
        List<Point> elements = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            elements.add(new Point(path, connector.name(), i));
        }
        return elements;
    }

    private final class Expansion {

        private final CompositeBlock root;
        private final List<FlatInstance> instances = new ArrayList<>();
        private final Map<String, BlockType> elementary = new LinkedHashMap<>();
        private final Map<String, Map<String, Integer>> elementarySizes = new HashMap<>();
        private final Map<Point, Point> drivers = new HashMap<>();

        Expansion(CompositeBlock root) {
            this.root = root;
        }

        void expand(CompositeBlock block, String prefix, ParameterScope scope) {
            for (Instance instance : block.instances()) {
                String path = prefix.isEmpty() ? instance.name() : prefix + "." + instance.name();
                ParameterScope instanceScope = instanceScope(instance, scope);
                List<ParameterBinding> bindings = evaluate(instance.type(), instanceScope, path);
                if (instance.type().isComposite()) {
                    CompositeBlock body = symbols.compositeBlock(instance.type().qualifiedName())
                        .orElseThrow(() -> new IllegalStateException(
                            "Composite " + instance.type().qualifiedName() + " has no registered body"));
                    expand(body, path, instanceScope);
                } else {
                    instances.add(new FlatInstance(path, instance.type().qualifiedName(), bindings, instance.tags()));
                    elementary.put(path, instance.type());
                    elementarySizes.put(path, instance.connectorSizes());
                }
            }
            for (Connection connection : block.connections()) {
                List<Point> sources = points(block, prefix, connection.source());
                List<Point> sinks = points(block, prefix, connection.sink());
                for (int i = 0; i < sinks.size(); i++) {
                    drivers.put(sinks.get(i), sources.size() == 1 ? sources.get(0) : sources.get(i));
                }
            }
        }

        private ParameterScope instanceScope(Instance instance, ParameterScope enclosing) {
            ParameterScope scope = new ParameterScope(symbols.catalog());
            for (ParameterDecl decl : instance.type().parameters()) {
                ParameterBinding binding = instance.binding(decl.name()).orElse(null);
                if (binding != null && binding.origin() == BindingOrigin.EXPLICIT) {
                    scope.declare(decl, binding.expression(), BindingOrigin.EXPLICIT, enclosing);
                } else {
                    scope.declare(decl, decl.defaultValue(),
                        decl.defaultValue() != null ? BindingOrigin.DEFAULT : BindingOrigin.UNBOUND, null);
                }
            }
            return scope;
        }

        private List<ParameterBinding> evaluate(BlockType type, ParameterScope scope, String path) {
            for (ParameterDecl decl : type.parameters()) {
                try {
                    scope.valueOf(decl.name());
                } catch (EvaluationException e) {
                    throw CdlException.of(ModelBuilder.errorKind(e, false), root.qualifiedName(), null,
                        "Parameter " + path + "." + decl.name() + ": " + e.getMessage(), path + "." + decl.name());
                }
            }
            return scope.bindings();
        }

        private List<Point> points(CompositeBlock block, String prefix, ConnectorRef ref) {
            String path;
            Integer size;
            if (ref.isOwn()) {
                path = prefix;
                size = block.connectorSizes().get(ref.connector());
            } else {
                path = prefix.isEmpty() ? ref.instance() : prefix + "." + ref.instance();
                size = block.instance(ref.instance())
                    .map(i -> i.connectorSizes().get(ref.connector()))
                    .orElse(null);
            }
            if (ref.index() != null || size == null) {
                return List.of(new Point(path, ref.connector(), ref.index()));
            }
            List<Point> elements = new ArrayList<>(size);
            for (int i = 1; i <= size; i++) {
                elements.add(new Point(path, ref.connector(), i));
            }
            return elements;
        }

        List<Connection> resolveConnections() {
            List<Connection> connections = new ArrayList<>();
            for (Map.Entry<String, BlockType> entry : elementary.entrySet()) {
                String path = entry.getKey();
                for (ConnectorDecl input : entry.getValue().inputs()) {
                    for (Point sink : elements(path, input, elementarySizes.get(path).get(input.name()))) {
                        connect(sink, connections);
                    }
                }
            }
            for (ConnectorDecl output : root.outputs()) {
                for (Point sink : elements("", output, root.connectorSizes().get(output.name()))) {
                    connect(sink, connections);
                }
            }
            return connections;
        }

        private void connect(Point sink, List<Connection> connections) {
            Point source = drivers.get(sink);
            while (source != null && !isTerminal(source)) {
                source = drivers.get(source);
            }
            if (source != null) {
                connections.add(Connection.of(source.toRef(), sink.toRef()));
            }
        }

        private boolean isTerminal(Point point) {
            if (point.path().isEmpty()) {
                return root.connector(point.connector()).map(ConnectorDecl::isInput).orElse(false);
            }
            return elementary.containsKey(point.path());
        }
    }
}
