package com.cdlc.core.resolver;

import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.model.BlockKind;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.DirectDependency;
import com.cdlc.core.model.Instance;
import com.cdlc.core.validation.ConnectorNode;
import com.cdlc.core.validation.DependencyGraph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Derives the interface of a validated composite block, so that it can be instantiated
 * like an elementary block.
 */
final class CompositeTypes {

    private CompositeTypes() {
        // Utility class
    }

    /**
     * Derives the block type of a composite.
     *
     * <p>An output directly depends on an input when the input reaches the output in the
     * dependency graph. Connectors declared without unit or quantity take the one of the
     * inner connectors they are wired to.
     *
     * @param block validated composite body
     * @param graph dependency graph of the body
     * @return block type of kind {@link BlockKind#COMPOSITE}
     * @throws CdlException with {@code TYPE_MISMATCH} if inner connectors disagree on a unit
     */
    static BlockType derive(CompositeBlock block, DependencyGraph graph) {
        List<Diagnostic> errors = new ArrayList<>();
        List<ConnectorDecl> connectors = new ArrayList<>();
        for (ConnectorDecl connector : block.connectors()) {
            connectors.add(inferUnits(block, connector, errors));
        }
        if (!errors.isEmpty()) {
            throw new CdlException(errors);
        }

        List<DirectDependency> dependencies = new ArrayList<>();
        for (ConnectorDecl output : block.outputs()) {
            ConnectorNode outputNode = new ConnectorNode(null, output.name());
            for (ConnectorDecl input : block.inputs()) {
                if (graph.reachableFrom(new ConnectorNode(null, input.name())).contains(outputNode)) {
                    dependencies.add(new DirectDependency(output.name(), input.name()));
                }
            }
        }

        return new BlockType(
            block.qualifiedName(),
            BlockKind.COMPOSITE,
            block.parameters(),
            connectors,
            dependencies,
            block.documentation(),
            block.tags()
        );
    }

    private static ConnectorDecl inferUnits(CompositeBlock block, ConnectorDecl connector, List<Diagnostic> errors) {
        if (connector.unit() != null && connector.quantity() != null) {
            return connector;
        }
        List<ConnectorDecl> wired = wiredInnerConnectors(block, connector);
        String unit = connector.unit() != null
            ? connector.unit()
            : agreed(block, connector, wired, ConnectorDecl::unit, "unit", errors);
        String quantity = connector.quantity() != null
            ? connector.quantity()
            : agreed(block, connector, wired, ConnectorDecl::quantity, "quantity", errors);
        return connector.withUnits(unit, quantity);
    }

    private static List<ConnectorDecl> wiredInnerConnectors(CompositeBlock block, ConnectorDecl connector) {
        List<ConnectorDecl> wired = new ArrayList<>();
        for (Connection connection : block.connections()) {
            ConnectorRef own = connector.isInput() ? connection.source() : connection.sink();
            ConnectorRef other = connector.isInput() ? connection.sink() : connection.source();
            if (!own.isOwn() || !own.connector().equals(connector.name()) || other.isOwn()) {
                continue;
            }
            block.instance(other.instance())
                .map(Instance::type)
                .flatMap(type -> type.connector(other.connector()))
                .ifPresent(wired::add);
        }
        return wired;
    }

    private static String agreed(CompositeBlock block, ConnectorDecl connector, List<ConnectorDecl> wired,
                                 Function<ConnectorDecl, String> attribute, String attributeName,
                                 List<Diagnostic> errors) {
        Set<String> values = new LinkedHashSet<>();
        for (ConnectorDecl inner : wired) {
            String value = attribute.apply(inner);
            if (value != null) {
                values.add(value);
            }
        }
        if (values.size() > 1) {
            errors.add(new Diagnostic(ErrorKind.TYPE_MISMATCH, block.qualifiedName(), null,
                "Connector " + connector.name() + " is wired to inner connectors with different "
                    + attributeName + "s " + values,
                List.of(connector.name())));
            return null;
        }
        return values.isEmpty() ? null : values.iterator().next();
    }
}
