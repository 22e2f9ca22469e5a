package com.cdlc.core.validation;

import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks the connection rules of a built composite block.
 *
 * <p><b>Rules:</b>
 * <ol>
 *   <li><b>Type compatibility:</b> source and sink of a connection have the same primitive
 *       type, the same number of elements and, when {@link ValidationOptions#checkUnits()}
 *       is on, the same declared unit ({@code TYPE_MISMATCH}).</li>
 *   <li><b>Single assignment:</b> every element of every instance input and of every output
 *       of the block is the sink of exactly one connection ({@code UNCONNECTED_INPUT},
 *       {@code MULTIPLE_ASSIGNMENT}).</li>
 *   <li><b>Acyclicity:</b> the {@link DependencyGraph} has no cycle ({@code ALGEBRAIC_LOOP}).</li>
 * </ol>
 *
 * <p>All rules run on every block and all violations are reported.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationReport report = new SemanticValidator().validate(block);
 * report.diagnostics().forEach(System.out::println);
 * }</pre>
 */
public class SemanticValidator {

    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    private final ValidationOptions options;

    public SemanticValidator() {
        this(ValidationOptions.defaults());
    }

    public SemanticValidator(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Validates a composite block.
     *
     * @param block built composite block
     * @return report with all violations and the dependency graph
     */
    public ValidationReport validate(CompositeBlock block) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        checkTypes(block, diagnostics);
        checkSingleAssignment(block, diagnostics);
        DependencyGraph graph = DependencyGraph.of(block);
        checkAcyclic(block, graph, diagnostics);

        log.debug("Validated {}: {} diagnostic(s)", block.qualifiedName(), diagnostics.size());
        return new ValidationReport(block.qualifiedName(), diagnostics, graph);
    }

    // --- type compatibility ---------------------------------------------------------------

    private void checkTypes(CompositeBlock block, List<Diagnostic> diagnostics) {
        for (Connection connection : block.connections()) {
            ConnectorDecl source = declaration(block, connection.source());
            ConnectorDecl sink = declaration(block, connection.sink());
            if (source == null || sink == null) {
                continue;
            }
            String subjects = connection.source() + " -> " + connection.sink();

            if (source.type() != sink.type()) {
                diagnostics.add(new Diagnostic(ErrorKind.TYPE_MISMATCH, block.qualifiedName(), connection.location(),
                    "Cannot connect " + source.type().getCdlName() + " output " + connection.source()
                        + " to " + sink.type().getCdlName() + " input " + connection.sink(),
                    List.of(connection.source().toString(), connection.sink().toString())));
                continue;
            }

            int sourceCount = elementCount(block, connection.source());
            int sinkCount = elementCount(block, connection.sink());
            if (sourceCount != sinkCount) {
                diagnostics.add(new Diagnostic(ErrorKind.TYPE_MISMATCH, block.qualifiedName(), connection.location(),
                    "Element count differs in " + subjects + ": " + sourceCount + " vs " + sinkCount,
                    List.of(connection.source().toString(), connection.sink().toString())));
                continue;
            }

            if (options.checkUnits() && source.unit() != null && sink.unit() != null
                && !source.unit().equals(sink.unit())) {
                diagnostics.add(new Diagnostic(ErrorKind.TYPE_MISMATCH, block.qualifiedName(), connection.location(),
                    "Unit '" + source.unit() + "' of " + connection.source() + " differs from unit '"
                        + sink.unit() + "' of " + connection.sink(),
                    List.of(connection.source().toString(), connection.sink().toString())));
            }
        }
    }

    private static ConnectorDecl declaration(CompositeBlock block, ConnectorRef ref) {
        if (ref.isOwn()) {
            return block.connector(ref.connector()).orElse(null);
        }
        return block.instance(ref.instance())
            .flatMap(i -> i.type().connector(ref.connector()))
            .orElse(null);
    }

    private static Integer arraySize(CompositeBlock block, ConnectorRef ref) {
        if (ref.isOwn()) {
            return block.arraySize(ref.connector()).orElse(null);
        }
        return block.instance(ref.instance())
            .flatMap(i -> i.arraySize(ref.connector()))
            .orElse(null);
    }

    private static int elementCount(CompositeBlock block, ConnectorRef ref) {
        if (ref.index() != null) {
            return 1;
        }
        Integer size = arraySize(block, ref);
        return size != null ? size : 1;
    }

    // --- single assignment ----------------------------------------------------------------

    private void checkSingleAssignment(CompositeBlock block, List<Diagnostic> diagnostics) {
        Map<ConnectorRef, List<ConnectorRef>> sources = new LinkedHashMap<>();
        Map<ConnectorRef, List<Connection>> assignments = new LinkedHashMap<>();
        Map<ConnectorRef, SourceLocation> declaredAt = new LinkedHashMap<>();

        for (ConnectorDecl output : block.outputs()) {
            for (ConnectorRef element : elements(ConnectorRef.own(output.name()), block.arraySize(output.name()).orElse(null))) {
                sources.put(element, new ArrayList<>());
                assignments.put(element, new ArrayList<>());
                declaredAt.put(element, null);
            }
        }
        for (Instance instance : block.instances()) {
            for (ConnectorDecl input : instance.type().inputs()) {
                ConnectorRef ref = ConnectorRef.of(instance.name(), input.name());
                for (ConnectorRef element : elements(ref, instance.arraySize(input.name()).orElse(null))) {
                    sources.put(element, new ArrayList<>());
                    assignments.put(element, new ArrayList<>());
                    declaredAt.put(element, instance.location());
                }
            }
        }

        for (Connection connection : block.connections()) {
            ConnectorRef sink = connection.sink();
            ConnectorRef source = connection.source();
            Integer sinkSize = arraySize(block, sink);
            if (sink.index() == null && sinkSize != null) {
                for (int i = 1; i <= sinkSize; i++) {
                    ConnectorRef sourceElement = source.index() == null && arraySize(block, source) != null
                        ? source.element(i)
                        : source;
                    record(sink.element(i), sourceElement, connection, sources, assignments);
                }
            } else {
                record(sink, source, connection, sources, assignments);
            }
        }

        for (Map.Entry<ConnectorRef, List<ConnectorRef>> entry : sources.entrySet()) {
            ConnectorRef sink = entry.getKey();
            List<ConnectorRef> feeding = entry.getValue();
            if (feeding.isEmpty()) {
                String message = sink.isOwn()
                    ? "Output " + sink + " of " + block.qualifiedName() + " is not connected"
                    : "Input " + sink + " is not connected";
                diagnostics.add(new Diagnostic(ErrorKind.UNCONNECTED_INPUT, block.qualifiedName(),
                    declaredAt.get(sink), message, List.of(sink.toString())));
            } else if (feeding.size() > 1) {
                List<String> subjects = new ArrayList<>();
                subjects.add(sink.toString());
                feeding.forEach(s -> subjects.add(s.toString()));
                List<Connection> connections = assignments.get(sink);
                diagnostics.add(new Diagnostic(ErrorKind.MULTIPLE_ASSIGNMENT, block.qualifiedName(),
                    connections.get(1).location(),
                    sink + " is assigned by " + feeding.size() + " connections: "
                        + String.join(", ", subjects.subList(1, subjects.size())),
                    subjects));
            }
        }
    }

    private static void record(ConnectorRef sink, ConnectorRef source, Connection connection,
                               Map<ConnectorRef, List<ConnectorRef>> sources,
                               Map<ConnectorRef, List<Connection>> assignments) {
        List<ConnectorRef> feeding = sources.get(sink);
        if (feeding == null) {
            return;
        }
        feeding.add(source);
        assignments.get(sink).add(connection);
    }

    private static List<ConnectorRef> elements(ConnectorRef ref, Integer size) {
        if (size == null) {
            return List.of(ref);
        }
        List<ConnectorRef> result = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            result.add(ref.element(i));
        }
        return result;
    }

    // --- acyclicity -----------------------------------------------------------------------

    private void checkAcyclic(CompositeBlock block, DependencyGraph graph, List<Diagnostic> diagnostics) {
        for (DependencyGraph.Cycle cycle : graph.findCycles()) {
            List<String> path = cycle.nodes().stream().map(ConnectorNode::toString).toList();
            diagnostics.add(new Diagnostic(ErrorKind.ALGEBRAIC_LOOP, block.qualifiedName(),
                cycle.closingEdge().location(),
                "Algebraic loop: " + String.join(" -> ", path) + " -> " + path.get(0),
                path));
        }
    }
}
