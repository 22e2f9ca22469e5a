package com.cdlc.core.validation;

import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.DirectDependency;
import com.cdlc.core.model.Instance;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Signal dependency graph of a composite block.
 *
 * <p>Nodes are connectors of the block's instances and of the block itself. Edges are
 * <ul>
 *   <li>connection edges, from the source connector of a {@code connect} to its sink;</li>
 *   <li>direct-feedthrough edges, from an instance input to an instance output that
 *       depends on it within the same evaluation instant, as declared by the block type.</li>
 * </ul>
 * Blocks holding state (delays, integrators) declare no feedthrough, so a feedback loop
 * through them is not a cycle of this graph.
 *
 * <p>Array elements share the node of their connector.
 */
public final class DependencyGraph {

    /**
     * Kind of dependency an edge represents.
     */
    public enum EdgeKind {
        CONNECTION,
        DIRECT_FEEDTHROUGH
    }

    /**
     * Directed edge.
     *
     * @param from upstream connector
     * @param to downstream connector
     * @param kind edge kind
     * @param location location of the connect statement or the instance declaration
     */
    public record Edge(ConnectorNode from, ConnectorNode to, EdgeKind kind, SourceLocation location) {
    }

    private final List<ConnectorNode> nodes;
    private final Map<ConnectorNode, List<Edge>> adjacency;

    private DependencyGraph(List<ConnectorNode> nodes, Map<ConnectorNode, List<Edge>> adjacency) {
        this.nodes = List.copyOf(nodes);
        this.adjacency = adjacency;
    }

    /**
     * Builds the graph of a composite block.
     *
     * <p>Nodes are ordered with the block's own connectors first, then for each instance in
     * declaration order its outputs followed by its inputs.
     *
     * @param block composite block
     * @return the graph
     */
    public static DependencyGraph of(CompositeBlock block) {
        List<ConnectorNode> nodes = new ArrayList<>();
        Map<ConnectorNode, List<Edge>> adjacency = new LinkedHashMap<>();

        for (ConnectorDecl connector : block.connectors()) {
            addNode(new ConnectorNode(null, connector.name()), nodes, adjacency);
        }
        for (Instance instance : block.instances()) {
            for (ConnectorDecl output : instance.type().outputs()) {
                addNode(new ConnectorNode(instance.name(), output.name()), nodes, adjacency);
            }
            for (ConnectorDecl input : instance.type().inputs()) {
                addNode(new ConnectorNode(instance.name(), input.name()), nodes, adjacency);
            }
        }

        for (Connection connection : block.connections()) {
            addEdge(adjacency, new Edge(ConnectorNode.of(connection.source()), ConnectorNode.of(connection.sink()),
                EdgeKind.CONNECTION, connection.location()));
        }
        for (Instance instance : block.instances()) {
            for (DirectDependency dependency : instance.type().directDependencies()) {
                addEdge(adjacency, new Edge(
                    new ConnectorNode(instance.name(), dependency.input()),
                    new ConnectorNode(instance.name(), dependency.output()),
                    EdgeKind.DIRECT_FEEDTHROUGH,
                    instance.location()));
            }
        }
        return new DependencyGraph(nodes, adjacency);
    }

    private static void addNode(ConnectorNode node, List<ConnectorNode> nodes, Map<ConnectorNode, List<Edge>> adjacency) {
        if (adjacency.putIfAbsent(node, new ArrayList<>()) == null) {
            nodes.add(node);
        }
    }

    private static void addEdge(Map<ConnectorNode, List<Edge>> adjacency, Edge edge) {
        List<Edge> out = adjacency.get(edge.from());
        if (out == null || !adjacency.containsKey(edge.to())) {
            return;
        }
        boolean duplicate = out.stream()
            .anyMatch(e -> e.to().equals(edge.to()) && e.kind() == edge.kind());
        if (!duplicate) {
            out.add(edge);
        }
    }

    public List<ConnectorNode> nodes() {
        return nodes;
    }

    /**
     * Returns all edges, grouped by source node in node order.
     *
     * @return edges
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        for (ConnectorNode node : nodes) {
            result.addAll(adjacency.get(node));
        }
        return result;
    }

    public List<Edge> connectionEdges() {
        return edges().stream().filter(e -> e.kind() == EdgeKind.CONNECTION).toList();
    }

    public List<Edge> successors(ConnectorNode node) {
        return Collections.unmodifiableList(adjacency.getOrDefault(node, List.of()));
    }

    /**
     * Returns every node reachable from {@code start} through one or more edges.
     *
     * @param start start node
     * @return reachable nodes in discovery order
     */
    public Set<ConnectorNode> reachableFrom(ConnectorNode start) {
        Set<ConnectorNode> visited = new LinkedHashSet<>();
        Deque<ConnectorNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            ConnectorNode node = stack.pop();
            for (Edge edge : successors(node)) {
                if (visited.add(edge.to())) {
                    stack.push(edge.to());
                }
            }
        }
        return visited;
    }

    /**
     * A cycle found by {@link #findCycles()}.
     *
     * @param nodes nodes of the cycle, starting with the target of the back edge
     * @param closingEdge back edge that closes the cycle
     */
    public record Cycle(List<ConnectorNode> nodes, Edge closingEdge) {
        public Cycle {
            nodes = List.copyOf(nodes);
        }
    }

    private enum Mark {
        IN_PROGRESS,
        DONE
    }

    /**
     * Finds cycles by iterative depth-first search.
     *
     * <p>Roots are visited in node order. Every back edge, an edge into a node that is
     * still in progress, yields one cycle made of the nodes on the current search path
     * from that node onwards.
     *
     * @return cycles in discovery order, empty if the graph is acyclic
     */
    public List<Cycle> findCycles() {
        Map<ConnectorNode, Mark> marks = new HashMap<>();
        List<Cycle> cycles = new ArrayList<>();

        for (ConnectorNode root : nodes) {
            if (marks.containsKey(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<ConnectorNode> path = new ArrayList<>();
            marks.put(root, Mark.IN_PROGRESS);
            stack.push(new Frame(root));
            path.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<Edge> out = adjacency.get(frame.node);
                if (frame.next >= out.size()) {
                    marks.put(frame.node, Mark.DONE);
                    stack.pop();
                    path.remove(path.size() - 1);
                    continue;
                }
                Edge edge = out.get(frame.next++);
                Mark mark = marks.get(edge.to());
                if (mark == null) {
                    marks.put(edge.to(), Mark.IN_PROGRESS);
                    stack.push(new Frame(edge.to()));
                    path.add(edge.to());
                } else if (mark == Mark.IN_PROGRESS) {
                    int start = path.indexOf(edge.to());
                    cycles.add(new Cycle(path.subList(start, path.size()), edge));
                }
            }
        }
        return cycles;
    }

    private static final class Frame {
        private final ConnectorNode node;
        private int next;

        private Frame(ConnectorNode node) {
            this.node = node;
        }
    }
}
