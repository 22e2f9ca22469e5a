package com.cdlc.core.export;

import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.expr.EnumValue;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorDecl;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.FlatInstance;
import com.cdlc.core.model.FlatModel;
import com.cdlc.core.model.Instance;
import com.cdlc.core.model.ParameterBinding;
import com.cdlc.core.model.ParameterDecl;
import com.cdlc.core.model.TagPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Serializes block diagrams, flat models and diagnostics to JSON.
 *
 * <p>The documents are built as Jackson trees so that the layout does not depend on the
 * shape of the model records. Expressions are written in CDL syntax, tags verbatim.
 */
public class GraphJsonExporter {

    private final ObjectMapper mapper;

    public GraphJsonExporter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Converts a composite block to a JSON tree.
     *
     * @param block composite block
     * @return JSON object with parameters, connectors, instances and connections
     */
    public ObjectNode toJson(CompositeBlock block) {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", block.qualifiedName());
        putIfNotNull(root, "documentation", block.documentation());
        putIfNotNull(root, "source", block.sourcePath());

        ArrayNode parameters = root.putArray("parameters");
        for (ParameterDecl decl : block.parameters()) {
            ObjectNode node = parameters.addObject();
            node.put("name", decl.name());
            node.put("type", decl.typeName());
            if (decl.dimension() != null) {
                node.put("dimension", decl.dimension().toSource());
            }
            putIfNotNull(node, "unit", decl.unit());
            putIfNotNull(node, "quantity", decl.quantity());
            block.parameterBindings().stream()
                .filter(b -> b.name().equals(decl.name()))
                .findFirst()
                .ifPresent(b -> writeBinding(node, b));
            writeTags(node, decl.tags());
        }

        root.set("connectors", connectors(block.connectors(), block.connectorSizes()));

        ArrayNode instances = root.putArray("instances");
        for (Instance instance : block.instances()) {
            ObjectNode node = instances.addObject();
            node.put("name", instance.name());
            node.put("type", instance.type().qualifiedName());
            node.put("kind", instance.type().kind().name().toLowerCase());
            putIfNotNull(node, "documentation", instance.documentation());
            ArrayNode bindings = node.putArray("parameters");
            for (ParameterBinding binding : instance.bindings()) {
                ObjectNode bindingNode = bindings.addObject();
                bindingNode.put("name", binding.name());
                writeBinding(bindingNode, binding);
            }
            if (!instance.connectorSizes().isEmpty()) {
                ObjectNode sizes = node.putObject("connectorSizes");
                instance.type().connectors().stream()
                    .filter(c -> instance.connectorSizes().containsKey(c.name()))
                    .forEach(c -> sizes.put(c.name(), instance.connectorSizes().get(c.name())));
            }
            writeTags(node, instance.tags());
        }

        root.set("connections", connections(block.connections()));
        writeTags(root, block.tags());
        return root;
    }

    /**
     * Converts a flat model to a JSON tree.
     *
     * @param model flat model
     * @return JSON object with connectors, elementary instances and resolved connections
     */
    public ObjectNode toJson(FlatModel model) {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", model.qualifiedName());
        root.set("connectors", connectors(model.connectors(), Map.of()));
        ArrayNode instances = root.putArray("instances");
        for (FlatInstance instance : model.instances()) {
            ObjectNode node = instances.addObject();
            node.put("path", instance.path());
            node.put("type", instance.type());
            ArrayNode bindings = node.putArray("parameters");
            for (ParameterBinding binding : instance.bindings()) {
                ObjectNode bindingNode = bindings.addObject();
                bindingNode.put("name", binding.name());
                writeBinding(bindingNode, binding);
            }
            writeTags(node, instance.tags());
        }
        root.set("connections", connections(model.connections()));
        return root;
    }

    /**
     * Converts diagnostics to a JSON array.
     *
     * @param diagnostics diagnostics in report order
     * @return array of {@code {kind, scope, location, message, subjects}} objects
     */
    public ArrayNode toJson(List<Diagnostic> diagnostics) {
        ArrayNode array = mapper.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode node = array.addObject();
            node.put("kind", diagnostic.kind().getDisplayName());
            putIfNotNull(node, "scope", diagnostic.scope());
            SourceLocation location = diagnostic.location();
            if (location != null) {
                ObjectNode locationNode = node.putObject("location");
                putIfNotNull(locationNode, "file", location.file());
                locationNode.put("line", location.line());
                locationNode.put("column", location.column());
            }
            node.put("message", diagnostic.message());
            ArrayNode subjects = node.putArray("subjects");
            diagnostic.subjects().forEach(subjects::add);
        }
        return array;
    }

    /**
     * Renders a JSON tree as indented text.
     *
     * @param node tree built by one of the {@code toJson} methods
     * @return JSON text
     */
    public String write(Object node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON document", e);
        }
    }

    private ArrayNode connectors(List<ConnectorDecl> declarations, Map<String, Integer> sizes) {
        ArrayNode array = mapper.createArrayNode();
        for (ConnectorDecl connector : declarations) {
            ObjectNode node = array.addObject();
            node.put("name", connector.name());
            node.put("direction", connector.direction().name().toLowerCase());
            node.put("type", connector.type().getCdlName());
            if (connector.dimension() != null) {
                node.put("dimension", connector.dimension().toSource());
            }
            if (sizes.containsKey(connector.name())) {
                node.put("size", sizes.get(connector.name()));
            }
            putIfNotNull(node, "unit", connector.unit());
            putIfNotNull(node, "quantity", connector.quantity());
            putIfNotNull(node, "documentation", connector.documentation());
            writeTags(node, connector.tags());
        }
        return array;
    }

    private ArrayNode connections(List<Connection> connections) {
        ArrayNode array = mapper.createArrayNode();
        for (Connection connection : connections) {
            ObjectNode node = array.addObject();
            node.set("source", endpoint(connection.source()));
            node.set("sink", endpoint(connection.sink()));
            putIfNotNull(node, "documentation", connection.documentation());
        }
        return array;
    }

    private ObjectNode endpoint(ConnectorRef ref) {
        ObjectNode node = mapper.createObjectNode();
        putIfNotNull(node, "instance", ref.instance());
        node.put("connector", ref.connector());
        if (ref.index() != null) {
            node.put("index", ref.index());
        }
        return node;
    }

    private void writeBinding(ObjectNode node, ParameterBinding binding) {
        if (binding.expression() != null) {
            node.put("expression", binding.expression().toSource());
        }
        if (binding.value() == null) {
            node.putNull("value");
        } else {
            node.set("value", mapper.valueToTree(plain(binding.value())));
        }
        node.put("origin", binding.origin().name().toLowerCase());
    }

    private static Object plain(Object value) {
        if (value instanceof EnumValue enumValue) {
            return enumValue.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(GraphJsonExporter::plain).toList();
        }
        return value;
    }

    private static void writeTags(ObjectNode node, List<TagPayload> tags) {
        if (tags.isEmpty()) {
            return;
        }
        ArrayNode array = node.putArray("tags");
        for (TagPayload tag : tags) {
            ObjectNode tagNode = array.addObject();
            tagNode.put("kind", tag.kind().getKeyword());
            tagNode.put("payload", tag.raw());
        }
    }

    private static void putIfNotNull(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
