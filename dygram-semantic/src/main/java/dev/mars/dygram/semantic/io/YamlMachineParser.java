/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.dygram.semantic.io;

import dev.mars.dygram.ast.Annotation;
import dev.mars.dygram.ast.ArrayValue;
import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.AttributeValue;
import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.ObjectValue;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.ast.TypeDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Machine} from a YAML document.
 *
 * <pre>
 * title: Onboarding
 * annotations: [StrictMode]
 * nodes:
 *   - name: start
 *     type: init
 *   - name: review.approve
 *     attributes:
 *       - name: retries
 *         type: Integer
 *         value: 3
 * edges:
 *   - source: start
 *     target: review.approve
 *     label: "when: retries &lt; 5"
 *   - source: [a, b]
 *     segments:
 *       - target: c
 *       - target: d
 *         label: done
 * </pre>
 *
 * <p>Attributes may also be given as a plain map of name to value. YAML strings become quoted
 * values, numbers and booleans become literals, lists become arrays and maps become objects.
 * Unquoted timestamps become quoted ISO-8601 instants.
 * Node names are kept as written; dotted names are left for expansion.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class YamlMachineParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlMachineParser.class);

    private final Yaml yaml;

    public YamlMachineParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    public Machine parse(InputStream input) throws MachineDefinitionException {
        try {
            return parse(new String(input.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MachineDefinitionException("Failed to read machine definition", e);
        }
    }

    public Machine parse(String yamlContent) throws MachineDefinitionException {
        Object data;
        try {
            data = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new MachineDefinitionException("YAML parsing failed", e);
        }
        if (!(data instanceof Map)) {
            throw new MachineDefinitionException("Empty or invalid YAML content");
        }

        Map<?, ?> root = (Map<?, ?>) data;
        Machine machine = new Machine(getString(root, "title", "Untitled"));
        machine.getAnnotations().addAll(parseAnnotations(root.get("annotations"), "machine"));
        for (Map<?, ?> nodeData : getMapList(root, "nodes", "machine")) {
            machine.getNodes().add(parseNode(nodeData));
        }
        for (Map<?, ?> edgeData : getMapList(root, "edges", "machine")) {
            machine.getEdges().add(parseEdge(edgeData));
        }

        logger.debug("Parsed machine '{}' with {} root node(s) and {} root edge(s)",
                machine.getTitle(), machine.getNodes().size(), machine.getEdges().size());
        return machine;
    }

    private Node parseNode(Map<?, ?> data) throws MachineDefinitionException {
        String name = getString(data, "name", null);
        if (name == null || name.isBlank()) {
            throw new MachineDefinitionException("Node without a name: " + data);
        }

        Node node = new Node(name, getString(data, "type", null));
        node.setTitle(getString(data, "title", null));
        node.getAnnotations().addAll(parseAnnotations(data.get("annotations"), name));
        node.getAttributes().addAll(parseAttributes(data.get("attributes"), name));
        for (Map<?, ?> child : getMapList(data, "nodes", name)) {
            node.getNodes().add(parseNode(child));
        }
        for (Map<?, ?> edge : getMapList(data, "edges", name)) {
            node.getEdges().add(parseEdge(edge));
        }
        return node;
    }

    private List<Annotation> parseAnnotations(Object data, String owner) throws MachineDefinitionException {
        List<Annotation> annotations = new ArrayList<>();
        if (data == null) {
            return annotations;
        }
        if (!(data instanceof List)) {
            throw new MachineDefinitionException("Annotations of '" + owner + "' must be a list");
        }
        for (Object item : (List<?>) data) {
            if (item instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) item;
                String name = stripAt(getString(map, "name", ""));
                String value = getString(map, "value", null);
                annotations.add(value == null ? new Annotation(name) : new Annotation(name, value));
            } else if (item != null) {
                annotations.add(new Annotation(stripAt(item.toString())));
            }
        }
        return annotations;
    }

    private List<Attribute> parseAttributes(Object data, String owner) throws MachineDefinitionException {
        List<Attribute> attributes = new ArrayList<>();
        if (data == null) {
            return attributes;
        }
        if (data instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                attributes.add(Attribute.of(String.valueOf(entry.getKey()), toValue(entry.getValue())));
            }
            return attributes;
        }
        if (!(data instanceof List)) {
            throw new MachineDefinitionException("Attributes of '" + owner + "' must be a list or a map");
        }
        for (Object item : (List<?>) data) {
            if (!(item instanceof Map)) {
                throw new MachineDefinitionException("Attribute entry of '" + owner + "' must be a map: " + item);
            }
            Map<?, ?> map = (Map<?, ?>) item;
            String name = getString(map, "name", null);
            if (name == null || name.isBlank()) {
                throw new MachineDefinitionException("Attribute without a name on '" + owner + "'");
            }
            String type = getString(map, "type", null);
            AttributeValue value = map.containsKey("value") ? toValue(map.get("value")) : null;
            attributes.add(new Attribute(name, type == null ? null : parseType(type, owner), value));
        }
        return attributes;
    }

    private static TypeDef parseType(String type, String owner) throws MachineDefinitionException {
        try {
            return TypeDef.parse(type);
        } catch (IllegalArgumentException e) {
            throw new MachineDefinitionException("Invalid type '" + type + "' on '" + owner + "'", e);
        }
    }

    private Edge parseEdge(Map<?, ?> data) throws MachineDefinitionException {
        List<Reference> sources = toReferences(data.get("source"));
        if (sources.isEmpty()) {
            throw new MachineDefinitionException("Edge without a source: " + data);
        }

        List<EdgeSegment> segments = new ArrayList<>();
        if (data.containsKey("segments")) {
            for (Map<?, ?> segment : getMapList(data, "segments", "edge")) {
                segments.add(new EdgeSegment(toReferences(segment.get("target")), getString(segment, "label", null)));
            }
        } else {
            segments.add(new EdgeSegment(toReferences(data.get("target")), getString(data, "label", null)));
        }
        if (segments.stream().anyMatch(segment -> segment.getTargets().isEmpty())) {
            throw new MachineDefinitionException("Edge without a target: " + data);
        }
        return new Edge(sources, segments);
    }

    private static List<Reference> toReferences(Object data) {
        List<Reference> references = new ArrayList<>();
        if (data instanceof List) {
            for (Object item : (List<?>) data) {
                if (item != null) {
                    references.add(new Reference(item.toString()));
                }
            }
        } else if (data != null) {
            references.add(new Reference(data.toString()));
        }
        return references;
    }

    static AttributeValue toValue(Object data) {
        if (data == null) {
            return PrimitiveValue.literal("null");
        }
        if (data instanceof String) {
            return PrimitiveValue.quoted((String) data);
        }
        if (data instanceof Number) {
            return PrimitiveValue.of((Number) data);
        }
        if (data instanceof Boolean) {
            return PrimitiveValue.of((Boolean) data);
        }
        if (data instanceof List) {
            List<AttributeValue> values = new ArrayList<>();
            for (Object item : (List<?>) data) {
                values.add(toValue(item));
            }
            return new ArrayValue(values);
        }
        if (data instanceof Map) {
            List<Attribute> attributes = new ArrayList<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                attributes.add(Attribute.of(String.valueOf(entry.getKey()), toValue(entry.getValue())));
            }
            return new ObjectValue(attributes);
        }
        if (data instanceof Date) {
            return PrimitiveValue.quoted(((Date) data).toInstant().toString());
        }
        return PrimitiveValue.quoted(data.toString());
    }

    private static List<Map<?, ?>> getMapList(Map<?, ?> data, String key, String owner)
            throws MachineDefinitionException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new MachineDefinitionException("'" + key + "' of '" + owner + "' must be a list");
        }
        List<Map<?, ?>> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof Map)) {
                throw new MachineDefinitionException("Entry of '" + key + "' in '" + owner + "' must be a map: " + item);
            }
            result.add((Map<?, ?>) item);
        }
        return result;
    }

    private static String getString(Map<?, ?> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static String stripAt(String name) {
        return name.startsWith("@") ? name.substring(1) : name;
    }
}
