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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.dygram.ast.Annotation;
import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.semantic.SemanticAnalysis;
import dev.mars.dygram.semantic.dependency.InferredDependency;
import dev.mars.dygram.semantic.graph.GraphStatistics;
import dev.mars.dygram.semantic.graph.GraphValidationResult;
import dev.mars.dygram.semantic.nodes.NodeTypeChecker;
import dev.mars.dygram.semantic.nodes.SimpleEdge;
import dev.mars.dygram.semantic.types.ValueExtractor;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;

import java.util.List;

/**
 * Renders an analyzed machine as a JSON document for executors and visualizers.
 *
 * <p>Nodes are flattened in document order; each carries its simple {@code name}, its
 * {@code qualifiedName}, the qualified name of its {@code parent} when nested, and its effective
 * type. Edges are flattened to single hops. The document also holds the inferred dependencies,
 * the graph analysis and every diagnostic.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MachineJsonSerializer {

    private final ObjectMapper objectMapper;

    public MachineJsonSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(SemanticAnalysis analysis) throws MachineDefinitionException {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(analysis));
        } catch (JsonProcessingException e) {
            throw new MachineDefinitionException("Failed to serialize machine '" + analysis.getMachine().getTitle() + "'", e);
        }
    }

    public ObjectNode toTree(SemanticAnalysis analysis) {
        Machine machine = analysis.getMachine();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", machine.getTitle());
        root.set("annotations", annotations(machine.getAnnotations()));
        root.set("nodes", nodes(machine));
        root.set("edges", edges(machine));
        root.set("inferredDependencies", dependencies(analysis.getDependencies()));
        root.set("graph", graph(analysis.getGraphResult(), analysis.getStatistics()));
        root.set("validation", validation(analysis.getContext()));
        return root;
    }

    private ArrayNode nodes(Machine machine) {
        ArrayNode array = objectMapper.createArrayNode();
        NodeWalker.walk(machine, (qualified, node) -> {
            ObjectNode json = array.addObject();
            json.put("name", node.getName());
            json.put("qualifiedName", qualified);
            int dot = qualified.lastIndexOf('.');
            if (dot > 0) {
                json.put("parent", qualified.substring(0, dot));
            }
            NodeTypeChecker.getNodeType(node).ifPresent(type -> json.put("type", type));
            node.getTitle().ifPresent(title -> json.put("title", title));
            if (node.isPlaceholder()) {
                json.put("placeholder", true);
            }
            if (!node.getAnnotations().isEmpty()) {
                json.set("annotations", annotations(node.getAnnotations()));
            }
            if (!node.getAttributes().isEmpty()) {
                ArrayNode attributes = json.putArray("attributes");
                for (Attribute attribute : node.getAttributes()) {
                    ObjectNode attributeJson = attributes.addObject();
                    attributeJson.put("name", attribute.getName());
                    attribute.getType().ifPresent(type -> attributeJson.put("type", type.toString()));
                    attributeJson.set("value", objectMapper.valueToTree(
                            attribute.getValue().map(ValueExtractor::extract).orElse(null)));
                }
            }
        });
        return array;
    }

    private ArrayNode edges(Machine machine) {
        ArrayNode array = objectMapper.createArrayNode();
        for (SimpleEdge edge : SimpleEdge.flatten(machine)) {
            ObjectNode json = array.addObject();
            json.put("source", edge.getSource());
            json.put("target", edge.getTarget());
            edge.getLabel().ifPresent(label -> json.put("label", label));
        }
        return array;
    }

    private ArrayNode annotations(List<Annotation> annotations) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Annotation annotation : annotations) {
            ObjectNode json = array.addObject();
            json.put("name", annotation.getName());
            annotation.getValue().ifPresent(value -> json.put("value", value));
        }
        return array;
    }

    private ArrayNode dependencies(List<InferredDependency> dependencies) {
        ArrayNode array = objectMapper.createArrayNode();
        for (InferredDependency dependency : dependencies) {
            ObjectNode json = array.addObject();
            json.put("source", dependency.source());
            json.put("target", dependency.target());
            json.put("reason", dependency.reason());
            json.put("path", dependency.path());
        }
        return array;
    }

    private ObjectNode graph(GraphValidationResult result, GraphStatistics statistics) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("valid", result.isValid());
        json.set("entryPoints", objectMapper.valueToTree(result.getEntryPoints()));
        json.set("exitPoints", objectMapper.valueToTree(result.getExitPoints()));
        json.set("unreachableNodes", objectMapper.valueToTree(result.getUnreachableNodes()));
        json.set("orphanedNodes", objectMapper.valueToTree(result.getOrphanedNodes()));
        json.set("cycles", objectMapper.valueToTree(result.getCycles()));
        json.set("warnings", objectMapper.valueToTree(result.getWarnings()));
        json.set("statistics", objectMapper.valueToTree(statistics));
        return json;
    }

    private ObjectNode validation(ValidationContext context) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("errorCount", context.getCount(ValidationSeverity.ERROR));
        json.put("warningCount", context.getCount(ValidationSeverity.WARNING));
        ArrayNode diagnostics = json.putArray("diagnostics");
        for (ValidationError error : context.getErrors()) {
            ObjectNode item = diagnostics.addObject();
            item.put("severity", error.getSeverity().getValue());
            item.put("category", error.getCategory().getValue());
            item.put("code", error.getCode());
            item.put("message", error.getMessage());
            error.getLocation().ifPresent(location -> {
                location.getNode().ifPresent(node -> item.put("node", node));
                location.getProperty().ifPresent(property -> item.put("property", property));
            });
            error.getExpected().ifPresent(expected -> item.put("expected", expected));
            error.getActual().ifPresent(actual -> item.put("actual", actual));
            error.getSuggestion().ifPresent(suggestion -> item.put("suggestion", suggestion));
            if (!error.getContext().isEmpty()) {
                item.set("context", objectMapper.valueToTree(error.getContext()));
            }
            error.getTimestamp().ifPresent(timestamp -> item.set("timestamp", objectMapper.valueToTree(timestamp)));
        }
        return json;
    }
}
